package com.underscoreresearch.stash.archive;

import static org.hamcrest.MatcherAssert.assertThat;

import java.nio.file.Path;
import java.util.List;

import org.hamcrest.core.Is;
import org.junit.jupiter.api.Test;

class IncludeFilterTest {
    @Test
    public void emptyIncludesEverything() {
        assertThat(IncludeFilter.ALL.includes("anything/at/all"), Is.is(true));
        assertThat(new IncludeFilter(List.of()).includes("config/app.yml"), Is.is(true));
        assertThat(new IncludeFilter(List.of(" ", "/")).getFolders().isEmpty(), Is.is(true));
    }

    @Test
    public void uploadsOnly() {
        IncludeFilter filter = new IncludeFilter(List.of("uploads"));
        assertThat(filter.includes("."), Is.is(true));
        assertThat(filter.includes("uploads"), Is.is(true));
        assertThat(filter.includes("uploads/a.jpg"), Is.is(true));
        assertThat(filter.includes("config"), Is.is(false));
        assertThat(filter.includes("config/app.yml"), Is.is(false));
        // Plain string prefix, so siblings sharing the prefix are kept as well.
        assertThat(filter.includes("uploads-old/b.jpg"), Is.is(true));
    }

    @Test
    public void parentsOfNestedFolder() {
        IncludeFilter filter = new IncludeFilter(List.of("./var/log/"));
        assertThat(filter.getFolders(), Is.is(List.of("var/log")));
        assertThat(filter.includes("var"), Is.is(true));
        assertThat(filter.includes("var/log/syslog"), Is.is(true));
        assertThat(filter.includes("var/cache"), Is.is(false));
        assertThat(filter.includes("etc"), Is.is(false));
    }

    @Test
    public void relativeName() {
        Path root = Path.of("/data");
        assertThat(IncludeFilter.relativeName(root, root), Is.is("."));
        assertThat(IncludeFilter.relativeName(root, root.resolve("uploads").resolve("a.jpg")),
                Is.is("uploads/a.jpg"));
    }
}
