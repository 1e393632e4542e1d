package com.underscoreresearch.stash.file.implementation;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.nio.file.FileStore;
import java.nio.file.Path;
import java.nio.file.attribute.AclFileAttributeView;
import java.nio.file.attribute.PosixFileAttributeView;
import java.util.Map;

import org.hamcrest.core.Is;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class FileSystemPermissionManagerTest {
    private static final Path SYSTEM_ROOT = Path.of("/srv/system");
    private static final Path SHARE_ROOT = Path.of("/mnt/share");
    private static final Path UNKNOWN_ROOT = Path.of("/proc/unknown");

    private FileSystemPermissionManager manager;

    @BeforeEach
    public void setup() {
        FileStore posix = mock(FileStore.class);
        when(posix.name()).thenReturn("posix");
        when(posix.supportsFileAttributeView(PosixFileAttributeView.class)).thenReturn(true);
        FileStore acl = mock(FileStore.class);
        when(acl.name()).thenReturn("acl");
        when(acl.supportsFileAttributeView(AclFileAttributeView.class)).thenReturn(true);

        Map<Path, FileStore> stores = Map.of(SYSTEM_ROOT, posix, SHARE_ROOT, acl);
        manager = new FileSystemPermissionManager(path -> stores.entrySet().stream()
                .filter(entry -> path.startsWith(entry.getKey()))
                .map(Map.Entry::getValue)
                .findFirst());
    }

    @Test
    public void managerPerFileSystem() {
        assertThat(manager.managerFor(SYSTEM_ROOT.resolve("a.txt")) instanceof PosixPermissionManager, Is.is(true));
        assertThat(manager.managerFor(SHARE_ROOT.resolve("b.txt")) instanceof AclPermissionManager, Is.is(true));
        assertThat(manager.managerFor(UNKNOWN_ROOT.resolve("c.txt")) instanceof NullPermissionManager, Is.is(true));
    }

    @Test
    public void managersReused() {
        assertThat(manager.managerFor(SYSTEM_ROOT.resolve("a.txt"))
                == manager.managerFor(SYSTEM_ROOT.resolve("nested").resolve("b.txt")), Is.is(true));
    }

    @Test
    public void unknownFileSystemHasNoDescriptor() {
        assertThat(manager.getPermissionDescriptor(UNKNOWN_ROOT.resolve("c.txt")), Is.is((String) null));
        manager.setPermissionDescriptor(UNKNOWN_ROOT.resolve("c.txt"), "{}");
    }

    @Test
    public void defaultLookup() {
        assertThat(new FileSystemPermissionManager().managerFor(Path.of("").toAbsolutePath()) != null,
                Is.is(true));
    }
}
