package com.underscoreresearch.stash.configuration;

import static org.hamcrest.MatcherAssert.assertThat;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.hamcrest.core.Is;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.google.inject.Guice;
import com.google.inject.Injector;
import com.underscoreresearch.stash.archive.Archiver;
import com.underscoreresearch.stash.engine.BackupCatalog;
import com.underscoreresearch.stash.engine.BackupEngine;
import com.underscoreresearch.stash.engine.CleanupEngine;
import com.underscoreresearch.stash.engine.RestoreEngine;
import com.underscoreresearch.stash.file.FilePermissionManager;
import com.underscoreresearch.stash.file.implementation.FileSystemPermissionManager;
import com.underscoreresearch.stash.file.implementation.NullPermissionManager;
import com.underscoreresearch.stash.io.ObjectStore;
import com.underscoreresearch.stash.io.implementation.FileObjectStore;
import com.underscoreresearch.stash.model.ArchiveConfiguration;
import com.underscoreresearch.stash.model.BackupRecord;
import com.underscoreresearch.stash.model.BackupResult;
import com.underscoreresearch.stash.model.CleanupOptions;
import com.underscoreresearch.stash.model.CleanupResult;
import com.underscoreresearch.stash.model.RestoreOptions;
import com.underscoreresearch.stash.model.RestoreResult;
import com.underscoreresearch.stash.model.RunSummary;
import com.underscoreresearch.stash.model.ServiceSpec;
import com.underscoreresearch.stash.model.StashConfiguration;
import com.underscoreresearch.stash.model.StorageConfiguration;

class StashModuleTest {
    @TempDir
    Path tempDir;
    private Path source;
    private StashConfiguration configuration;
    private Injector injector;

    @BeforeEach
    public void setup() throws IOException {
        source = tempDir.resolve("source");
        Files.createDirectories(source.resolve("uploads"));
        Files.write(source.resolve("uploads").resolve("photo.jpg"), "photo".getBytes(StandardCharsets.UTF_8));
        Files.write(source.resolve("settings.ini"), "a=b".getBytes(StandardCharsets.UTF_8));

        configuration = StashConfiguration.builder()
                .storage(StorageConfiguration.builder()
                        .type(StorageConfiguration.FILE_TYPE)
                        .localRoot(tempDir.resolve("store").toString())
                        .prefix("backups")
                        .build())
                .services(Map.of("web", ServiceSpec.builder()
                        .paths(Map.of("data", source.toString()))
                        .includeFolders(Map.of("data", List.of("uploads")))
                        .build()))
                .retention(30)
                .archive(ArchiveConfiguration.builder().tempDir(tempDir.resolve("scratch").toString()).build())
                .build();
        ConfigurationValidator.validateConfiguration(configuration);
        injector = Guice.createInjector(new StashModule(configuration));
    }

    @Test
    public void bindings() {
        assertThat(injector.getInstance(ObjectStore.class) instanceof FileObjectStore, Is.is(true));
        assertThat(injector.getInstance(FilePermissionManager.class) instanceof NullPermissionManager, Is.is(true));
        assertThat(injector.getInstance(Archiver.class).isCompression(), Is.is(true));
        assertThat(injector.getInstance(ObjectStore.class) == injector.getInstance(ObjectStore.class), Is.is(true));
        assertThat(injector.getInstance(BackupEngine.class) == injector.getInstance(BackupEngine.class), Is.is(true));
    }

    @Test
    public void permissionPreservationBinding() {
        configuration.setArchive(configuration.getArchive().toBuilder().preserveAcls(true).build());
        Injector preserving = Guice.createInjector(new StashModule(configuration));
        assertThat(preserving.getInstance(FilePermissionManager.class) instanceof FileSystemPermissionManager,
                Is.is(true));
    }

    @Test
    public void backupListRestoreCleanup() throws IOException {
        List<BackupResult> backups = injector.getInstance(BackupEngine.class).runService("web", null);
        assertThat(RunSummary.of(backups).isFailed(), Is.is(false));
        assertThat(backups.get(0).getRecord().getKey().endsWith(".tar.gz"), Is.is(true));

        List<BackupRecord> records = injector.getInstance(BackupCatalog.class).list("web");
        assertThat(records.size(), Is.is(1));
        assertThat(records.get(0).getPathName(), Is.is("data"));

        Path destination = tempDir.resolve("restored");
        List<RestoreResult> restores = injector.getInstance(RestoreEngine.class).runService(RestoreOptions.builder()
                .serviceName("web")
                .destination(destination.toString())
                .build());
        assertThat(RunSummary.of(restores).isFailed(), Is.is(false));
        assertThat(Files.readString(destination.resolve("data").resolve("uploads").resolve("photo.jpg")),
                Is.is("photo"));
        assertThat(Files.exists(destination.resolve("data").resolve("settings.ini")), Is.is(false));

        CleanupResult cleanup = injector.getInstance(CleanupEngine.class).run(CleanupOptions.builder()
                .serviceName("web")
                .olderThanDays(1)
                .build());
        assertThat(cleanup.getDeleted().isEmpty(), Is.is(true));
        assertThat(cleanup.isFailed(), Is.is(false));
    }
}
