package com.underscoreresearch.stash.configuration;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;

import lombok.extern.slf4j.Slf4j;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.underscoreresearch.stash.archive.Archiver;
import com.underscoreresearch.stash.archive.implementation.TarArchiver;
import com.underscoreresearch.stash.engine.BackupCatalog;
import com.underscoreresearch.stash.engine.BackupEngine;
import com.underscoreresearch.stash.engine.CleanupEngine;
import com.underscoreresearch.stash.engine.RestoreEngine;
import com.underscoreresearch.stash.file.FilePermissionManager;
import com.underscoreresearch.stash.file.implementation.FileSystemPermissionManager;
import com.underscoreresearch.stash.file.implementation.NullPermissionManager;
import com.underscoreresearch.stash.io.BackupKeyCodec;
import com.underscoreresearch.stash.io.ObjectStore;
import com.underscoreresearch.stash.io.implementation.FileObjectStore;
import com.underscoreresearch.stash.io.implementation.S3ObjectStore;
import com.underscoreresearch.stash.model.StashConfiguration;
import com.underscoreresearch.stash.model.StorageConfiguration;
import com.underscoreresearch.stash.notification.LoggingNotificationSink;
import com.underscoreresearch.stash.notification.NotificationSink;
import com.underscoreresearch.stash.selection.RestoreSelector;
import com.underscoreresearch.stash.selection.RetentionSelector;

@Slf4j
public class StashModule extends AbstractModule {
    private final StashConfiguration configuration;

    public StashModule(StashConfiguration configuration) {
        this.configuration = configuration;
    }

    @Provides
    @Singleton
    public StashConfiguration stashConfiguration() {
        return configuration;
    }

    @Provides
    @Singleton
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Provides
    @Singleton
    public BackupKeyCodec backupKeyCodec(StashConfiguration configuration) {
        return new BackupKeyCodec(configuration.getStorage().normalizedPrefix(),
                configuration.archiveSettings().compressionEnabled());
    }

    @Provides
    @Singleton
    public ObjectStore objectStore(StashConfiguration configuration, BackupKeyCodec keyCodec) throws IOException {
        StorageConfiguration storage = configuration.getStorage();
        return switch (storage.storageType()) {
            case StorageConfiguration.S3_TYPE -> new S3ObjectStore(storage, keyCodec);
            case StorageConfiguration.FILE_TYPE -> new FileObjectStore(Path.of(storage.getLocalRoot()), keyCodec);
            default -> throw new IllegalArgumentException("Unknown storage type \"" + storage.getType() + "\"");
        };
    }

    @Provides
    @Singleton
    public FilePermissionManager filePermissionManager(StashConfiguration configuration) {
        if (!configuration.archiveSettings().aclPreservation()) {
            return new NullPermissionManager();
        }
        log.info("Preserving permissions of archived files");
        return new FileSystemPermissionManager();
    }

    @Provides
    @Singleton
    public Archiver archiver(StashConfiguration configuration, FilePermissionManager permissionManager) {
        return new TarArchiver(configuration.archiveSettings().compressionEnabled(),
                configuration.archiveSettings().aclPreservation(), permissionManager);
    }

    @Provides
    @Singleton
    public NotificationSink notificationSink(StashConfiguration configuration) {
        return new LoggingNotificationSink(configuration.notificationSettings());
    }

    @Provides
    @Singleton
    public RetentionSelector retentionSelector(Clock clock) {
        return new RetentionSelector(clock);
    }

    @Provides
    @Singleton
    public RestoreSelector restoreSelector() {
        return new RestoreSelector();
    }

    @Provides
    @Singleton
    public CleanupEngine cleanupEngine(StashConfiguration configuration, ObjectStore store,
                                       RetentionSelector selector, NotificationSink sink) {
        return new CleanupEngine(configuration, store, selector, sink);
    }

    @Provides
    @Singleton
    public BackupEngine backupEngine(StashConfiguration configuration, ObjectStore store, Archiver archiver,
                                     CleanupEngine cleanupEngine, NotificationSink sink, Clock clock) {
        return new BackupEngine(configuration, store, archiver, cleanupEngine, sink, clock);
    }

    @Provides
    @Singleton
    public RestoreEngine restoreEngine(StashConfiguration configuration, ObjectStore store, Archiver archiver,
                                       RestoreSelector selector, NotificationSink sink) {
        return new RestoreEngine(configuration, store, archiver, selector, sink);
    }

    @Provides
    @Singleton
    public BackupCatalog backupCatalog(ObjectStore store, Clock clock) {
        return new BackupCatalog(store, clock);
    }
}
