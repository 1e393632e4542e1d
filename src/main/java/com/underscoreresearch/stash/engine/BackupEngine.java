package com.underscoreresearch.stash.engine;

import static com.underscoreresearch.stash.utils.LogUtil.readableDuration;
import static com.underscoreresearch.stash.utils.LogUtil.readableNumber;
import static com.underscoreresearch.stash.utils.LogUtil.readableSize;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import lombok.extern.slf4j.Slf4j;

import com.google.common.base.Stopwatch;
import com.underscoreresearch.stash.archive.ArchiveStats;
import com.underscoreresearch.stash.archive.Archiver;
import com.underscoreresearch.stash.io.IOUtils;
import com.underscoreresearch.stash.io.ObjectStore;
import com.underscoreresearch.stash.model.ArchiveConfiguration;
import com.underscoreresearch.stash.model.BackupRecord;
import com.underscoreresearch.stash.model.BackupResult;
import com.underscoreresearch.stash.model.CleanupOptions;
import com.underscoreresearch.stash.model.CleanupResult;
import com.underscoreresearch.stash.model.ServiceSpec;
import com.underscoreresearch.stash.model.StashConfiguration;
import com.underscoreresearch.stash.notification.NotificationDispatcher;
import com.underscoreresearch.stash.notification.NotificationSink;
import com.underscoreresearch.stash.utils.BackupTimestamp;
import com.underscoreresearch.stash.utils.ProcessingStoppedException;

/**
 * Archives the paths of a service and uploads them. Every path is handled on its own, one failing path
 * never stops the others.
 */
@Slf4j
public class BackupEngine {
    private static final String OPERATION = "backup";

    private final StashConfiguration configuration;
    private final ObjectStore store;
    private final Archiver archiver;
    private final CleanupEngine cleanupEngine;
    private final NotificationDispatcher notifications;
    private final Clock clock;

    public BackupEngine(StashConfiguration configuration, ObjectStore store, Archiver archiver,
                        CleanupEngine cleanupEngine, NotificationSink sink, Clock clock) {
        this.configuration = configuration;
        this.store = store;
        this.archiver = archiver;
        this.cleanupEngine = cleanupEngine;
        this.notifications = new NotificationDispatcher(sink);
        this.clock = clock;
    }

    private static List<String> resolvePaths(ServiceSpec service, List<String> pathFilter) {
        if (pathFilter == null || pathFilter.isEmpty()) {
            return service.pathNames();
        }
        List<String> ret = new ArrayList<>();
        for (String pathName : pathFilter) {
            if (service.getPaths() != null && service.getPaths().containsKey(pathName)) {
                if (!ret.contains(pathName)) {
                    ret.add(pathName);
                }
            } else {
                log.warn("Path {} not found in service {} configuration", pathName, service.getName());
            }
        }
        ret.sort(String::compareTo);
        return ret;
    }

    /**
     * Backs up one service.
     *
     * @param pathFilter path names to back up, null or empty for all of them.
     * @throws IllegalArgumentException if the service is unknown or no path is left to back up.
     */
    public List<BackupResult> runService(String serviceName, List<String> pathFilter) {
        ServiceSpec service = configuration.findService(serviceName)
                .orElseThrow(() -> new IllegalArgumentException("Service " + serviceName
                        + " not found in configuration"));

        List<String> paths = resolvePaths(service, pathFilter);
        if (paths.isEmpty()) {
            throw new IllegalArgumentException("No valid paths to back up for service " + serviceName);
        }

        log.info("Starting backup for service: {} ({} paths)", serviceName, paths.size());
        List<BackupResult> results = new ArrayList<>();
        for (String pathName : paths) {
            if (Thread.currentThread().isInterrupted()) {
                throw new ProcessingStoppedException(OPERATION + " of " + serviceName);
            }
            BackupResult result = backupPath(service, pathName);
            results.add(result);
            notify(result);
        }

        if (configuration.autoCleanupEnabled()) {
            performAutoCleanup(serviceName, results);
        }
        return results;
    }

    /**
     * Backs up every configured service in name order. A service that can not be started at all is
     * reported as a single failed result.
     */
    public Map<String, List<BackupResult>> runAll(List<String> pathFilter) {
        List<String> services = configuration.serviceNames();
        log.info("Starting backup for all services ({} services)", services.size());

        Map<String, List<BackupResult>> ret = new TreeMap<>();
        for (String serviceName : services) {
            try {
                ret.put(serviceName, runService(serviceName, pathFilter));
            } catch (IllegalArgumentException exc) {
                log.error("Failed to back up service {}: {}", serviceName, exc.getMessage());
                ret.put(serviceName, List.of(BackupResult.builder()
                        .service(serviceName)
                        .error(exc)
                        .build()));
            }
        }
        return ret;
    }

    private BackupResult backupPath(ServiceSpec service, String pathName) {
        Stopwatch stopwatch = Stopwatch.createStarted();
        BackupResult result = BackupResult.builder()
                .service(service.getName())
                .path(pathName)
                .build();
        Path root = Path.of(service.getPaths().get(pathName));
        List<String> includeFolders = service.includeFoldersFor(pathName);
        ArchiveConfiguration settings = configuration.archiveSettings();

        log.info("Backing up {}:{} from {}", service.getName(), pathName, root);
        try {
            if (!Files.exists(root)) {
                throw new IOException("Source path does not exist: " + root);
            }

            long fileCount = archiver.countFiles(root, includeFolders);
            log.info("Archiving {} files from {}", readableNumber(fileCount), root);

            Path scratch = IOUtils.createScratchFile(settings.scratchDirectory(),
                    String.format("stash-%s-%s-", service.getName(), pathName.replace('/', '-')),
                    store.getKeyCodec().suffix());
            try {
                ArchiveStats stats;
                try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(scratch))) {
                    stats = archiver.createArchive(out, root, includeFolders);
                }
                result.setFilesProcessed(stats.getFilesProcessed());

                long archiveSize = Files.size(scratch);
                result.setArchiveSize(archiveSize);
                if (settings.minimumSize() > 0 && archiveSize < settings.minimumSize()) {
                    throw new IOException(String.format("Archive size (%d bytes) is below minimum threshold (%d bytes)",
                            archiveSize, settings.minimumSize()));
                }

                String key = store.getKeyCodec().encode(service.getName(), pathName,
                        BackupTimestamp.of(clock.instant()));
                BackupRecord record = store.put(key, scratch);
                result.setRecord(record);
            } finally {
                IOUtils.deleteFile(scratch);
            }

            result.setDuration(stopwatch.elapsed());
            log.info("Backup completed for {}:{} in {} ({})", service.getName(), pathName,
                    readableDuration(result.getDuration()), readableSize(result.getArchiveSize()));
        } catch (IOException | RuntimeException exc) {
            result.setDuration(stopwatch.elapsed());
            result.setError(exc);
            log.error("Backup of {}:{} failed: {}", service.getName(), pathName, exc.getMessage(), exc);
        }
        return result;
    }

    private void notify(BackupResult result) {
        Map<String, String> details = new LinkedHashMap<>();
        details.put("path", result.getPath());
        if (result.getRecord() != null) {
            details.put("key", result.getRecord().getKey());
        }
        details.put("size", readableSize(result.getArchiveSize()));
        details.put("files", readableNumber(result.getFilesProcessed()));
        details.put("duration", readableDuration(result.getDuration() != null ? result.getDuration()
                : Duration.ZERO));

        if (result.isSuccessful()) {
            notifications.success(result.getService(), OPERATION, details);
        } else {
            notifications.error(result.getService(), OPERATION, details, result.getError());
        }
    }

    private void performAutoCleanup(String serviceName, List<BackupResult> results) {
        if (results.stream().noneMatch(BackupResult::isSuccessful)) {
            log.info("Skipping auto-cleanup of service {} since no backup succeeded", serviceName);
            return;
        }

        log.info("Running auto-cleanup for service {}", serviceName);
        try {
            CleanupResult cleanup = cleanupEngine.run(CleanupOptions.builder()
                    .serviceName(serviceName)
                    .keepLatest(1)
                    .build());
            if (cleanup.isFailed()) {
                log.warn("Auto-cleanup of service {} failed: {}", serviceName,
                        cleanup.getErrors().get(serviceName).getMessage());
            }
        } catch (IllegalArgumentException exc) {
            log.warn("Auto-cleanup of service {} skipped: {}", serviceName, exc.getMessage());
        }
    }
}
