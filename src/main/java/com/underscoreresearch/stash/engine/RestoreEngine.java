package com.underscoreresearch.stash.engine;

import static com.underscoreresearch.stash.utils.LogUtil.readableDuration;
import static com.underscoreresearch.stash.utils.LogUtil.readableNumber;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import lombok.extern.slf4j.Slf4j;

import com.google.common.base.Stopwatch;
import com.underscoreresearch.stash.archive.ArchiveStats;
import com.underscoreresearch.stash.archive.Archiver;
import com.underscoreresearch.stash.io.ObjectStore;
import com.underscoreresearch.stash.model.BackupRecord;
import com.underscoreresearch.stash.model.RestoreOptions;
import com.underscoreresearch.stash.model.RestoreResult;
import com.underscoreresearch.stash.model.RestoreTarget;
import com.underscoreresearch.stash.model.ServiceSpec;
import com.underscoreresearch.stash.model.StashConfiguration;
import com.underscoreresearch.stash.notification.NotificationDispatcher;
import com.underscoreresearch.stash.notification.NotificationSink;
import com.underscoreresearch.stash.selection.RestoreSelector;
import com.underscoreresearch.stash.utils.ProcessingStoppedException;

@Slf4j
public class RestoreEngine {
    private static final String OPERATION = "restore";

    private final StashConfiguration configuration;
    private final ObjectStore store;
    private final Archiver archiver;
    private final RestoreSelector selector;
    private final NotificationDispatcher notifications;

    public RestoreEngine(StashConfiguration configuration, ObjectStore store, Archiver archiver,
                         RestoreSelector selector, NotificationSink sink) {
        this.configuration = configuration;
        this.store = store;
        this.archiver = archiver;
        this.selector = selector;
        this.notifications = new NotificationDispatcher(sink);
    }

    /**
     * Restores the archives of a service picked by the date and latest options.
     *
     * @throws IllegalArgumentException if the service is unknown or the date can not be parsed.
     * @throws IOException              if the archives can not be listed or none match.
     */
    public List<RestoreResult> runService(RestoreOptions options) throws IOException {
        String serviceName = options.getServiceName();
        ServiceSpec service = configuration.findService(serviceName)
                .orElseThrow(() -> new IllegalArgumentException("Service " + serviceName
                        + " not found in configuration"));
        RestoreTarget target = RestoreTarget.parse(options.getDate());

        List<BackupRecord> records = store.list(store.getKeyCodec().servicePrefix(serviceName)).stream()
                .filter(record -> serviceName.equals(record.getService()))
                .collect(Collectors.toList());
        if (records.isEmpty()) {
            throw new IOException("No backups found for service " + serviceName);
        }

        List<BackupRecord> selected = selector.select(records, target, options.isLatest());
        if (selected.isEmpty()) {
            throw new IOException("No backups of service " + serviceName + " match " + target);
        }
        log.info("Found {} backups to restore for service: {}", selected.size(), serviceName);

        List<RestoreResult> results = new ArrayList<>();
        for (BackupRecord record : selected) {
            if (Thread.currentThread().isInterrupted()) {
                throw new ProcessingStoppedException(OPERATION + " of " + serviceName);
            }
            String location = service.getPaths().get(record.getPathName());
            if (location == null) {
                log.warn("Path {} not found in current service configuration, skipping", record.getPathName());
                continue;
            }

            Path destination = options.getDestination() != null && !options.getDestination().isEmpty()
                    ? Path.of(options.getDestination()).resolve(record.getPathName())
                    : Path.of(location);

            RestoreResult result = restoreRecord(record, destination, options.isForce(), options.isDryRun());
            results.add(result);
            if (!options.isDryRun()) {
                notify(result);
            }
        }
        return results;
    }

    private RestoreResult restoreRecord(BackupRecord record, Path destination, boolean force, boolean dryRun) {
        Stopwatch stopwatch = Stopwatch.createStarted();
        RestoreResult result = RestoreResult.builder()
                .service(record.getService())
                .path(record.getPathName())
                .record(record)
                .restorePath(destination)
                .dryRun(dryRun)
                .build();

        log.info("Restoring {}:{} to {}", record.getService(), record.getPathName(), destination);
        if (dryRun) {
            log.info("[DRY RUN] Would restore backup {} to {}", record.getKey(), destination);
            result.setDuration(stopwatch.elapsed());
            return result;
        }

        try {
            checkDestination(destination, force);
            try (InputStream stream = store.get(record.getKey())) {
                ArchiveStats stats = archiver.extractArchive(stream, destination);
                result.setFilesRestored(stats.getFilesProcessed());
            }
            result.setDuration(stopwatch.elapsed());
            log.info("Restore completed for {}:{} in {} ({} files)", record.getService(), record.getPathName(),
                    readableDuration(result.getDuration()), readableNumber(result.getFilesRestored()));
        } catch (IOException | RuntimeException exc) {
            result.setDuration(stopwatch.elapsed());
            result.setError(exc);
            log.error("Restore of {}:{} failed: {}", record.getService(), record.getPathName(), exc.getMessage(), exc);
        }
        return result;
    }

    private static void checkDestination(Path destination, boolean force) throws IOException {
        if (!force && Files.exists(destination)) {
            throw new IOException("Destination path " + destination + " already exists, use force to overwrite");
        }
    }

    /**
     * Restores an archive file from local disk into an explicit destination, bypassing the object store.
     *
     * @throws IllegalArgumentException if no destination is given.
     * @throws IOException              if the archive can not be opened or the destination exists without force.
     */
    public RestoreResult restoreLocal(Path archive, Path destination, boolean force, boolean dryRun)
            throws IOException {
        if (destination == null) {
            throw new IllegalArgumentException("Destination path is required when restoring from a local file");
        }
        if (!Files.isRegularFile(archive) || !Files.isReadable(archive)) {
            throw new IOException("Failed to open local file " + archive);
        }

        Stopwatch stopwatch = Stopwatch.createStarted();
        RestoreResult result = RestoreResult.builder()
                .path(archive.getFileName().toString())
                .restorePath(destination)
                .dryRun(dryRun)
                .build();

        if (dryRun) {
            log.info("[DRY RUN] Would restore local file {} to {}", archive, destination);
            result.setDuration(stopwatch.elapsed());
            return result;
        }
        checkDestination(destination, force);

        try (InputStream stream = Files.newInputStream(archive)) {
            ArchiveStats stats = archiver.extractArchive(stream, destination);
            result.setFilesRestored(stats.getFilesProcessed());
            log.info("Restored local file {} to {}", archive, destination);
        } catch (IOException | RuntimeException exc) {
            result.setError(exc);
            log.error("Restore of local file {} failed: {}", archive, exc.getMessage(), exc);
        }
        result.setDuration(stopwatch.elapsed());
        return result;
    }

    private void notify(RestoreResult result) {
        Map<String, String> details = new LinkedHashMap<>();
        details.put("path", result.getPath());
        if (result.getRecord() != null) {
            details.put("backup", result.getRecord().timestampText());
        }
        details.put("destination", result.getRestorePath().toString());
        if (result.getDuration() != null) {
            details.put("duration", readableDuration(result.getDuration()));
        }

        if (result.isSuccessful()) {
            notifications.success(result.getService(), OPERATION, details);
        } else {
            notifications.error(result.getService(), OPERATION, details, result.getError());
        }
    }
}
