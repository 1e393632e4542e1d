package com.underscoreresearch.stash.engine;

import static com.underscoreresearch.stash.utils.LogUtil.debug;
import static com.underscoreresearch.stash.utils.LogUtil.readableNumber;
import static com.underscoreresearch.stash.utils.LogUtil.readableSize;

import java.io.IOException;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import lombok.extern.slf4j.Slf4j;

import com.underscoreresearch.stash.io.ObjectStore;
import com.underscoreresearch.stash.model.BackupRecord;
import com.underscoreresearch.stash.model.CleanupOptions;
import com.underscoreresearch.stash.model.CleanupResult;
import com.underscoreresearch.stash.model.RetentionPolicy;
import com.underscoreresearch.stash.model.StashConfiguration;
import com.underscoreresearch.stash.notification.NotificationDispatcher;
import com.underscoreresearch.stash.notification.NotificationSink;
import com.underscoreresearch.stash.selection.RetentionSelector;
import com.underscoreresearch.stash.utils.ProcessingStoppedException;

/**
 * Deletes expired archives. Every service is cleaned independently, so a failure to list or delete the
 * archives of one service is recorded in the result and the remaining services are still processed.
 */
@Slf4j
public class CleanupEngine {
    private static final DateTimeFormatter DISPLAY_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final StashConfiguration configuration;
    private final ObjectStore store;
    private final RetentionSelector selector;
    private final NotificationDispatcher notifications;

    public CleanupEngine(StashConfiguration configuration, ObjectStore store, RetentionSelector selector,
                         NotificationSink sink) {
        this.configuration = configuration;
        this.store = store;
        this.selector = selector;
        this.notifications = new NotificationDispatcher(sink);
    }

    private RetentionPolicy policy(CleanupOptions options) {
        Integer days = options.getOlderThanDays();
        if (days == null || days == 0) {
            days = configuration.getRetention();
        }
        if (days == null || days <= 0) {
            throw new IllegalArgumentException("Retention period must be greater than 0 days");
        }
        return new RetentionPolicy(days, options.getKeepLatest());
    }

    private List<String> services(CleanupOptions options) {
        if (options.allServices()) {
            return configuration.serviceNames();
        }
        if (configuration.findService(options.getServiceName()).isEmpty()) {
            throw new IllegalArgumentException("Service " + options.getServiceName() + " not found in configuration");
        }
        return List.of(options.getServiceName());
    }

    public CleanupResult run(CleanupOptions options) {
        RetentionPolicy policy = policy(options);
        List<String> services = services(options);
        CleanupResult result = CleanupResult.builder().preview(options.isPreview()).build();

        log.info("Starting cleanup: older than {} days, keep latest {}", policy.getMaxAgeDays(),
                policy.getKeepLatest());

        for (String service : services) {
            if (Thread.currentThread().isInterrupted()) {
                throw new ProcessingStoppedException("cleanup");
            }
            cleanService(service, policy, options.isPreview(), result);
        }

        if (options.isPreview()) {
            log.info("Would delete {} archives ({})", readableNumber(result.getDeleted().size()),
                    readableSize(result.getBytesFreed()));
        } else {
            log.info("Deleted {} archives ({} freed)", readableNumber(result.getDeleted().size()),
                    readableSize(result.getBytesFreed()));
        }

        if (!result.getDeleted().isEmpty() || result.isFailed()) {
            Map<String, String> details = new LinkedHashMap<>();
            details.put("deleted", String.valueOf(result.getDeleted().size()));
            details.put("freed", readableSize(result.getBytesFreed()));
            details.put("preview", String.valueOf(result.isPreview()));
            if (result.isFailed()) {
                details.put("failed", String.join(", ", result.getErrors().keySet()));
                notifications.warning(options.allServices() ? CleanupOptions.ALL_SERVICES : options.getServiceName(),
                        "cleanup", details);
            } else {
                notifications.success(options.allServices() ? CleanupOptions.ALL_SERVICES : options.getServiceName(),
                        "cleanup", details);
            }
        }
        return result;
    }

    private void cleanService(String service, RetentionPolicy policy, boolean preview, CleanupResult result) {
        log.info("Cleaning up service: {}", service);

        List<BackupRecord> records;
        try {
            records = store.list(store.getKeyCodec().servicePrefix(service)).stream()
                    .filter(record -> service.equals(record.getService()))
                    .collect(Collectors.toList());
        } catch (ProcessingStoppedException exc) {
            throw exc;
        } catch (IOException | RuntimeException exc) {
            log.error("Failed to list archives of service {}", service, exc);
            result.getErrors().put(service, exc);
            return;
        }

        List<BackupRecord> selected = selector.select(records, policy);
        if (selected.isEmpty()) {
            log.info("No archives to delete for service {}", service);
            return;
        }
        debug(() -> selected.forEach(record -> log.debug("Marking for deletion: {} ({})", record.getKey(),
                DISPLAY_FORMAT.format(record.getTimestamp()))));

        long size = selected.stream().mapToLong(BackupRecord::getSize).sum();
        if (preview) {
            log.info("Would delete {} archives of service {}:", selected.size(), service);
            for (BackupRecord record : selected) {
                log.info("  - {} ({}, {})", record.getKey(), DISPLAY_FORMAT.format(record.getTimestamp()),
                        readableSize(record.getSize()));
            }
        } else {
            List<String> keys = new ArrayList<>(selected.size());
            for (BackupRecord record : selected) {
                keys.add(record.getKey());
            }
            try {
                store.deleteMany(keys);
            } catch (ProcessingStoppedException exc) {
                throw exc;
            } catch (IOException | RuntimeException exc) {
                log.error("Failed to delete archives of service {}", service, exc);
                result.getErrors().put(service, exc);
                return;
            }
            log.info("Deleted {} archives of service {} ({} freed)", selected.size(), service, readableSize(size));
        }

        result.getDeleted().addAll(selected);
        result.setBytesFreed(result.getBytesFreed() + size);
    }
}
