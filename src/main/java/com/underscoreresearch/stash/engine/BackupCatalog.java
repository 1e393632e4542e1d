package com.underscoreresearch.stash.engine;

import static com.underscoreresearch.stash.utils.LogUtil.readableAge;
import static com.underscoreresearch.stash.utils.LogUtil.readableSize;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

import lombok.extern.slf4j.Slf4j;

import com.underscoreresearch.stash.io.ObjectStore;
import com.underscoreresearch.stash.model.BackupRecord;
import com.underscoreresearch.stash.model.CleanupOptions;
import com.underscoreresearch.stash.selection.RetentionSelector;
import com.underscoreresearch.stash.utils.BackupTimestamp;

/**
 * Read only view of the archives in the object store.
 */
@Slf4j
public class BackupCatalog {
    private static final DateTimeFormatter DISPLAY_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private final ObjectStore store;
    private final Clock clock;

    public BackupCatalog(ObjectStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    /**
     * Archives of one service, or of every service when serviceName is null, empty or "all". Newest first.
     */
    public List<BackupRecord> list(String serviceName) throws IOException {
        boolean all = serviceName == null || serviceName.isEmpty() || CleanupOptions.ALL_SERVICES.equals(serviceName);
        String prefix = all ? store.getKeyCodec().rootPrefix() : store.getKeyCodec().servicePrefix(serviceName);

        List<BackupRecord> ret = store.list(prefix).stream()
                .filter(record -> all || serviceName.equals(record.getService()))
                .sorted(RetentionSelector.CHRONOLOGICAL.reversed())
                .collect(Collectors.toList());
        if (ret.isEmpty()) {
            if (all) {
                log.info("No backups found");
            } else {
                log.info("No backups found for service: {}", serviceName);
            }
        }
        return ret;
    }

    public static Map<String, List<BackupRecord>> groupByService(List<BackupRecord> records) {
        Map<String, List<BackupRecord>> ret = new TreeMap<>();
        for (BackupRecord record : records) {
            ret.computeIfAbsent(record.getService(), k -> new ArrayList<>()).add(record);
        }
        return ret;
    }

    /**
     * One line summary like {@code data | 2024-01-15 10:30 | 1.2 MB | 3.5h ago}.
     */
    public String describe(BackupRecord record) {
        Duration age = Duration.between(BackupTimestamp.toInstant(record.getTimestamp()), clock.instant());
        if (age.isNegative()) {
            age = Duration.ZERO;
        }
        return String.format("%s | %s | %s | %s ago", record.getPathName(),
                DISPLAY_FORMAT.format(record.getTimestamp()), readableSize(record.getSize()), readableAge(age));
    }

    /**
     * Logs the listing grouped by service and returns the number of archives.
     */
    public int logListing(String serviceName) throws IOException {
        List<BackupRecord> records = list(serviceName);
        for (Map.Entry<String, List<BackupRecord>> entry : groupByService(records).entrySet()) {
            log.info("{} ({} backups)", entry.getKey(), entry.getValue().size());
            for (BackupRecord record : entry.getValue()) {
                log.info("  {}", describe(record));
            }
        }
        return records.size();
    }
}
