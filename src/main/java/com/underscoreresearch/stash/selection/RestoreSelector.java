package com.underscoreresearch.stash.selection;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.underscoreresearch.stash.model.BackupRecord;
import com.underscoreresearch.stash.model.RestoreTarget;

/**
 * Picks the archives of one service to restore. Paths come out in name order, and within a path the
 * newest archive comes first.
 */
public class RestoreSelector {
    private static final Comparator<BackupRecord> NEWEST_FIRST = RetentionSelector.CHRONOLOGICAL.reversed();

    public List<BackupRecord> select(Collection<BackupRecord> records, RestoreTarget target) {
        return select(records, target, false);
    }

    /**
     * @param newestOnly keep only the newest match of every path even when a date matches several archives.
     */
    public List<BackupRecord> select(Collection<BackupRecord> records, RestoreTarget target, boolean newestOnly) {
        Map<String, List<BackupRecord>> byPath = new TreeMap<>();
        for (BackupRecord record : records) {
            byPath.computeIfAbsent(record.getPathName(), k -> new ArrayList<>()).add(record);
        }

        boolean single = newestOnly || target.getKind() == RestoreTarget.Kind.LATEST;
        List<BackupRecord> ret = new ArrayList<>();
        for (List<BackupRecord> pathRecords : byPath.values()) {
            pathRecords.sort(NEWEST_FIRST);
            for (BackupRecord record : pathRecords) {
                if (target.matches(record)) {
                    ret.add(record);
                    if (single) {
                        break;
                    }
                }
            }
        }
        return ret;
    }
}
