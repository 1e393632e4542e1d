package com.underscoreresearch.stash.selection;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.underscoreresearch.stash.model.BackupRecord;
import com.underscoreresearch.stash.model.RetentionPolicy;

/**
 * Decides which archives have expired.
 * <p>
 * Archives are grouped by service and path. In every group the newest {@code keepLatest} archives are
 * always kept, and of the rest only those strictly older than the cutoff are selected. The result is
 * ordered oldest first.
 */
public class RetentionSelector {
    public static final Comparator<BackupRecord> CHRONOLOGICAL = Comparator
            .comparing(BackupRecord::getTimestamp)
            .thenComparing(BackupRecord::getService)
            .thenComparing(BackupRecord::getPathName)
            .thenComparing(BackupRecord::getKey);

    private final Clock clock;

    public RetentionSelector(Clock clock) {
        this.clock = clock;
    }

    public List<BackupRecord> select(Collection<BackupRecord> records, RetentionPolicy policy) {
        return select(records, policy, clock.instant());
    }

    public List<BackupRecord> select(Collection<BackupRecord> records, RetentionPolicy policy, Instant now) {
        List<BackupRecord> ret = new ArrayList<>();

        for (List<BackupRecord> group : group(records).values()) {
            group.sort(CHRONOLOGICAL.reversed());
            for (int i = policy.getKeepLatest(); i < group.size(); i++) {
                BackupRecord candidate = group.get(i);
                if (policy.isExpired(candidate.getTimestamp(), now)) {
                    ret.add(candidate);
                }
            }
        }

        ret.sort(CHRONOLOGICAL);
        return ret;
    }

    private static Map<GroupKey, List<BackupRecord>> group(Collection<BackupRecord> records) {
        Map<GroupKey, List<BackupRecord>> groups = new TreeMap<>();
        for (BackupRecord record : records) {
            groups.computeIfAbsent(new GroupKey(record.getService(), record.getPathName()),
                    k -> new ArrayList<>()).add(record);
        }
        return groups;
    }

    private static final class GroupKey implements Comparable<GroupKey> {
        private static final Comparator<GroupKey> ORDER = Comparator
                .comparing((GroupKey key) -> key.service)
                .thenComparing(key -> key.pathName);

        private final String service;
        private final String pathName;

        private GroupKey(String service, String pathName) {
            this.service = service;
            this.pathName = pathName;
        }

        @Override
        public int compareTo(GroupKey other) {
            return ORDER.compare(this, other);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof GroupKey other)) return false;
            return service.equals(other.service) && pathName.equals(other.pathName);
        }

        @Override
        public int hashCode() {
            return 31 * service.hashCode() + pathName.hashCode();
        }
    }
}
