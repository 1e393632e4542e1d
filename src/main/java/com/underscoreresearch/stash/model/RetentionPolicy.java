package com.underscoreresearch.stash.model;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;

import lombok.Value;

import com.underscoreresearch.stash.utils.BackupTimestamp;

@Value
public class RetentionPolicy {
    int maxAgeDays;
    int keepLatest;

    public RetentionPolicy(int maxAgeDays, int keepLatest) {
        if (maxAgeDays <= 0) {
            throw new IllegalArgumentException("Retention period must be greater than 0 days, got " + maxAgeDays);
        }
        if (keepLatest < 0) {
            throw new IllegalArgumentException("Number of archives to keep can not be negative, got " + keepLatest);
        }
        this.maxAgeDays = maxAgeDays;
        this.keepLatest = keepLatest;
    }

    public Instant cutoff(Instant now) {
        return now.minus(Duration.ofDays(maxAgeDays));
    }

    /**
     * Compared at full precision, a timestamp a fraction of a second before the cutoff is expired.
     */
    public boolean isExpired(LocalDateTime timestamp, Instant now) {
        return BackupTimestamp.toInstant(timestamp).isBefore(cutoff(now));
    }
}
