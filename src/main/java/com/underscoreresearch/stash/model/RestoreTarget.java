package com.underscoreresearch.stash.model;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Optional;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import com.underscoreresearch.stash.utils.BackupTimestamp;

/**
 * Which archive generations a restore should pick. Accepts either a calendar day
 * ({@code yyyyMMdd}) matching every archive from that day, or an exact canonical timestamp
 * ({@code yyyyMMdd-HHmmss}). No token means the latest archive of every path.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RestoreTarget {
    public static final RestoreTarget LATEST = new RestoreTarget(Kind.LATEST, null, null);

    Kind kind;
    LocalDate date;
    LocalDateTime timestamp;

    public static RestoreTarget parse(String token) {
        if (token == null || token.isBlank()) {
            return LATEST;
        }
        String trimmed = token.trim();
        if (trimmed.length() == BackupTimestamp.TIMESTAMP_LENGTH) {
            Optional<LocalDateTime> timestamp = BackupTimestamp.parse(trimmed);
            if (timestamp.isPresent()) {
                return new RestoreTarget(Kind.EXACT, null, timestamp.get());
            }
        } else if (trimmed.length() == BackupTimestamp.DATE_LENGTH) {
            Optional<LocalDate> date = BackupTimestamp.parseDate(trimmed);
            if (date.isPresent()) {
                return new RestoreTarget(Kind.DAY, date.get(), null);
            }
        }
        throw new IllegalArgumentException("Invalid date format: expected YYYYMMDD or YYYYMMDD-HHMMSS, got "
                + token);
    }

    public boolean matches(BackupRecord record) {
        return switch (kind) {
            case LATEST -> true;
            case DAY -> record.getTimestamp().toLocalDate().equals(date);
            case EXACT -> record.getTimestamp().equals(timestamp);
        };
    }

    @Override
    public String toString() {
        return switch (kind) {
            case LATEST -> "latest";
            case DAY -> BackupTimestamp.formatDate(date);
            case EXACT -> BackupTimestamp.format(timestamp);
        };
    }

    public enum Kind {
        LATEST,
        DAY,
        EXACT
    }
}
