package com.underscoreresearch.stash.utils;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

/**
 * Canonical archive timestamps. The textual form is always {@code yyyyMMdd-HHmmss} in UTC, so
 * lexicographic order of the text equals chronological order.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class BackupTimestamp {
    public static final int TIMESTAMP_LENGTH = 15;
    public static final int DATE_LENGTH = 8;
    public static final int SEPARATOR_INDEX = 8;
    public static final char SEPARATOR = '-';

    public static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("uuuuMMdd-HHmmss")
            .withResolverStyle(ResolverStyle.STRICT);
    public static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("uuuuMMdd")
            .withResolverStyle(ResolverStyle.STRICT);

    public static LocalDateTime of(Instant instant) {
        return LocalDateTime.ofInstant(instant, ZoneOffset.UTC).truncatedTo(ChronoUnit.SECONDS);
    }

    public static Instant toInstant(LocalDateTime timestamp) {
        return timestamp.toInstant(ZoneOffset.UTC);
    }

    public static String format(LocalDateTime timestamp) {
        return TIMESTAMP_FORMAT.format(timestamp);
    }

    public static String formatDate(LocalDate date) {
        return DATE_FORMAT.format(date);
    }

    public static boolean isCanonical(String text) {
        return text != null
                && text.length() == TIMESTAMP_LENGTH
                && text.charAt(SEPARATOR_INDEX) == SEPARATOR;
    }

    /**
     * Parses a canonical timestamp. Anything that is not exactly a valid 15 character timestamp
     * yields an empty result.
     */
    public static Optional<LocalDateTime> parse(String text) {
        if (!isCanonical(text)) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDateTime.parse(text, TIMESTAMP_FORMAT));
        } catch (DateTimeParseException exc) {
            return Optional.empty();
        }
    }

    public static Optional<LocalDate> parseDate(String text) {
        if (text == null || text.length() != DATE_LENGTH) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDate.parse(text, DATE_FORMAT));
        } catch (DateTimeParseException exc) {
            return Optional.empty();
        }
    }
}
