package com.underscoreresearch.stash.utils;

import java.text.NumberFormat;
import java.time.Duration;
import java.util.Map;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@Slf4j
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class LogUtil {
    private static final Logger ROOT_LOGGER = LoggerFactory.getLogger("com.underscoreresearch.stash");

    public static boolean isDebug() {
        return ROOT_LOGGER.isDebugEnabled();
    }

    public static void debug(Runnable log) {
        if (isDebug()) {
            log.run();
        }
    }

    public static String readableSize(long length) {
        if (length >= 1024L * 1024 * 1024) {
            return String.format("%s GB", formatNumber(((double) length) / 1024 / 1024 / 1024));
        }
        if (length >= 1024 * 1024) {
            return String.format("%s MB", formatNumber(((double) length) / 1024 / 1024));
        }
        if (length >= 1024) {
            return String.format("%s KB", formatNumber(((double) length) / 1024));
        }
        return String.format("%s B", formatNumber(length));
    }

    private static String formatNumber(double num) {
        return NumberFormat.getNumberInstance().format(Math.round(num * 10) / 10.0);
    }

    public static String readableNumber(long num) {
        return NumberFormat.getNumberInstance().format(num);
    }

    public static String readableDuration(Duration duration) {
        long seconds = duration.getSeconds();
        if (duration.toDays() > 0) {
            return String.format("%d days %d:%02d:%02d", duration.toDays(),
                    (seconds / 3600) % 24,
                    (seconds / 60) % 60,
                    seconds % 60);
        }
        if (seconds > 3600) {
            return String.format("%d:%02d:%02d",
                    (seconds / 3600) % 24,
                    (seconds / 60) % 60,
                    seconds % 60);
        }
        return String.format("%d:%02d",
                (seconds / 60) % 60,
                seconds % 60);
    }

    /**
     * Short age description used when listing archives, like "45m", "3.5h" or "12d".
     */
    public static String readableAge(Duration age) {
        if (age.compareTo(Duration.ofHours(1)) < 0) {
            return String.format("%dm", age.toMinutes());
        }
        if (age.compareTo(Duration.ofDays(1)) < 0) {
            return String.format("%.1fh", age.toMinutes() / 60.0);
        }
        return String.format("%dd", age.toDays());
    }

    public static String formatDetails(Map<String, String> details) {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, String> entry : details.entrySet()) {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append("=").append(entry.getValue());
        }
        return sb.toString();
    }
}
