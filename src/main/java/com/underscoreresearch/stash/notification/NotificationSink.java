package com.underscoreresearch.stash.notification;

import java.util.Map;

/**
 * Receives the outcome of backup, restore and cleanup operations. Implementations may throw,
 * callers are expected to go through {@link NotificationDispatcher} which never lets a delivery
 * failure reach the operation that produced it.
 */
public interface NotificationSink {
    void notify(NotificationKind kind, String subject, String operation, Map<String, String> details,
                Throwable error) throws Exception;
}
