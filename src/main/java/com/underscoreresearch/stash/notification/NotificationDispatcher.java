package com.underscoreresearch.stash.notification;

import java.util.LinkedHashMap;
import java.util.Map;

import lombok.extern.slf4j.Slf4j;

/**
 * Fire and forget front for a {@link NotificationSink}.
 */
@Slf4j
public class NotificationDispatcher {
    private final NotificationSink sink;

    public NotificationDispatcher(NotificationSink sink) {
        this.sink = sink;
    }

    public void success(String subject, String operation, Map<String, String> details) {
        send(NotificationKind.SUCCESS, subject, operation, details, null);
    }

    public void warning(String subject, String operation, Map<String, String> details) {
        send(NotificationKind.WARNING, subject, operation, details, null);
    }

    public void error(String subject, String operation, Map<String, String> details, Throwable error) {
        send(NotificationKind.ERROR, subject, operation, details, error);
    }

    public void send(NotificationKind kind, String subject, String operation, Map<String, String> details,
                     Throwable error) {
        if (sink == null) {
            return;
        }
        Map<String, String> copy = details != null ? new LinkedHashMap<>(details) : new LinkedHashMap<>();
        try {
            sink.notify(kind, subject, operation, copy, error);
        } catch (InterruptedException exc) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while sending {} notification for {}", kind, subject);
        } catch (Exception exc) {
            log.warn("Failed to send {} notification for {}", kind, subject, exc);
        }
    }
}
