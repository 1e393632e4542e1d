package com.underscoreresearch.stash.notification;

import java.util.Map;

import lombok.extern.slf4j.Slf4j;

import com.underscoreresearch.stash.model.NotificationConfiguration;
import com.underscoreresearch.stash.utils.LogUtil;

@Slf4j
public class LoggingNotificationSink implements NotificationSink {
    private final NotificationConfiguration configuration;

    public LoggingNotificationSink(NotificationConfiguration configuration) {
        this.configuration = configuration != null ? configuration : new NotificationConfiguration();
    }

    @Override
    public void notify(NotificationKind kind, String subject, String operation, Map<String, String> details,
                       Throwable error) {
        if (!configuration.enabled(kind)) {
            return;
        }
        String message = String.format("%s %s: %s", operation, subject, LogUtil.formatDetails(details));
        switch (kind) {
            case SUCCESS -> log.info(message);
            case WARNING -> log.warn(message);
            case ERROR -> {
                if (error != null) {
                    log.error(message + " ({})", error.getMessage(), error);
                } else {
                    log.error(message);
                }
            }
        }
    }
}
