package com.underscoreresearch.stash.notification;

public enum NotificationKind {
    SUCCESS,
    ERROR,
    WARNING
}
