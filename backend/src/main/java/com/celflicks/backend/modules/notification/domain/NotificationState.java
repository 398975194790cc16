package com.celflicks.backend.modules.notification.domain;

public enum NotificationState {
    UNREAD,
    READ
}
