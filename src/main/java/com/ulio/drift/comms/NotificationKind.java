package com.ulio.drift.comms;

public enum NotificationKind {
    ALERT,
    RECOVERY
}
