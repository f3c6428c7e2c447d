package com.ulio.drift.exception;

/**
 * Thrown by a notification transport when a payload could not be delivered.
 */
public class NotificationException extends DriftException {
    public NotificationException(String message) {
        super(message);
    }

    public NotificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
