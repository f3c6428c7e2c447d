package com.ulio.drift.comms;

import com.ulio.drift.exception.NotificationException;

/**
 * Blocking delivery of one notification. Implementations do not retry.
 */
public interface NotificationTransport {
    void send(NotificationPayload payload) throws NotificationException;
}
