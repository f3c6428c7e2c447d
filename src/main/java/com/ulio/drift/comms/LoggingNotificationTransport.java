package com.ulio.drift.comms;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ulio.drift.exception.NotificationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes each notification's JSON to the log. Used when no webhook is configured.
 */
public class LoggingNotificationTransport implements NotificationTransport {
    private static final Logger LOG = LoggerFactory.getLogger(LoggingNotificationTransport.class);

    private final EmbedRenderer renderer = new EmbedRenderer(new ObjectMapper());

    @Override
    public void send(NotificationPayload payload) throws NotificationException {
        try {
            LOG.info("{}", renderer.render(payload));
        } catch (JsonProcessingException e) {
            throw new NotificationException("Could not render notification for " + payload.getMetric(), e);
        }
    }
}
