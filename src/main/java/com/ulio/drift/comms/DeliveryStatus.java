package com.ulio.drift.comms;

/**
 * Result of one alert or recovery attempt for a metric.
 */
public enum DeliveryStatus {
    /** Payload handed to the transport and accepted. */
    DELIVERED,
    /** No notification is due in the metric's current state. */
    NOT_APPLICABLE,
    /** The metric used up its hourly allowance; the attempt was dropped. */
    RATE_LIMITED,
    /** The transport failed; gateway state is unchanged. */
    FAILED;

    public boolean delivered() {
        return this == DELIVERED;
    }
}
