package com.ulio.drift.anomaly;

import java.time.Instant;

/**
 * Emitted the first cycle a metric that had reached a sustained anomaly is no longer
 * raw-positive.
 */
public class RecoveryTransition {
    private final String metric;
    private final double lastAnomalousValue;
    private final int episodeLength;
    private final Instant timestamp;

    public RecoveryTransition(String metric, double lastAnomalousValue, int episodeLength, Instant timestamp) {
        this.metric = metric;
        this.lastAnomalousValue = lastAnomalousValue;
        this.episodeLength = episodeLength;
        this.timestamp = timestamp;
    }

    public String getMetric() {
        return metric;
    }

    public double getLastAnomalousValue() {
        return lastAnomalousValue;
    }

    /**
     * Consecutive raw-positive checks the metric accumulated before recovering.
     */
    public int getEpisodeLength() {
        return episodeLength;
    }

    public Instant getTimestamp() {
        return timestamp;
    }
}
