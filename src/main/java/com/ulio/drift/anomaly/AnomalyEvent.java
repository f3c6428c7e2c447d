package com.ulio.drift.anomaly;

import com.ulio.drift.detector.Algorithm;

import java.time.Instant;

/**
 * A raw detector positive that has persisted long enough to be reported.
 */
public class AnomalyEvent {
    private final String metric;
    private final double value;
    private final double score;
    private final Algorithm algorithm;
    private final Severity severity;
    private final int consecutiveCount;
    private final Instant timestamp;

    public AnomalyEvent(
            String metric,
            double value,
            double score,
            Algorithm algorithm,
            Severity severity,
            int consecutiveCount,
            Instant timestamp
    ) {
        this.metric = metric;
        this.value = value;
        this.score = score;
        this.algorithm = algorithm;
        this.severity = severity;
        this.consecutiveCount = consecutiveCount;
        this.timestamp = timestamp;
    }

    public String getMetric() {
        return metric;
    }

    public double getValue() {
        return value;
    }

    public double getScore() {
        return score;
    }

    public Algorithm getAlgorithm() {
        return algorithm;
    }

    public Severity getSeverity() {
        return severity;
    }

    public int getConsecutiveCount() {
        return consecutiveCount;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return String.format("%s: %.2f (score: %.2f, severity: %s, checks: %d)",
                metric, value, score, severity, consecutiveCount);
    }
}
