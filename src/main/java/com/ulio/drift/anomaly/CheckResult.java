package com.ulio.drift.anomaly;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable outcome of one monitoring cycle.
 */
public class CheckResult {
    private final Instant timestamp;
    private final List<AnomalyEvent> anomalies;
    private final Map<String, Double> metrics;
    private final Map<String, Double> scores;

    public CheckResult(
            Instant timestamp,
            List<AnomalyEvent> anomalies,
            Map<String, Double> metrics,
            Map<String, Double> scores
    ) {
        this.timestamp = timestamp;
        this.anomalies = anomalies == null ? Collections.emptyList() : List.copyOf(anomalies);
        this.metrics = metrics == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
        this.scores = scores == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(scores));
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public boolean hasAnomalies() {
        return !anomalies.isEmpty();
    }

    public int getAnomalyCount() {
        return anomalies.size();
    }

    public List<AnomalyEvent> getAnomalies() {
        return anomalies;
    }

    public Map<String, Double> getMetrics() {
        return metrics;
    }

    public Map<String, Double> getScores() {
        return scores;
    }
}
