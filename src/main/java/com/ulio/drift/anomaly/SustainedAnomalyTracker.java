package com.ulio.drift.anomaly;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Debounces raw detector positives. A metric is reported only after
 * {@code minDuration} consecutive raw positives, and escalates to
 * {@link Severity#HIGH} once the streak passes twice that length.
 *
 * <p>Not thread-safe.
 */
public class SustainedAnomalyTracker {
    private final int minDuration;
    private final Map<String, Integer> counters = new LinkedHashMap<>();
    private final Map<String, Double> lastSustainedValues = new HashMap<>();

    public SustainedAnomalyTracker(int minDuration) {
        if (minDuration <= 0) {
            throw new IllegalArgumentException("minDuration must be positive: " + minDuration);
        }
        this.minDuration = minDuration;
    }

    public DebounceOutcome evaluate(List<Detection> detections, Instant timestamp) {
        List<AnomalyEvent> sustained = new ArrayList<>();
        Set<String> rawPositive = new HashSet<>();

        for (Detection detection : detections) {
            if (!detection.isAnomalous()) {
                continue;
            }
            String metric = detection.getMetric();
            rawPositive.add(metric);

            int count = counters.getOrDefault(metric, 0) + 1;
            counters.put(metric, count);
            if (count >= minDuration) {
                Severity severity = count > minDuration * 2 ? Severity.HIGH : Severity.MEDIUM;
                sustained.add(new AnomalyEvent(
                        metric,
                        detection.getValue(),
                        detection.getScore(),
                        detection.getAlgorithm(),
                        severity,
                        count,
                        timestamp
                ));
                lastSustainedValues.put(metric, detection.getValue());
            }
        }

        List<RecoveryTransition> recoveries = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : counters.entrySet()) {
            String metric = entry.getKey();
            if (rawPositive.contains(metric)) {
                continue;
            }
            int previous = entry.getValue();
            if (previous >= minDuration) {
                Double lastValue = lastSustainedValues.remove(metric);
                recoveries.add(new RecoveryTransition(
                        metric,
                        lastValue == null ? Double.NaN : lastValue,
                        previous,
                        timestamp
                ));
            }
            entry.setValue(0);
        }

        return new DebounceOutcome(sustained, recoveries);
    }

    public int getCounter(String metric) {
        return counters.getOrDefault(metric, 0);
    }

    public void reset() {
        counters.clear();
        lastSustainedValues.clear();
    }
}
