package com.ulio.drift.telemetry;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Values of every metric observed in one cycle, sharing a single timestamp.
 */
public class SampleSet {
    private final Instant timestamp;
    private final Map<String, Double> values;

    public SampleSet(Instant timestamp, Map<String, Double> values) {
        this.timestamp = timestamp == null ? Instant.now() : timestamp;
        this.values = values == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static SampleSet of(Map<String, Double> values) {
        return new SampleSet(Instant.now(), values);
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Map<String, Double> getValues() {
        return values;
    }

    public Double get(String metricName) {
        return values.get(metricName);
    }

    public List<MetricSample> samples() {
        List<MetricSample> samples = new ArrayList<>(values.size());
        for (Map.Entry<String, Double> entry : values.entrySet()) {
            samples.add(new MetricSample(entry.getKey(), entry.getValue(), timestamp));
        }
        return samples;
    }
}
