package com.ulio.drift.telemetry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Gathers one cycle's values from the system source and every custom collector.
 * A failing source or collector only loses its own values.
 */
public class MetricCollection {
    private static final Logger LOG = LoggerFactory.getLogger(MetricCollection.class);

    private final SystemMetricsSource systemSource;

    public MetricCollection(SystemMetricsSource systemSource) {
        this.systemSource = systemSource;
    }

    public SampleSet collect(Map<String, MetricCollector> customCollectors) {
        Instant timestamp = Instant.now();
        Map<String, Double> values = new LinkedHashMap<>();

        if (systemSource != null) {
            try {
                SampleSet system = systemSource.collect();
                if (system != null) {
                    timestamp = system.getTimestamp();
                    values.putAll(system.getValues());
                }
            } catch (Throwable e) {
                LOG.warn("System metrics collection failed: {}", e.getMessage(), e);
            }
        }

        for (Map.Entry<String, MetricCollector> entry : customCollectors.entrySet()) {
            CollectionResult result = CollectionResult.of(entry.getKey(), entry.getValue());
            if (result.isSuccess()) {
                values.put(result.getMetricName(), result.getValue());
            } else {
                LOG.warn("Failed to collect custom metric {}: {}",
                        result.getMetricName(), result.getFailure().getMessage());
            }
        }

        return new SampleSet(timestamp, values);
    }
}
