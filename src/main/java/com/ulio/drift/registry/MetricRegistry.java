package com.ulio.drift.registry;

import com.ulio.drift.detector.StreamingDetector;
import com.ulio.drift.detector.StreamingDetectors;
import com.ulio.drift.exception.ConfigurationException;
import com.ulio.drift.telemetry.MetricCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-metric configuration and the detector currently running for it.
 *
 * <p>Not thread-safe; the owning monitor serializes access. Replacing a metric's
 * config always throws away the old detector and its learned state.
 */
public class MetricRegistry {
    private static final Logger LOG = LoggerFactory.getLogger(MetricRegistry.class);

    private final Map<String, Entry> entries = new LinkedHashMap<>();
    private final Map<String, MetricCollector> customCollectors = new LinkedHashMap<>();

    public static MetricRegistry withDefaults() {
        MetricRegistry registry = new MetricRegistry();
        for (Map.Entry<String, MetricConfig> entry : DefaultMetricConfigs.all().entrySet()) {
            registry.install(entry.getKey(), entry.getValue());
        }
        return registry;
    }

    public void setConfig(String metricName, MetricConfig config) throws ConfigurationException {
        if (config == null) {
            throw new ConfigurationException("Config for metric " + metricName + " must not be null");
        }
        config.validate(metricName);
        install(metricName, config);
        LOG.debug("Configured metric {}: {}", metricName, config);
    }

    public MetricConfig configure(String metricName, MetricParameters parameters) throws ConfigurationException {
        MetricConfig merged = MetricConfig.merge(metricName, getConfig(metricName), parameters);
        setConfig(metricName, merged);
        return merged;
    }

    public void registerCustom(String metricName, MetricCollector collector, MetricConfig config)
            throws ConfigurationException {
        if (collector == null) {
            throw new ConfigurationException("Collector for metric " + metricName + " must not be null");
        }
        setConfig(metricName, config);
        customCollectors.put(metricName, collector);
    }

    /**
     * Stops detection for {@code metricName} but keeps its config so it can be
     * re-enabled later.
     *
     * @return false when the metric is unknown
     */
    public boolean disable(String metricName) {
        Entry entry = entries.get(metricName);
        if (entry == null) {
            return false;
        }
        entries.put(metricName, new Entry(entry.config.withEnabled(false), null));
        return true;
    }

    public MetricConfig getConfig(String metricName) {
        Entry entry = entries.get(metricName);
        return entry == null ? null : entry.config;
    }

    public StreamingDetector getDetector(String metricName) {
        Entry entry = entries.get(metricName);
        return entry == null ? null : entry.detector;
    }

    public Map<String, MetricConfig> getConfigs() {
        Map<String, MetricConfig> configs = new LinkedHashMap<>();
        for (Map.Entry<String, Entry> entry : entries.entrySet()) {
            configs.put(entry.getKey(), entry.getValue().config);
        }
        return Collections.unmodifiableMap(configs);
    }

    /**
     * Live detectors keyed by metric name, in registration order.
     */
    public Map<String, StreamingDetector> getActiveDetectors() {
        Map<String, StreamingDetector> detectors = new LinkedHashMap<>();
        for (Map.Entry<String, Entry> entry : entries.entrySet()) {
            if (entry.getValue().detector != null) {
                detectors.put(entry.getKey(), entry.getValue().detector);
            }
        }
        return detectors;
    }

    /**
     * Collectors of custom metrics that are currently enabled.
     */
    public Map<String, MetricCollector> getEnabledCollectors() {
        Map<String, MetricCollector> collectors = new LinkedHashMap<>();
        for (Map.Entry<String, MetricCollector> entry : customCollectors.entrySet()) {
            MetricConfig config = getConfig(entry.getKey());
            if (config != null && config.isEnabled()) {
                collectors.put(entry.getKey(), entry.getValue());
            }
        }
        return collectors;
    }

    public boolean hasCollector(String metricName) {
        return customCollectors.containsKey(metricName);
    }

    public void resetDetectors() {
        for (Entry entry : entries.values()) {
            if (entry.detector != null) {
                entry.detector.reset();
            }
        }
    }

    private void install(String metricName, MetricConfig config) {
        StreamingDetector detector = config.isEnabled() ? StreamingDetectors.create(config) : null;
        entries.put(metricName, new Entry(config, detector));
    }

    private static final class Entry {
        private final MetricConfig config;
        private final StreamingDetector detector;

        private Entry(MetricConfig config, StreamingDetector detector) {
            this.config = config;
            this.detector = detector;
        }
    }
}
