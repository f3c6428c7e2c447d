package com.ulio.drift.core;

import com.ulio.drift.anomaly.AnomalyEvent;
import com.ulio.drift.anomaly.AnomalyHistory;
import com.ulio.drift.anomaly.CheckResult;
import com.ulio.drift.anomaly.DebounceOutcome;
import com.ulio.drift.anomaly.Detection;
import com.ulio.drift.anomaly.RecoveryTransition;
import com.ulio.drift.anomaly.SustainedAnomalyTracker;
import com.ulio.drift.comms.LoggingNotificationTransport;
import com.ulio.drift.comms.NotificationGateway;
import com.ulio.drift.comms.NotificationTransport;
import com.ulio.drift.comms.WebhookNotificationTransport;
import com.ulio.drift.detector.DetectionResult;
import com.ulio.drift.detector.StreamingDetector;
import com.ulio.drift.exception.ConfigurationException;
import com.ulio.drift.registry.MetricConfig;
import com.ulio.drift.registry.MetricParameters;
import com.ulio.drift.registry.MetricRegistry;
import com.ulio.drift.telemetry.MetricCollection;
import com.ulio.drift.telemetry.MetricCollector;
import com.ulio.drift.telemetry.OshiSystemMetricsSource;
import com.ulio.drift.telemetry.SampleSet;
import com.ulio.drift.telemetry.SystemMetricsSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Samples every configured metric on a fixed interval, debounces detector positives
 * and drives alert and recovery notifications.
 *
 * <p>A single worker thread runs the cycle. The cycle body and every public
 * operation except {@link #start()} and {@link #stop()} share one lock, so a manual
 * {@link #checkMetrics(SampleSet)} waits for an in-flight cycle instead of
 * interleaving with it. Collectors and the notification transport are called with
 * the lock held and without a timeout.
 */
public class DriftMonitor implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(DriftMonitor.class);

    private final Config config;
    private final MetricRegistry registry;
    private final MetricCollection collection;
    private final SustainedAnomalyTracker tracker;
    private final NotificationGateway gateway;
    private final AnomalyHistory history;

    private final ReentrantLock lock = new ReentrantLock();
    private final Object lifecycle = new Object();

    private CheckResult latestResult;
    private SampleSet latestSamples;

    private Thread worker;
    private CountDownLatch stopSignal;
    private volatile boolean running;

    public DriftMonitor(Config config, SystemMetricsSource systemSource, NotificationTransport transport, Clock clock)
            throws ConfigurationException {
        this(config, MetricRegistry.withDefaults(), systemSource, transport, clock);
    }

    public DriftMonitor(Config config, SystemMetricsSource systemSource, NotificationTransport transport)
            throws ConfigurationException {
        this(config, systemSource, transport, Clock.systemUTC());
    }

    DriftMonitor(Config config, MetricRegistry registry, SystemMetricsSource systemSource,
            NotificationTransport transport, Clock clock) throws ConfigurationException {
        this.config = config == null ? Config.defaults() : config;
        this.registry = registry;
        this.collection = new MetricCollection(systemSource);
        this.tracker = new SustainedAnomalyTracker(this.config.getMinAnomalyDuration());
        this.gateway = new NotificationGateway(
                transport == null ? new LoggingNotificationTransport() : transport,
                this.config.getRateLimitPerHour(),
                this.config.isRecoveryNotifications(),
                clock
        );
        this.history = new AnomalyHistory(this.config.getHistoryCapacity());

        for (Map.Entry<String, MetricParameters> override : this.config.getMetrics().entrySet()) {
            registry.configure(override.getKey(), override.getValue());
        }
    }

    /**
     * Monitor reading host metrics through OSHI and notifying the configured webhook,
     * or the log when none is set.
     */
    public static DriftMonitor create(Config config) throws ConfigurationException {
        Config effective = config == null ? Config.defaults() : config;
        NotificationTransport transport;
        if (effective.hasWebhook()) {
            transport = new WebhookNotificationTransport(effective.getWebhookUrl(), effective.getWebhookTimeoutMs());
            LOG.info("Sending notifications to webhook");
        } else {
            transport = new LoggingNotificationTransport();
            LOG.info("No webhook configured, notifications will be logged");
        }
        return new DriftMonitor(effective, new OshiSystemMetricsSource(), transport);
    }

    /**
     * Starts the worker. Refused while a worker from an earlier {@link #stop()} is
     * still finishing its cycle.
     */
    public void start() {
        synchronized (lifecycle) {
            if (running) {
                LOG.warn("Monitoring already active");
                return;
            }
            if (worker != null && worker.isAlive()) {
                LOG.warn("Previous monitor thread {} is still running, not starting", worker.getName());
                return;
            }

            CountDownLatch signal = new CountDownLatch(1);
            Thread thread = new Thread(() -> runLoop(signal), "drift-monitor");
            thread.setDaemon(true);

            stopSignal = signal;
            worker = thread;
            running = true;
            thread.start();
        }
    }

    /**
     * Signals the worker and waits up to {@code stopTimeoutMs} for it to exit.
     */
    public void stop() {
        Thread thread;
        CountDownLatch signal;
        synchronized (lifecycle) {
            if (!running) {
                return;
            }
            running = false;
            thread = worker;
            signal = stopSignal;
            stopSignal = null;
        }

        signal.countDown();
        if (thread == Thread.currentThread()) {
            return;
        }

        try {
            thread.join(config.getStopTimeoutMs());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        synchronized (lifecycle) {
            if (thread.isAlive()) {
                LOG.warn("Monitor thread did not stop within {} ms", config.getStopTimeoutMs());
            } else if (worker == thread) {
                worker = null;
            }
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Runs one detection cycle.
     *
     * @param samples values to check, or {@code null} to collect fresh ones
     */
    public CheckResult checkMetrics(SampleSet samples) {
        lock.lock();
        try {
            return runCycle(samples);
        } finally {
            lock.unlock();
        }
    }

    public CheckResult checkMetrics() {
        return checkMetrics(null);
    }

    /**
     * Merges {@code parameters} into the metric's current config and restarts its
     * detector from scratch.
     */
    public MetricConfig configureMetric(String metricName, MetricParameters parameters)
            throws ConfigurationException {
        lock.lock();
        try {
            return registry.configure(metricName, parameters);
        } finally {
            lock.unlock();
        }
    }

    public void updateMetricConfig(String metricName, MetricConfig metricConfig) throws ConfigurationException {
        lock.lock();
        try {
            registry.setConfig(metricName, metricConfig);
        } finally {
            lock.unlock();
        }
    }

    public void registerCustomMetric(String metricName, MetricCollector collector, MetricConfig metricConfig)
            throws ConfigurationException {
        lock.lock();
        try {
            registry.registerCustom(metricName, collector, metricConfig);
        } finally {
            lock.unlock();
        }
    }

    public boolean disableMetric(String metricName) {
        lock.lock();
        try {
            return registry.disable(metricName);
        } finally {
            lock.unlock();
        }
    }

    public MetricConfig getConfig(String metricName) {
        lock.lock();
        try {
            return registry.getConfig(metricName);
        } finally {
            lock.unlock();
        }
    }

    public Map<String, MetricConfig> getConfiguration() {
        lock.lock();
        try {
            return registry.getConfigs();
        } finally {
            lock.unlock();
        }
    }

    public boolean hasCustomMetric(String metricName) {
        lock.lock();
        try {
            return registry.hasCollector(metricName);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return the most recent cycle's result, or {@code null} before the first cycle
     */
    public CheckResult getLatestResult() {
        lock.lock();
        try {
            return latestResult;
        } finally {
            lock.unlock();
        }
    }

    public Map<String, Double> getCurrentMetrics() {
        lock.lock();
        try {
            return latestSamples == null ? Collections.emptyMap() : latestSamples.getValues();
        } finally {
            lock.unlock();
        }
    }

    public List<CheckResult> getAnomalyHistory() {
        lock.lock();
        try {
            return history.snapshot();
        } finally {
            lock.unlock();
        }
    }

    public boolean isAlarmed(String metricName) {
        lock.lock();
        try {
            return gateway.isAlarmed(metricName);
        } finally {
            lock.unlock();
        }
    }

    public int getAnomalyCounter(String metricName) {
        lock.lock();
        try {
            return tracker.getCounter(metricName);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Clears detector state, debounce counters, notification state and history.
     * Configuration and custom collectors are kept.
     */
    public void reset() {
        lock.lock();
        try {
            registry.resetDetectors();
            tracker.reset();
            gateway.reset();
            history.clear();
        } finally {
            lock.unlock();
        }
    }

    private void runLoop(CountDownLatch signal) {
        LOG.info("Monitoring started, checking every {} ms", config.getCheckIntervalMs());

        while (signal.getCount() > 0) {
            try {
                CheckResult result = checkMetrics(null);
                if (result.hasAnomalies()) {
                    LOG.warn("{} anomalies detected at {}", result.getAnomalyCount(), result.getTimestamp());
                    for (AnomalyEvent anomaly : result.getAnomalies()) {
                        LOG.warn("  - {}", anomaly);
                    }
                }
            } catch (Throwable e) {
                // A broken cycle must not kill the worker.
                LOG.error("Error in monitoring loop", e);
            }

            try {
                if (signal.await(config.getCheckIntervalMs(), TimeUnit.MILLISECONDS)) {
                    break;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }

        LOG.info("Monitoring stopped");
    }

    private CheckResult runCycle(SampleSet provided) {
        SampleSet samples = provided != null ? provided : collection.collect(registry.getEnabledCollectors());

        List<Detection> detections = new ArrayList<>();
        Map<String, Double> scores = new LinkedHashMap<>();
        for (Map.Entry<String, StreamingDetector> entry : registry.getActiveDetectors().entrySet()) {
            String metricName = entry.getKey();
            Double value = samples.get(metricName);
            if (value == null) {
                continue;
            }
            if (!Double.isFinite(value)) {
                LOG.debug("Skipping non-finite value for metric {}: {}", metricName, value);
                continue;
            }

            StreamingDetector detector = entry.getValue();
            try {
                DetectionResult detected = detector.update(value);
                scores.put(metricName, detected.getScore());
                detections.add(new Detection(metricName, value, detector.getAlgorithm(), detected));
            } catch (Throwable e) {
                LOG.error("Error checking metric {}: {}", metricName, e.getMessage(), e);
            }
        }

        DebounceOutcome outcome = tracker.evaluate(detections, samples.getTimestamp());

        for (RecoveryTransition recovery : outcome.getRecoveries()) {
            gateway.recover(recovery);
        }
        for (AnomalyEvent event : outcome.getSustained()) {
            gateway.alert(event);
        }

        CheckResult result = new CheckResult(
                samples.getTimestamp(),
                outcome.getSustained(),
                samples.getValues(),
                scores
        );

        latestSamples = samples;
        latestResult = result;
        if (result.hasAnomalies()) {
            history.append(result);
        }
        return result;
    }
}
