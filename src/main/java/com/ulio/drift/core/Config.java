package com.ulio.drift.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.ulio.drift.anomaly.AnomalyHistory;
import com.ulio.drift.comms.NotificationGateway;
import com.ulio.drift.registry.MetricParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public class Config {
    private static final Logger LOG = LoggerFactory.getLogger(Config.class);

    static final String WEBHOOK_URL_ENV = "DRIFT_WEBHOOK_URL";

    private long checkIntervalMs = 5000;
    private int minAnomalyDuration = 3;
    private int historyCapacity = AnomalyHistory.DEFAULT_CAPACITY;
    private long stopTimeoutMs = 5000;

    private String webhookUrl = "";
    private int webhookTimeoutMs = 10000;
    private int rateLimitPerHour = NotificationGateway.DEFAULT_RATE_LIMIT_PER_HOUR;
    private boolean recoveryNotifications = true;

    private Map<String, MetricParameters> metrics = new LinkedHashMap<>();

    public static Config defaults() {
        Config config = new Config();
        config.applyDefaults();
        return config;
    }

    public static Config load(Path path) throws IOException {
        if (path == null || !Files.exists(path)) {
            LOG.info("Config file not found, using defaults: {}", path);
            return defaults();
        }

        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        Config loaded = mapper.readValue(path.toFile(), Config.class);
        if (loaded == null) {
            return defaults();
        }

        loaded.applyDefaults();
        return loaded;
    }

    void applyDefaults() {
        if (checkIntervalMs <= 0) {
            checkIntervalMs = 5000;
        }
        if (minAnomalyDuration <= 0) {
            minAnomalyDuration = 3;
        }
        if (historyCapacity <= 0) {
            historyCapacity = AnomalyHistory.DEFAULT_CAPACITY;
        }
        if (stopTimeoutMs <= 0) {
            stopTimeoutMs = 5000;
        }

        webhookUrl = resolveWebhookUrl(webhookUrl);
        if (webhookTimeoutMs <= 0) {
            webhookTimeoutMs = 10000;
        }
        if (rateLimitPerHour <= 0) {
            rateLimitPerHour = NotificationGateway.DEFAULT_RATE_LIMIT_PER_HOUR;
        }

        if (metrics == null) {
            metrics = new LinkedHashMap<>();
        }
    }

    private String resolveWebhookUrl(String configuredUrl) {
        String envUrl = System.getenv(WEBHOOK_URL_ENV);
        if (envUrl != null && !envUrl.isBlank()) {
            return envUrl.trim();
        }

        return configuredUrl == null ? "" : configuredUrl.trim();
    }

    public boolean hasWebhook() {
        return webhookUrl != null && !webhookUrl.isBlank();
    }

    public long getCheckIntervalMs() {
        return checkIntervalMs;
    }

    public void setCheckIntervalMs(long checkIntervalMs) {
        this.checkIntervalMs = checkIntervalMs;
    }

    public int getMinAnomalyDuration() {
        return minAnomalyDuration;
    }

    public void setMinAnomalyDuration(int minAnomalyDuration) {
        this.minAnomalyDuration = minAnomalyDuration;
    }

    public int getHistoryCapacity() {
        return historyCapacity;
    }

    public void setHistoryCapacity(int historyCapacity) {
        this.historyCapacity = historyCapacity;
    }

    public long getStopTimeoutMs() {
        return stopTimeoutMs;
    }

    public void setStopTimeoutMs(long stopTimeoutMs) {
        this.stopTimeoutMs = stopTimeoutMs;
    }

    public String getWebhookUrl() {
        return webhookUrl;
    }

    public void setWebhookUrl(String webhookUrl) {
        this.webhookUrl = webhookUrl;
    }

    public int getWebhookTimeoutMs() {
        return webhookTimeoutMs;
    }

    public void setWebhookTimeoutMs(int webhookTimeoutMs) {
        this.webhookTimeoutMs = webhookTimeoutMs;
    }

    public int getRateLimitPerHour() {
        return rateLimitPerHour;
    }

    public void setRateLimitPerHour(int rateLimitPerHour) {
        this.rateLimitPerHour = rateLimitPerHour;
    }

    public boolean isRecoveryNotifications() {
        return recoveryNotifications;
    }

    public void setRecoveryNotifications(boolean recoveryNotifications) {
        this.recoveryNotifications = recoveryNotifications;
    }

    public Map<String, MetricParameters> getMetrics() {
        return metrics;
    }

    public void setMetrics(Map<String, MetricParameters> metrics) {
        this.metrics = metrics;
    }
}
