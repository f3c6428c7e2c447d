package com.ulio.drift.registry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tuned settings for the system metrics reported by
 * {@link com.ulio.drift.telemetry.OshiSystemMetricsSource}.
 */
public final class DefaultMetricConfigs {
    public static final String CPU_PERCENT = "cpu_percent";
    public static final String RAM_PERCENT = "ram_percent";
    public static final String LOAD_AVG = "load_avg";
    public static final String NET_SENT_MB = "net_sent_mb";
    public static final String NET_RECV_MB = "net_recv_mb";
    public static final String DISK_READ_MB = "disk_read_mb";
    public static final String DISK_WRITE_MB = "disk_write_mb";
    public static final String CONNECTIONS = "connections";

    private static final Map<String, MetricConfig> DEFAULTS = buildDefaults();

    private DefaultMetricConfigs() {
    }

    public static Map<String, MetricConfig> all() {
        return DEFAULTS;
    }

    private static Map<String, MetricConfig> buildDefaults() {
        Map<String, MetricConfig> defaults = new LinkedHashMap<>();
        defaults.put(CPU_PERCENT, MetricConfig.cumsum(25.0, 5.0, 30.0, "CPU usage - sustained changes only"));
        // lower threshold and drift than CPU so memory creep is caught earlier
        defaults.put(RAM_PERCENT, MetricConfig.cumsum(10.0, 2.0, 50.0, "RAM usage - more sensitive to fluctuations"));
        defaults.put(LOAD_AVG, MetricConfig.cumsum(15.0, 1.0, 2.0, "System load average"));
        defaults.put(NET_SENT_MB, MetricConfig.ewma(0.1, 5.0, "Network bytes sent"));
        defaults.put(NET_RECV_MB, MetricConfig.ewma(0.1, 5.0, "Network bytes received"));
        defaults.put(DISK_READ_MB, MetricConfig.ewma(0.15, 4.5, "Disk read throughput"));
        defaults.put(DISK_WRITE_MB, MetricConfig.ewma(0.15, 4.5, "Disk write throughput"));
        defaults.put(CONNECTIONS, MetricConfig.ewma(0.15, 5.0, "Number of network connections"));
        return Collections.unmodifiableMap(defaults);
    }
}
