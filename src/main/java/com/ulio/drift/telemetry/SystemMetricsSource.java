package com.ulio.drift.telemetry;

/**
 * Synchronous source of the well-known system metrics.
 */
public interface SystemMetricsSource {
    SampleSet collect();
}
