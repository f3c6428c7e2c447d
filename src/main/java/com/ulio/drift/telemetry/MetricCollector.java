package com.ulio.drift.telemetry;

/**
 * Produces the current value of an application-defined metric. Called once per
 * monitoring cycle on the monitor thread.
 */
@FunctionalInterface
public interface MetricCollector {
    double collect() throws Exception;
}
