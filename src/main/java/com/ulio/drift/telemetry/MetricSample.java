package com.ulio.drift.telemetry;

import java.time.Instant;

public class MetricSample {
    private final String name;
    private final double value;
    private final Instant timestamp;

    public MetricSample(String name, double value, Instant timestamp) {
        this.name = name;
        this.value = value;
        this.timestamp = timestamp;
    }

    public String getName() {
        return name;
    }

    public double getValue() {
        return value;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return name + "=" + value + "@" + timestamp;
    }
}
