package com.ulio.drift.testutil;

import com.ulio.drift.anomaly.AnomalyEvent;
import com.ulio.drift.anomaly.RecoveryTransition;
import com.ulio.drift.anomaly.Severity;
import com.ulio.drift.detector.Algorithm;
import com.ulio.drift.telemetry.SampleSet;

import java.time.Instant;
import java.util.Map;

public final class TestFactory {
    public static final Instant T0 = Instant.parse("2025-01-01T12:00:00Z");

    private TestFactory() {
    }

    public static AnomalyEvent event(String metric, Severity severity, int count) {
        return new AnomalyEvent(metric, 95.0, 15.0, Algorithm.CUMSUM, severity, count, T0);
    }

    public static AnomalyEvent event(String metric) {
        return event(metric, Severity.MEDIUM, 3);
    }

    public static RecoveryTransition recovery(String metric) {
        return new RecoveryTransition(metric, 95.0, 4, T0);
    }

    public static SampleSet samples(String metric, double value) {
        return new SampleSet(T0, Map.of(metric, value));
    }
}
