package com.ulio.drift.telemetry;

/**
 * Outcome of calling one custom collector: either a value or the failure that
 * prevented one.
 */
public final class CollectionResult {
    private final String metricName;
    private final double value;
    private final Throwable failure;

    private CollectionResult(String metricName, double value, Throwable failure) {
        this.metricName = metricName;
        this.value = value;
        this.failure = failure;
    }

    public static CollectionResult success(String metricName, double value) {
        return new CollectionResult(metricName, value, null);
    }

    public static CollectionResult failure(String metricName, Throwable failure) {
        return new CollectionResult(metricName, Double.NaN, failure);
    }

    public static CollectionResult of(String metricName, MetricCollector collector) {
        try {
            double value = collector.collect();
            if (!Double.isFinite(value)) {
                return failure(metricName, new IllegalStateException("collector returned " + value));
            }
            return success(metricName, value);
        } catch (Throwable e) {
            return failure(metricName, e);
        }
    }

    public String getMetricName() {
        return metricName;
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public double getValue() {
        return value;
    }

    public Throwable getFailure() {
        return failure;
    }
}
