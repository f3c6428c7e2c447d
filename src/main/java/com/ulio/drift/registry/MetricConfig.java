package com.ulio.drift.registry;

import com.ulio.drift.detector.Algorithm;
import com.ulio.drift.exception.ConfigurationException;

/**
 * Immutable detection settings for one metric. CUMSUM reads {@code threshold},
 * {@code drift} and {@code referenceMean}; EWMA reads {@code alpha} and
 * {@code thresholdSigma}.
 */
public final class MetricConfig {
    public static final double DEFAULT_THRESHOLD = 5.0;
    public static final double DEFAULT_DRIFT = 0.5;
    public static final double DEFAULT_ALPHA = 0.3;
    public static final double DEFAULT_THRESHOLD_SIGMA = 3.0;

    private final Algorithm algorithm;
    private final double threshold;
    private final double drift;
    private final Double referenceMean;
    private final double alpha;
    private final double thresholdSigma;
    private final boolean enabled;
    private final String description;

    private MetricConfig(Builder builder) {
        this.algorithm = builder.algorithm;
        this.threshold = builder.threshold;
        this.drift = builder.drift;
        this.referenceMean = builder.referenceMean;
        this.alpha = builder.alpha;
        this.thresholdSigma = builder.thresholdSigma;
        this.enabled = builder.enabled;
        this.description = builder.description == null ? "" : builder.description;
    }

    public static Builder builder(Algorithm algorithm) {
        return new Builder(algorithm);
    }

    public static MetricConfig cumsum(double threshold, double drift, Double referenceMean, String description) {
        return builder(Algorithm.CUMSUM)
                .threshold(threshold)
                .drift(drift)
                .referenceMean(referenceMean)
                .description(description)
                .build();
    }

    public static MetricConfig ewma(double alpha, double thresholdSigma, String description) {
        return builder(Algorithm.EWMA)
                .alpha(alpha)
                .thresholdSigma(thresholdSigma)
                .description(description)
                .build();
    }

    /**
     * Combines {@code parameters} with the config currently held for {@code metricName}.
     * Fields left unset in {@code parameters} keep the existing value, or fall back to the
     * built-in defaults when the metric has never been configured.
     */
    public static MetricConfig merge(String metricName, MetricConfig existing, MetricParameters parameters)
            throws ConfigurationException {
        MetricParameters params = parameters == null ? new MetricParameters() : parameters;
        Builder builder = existing == null
                ? builder(Algorithm.CUMSUM).description("Custom metric: " + metricName)
                : existing.toBuilder();

        if (params.getAlgorithm() != null) {
            builder.algorithm(params.getAlgorithm());
        }
        if (params.getThreshold() != null) {
            builder.threshold(params.getThreshold());
        }
        if (params.getDrift() != null) {
            builder.drift(params.getDrift());
        }
        if (params.getReferenceMean() != null) {
            builder.referenceMean(params.getReferenceMean());
        }
        if (params.getAlpha() != null) {
            builder.alpha(params.getAlpha());
        }
        if (params.getThresholdSigma() != null) {
            builder.thresholdSigma(params.getThresholdSigma());
        }
        if (params.getEnabled() != null) {
            builder.enabled(params.getEnabled());
        }
        if (params.getDescription() != null) {
            builder.description(params.getDescription());
        }

        MetricConfig merged = builder.build();
        merged.validate(metricName);
        return merged;
    }

    public void validate(String metricName) throws ConfigurationException {
        if (metricName == null || metricName.isBlank()) {
            throw new ConfigurationException("Metric name must not be blank");
        }
        if (algorithm == null) {
            throw new ConfigurationException("Algorithm missing for metric " + metricName);
        }
        if (!Double.isFinite(threshold) || threshold <= 0.0) {
            throw new ConfigurationException("threshold must be > 0 for metric " + metricName + ": " + threshold);
        }
        if (!Double.isFinite(drift) || drift < 0.0) {
            throw new ConfigurationException("drift must be >= 0 for metric " + metricName + ": " + drift);
        }
        if (referenceMean != null && !Double.isFinite(referenceMean)) {
            throw new ConfigurationException("referenceMean must be finite for metric " + metricName);
        }
        if (!Double.isFinite(alpha) || alpha <= 0.0 || alpha > 1.0) {
            throw new ConfigurationException("alpha must be in (0, 1] for metric " + metricName + ": " + alpha);
        }
        if (!Double.isFinite(thresholdSigma) || thresholdSigma <= 0.0) {
            throw new ConfigurationException(
                    "thresholdSigma must be > 0 for metric " + metricName + ": " + thresholdSigma);
        }
    }

    public MetricConfig withEnabled(boolean enabled) {
        return toBuilder().enabled(enabled).build();
    }

    public Builder toBuilder() {
        return builder(algorithm)
                .threshold(threshold)
                .drift(drift)
                .referenceMean(referenceMean)
                .alpha(alpha)
                .thresholdSigma(thresholdSigma)
                .enabled(enabled)
                .description(description);
    }

    public Algorithm getAlgorithm() {
        return algorithm;
    }

    public double getThreshold() {
        return threshold;
    }

    public double getDrift() {
        return drift;
    }

    public Double getReferenceMean() {
        return referenceMean;
    }

    public double getAlpha() {
        return alpha;
    }

    public double getThresholdSigma() {
        return thresholdSigma;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public String getDescription() {
        return description;
    }

    @Override
    public String toString() {
        return "MetricConfig{algorithm=" + algorithm
                + ", threshold=" + threshold
                + ", drift=" + drift
                + ", referenceMean=" + referenceMean
                + ", alpha=" + alpha
                + ", thresholdSigma=" + thresholdSigma
                + ", enabled=" + enabled
                + ", description='" + description + "'}";
    }

    public static final class Builder {
        private Algorithm algorithm;
        private double threshold = DEFAULT_THRESHOLD;
        private double drift = DEFAULT_DRIFT;
        private Double referenceMean;
        private double alpha = DEFAULT_ALPHA;
        private double thresholdSigma = DEFAULT_THRESHOLD_SIGMA;
        private boolean enabled = true;
        private String description = "";

        private Builder(Algorithm algorithm) {
            this.algorithm = algorithm;
        }

        public Builder algorithm(Algorithm algorithm) {
            this.algorithm = algorithm;
            return this;
        }

        public Builder threshold(double threshold) {
            this.threshold = threshold;
            return this;
        }

        public Builder drift(double drift) {
            this.drift = drift;
            return this;
        }

        public Builder referenceMean(Double referenceMean) {
            this.referenceMean = referenceMean;
            return this;
        }

        public Builder alpha(double alpha) {
            this.alpha = alpha;
            return this;
        }

        public Builder thresholdSigma(double thresholdSigma) {
            this.thresholdSigma = thresholdSigma;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public MetricConfig build() {
            return new MetricConfig(this);
        }
    }
}
