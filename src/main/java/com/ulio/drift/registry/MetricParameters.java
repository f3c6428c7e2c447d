package com.ulio.drift.registry;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.ulio.drift.detector.Algorithm;

/**
 * Partial metric settings. Any field left {@code null} is taken from the metric's
 * current config when merged, see {@link MetricConfig#merge}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class MetricParameters {
    private Algorithm algorithm;
    private Double threshold;
    private Double drift;
    private Double referenceMean;
    private Double alpha;
    private Double thresholdSigma;
    private Boolean enabled;
    private String description;

    public static MetricParameters cumsum(Double threshold, Double drift, Double referenceMean) {
        MetricParameters parameters = new MetricParameters();
        parameters.setAlgorithm(Algorithm.CUMSUM);
        parameters.setThreshold(threshold);
        parameters.setDrift(drift);
        parameters.setReferenceMean(referenceMean);
        return parameters;
    }

    public static MetricParameters ewma(Double alpha, Double thresholdSigma) {
        MetricParameters parameters = new MetricParameters();
        parameters.setAlgorithm(Algorithm.EWMA);
        parameters.setAlpha(alpha);
        parameters.setThresholdSigma(thresholdSigma);
        return parameters;
    }

    public Algorithm getAlgorithm() {
        return algorithm;
    }

    public void setAlgorithm(Algorithm algorithm) {
        this.algorithm = algorithm;
    }

    public Double getThreshold() {
        return threshold;
    }

    public void setThreshold(Double threshold) {
        this.threshold = threshold;
    }

    public Double getDrift() {
        return drift;
    }

    public void setDrift(Double drift) {
        this.drift = drift;
    }

    public Double getReferenceMean() {
        return referenceMean;
    }

    public void setReferenceMean(Double referenceMean) {
        this.referenceMean = referenceMean;
    }

    public Double getAlpha() {
        return alpha;
    }

    public void setAlpha(Double alpha) {
        this.alpha = alpha;
    }

    public Double getThresholdSigma() {
        return thresholdSigma;
    }

    public void setThresholdSigma(Double thresholdSigma) {
        this.thresholdSigma = thresholdSigma;
    }

    public Boolean getEnabled() {
        return enabled;
    }

    public void setEnabled(Boolean enabled) {
        this.enabled = enabled;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }
}
