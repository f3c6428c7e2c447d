package com.ulio.drift.anomaly;

import com.ulio.drift.detector.Algorithm;
import com.ulio.drift.detector.DetectionResult;

/**
 * One metric's raw detector output for a single cycle, before debouncing.
 */
public class Detection {
    private final String metric;
    private final double value;
    private final Algorithm algorithm;
    private final DetectionResult result;

    public Detection(String metric, double value, Algorithm algorithm, DetectionResult result) {
        this.metric = metric;
        this.value = value;
        this.algorithm = algorithm;
        this.result = result;
    }

    public String getMetric() {
        return metric;
    }

    public double getValue() {
        return value;
    }

    public Algorithm getAlgorithm() {
        return algorithm;
    }

    public boolean isAnomalous() {
        return result.isAnomalous();
    }

    public double getScore() {
        return result.getScore();
    }
}
