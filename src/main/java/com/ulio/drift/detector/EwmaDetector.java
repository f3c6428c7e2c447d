package com.ulio.drift.detector;

/**
 * Exponentially weighted mean and variance, scoring each value in units of the
 * adaptive standard deviation.
 */
public class EwmaDetector implements StreamingDetector {
    static final double MIN_STD_DEV = 0.01;

    private final double alpha;
    private final double thresholdSigma;

    private double mean;
    private double variance;
    private boolean initialized;

    public EwmaDetector(double alpha, double thresholdSigma) {
        this.alpha = alpha;
        this.thresholdSigma = thresholdSigma;
    }

    @Override
    public DetectionResult update(double value) {
        if (!initialized) {
            mean = value;
            variance = 0.0;
            initialized = true;
            return DetectionResult.warmingUp();
        }

        double previousMean = mean;
        mean = alpha * value + (1.0 - alpha) * mean;

        double diff = value - previousMean;
        variance = alpha * diff * diff + (1.0 - alpha) * variance;

        double stdDev = Math.max(Math.sqrt(variance), MIN_STD_DEV);
        double score = Math.abs(value - mean) / stdDev;
        return new DetectionResult(score > thresholdSigma, score);
    }

    @Override
    public void reset() {
        mean = 0.0;
        variance = 0.0;
        initialized = false;
    }

    @Override
    public Algorithm getAlgorithm() {
        return Algorithm.EWMA;
    }

    public double getAlpha() {
        return alpha;
    }

    public double getThresholdSigma() {
        return thresholdSigma;
    }

    public boolean hasMean() {
        return initialized;
    }

    public double getMean() {
        return mean;
    }

    public double getVariance() {
        return variance;
    }
}
