package com.ulio.drift.detector;

/**
 * Two-sided cumulative sum test against a reference mean.
 *
 * <p>Deviations smaller than {@code drift} never accumulate. Once either sum exceeds
 * {@code threshold} both sums restart from zero, so a signal that stays shifted keeps
 * re-triggering instead of latching.
 */
public class CumsumDetector implements StreamingDetector {
    private final double threshold;
    private final double drift;

    private double positiveSum;
    private double negativeSum;
    private double referenceMean;
    private boolean referenceSet;

    public CumsumDetector(double threshold, double drift) {
        this.threshold = threshold;
        this.drift = drift;
    }

    public void setReference(double mean) {
        this.referenceMean = mean;
        this.referenceSet = true;
    }

    @Override
    public DetectionResult update(double value) {
        if (!referenceSet) {
            setReference(value);
            return DetectionResult.warmingUp();
        }

        double deviation = value - referenceMean - drift;
        positiveSum = Math.max(0.0, positiveSum + deviation);
        negativeSum = Math.max(0.0, negativeSum - deviation);

        double score = Math.max(positiveSum, negativeSum);
        if (score > threshold) {
            positiveSum = 0.0;
            negativeSum = 0.0;
            return new DetectionResult(true, score);
        }
        return new DetectionResult(false, score);
    }

    @Override
    public void reset() {
        positiveSum = 0.0;
        negativeSum = 0.0;
        referenceMean = 0.0;
        referenceSet = false;
    }

    @Override
    public Algorithm getAlgorithm() {
        return Algorithm.CUMSUM;
    }

    public double getThreshold() {
        return threshold;
    }

    public double getDrift() {
        return drift;
    }

    public double getPositiveSum() {
        return positiveSum;
    }

    public double getNegativeSum() {
        return negativeSum;
    }

    public boolean hasReference() {
        return referenceSet;
    }

    public double getReferenceMean() {
        return referenceMean;
    }
}
