package com.ulio.drift.detector;

/**
 * Turns one new observation of a metric into an anomaly decision and a score.
 * Implementations keep their own state and are not thread-safe.
 */
public interface StreamingDetector {
    DetectionResult update(double value);

    /**
     * Forgets everything learned so far. The next {@link #update(double)} behaves
     * like the first one on a freshly built detector.
     */
    void reset();

    Algorithm getAlgorithm();
}
