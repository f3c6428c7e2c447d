package com.ulio.drift.detector;

public class DetectionResult {
    private static final DetectionResult WARMING_UP = new DetectionResult(false, 0.0);

    private final boolean anomalous;
    private final double score;

    public DetectionResult(boolean anomalous, double score) {
        this.anomalous = anomalous;
        this.score = score;
    }

    static DetectionResult warmingUp() {
        return WARMING_UP;
    }

    public boolean isAnomalous() {
        return anomalous;
    }

    public double getScore() {
        return score;
    }

    @Override
    public String toString() {
        return "DetectionResult{anomalous=" + anomalous + ", score=" + score + "}";
    }
}
