package com.ulio.drift.anomaly;

public enum Severity {
    MEDIUM("medium"),
    HIGH("high");

    private final String label;

    Severity(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
