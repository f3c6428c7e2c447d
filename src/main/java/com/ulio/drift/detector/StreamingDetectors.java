package com.ulio.drift.detector;

import com.ulio.drift.registry.MetricConfig;

public final class StreamingDetectors {
    private StreamingDetectors() {
    }

    /**
     * Builds a fresh detector for {@code config}. A CUMSUM config with a reference mean
     * starts seeded; everything else learns its baseline from the first value.
     */
    public static StreamingDetector create(MetricConfig config) {
        switch (config.getAlgorithm()) {
            case CUMSUM:
                CumsumDetector cumsum = new CumsumDetector(config.getThreshold(), config.getDrift());
                if (config.getReferenceMean() != null) {
                    cumsum.setReference(config.getReferenceMean());
                }
                return cumsum;
            case EWMA:
                return new EwmaDetector(config.getAlpha(), config.getThresholdSigma());
            default:
                throw new IllegalArgumentException("Unsupported algorithm: " + config.getAlgorithm());
        }
    }
}
