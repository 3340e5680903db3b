package com.raditha.leakage.config;

/**
 * Maps leakage scores to severity labels.
 *
 * @param majorThreshold    scores above this value are at least major
 * @param criticalThreshold scores above this value are critical
 */
public record SeverityPolicy(double majorThreshold, double criticalThreshold) {

    public SeverityPolicy {
        if (majorThreshold < 0.0 || majorThreshold > 100.0) {
            throw new IllegalArgumentException("majorThreshold must be between 0 and 100");
        }
        if (criticalThreshold < majorThreshold || criticalThreshold > 100.0) {
            throw new IllegalArgumentException("criticalThreshold must be between majorThreshold and 100");
        }
    }

    /**
     * Default thresholds: major above 20, critical above 80.
     */
    public static SeverityPolicy defaults() {
        return new SeverityPolicy(20.0, 80.0);
    }

    public Severity classify(double score) {
        if (score > criticalThreshold) {
            return Severity.CRITICAL;
        }
        if (score > majorThreshold) {
            return Severity.MAJOR;
        }
        return Severity.MINOR;
    }
}
