package com.raditha.leakage.config;

/**
 * Severity label assigned to a divergence site based on its score.
 */
public enum Severity {
    MINOR,
    MAJOR,
    CRITICAL;

    public String label() {
        return name().toLowerCase();
    }
}
