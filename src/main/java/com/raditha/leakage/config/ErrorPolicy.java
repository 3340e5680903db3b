package com.raditha.leakage.config;

/**
 * What to do when a trace cannot be parsed or merged.
 */
public enum ErrorPolicy {
    /**
     * Stop the run at the first invalid trace.
     */
    ABORT,

    /**
     * Log a warning, leave the tree untouched and continue with the next trace.
     */
    SKIP;

    /**
     * Convert a string value to ErrorPolicy.
     *
     * @throws IllegalArgumentException if the value is not a valid policy
     */
    public static ErrorPolicy fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("ErrorPolicy value cannot be null");
        }
        return switch (value.toLowerCase()) {
            case "abort" -> ABORT;
            case "skip" -> SKIP;
            default -> throw new IllegalArgumentException(
                    "Invalid error policy: " + value + ". Must be: abort or skip");
        };
    }
}
