package com.raditha.leakage.config;

/**
 * Report files to write next to the console report.
 */
public enum ExportFormat {
    NONE,
    CSV,
    JSON,
    BOTH;

    public static ExportFormat fromString(String value) {
        if (value == null || value.isEmpty()) {
            return NONE;
        }
        return switch (value.toLowerCase()) {
            case "none" -> NONE;
            case "csv" -> CSV;
            case "json" -> JSON;
            case "both" -> BOTH;
            default -> throw new IllegalArgumentException(
                    "Export format must be 'csv', 'json', or 'both', got: " + value);
        };
    }

    public boolean includesCsv() {
        return this == CSV || this == BOTH;
    }

    public boolean includesJson() {
        return this == JSON || this == BOTH;
    }
}
