package com.raditha.leakage.config;

import com.raditha.leakage.scoring.GuessingEntropyScoring;
import com.raditha.leakage.scoring.ScoringFunction;

/**
 * Configuration of a leakage analysis run.
 *
 * @param parserThreads  number of threads parsing trace files
 * @param queueCapacity  maximum number of parsed traces waiting to be merged
 * @param errorPolicy    handling of invalid traces
 * @param scoring        name of the scoring function
 * @param severity       thresholds for severity labels
 * @param dumpCallTree   write a text dump of the merged call tree
 * @param exportFormat   report files to write
 */
public record AnalysisConfig(
        int parserThreads,
        int queueCapacity,
        ErrorPolicy errorPolicy,
        String scoring,
        SeverityPolicy severity,
        boolean dumpCallTree,
        ExportFormat exportFormat) {

    public static final int DEFAULT_PARSER_THREADS = 4;
    public static final int DEFAULT_QUEUE_CAPACITY = 16;

    /**
     * Validate configuration.
     */
    public AnalysisConfig {
        if (parserThreads < 1) {
            throw new IllegalArgumentException("parserThreads must be >= 1");
        }
        if (queueCapacity < 1) {
            throw new IllegalArgumentException("queueCapacity must be >= 1");
        }
        if (errorPolicy == null) {
            throw new IllegalArgumentException("errorPolicy cannot be null");
        }
        if (scoring == null) {
            scoring = GuessingEntropyScoring.NAME;
        }
        // Fails early for unknown names
        ScoringFunction.byName(scoring);
        if (severity == null) {
            severity = SeverityPolicy.defaults();
        }
        if (exportFormat == null) {
            exportFormat = ExportFormat.NONE;
        }
    }

    /**
     * Default configuration: abort on invalid traces, guessing entropy
     * scoring, no exports.
     */
    public static AnalysisConfig defaults() {
        return new AnalysisConfig(
                DEFAULT_PARSER_THREADS,
                DEFAULT_QUEUE_CAPACITY,
                ErrorPolicy.ABORT,
                GuessingEntropyScoring.NAME,
                SeverityPolicy.defaults(),
                false,
                ExportFormat.NONE);
    }

    public ScoringFunction scoringFunction() {
        return ScoringFunction.byName(scoring);
    }
}
