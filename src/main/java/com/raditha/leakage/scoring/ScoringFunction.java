package com.raditha.leakage.scoring;

import java.util.Locale;

/**
 * Policy that turns a leakage measure into a score between 0 (no leakage)
 * and 100 (the outcome identifies the testcase).
 * <p>
 * Implementations must be monotone: a more skewed partition never scores
 * lower than a more balanced one of the same size.
 */
public interface ScoringFunction {

    /**
     * Scores one measured value.
     *
     * @param measure       the measure the value belongs to
     * @param value         the measured value
     * @param testcaseCount number of testcases that reached the divergence
     * @return score in [0, 100]
     */
    double score(LeakageMeasure measure, double value, int testcaseCount);

    /**
     * Name used in configuration files and on the command line.
     */
    String name();

    /**
     * Resolves a scoring function by its configured name.
     *
     * @throws IllegalArgumentException for unknown names
     */
    static ScoringFunction byName(String name) {
        return switch (name.toLowerCase(Locale.ROOT)) {
            case GuessingEntropyScoring.NAME -> new GuessingEntropyScoring();
            case MutualInformationScoring.NAME -> new MutualInformationScoring();
            default -> throw new IllegalArgumentException("Unknown scoring function: " + name
                    + ". Valid values: " + GuessingEntropyScoring.NAME + ", " + MutualInformationScoring.NAME);
        };
    }

    static double clamp(double score) {
        if (Double.isNaN(score)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(100.0, score));
    }
}
