package com.raditha.leakage.scoring;

/**
 * Statistical measures computed for every evaluation of a divergence site.
 */
public enum LeakageMeasure {
    /**
     * Mutual information between testcase and observed outcome, in bits.
     */
    MUTUAL_INFORMATION,

    /**
     * Expected number of guesses for the testcase given the outcome, averaged
     * over the outcomes.
     */
    CONDITIONAL_GUESSING_ENTROPY,

    /**
     * Number of guesses for the testcase given the most revealing outcome.
     */
    MINIMUM_CONDITIONAL_GUESSING_ENTROPY
}
