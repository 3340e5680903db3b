package com.raditha.leakage.scoring;

/**
 * Default scoring: measures how much the outcome reduces the number of
 * guesses an attacker needs.
 * <p>
 * Without any observation, guessing one of n testcases takes (n + 1) / 2
 * tries on average; with a uniquely identifying outcome it takes 1. A
 * guessing entropy g is scored as {@code 100 * (1 - (g - 1) / ((n + 1) / 2 - 1))}.
 * Mutual information is scored relative to its maximum log2(n).
 */
public class GuessingEntropyScoring implements ScoringFunction {

    public static final String NAME = "guessing-entropy";

    @Override
    public double score(LeakageMeasure measure, double value, int testcaseCount) {
        if (testcaseCount <= 1) {
            return 0.0;
        }

        if (measure == LeakageMeasure.MUTUAL_INFORMATION) {
            return ScoringFunction.clamp(100.0 * value / DivergenceEvaluation.log2(testcaseCount));
        }

        double unconditional = (testcaseCount + 1) / 2.0;
        return ScoringFunction.clamp(100.0 * (1.0 - (value - 1.0) / (unconditional - 1.0)));
    }

    @Override
    public String name() {
        return NAME;
    }
}
