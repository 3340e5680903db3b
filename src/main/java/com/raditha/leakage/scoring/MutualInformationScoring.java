package com.raditha.leakage.scoring;

/**
 * Scores every measure by the fraction of the testcase information it
 * reveals, in bits.
 * <p>
 * Guessing entropies are converted to the number of bits the observation
 * saves against the unconditional guessing entropy (n + 1) / 2.
 */
public class MutualInformationScoring implements ScoringFunction {

    public static final String NAME = "mutual-information";

    @Override
    public double score(LeakageMeasure measure, double value, int testcaseCount) {
        if (testcaseCount <= 1) {
            return 0.0;
        }

        if (measure == LeakageMeasure.MUTUAL_INFORMATION) {
            return ScoringFunction.clamp(100.0 * value / DivergenceEvaluation.log2(testcaseCount));
        }

        double unconditional = (testcaseCount + 1) / 2.0;
        return ScoringFunction.clamp(100.0 * DivergenceEvaluation.log2(unconditional / value)
                / DivergenceEvaluation.log2(unconditional));
    }

    @Override
    public String name() {
        return NAME;
    }
}
