package com.raditha.leakage.scoring;

import java.util.Arrays;

/**
 * Leakage measures for one observation of a divergence: a partition of the
 * testcases reaching it into outcome groups.
 * <p>
 * Testcases are assumed to be distinct and uniformly distributed, so
 * p(x) = 1/n for every testcase and p(y) = |group y| / n.
 *
 * @param populations                       testcase count per outcome
 * @param depth                             split nesting depth of the site
 * @param mutualInformation                 I(X;Y) in bits
 * @param conditionalGuessingEntropy        G(X|Y)
 * @param minimumConditionalGuessingEntropy min over y of G(X|Y=y)
 */
public record DivergenceEvaluation(
        int[] populations,
        int depth,
        double mutualInformation,
        double conditionalGuessingEntropy,
        double minimumConditionalGuessingEntropy) {

    /**
     * Computes all measures for the given outcome populations.
     *
     * @throws IllegalArgumentException if there is no outcome or an outcome
     *                                  is empty
     */
    public static DivergenceEvaluation of(int[] populations, int depth) {
        if (populations.length == 0) {
            throw new IllegalArgumentException("At least one outcome is required");
        }

        int n = 0;
        for (int c : populations) {
            if (c <= 0) {
                throw new IllegalArgumentException("Outcome populations must be positive: "
                        + Arrays.toString(populations));
            }
            n += c;
        }

        double mutualInformation = 0.0;
        double conditionalGuessingEntropy = 0.0;
        double minimumConditionalGuessingEntropy = Double.MAX_VALUE;
        for (int c : populations) {
            double pY = (double) c / n;
            mutualInformation += pY * log2((double) n / c);

            // Gaussian sum: guessing among c equally likely testcases takes (c + 1) / 2 tries
            double guessingEntropy = (c + 1.0) / 2;
            conditionalGuessingEntropy += pY * guessingEntropy;
            minimumConditionalGuessingEntropy = Math.min(minimumConditionalGuessingEntropy, guessingEntropy);
        }

        return new DivergenceEvaluation(populations.clone(), depth, mutualInformation, conditionalGuessingEntropy,
                minimumConditionalGuessingEntropy);
    }

    public int testcaseCount() {
        return Arrays.stream(populations).sum();
    }

    public int outcomeCount() {
        return populations.length;
    }

    public double value(LeakageMeasure measure) {
        return switch (measure) {
            case MUTUAL_INFORMATION -> mutualInformation;
            case CONDITIONAL_GUESSING_ENTROPY -> conditionalGuessingEntropy;
            case MINIMUM_CONDITIONAL_GUESSING_ENTROPY -> minimumConditionalGuessingEntropy;
        };
    }

    static double log2(double value) {
        return Math.log(value) / Math.log(2);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof DivergenceEvaluation other
                && Arrays.equals(populations, other.populations)
                && depth == other.depth;
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(populations) + depth;
    }

    @Override
    public String toString() {
        return "DivergenceEvaluation" + Arrays.toString(populations);
    }
}
