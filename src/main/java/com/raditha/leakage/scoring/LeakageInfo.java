package com.raditha.leakage.scoring;

import java.util.List;

/**
 * Aggregated leakage of one divergence site.
 *
 * @param site                              the divergence site
 * @param numberOfCalls                     how often the site was evaluated
 *                                          (loop iterations, different paths)
 * @param maximumOutcomeCount               largest number of distinct
 *                                          outcomes observed in one evaluation
 * @param worstCasePopulations              outcome populations of the
 *                                          evaluation with the highest
 *                                          headline score
 * @param treeDepth                         split nesting depth
 * @param mutualInformation                 mutual information in bits
 * @param conditionalGuessingEntropy        conditional guessing entropy
 * @param minimumConditionalGuessingEntropy minimum conditional guessing entropy
 */
public record LeakageInfo(
        LeakageSite site,
        int numberOfCalls,
        int maximumOutcomeCount,
        List<Integer> worstCasePopulations,
        StatisticsEntry treeDepth,
        StatisticsEntry mutualInformation,
        StatisticsEntry conditionalGuessingEntropy,
        StatisticsEntry minimumConditionalGuessingEntropy) {

    public LeakageInfo {
        worstCasePopulations = List.copyOf(worstCasePopulations);
    }

    /**
     * The score used to rank sites: the mean score of the minimum conditional
     * guessing entropy.
     */
    public double headlineScore() {
        Double score = minimumConditionalGuessingEntropy.score();
        return score == null ? 0.0 : score;
    }

    public StatisticsEntry measure(LeakageMeasure measure) {
        return switch (measure) {
            case MUTUAL_INFORMATION -> mutualInformation;
            case CONDITIONAL_GUESSING_ENTROPY -> conditionalGuessingEntropy;
            case MINIMUM_CONDITIONAL_GUESSING_ENTROPY -> minimumConditionalGuessingEntropy;
        };
    }
}
