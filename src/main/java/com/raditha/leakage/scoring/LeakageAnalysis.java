package com.raditha.leakage.scoring;

import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Result of scoring a merged call tree.
 *
 * @param testcaseCount         number of testcases in the tree
 * @param sites                 leakage per divergence site, in traversal order
 * @param callStacks            call stacks by ID, in traversal order
 * @param maximumMutualInformation highest mutual information of any evaluation
 */
public record LeakageAnalysis(
        int testcaseCount,
        Map<LeakageSite, LeakageInfo> sites,
        Map<Long, CallStackInfo> callStacks,
        double maximumMutualInformation) {

    public LeakageAnalysis {
        sites = Collections.unmodifiableMap(sites);
        callStacks = Collections.unmodifiableMap(callStacks);
    }

    /**
     * Returns the sites ordered by descending headline score.
     */
    public List<LeakageInfo> sitesByScore() {
        return sites.values().stream()
                .sorted(Comparator.comparingDouble(LeakageInfo::headlineScore).reversed())
                .toList();
    }
}
