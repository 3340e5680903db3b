package com.raditha.leakage.merge;

/**
 * Counters describing how much restructuring merging caused.
 *
 * @param mergedTestcases   number of testcases merged into the tree
 * @param splits            control flow splits inside an existing successor chain
 * @param branches          split successors appended after an exhausted chain
 * @param addressPromotions memory accesses promoted to split accesses
 */
public record MergeStatistics(int mergedTestcases, int splits, int branches, int addressPromotions) {
}
