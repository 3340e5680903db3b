package com.raditha.leakage.pipeline;

import com.raditha.leakage.merge.MergeStatistics;
import com.raditha.leakage.model.RootNode;

import java.util.List;

/**
 * Outcome of a pipeline run.
 *
 * @param root              the merged call tree
 * @param mergedTestcases   number of testcases merged into the tree
 * @param skippedTestcases  traces rejected under the skip policy
 * @param cancelled         true if the run was cancelled before all traces
 *                          were merged
 * @param statistics        merge counters
 */
public record PipelineResult(
        RootNode root,
        int mergedTestcases,
        List<SkippedTrace> skippedTestcases,
        boolean cancelled,
        MergeStatistics statistics) {

    public PipelineResult {
        skippedTestcases = List.copyOf(skippedTestcases);
    }
}
