package com.raditha.leakage.scoring;

import com.raditha.leakage.model.AllocationNode;
import com.raditha.leakage.model.BranchNode;
import com.raditha.leakage.model.CallNode;
import com.raditha.leakage.model.CallTreeNode;
import com.raditha.leakage.model.MemoryAccessNode;
import com.raditha.leakage.model.ReturnNode;
import com.raditha.leakage.model.RootNode;
import com.raditha.leakage.model.SplitMemoryAccessNode;
import com.raditha.leakage.model.SplitNode;
import com.raditha.leakage.model.TestcaseIdSet;
import com.raditha.leakage.trace.CallStackIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Walks a merged call tree and quantifies how much each divergence reveals
 * about the testcase.
 * <p>
 * Every split node with at least two split successors and every split memory
 * access is a divergence. Each visit is evaluated separately and aggregated
 * per {@link LeakageSite}. The tree is not modified.
 */
public class LeakageScorer {

    private static final Logger logger = LoggerFactory.getLogger(LeakageScorer.class);

    /**
     * Distance to log2(#testcases) in bits below which the mutual information
     * is considered saturated.
     */
    static final double MUTUAL_INFORMATION_SATURATION_MARGIN = 0.9;

    private final ScoringFunction scoringFunction;

    public LeakageScorer() {
        this(new GuessingEntropyScoring());
    }

    public LeakageScorer(ScoringFunction scoringFunction) {
        this.scoringFunction = scoringFunction;
    }

    private record Frame(SplitNode node, long callStackId, int depth) {
    }

    /**
     * Scores all divergence sites of the given tree.
     */
    public Map<LeakageSite, LeakageInfo> scoreTree(RootNode root) {
        return analyze(root).sites();
    }

    /**
     * Scores all divergence sites and collects the call stacks they live in.
     */
    public LeakageAnalysis analyze(RootNode root) {
        Map<LeakageSite, SiteAccumulator> accumulators = new LinkedHashMap<>();
        Map<Long, CallStackInfo> callStacks = new LinkedHashMap<>();
        double maximumMutualInformation = 0.0;

        Deque<Frame> pending = new ArrayDeque<>();
        pending.push(new Frame(root, CallStackIds.ROOT, 0));
        while (!pending.isEmpty()) {
            Frame frame = pending.pop();
            SplitNode node = frame.node();

            for (CallTreeNode successor : node.successors()) {
                if (successor instanceof CallNode call) {
                    callStacks.putIfAbsent(call.callStackId(), new CallStackInfo(call.callStackId(),
                            frame.callStackId(), call.sourceInstructionId(), call.targetInstructionId()));
                    pending.push(new Frame(call, call.callStackId(), 0));
                } else if (successor instanceof SplitMemoryAccessNode access) {
                    DivergenceEvaluation evaluation = DivergenceEvaluation.of(
                            populations(access.targets().values()), frame.depth());
                    LeakageSite site = new LeakageSite(frame.callStackId(), access.instructionId(),
                            LeakageType.MEMORY_ACCESS);
                    record(accumulators, site, evaluation);
                    maximumMutualInformation = Math.max(maximumMutualInformation, evaluation.mutualInformation());
                }
            }

            List<SplitNode> children = node.splitSuccessors();
            if (children.size() >= 2) {
                DivergenceEvaluation evaluation = DivergenceEvaluation.of(
                        populations(children.stream().map(SplitNode::testcaseIds).toList()), frame.depth());
                maximumMutualInformation = Math.max(maximumMutualInformation, evaluation.mutualInformation());

                // Outcomes often differ in the target only; those share one site
                Set<LeakageSite> sites = new LinkedHashSet<>();
                for (SplitNode child : children) {
                    if (!child.successors().isEmpty()) {
                        sites.add(siteOf(child.successors().get(0), frame.callStackId()));
                    }
                }
                for (LeakageSite site : sites) {
                    record(accumulators, site, evaluation);
                }
            }
            for (SplitNode child : children) {
                pending.push(new Frame(child, frame.callStackId(), frame.depth() + 1));
            }
        }

        Map<LeakageSite, LeakageInfo> sites = new LinkedHashMap<>();
        accumulators.forEach((site, accumulator) -> sites.put(site, accumulator.toLeakageInfo(site)));

        int testcaseCount = root.testcaseIds().size();
        warnIfSaturated(maximumMutualInformation, testcaseCount);
        logger.info("Scored {} divergence sites in {} call stacks", sites.size(), callStacks.size());

        return new LeakageAnalysis(testcaseCount, sites, callStacks, maximumMutualInformation);
    }

    private void record(Map<LeakageSite, SiteAccumulator> accumulators, LeakageSite site,
            DivergenceEvaluation evaluation) {
        accumulators.computeIfAbsent(site, s -> new SiteAccumulator()).add(evaluation, scoringFunction);
    }

    private static void warnIfSaturated(double maximumMutualInformation, int testcaseCount) {
        if (testcaseCount < 2) {
            return;
        }
        double limit = DivergenceEvaluation.log2(testcaseCount);
        if (maximumMutualInformation > limit - MUTUAL_INFORMATION_SATURATION_MARGIN) {
            logger.warn("The highest mutual information ({} bits) is close to its upper bound log2({}) = {} bits. "
                    + "Using more testcases is recommended.",
                    String.format("%.2f", maximumMutualInformation), testcaseCount, String.format("%.2f", limit));
        }
    }

    private static int[] populations(Collection<TestcaseIdSet> outcomes) {
        return outcomes.stream().mapToInt(TestcaseIdSet::size).filter(size -> size > 0).toArray();
    }

    static LeakageSite siteOf(CallTreeNode first, long callStackId) {
        if (first instanceof CallNode call) {
            return new LeakageSite(callStackId, call.sourceInstructionId(), LeakageType.CALL);
        } else if (first instanceof BranchNode branch) {
            return new LeakageSite(callStackId, branch.sourceInstructionId(), LeakageType.JUMP);
        } else if (first instanceof ReturnNode ret) {
            return new LeakageSite(callStackId, ret.sourceInstructionId(), LeakageType.RETURN);
        } else if (first instanceof MemoryAccessNode access) {
            return new LeakageSite(callStackId, access.instructionId(), LeakageType.MEMORY_ACCESS);
        } else if (first instanceof AllocationNode allocation) {
            return new LeakageSite(callStackId, allocation.id(), LeakageType.ALLOCATION);
        }
        throw new IllegalStateException("Unexpected node type: " + first.getClass().getSimpleName());
    }

    /**
     * Running statistics of one site.
     */
    private static final class SiteAccumulator {
        private int numberOfCalls;
        private int maximumOutcomeCount;
        private int[] worstCasePopulations = new int[0];
        private double worstCaseScore = -1.0;

        private final StatisticsAccumulator depth = new StatisticsAccumulator();
        private final StatisticsAccumulator[] values = new StatisticsAccumulator[LeakageMeasure.values().length];
        private final StatisticsAccumulator[] scores = new StatisticsAccumulator[LeakageMeasure.values().length];

        SiteAccumulator() {
            for (int i = 0; i < values.length; i++) {
                values[i] = new StatisticsAccumulator();
                scores[i] = new StatisticsAccumulator();
            }
        }

        void add(DivergenceEvaluation evaluation, ScoringFunction scoringFunction) {
            ++numberOfCalls;
            maximumOutcomeCount = Math.max(maximumOutcomeCount, evaluation.outcomeCount());
            depth.add(evaluation.depth());

            int n = evaluation.testcaseCount();
            for (LeakageMeasure measure : LeakageMeasure.values()) {
                double value = evaluation.value(measure);
                double score = scoringFunction.score(measure, value, n);
                values[measure.ordinal()].add(value);
                scores[measure.ordinal()].add(score);

                if (measure == LeakageMeasure.MINIMUM_CONDITIONAL_GUESSING_ENTROPY && score > worstCaseScore) {
                    worstCaseScore = score;
                    worstCasePopulations = evaluation.populations();
                }
            }
        }

        LeakageInfo toLeakageInfo(LeakageSite site) {
            return new LeakageInfo(site, numberOfCalls, maximumOutcomeCount,
                    Arrays.stream(worstCasePopulations).boxed().toList(),
                    StatisticsEntry.of(depth),
                    entry(LeakageMeasure.MUTUAL_INFORMATION),
                    entry(LeakageMeasure.CONDITIONAL_GUESSING_ENTROPY),
                    entry(LeakageMeasure.MINIMUM_CONDITIONAL_GUESSING_ENTROPY));
        }

        private StatisticsEntry entry(LeakageMeasure measure) {
            return StatisticsEntry.of(values[measure.ordinal()], scores[measure.ordinal()]);
        }
    }
}
