package com.raditha.leakage.scoring;

import com.raditha.leakage.merge.CallTreeMerger;
import com.raditha.leakage.metrics.CallTreeDumper;
import com.raditha.leakage.model.RootNode;
import com.raditha.leakage.trace.CallStackIds;
import com.raditha.leakage.trace.TraceFormatException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.raditha.leakage.trace.TraceFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class LeakageScorerTest {

    private static final double EPSILON = 1e-6;

    private CallTreeMerger merger;
    private LeakageScorer scorer;

    @BeforeEach
    void setUp() {
        merger = new CallTreeMerger();
        scorer = new LeakageScorer();
    }

    @Test
    void testNoDivergenceNoSites() throws TraceFormatException {
        for (int id = 0; id < 4; id++) {
            merger.mergeTrace(id, trace(branch(1, 2, true), call(3, 4), read(5, 0x10), ret(6, 4)));
        }

        LeakageAnalysis analysis = scorer.analyze(merger.getRoot());

        assertTrue(analysis.sites().isEmpty());
        assertEquals(4, analysis.testcaseCount());
        assertEquals(1, analysis.callStacks().size());
    }

    @Test
    void testBranchDivergenceSite() throws TraceFormatException {
        merger.mergeTrace(0, trace(branch(1, 2, true), branch(5, 6, true)));
        merger.mergeTrace(1, trace(branch(1, 2, true), branch(5, 7, false)));
        merger.mergeTrace(2, trace(branch(1, 2, true), branch(5, 6, true)));

        Map<LeakageSite, LeakageInfo> sites = scorer.scoreTree(merger.getRoot());

        LeakageSite site = new LeakageSite(CallStackIds.ROOT, 5, LeakageType.JUMP);
        assertEquals(List.of(site), List.copyOf(sites.keySet()));

        LeakageInfo info = sites.get(site);
        assertEquals(1, info.numberOfCalls());
        assertEquals(2, info.maximumOutcomeCount());
        assertEquals(List.of(2, 1), info.worstCasePopulations());
        assertEquals(0.918295834, info.mutualInformation().mean(), EPSILON);
        assertEquals(100.0, info.headlineScore(), EPSILON);
        assertEquals(4.0 / 3.0, info.conditionalGuessingEntropy().mean(), EPSILON);
        assertEquals(200.0 / 3.0, info.conditionalGuessingEntropy().score(), EPSILON);
        assertNull(info.treeDepth().score());
    }

    @Test
    void testMoreSkewedPartitionScoresNoLower() throws TraceFormatException {
        double skewed = headlineScoreOfPartition(99, 1);
        double balanced = headlineScoreOfPartition(50, 50);

        assertTrue(skewed >= balanced, skewed + " < " + balanced);
        assertEquals(100.0, skewed, EPSILON);
        assertEquals(100.0 * (1 - 24.5 / 49.5), balanced, EPSILON);
    }

    @Test
    void testScoreIsSymmetricUnderRelabeling() throws TraceFormatException {
        assertEquals(headlineScoreOfPartition(70, 30), headlineScoreOfPartition(30, 70), EPSILON);
    }

    private double headlineScoreOfPartition(int first, int second) throws TraceFormatException {
        CallTreeMerger partitionMerger = new CallTreeMerger();
        for (int id = 0; id < first + second; id++) {
            boolean taken = id < first;
            partitionMerger.mergeTrace(id, trace(branch(1, taken ? 2 : 3, taken)));
        }
        Map<LeakageSite, LeakageInfo> sites = scorer.scoreTree(partitionMerger.getRoot());
        assertEquals(1, sites.size());
        return sites.values().iterator().next().headlineScore();
    }

    @Test
    void testRepeatedVisitsAggregateIntoOneSite() throws TraceFormatException {
        merger.mergeTrace(0, trace(branch(5, 6, true), branch(5, 6, true)));
        merger.mergeTrace(1, trace(branch(5, 6, true), branch(5, 7, false)));
        merger.mergeTrace(2, trace(branch(5, 7, false)));

        Map<LeakageSite, LeakageInfo> sites = scorer.scoreTree(merger.getRoot());

        assertEquals(1, sites.size());
        LeakageInfo info = sites.get(new LeakageSite(CallStackIds.ROOT, 5, LeakageType.JUMP));
        assertEquals(2, info.numberOfCalls());
        assertEquals(0.5, info.treeDepth().mean(), EPSILON);
        assertEquals(0.0, info.treeDepth().minimum(), EPSILON);
        assertEquals(1.0, info.treeDepth().maximum(), EPSILON);
        assertEquals(100.0, info.minimumConditionalGuessingEntropy().score(), EPSILON);
        assertEquals(0.0, info.minimumConditionalGuessingEntropy().scoreStandardDeviation(), EPSILON);
        assertEquals(250.0 / 3.0, info.conditionalGuessingEntropy().score(), EPSILON);
        assertEquals(1.0, info.mutualInformation().maximum(), EPSILON);
    }

    @Test
    void testMemoryAccessSiteInsideCall() throws TraceFormatException {
        long[] addresses = {0xA000, 0xA000, 0xB000, 0xC000};
        for (int id = 0; id < addresses.length; id++) {
            merger.mergeTrace(id, trace(call(10, 20, 77), read(30, addresses[id]), ret(40, 11)));
        }

        LeakageAnalysis analysis = scorer.analyze(merger.getRoot());

        LeakageInfo info = analysis.sites().get(new LeakageSite(77, 30, LeakageType.MEMORY_ACCESS));
        assertNotNull(info);
        assertEquals(3, info.maximumOutcomeCount());
        assertEquals(1.5, info.mutualInformation().mean(), EPSILON);
        assertEquals(1.25, info.conditionalGuessingEntropy().mean(), EPSILON);

        assertEquals(new CallStackInfo(77, CallStackIds.ROOT, 10, 20), analysis.callStacks().get(77L));
        assertEquals(1.5, analysis.maximumMutualInformation(), EPSILON);
    }

    @Test
    void testMemoryAccessWithManyDistinctAddresses() throws TraceFormatException {
        int testcases = 200;
        for (int id = 0; id < testcases; id++) {
            merger.mergeTrace(id, trace(read(30, 0x1000L + 8L * id)));
        }

        LeakageInfo info = scorer.scoreTree(merger.getRoot())
                .get(new LeakageSite(CallStackIds.ROOT, 30, LeakageType.MEMORY_ACCESS));

        assertEquals(testcases, info.maximumOutcomeCount());
        assertEquals(testcases, info.worstCasePopulations().size());
        assertTrue(info.worstCasePopulations().stream().allMatch(population -> population == 1));
        assertEquals(Math.log(testcases) / Math.log(2), info.mutualInformation().mean(), EPSILON);
    }

    @Test
    void testTruncatedTraceDoesNotCountAtLaterMemoryAccess() throws TraceFormatException {
        merger.mergeTrace(0, trace(branch(1, 2, true), read(3, 0x100)));
        merger.mergeTrace(1, trace(branch(1, 2, true)));
        merger.mergeTrace(2, trace(branch(1, 2, true), read(3, 0x200)));

        LeakageInfo info = scorer.scoreTree(merger.getRoot())
                .get(new LeakageSite(CallStackIds.ROOT, 3, LeakageType.MEMORY_ACCESS));

        assertEquals(List.of(1, 1), info.worstCasePopulations());
        assertEquals(1.0, info.mutualInformation().mean(), EPSILON);
    }

    @Test
    void testSitesByScoreOrdering() throws TraceFormatException {
        // Branch 5 separates one testcase, the read separates all of them
        long[] addresses = {0x10, 0x20, 0x30, 0x40};
        for (int id = 0; id < 4; id++) {
            merger.mergeTrace(id, trace(read(1, addresses[id]), branch(5, id == 0 ? 6 : 7, id == 0)));
        }

        List<LeakageInfo> ordered = scorer.analyze(merger.getRoot()).sitesByScore();

        assertEquals(2, ordered.size());
        assertTrue(ordered.get(0).headlineScore() >= ordered.get(1).headlineScore());
        assertEquals(2.0, ordered.stream()
                .filter(info -> info.site().type() == LeakageType.MEMORY_ACCESS)
                .findFirst().orElseThrow().mutualInformation().mean(), EPSILON);
    }

    @Test
    void testCustomScoringFunctionIsUsed() throws TraceFormatException {
        ScoringFunction scoring = mock(ScoringFunction.class);
        when(scoring.score(any(LeakageMeasure.class), anyDouble(), anyInt())).thenReturn(42.0);

        merger.mergeTrace(0, trace(branch(1, 2, true)));
        merger.mergeTrace(1, trace(branch(1, 3, false)));
        Map<LeakageSite, LeakageInfo> sites = new LeakageScorer(scoring).scoreTree(merger.getRoot());

        assertEquals(42.0, sites.values().iterator().next().headlineScore());
        verify(scoring, times(LeakageMeasure.values().length)).score(any(LeakageMeasure.class), anyDouble(), eq(2));
        verify(scoring).score(eq(LeakageMeasure.MUTUAL_INFORMATION), eq(1.0), eq(2));
    }

    @Test
    void testScoringDoesNotModifyTree() throws TraceFormatException {
        merger.mergeTrace(0, trace(branch(1, 2, true), read(3, 0x10)));
        merger.mergeTrace(1, trace(branch(1, 2, true), read(3, 0x20)));
        merger.mergeTrace(2, trace(branch(1, 4, false)));
        RootNode root = merger.getRoot();
        String before = new CallTreeDumper().dumpToString(root);

        scorer.analyze(root);
        scorer.analyze(root);

        assertEquals(before, new CallTreeDumper().dumpToString(root));
    }

    @Test
    void testEmptyTree() {
        LeakageAnalysis analysis = scorer.analyze(new RootNode());

        assertTrue(analysis.sites().isEmpty());
        assertEquals(0, analysis.testcaseCount());
    }
}
