package com.raditha.leakage.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Node that has a number of successor nodes, followed by a split.
 * <p>
 * All testcases in {@link #testcaseIds()} share the {@link #successors()}
 * chain. After its last element they continue in exactly one of the
 * {@link #splitSuccessors()}, unless their trace ends within this node;
 * those are kept in {@link #endedTestcases()} by the position they reached.
 * <p>
 * Split nodes are identified by object identity only. Two structurally equal
 * subtrees may stem from unrelated divergences, so {@link #equals(Object)}
 * and {@link #hashCode()} refuse to work; use {@code ==} or an
 * {@link java.util.IdentityHashMap}.
 */
public sealed class SplitNode implements CallTreeNode permits RootNode, CallNode {

    private final TestcaseIdSet testcaseIds;
    private final List<CallTreeNode> successors = new ArrayList<>();
    private final List<SplitNode> splitSuccessors = new ArrayList<>();

    /**
     * Testcases whose trace ended here, keyed by the number of successors
     * they executed.
     */
    private final NavigableMap<Integer, TestcaseIdSet> endedTestcases = new TreeMap<>();

    public SplitNode() {
        this.testcaseIds = new TestcaseIdSet();
    }

    private SplitNode(TestcaseIdSet testcaseIds) {
        this.testcaseIds = testcaseIds;
    }

    /**
     * Testcase IDs leading to this node.
     */
    public TestcaseIdSet testcaseIds() {
        return testcaseIds;
    }

    /**
     * Successors of this node, in linear order.
     */
    public List<CallTreeNode> successors() {
        return Collections.unmodifiableList(successors);
    }

    /**
     * Alternative continuations directly following the last successor, in no
     * particular order.
     */
    public List<SplitNode> splitSuccessors() {
        return Collections.unmodifiableList(splitSuccessors);
    }

    /**
     * Testcases whose trace ended in this node, keyed by the number of
     * successors they executed.
     */
    public Map<Integer, TestcaseIdSet> endedTestcases() {
        return Collections.unmodifiableMap(endedTestcases);
    }

    /**
     * Records that the trace of the given testcase ended after executing
     * {@code position} successors of this node.
     */
    public void recordEnd(int testcaseId, int position) {
        if (position < 0 || position > successors.size()) {
            throw new IndexOutOfBoundsException("End position " + position
                    + " outside successor chain of length " + successors.size());
        }
        endedTestcases.computeIfAbsent(position, p -> new TestcaseIdSet()).add(testcaseId);
    }

    /**
     * Returns the testcases that executed the successor at the given index,
     * i.e. all testcases of this node except those that ended before it.
     */
    public TestcaseIdSet testcasesReaching(int index) {
        TestcaseIdSet result = testcaseIds.copy();
        for (TestcaseIdSet ended : endedTestcases.headMap(index, true).values()) {
            result = result.without(ended);
        }
        return result;
    }

    public void addTestcase(int testcaseId) {
        testcaseIds.add(testcaseId);
    }

    public void appendSuccessor(CallTreeNode node) {
        successors.add(node);
    }

    /**
     * Replaces the successor at the given index, used when a memory access is
     * promoted to a split access.
     */
    public void replaceSuccessor(int index, CallTreeNode node) {
        successors.set(index, node);
    }

    /**
     * Adds a new split successor for a single testcase, whose first step is
     * the given node.
     *
     * @return the new split successor
     */
    public SplitNode addSplitSuccessor(int testcaseId, CallTreeNode firstSuccessor) {
        SplitNode branch = new SplitNode(TestcaseIdSet.of(testcaseId));
        branch.successors.add(firstSuccessor);
        splitSuccessors.add(branch);
        return branch;
    }

    /**
     * Splits this node at the given successor index and creates two split
     * successors at that position:
     * <ol>
     * <li>all testcase IDs that reached the index except the current one,
     * together with the successors from the index on, all existing split
     * successors and the testcases that ended after the index (moved, not
     * copied);</li>
     * <li>the current testcase with the conflicting successor.</li>
     * </ol>
     *
     * @param successorIndex index of the successor where the split is created
     * @param testcaseId     current testcase ID
     * @param firstSuccessor first successor of the new branch
     * @return the new branch holding the current testcase
     */
    public SplitNode splitAtSuccessor(int successorIndex, int testcaseId, CallTreeNode firstSuccessor) {
        if (successorIndex < 0 || successorIndex > successors.size()) {
            throw new IndexOutOfBoundsException("Split index " + successorIndex
                    + " outside successor chain of length " + successors.size());
        }

        SplitNode existing = new SplitNode(testcasesReaching(successorIndex).without(testcaseId));
        List<CallTreeNode> tail = successors.subList(successorIndex, successors.size());
        existing.successors.addAll(tail);
        tail.clear();
        existing.splitSuccessors.addAll(splitSuccessors);
        splitSuccessors.clear();

        // Testcases that ended at or before the index stay here
        Map<Integer, TestcaseIdSet> movedEnds = endedTestcases.tailMap(successorIndex, false);
        movedEnds.forEach((position, ids) -> existing.endedTestcases.put(position - successorIndex, ids));
        movedEnds.clear();

        SplitNode diverging = new SplitNode(TestcaseIdSet.of(testcaseId));
        diverging.successors.add(firstSuccessor);

        splitSuccessors.add(existing);
        splitSuccessors.add(diverging);
        return diverging;
    }

    @Override
    public final boolean equals(Object obj) {
        throw new UnsupportedOperationException("Split nodes must not be compared by value");
    }

    @Override
    public final int hashCode() {
        throw new UnsupportedOperationException("Split nodes must not be hashed by value");
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[testcases=" + testcaseIds + ", successors=" + successors.size()
                + ", splitSuccessors=" + splitSuccessors.size() + "]";
    }
}
