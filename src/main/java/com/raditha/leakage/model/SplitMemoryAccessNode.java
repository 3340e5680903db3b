package com.raditha.leakage.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A memory access that went to different addresses for some testcases.
 * Tracks the testcase IDs for each observed target address.
 * <p>
 * The target sets are disjoint, and their sizes add up to the number of
 * testcases that reached this node.
 */
public final class SplitMemoryAccessNode implements MemoryAccessNode {

    private final long instructionId;
    private final boolean isWrite;
    private final Map<Long, TestcaseIdSet> targets = new LinkedHashMap<>();

    public SplitMemoryAccessNode(long instructionId, boolean isWrite) {
        this.instructionId = instructionId;
        this.isWrite = isWrite;
    }

    /**
     * Replaces a simple access node whose address was contradicted by the
     * current testcase.
     *
     * @param original       the node seen by all previous testcases
     * @param previousIds    IDs of every testcase that reached the node before
     * @param newAddress     address observed by the current testcase
     * @param testcaseId     current testcase ID
     */
    public static SplitMemoryAccessNode promote(SimpleMemoryAccessNode original, TestcaseIdSet previousIds,
            long newAddress, int testcaseId) {
        if (original.targetAddress() == newAddress) {
            throw new IllegalArgumentException("Promotion requires a differing address");
        }

        SplitMemoryAccessNode node = new SplitMemoryAccessNode(original.instructionId(), original.isWrite());
        node.targets.put(original.targetAddress(), previousIds.without(testcaseId));
        node.targets.put(newAddress, TestcaseIdSet.of(testcaseId));
        return node;
    }

    /**
     * Records that the given testcase accessed the given address.
     */
    public void addTarget(long address, int testcaseId) {
        targets.computeIfAbsent(address, a -> new TestcaseIdSet()).add(testcaseId);
    }

    @Override
    public long instructionId() {
        return instructionId;
    }

    @Override
    public boolean isWrite() {
        return isWrite;
    }

    /**
     * Target addresses and the testcases accessing them, in order of first
     * observation.
     */
    public Map<Long, TestcaseIdSet> targets() {
        return Collections.unmodifiableMap(targets);
    }

    /**
     * Number of testcases that reached this node.
     */
    public int testcaseCount() {
        int count = 0;
        for (TestcaseIdSet ids : targets.values()) {
            count += ids.size();
        }
        return count;
    }

    @Override
    public String toString() {
        return "SplitMemoryAccessNode[instructionId=" + instructionId + ", isWrite=" + isWrite
                + ", targets=" + targets.size() + "]";
    }
}
