package com.raditha.leakage.model;

/**
 * One step of execution in the merged call tree.
 * <p>
 * Only {@link SplitNode}s (the root and calls, plus the branches created at
 * divergences) own successor chains; all other node kinds are leaves inside
 * such a chain.
 */
public sealed interface CallTreeNode
        permits SplitNode, BranchNode, ReturnNode, MemoryAccessNode, AllocationNode {
}
