package com.raditha.leakage.model;

/**
 * A memory access by a single instruction.
 */
public sealed interface MemoryAccessNode extends CallTreeNode
        permits SimpleMemoryAccessNode, SplitMemoryAccessNode {

    long instructionId();

    /**
     * True if the access was a store.
     */
    boolean isWrite();
}
