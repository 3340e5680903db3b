package com.raditha.leakage.model;

/**
 * A memory access that went to the same address for every testcase seen so far.
 *
 * @param instructionId instruction ID of the memory access
 * @param isWrite       true if the access was a store
 * @param targetAddress accessed (encoded) memory address
 */
public record SimpleMemoryAccessNode(long instructionId, boolean isWrite, long targetAddress)
        implements MemoryAccessNode {
}
