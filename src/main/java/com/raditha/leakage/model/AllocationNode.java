package com.raditha.leakage.model;

/**
 * A memory allocation.
 *
 * @param id     call-site local allocation index, stable across testcases
 * @param size   allocation size in bytes
 * @param isHeap true for heap allocations, false for stack frames
 */
public record AllocationNode(int id, long size, boolean isHeap) implements CallTreeNode {
}
