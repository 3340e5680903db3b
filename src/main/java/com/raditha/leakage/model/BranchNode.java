package com.raditha.leakage.model;

/**
 * A conditional or unconditional branch (but not a call or return).
 *
 * @param sourceInstructionId ID of the branch instruction
 * @param targetInstructionId ID of the target instruction, only meaningful if
 *                            {@code taken} is true
 * @param taken               true if the branch was taken
 */
public record BranchNode(long sourceInstructionId, long targetInstructionId, boolean taken) implements CallTreeNode {
}
