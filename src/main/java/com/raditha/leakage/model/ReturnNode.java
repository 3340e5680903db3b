package com.raditha.leakage.model;

/**
 * A function return. Closes the subtree of the enclosing {@link CallNode}.
 *
 * @param sourceInstructionId ID of the return instruction
 * @param targetInstructionId ID of the instruction returned to
 */
public record ReturnNode(long sourceInstructionId, long targetInstructionId) implements CallTreeNode {
}
