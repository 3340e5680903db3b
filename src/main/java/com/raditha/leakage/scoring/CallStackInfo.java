package com.raditha.leakage.scoring;

/**
 * A call stack that was seen while walking the tree.
 *
 * @param callStackId         ID of the call stack
 * @param parentCallStackId   ID of the caller's call stack, 0 for top level calls
 * @param sourceInstructionId call instruction
 * @param targetInstructionId called function
 */
public record CallStackInfo(long callStackId, long parentCallStackId, long sourceInstructionId,
        long targetInstructionId) {
}
