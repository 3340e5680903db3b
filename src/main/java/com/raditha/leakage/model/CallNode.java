package com.raditha.leakage.model;

/**
 * A function call. Its successor chain is the body of the callee.
 */
public final class CallNode extends SplitNode {

    private final long sourceInstructionId;
    private final long targetInstructionId;
    private final long callStackId;

    /**
     * @param sourceInstructionId ID of the call instruction
     * @param targetInstructionId ID of the called instruction
     * @param callStackId         ID of the call stack created by this node
     */
    public CallNode(long sourceInstructionId, long targetInstructionId, long callStackId) {
        this.sourceInstructionId = sourceInstructionId;
        this.targetInstructionId = targetInstructionId;
        this.callStackId = callStackId;
    }

    public long sourceInstructionId() {
        return sourceInstructionId;
    }

    public long targetInstructionId() {
        return targetInstructionId;
    }

    public long callStackId() {
        return callStackId;
    }

    @Override
    public String toString() {
        return "CallNode[" + Long.toHexString(sourceInstructionId) + " -> " + Long.toHexString(targetInstructionId)
                + ", callStack=" + Long.toHexString(callStackId) + ", testcases=" + testcaseIds() + "]";
    }
}
