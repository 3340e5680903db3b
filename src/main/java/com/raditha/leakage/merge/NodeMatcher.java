package com.raditha.leakage.merge;

import com.raditha.leakage.model.AllocationNode;
import com.raditha.leakage.model.BranchNode;
import com.raditha.leakage.model.CallNode;
import com.raditha.leakage.model.CallTreeNode;
import com.raditha.leakage.model.MemoryAccessNode;
import com.raditha.leakage.model.ReturnNode;
import com.raditha.leakage.trace.TraceEntry;

/**
 * Structural equality between an existing tree node and an incoming trace
 * entry, i.e. whether both describe "the same step" regardless of testcase.
 * <ul>
 * <li>calls and returns: source and target instruction must match;</li>
 * <li>branches: additionally the taken flag;</li>
 * <li>memory accesses: instruction and read/write flag. The address is not
 * compared, it is tracked by the divergence handler;</li>
 * <li>allocations: ID, size and heap flag. A size mismatch indicates a
 * structurally different allocation and is a control flow divergence.</li>
 * </ul>
 */
public final class NodeMatcher {

    private NodeMatcher() {
    }

    public static boolean matches(CallTreeNode node, TraceEntry entry) {
        if (entry instanceof TraceEntry.CallEntry call) {
            return node instanceof CallNode callNode
                    && callNode.sourceInstructionId() == call.sourceInstructionId()
                    && callNode.targetInstructionId() == call.targetInstructionId();
        }
        if (entry instanceof TraceEntry.BranchEntry branch) {
            return node instanceof BranchNode branchNode
                    && branchNode.sourceInstructionId() == branch.sourceInstructionId()
                    && branchNode.targetInstructionId() == branch.targetInstructionId()
                    && branchNode.taken() == branch.taken();
        }
        if (entry instanceof TraceEntry.ReturnEntry ret) {
            return node instanceof ReturnNode returnNode
                    && returnNode.sourceInstructionId() == ret.sourceInstructionId()
                    && returnNode.targetInstructionId() == ret.targetInstructionId();
        }
        if (entry instanceof TraceEntry.MemoryAccessEntry access) {
            return node instanceof MemoryAccessNode accessNode
                    && accessNode.instructionId() == access.instructionId()
                    && accessNode.isWrite() == access.isWrite();
        }
        if (entry instanceof TraceEntry.AllocationEntry allocation) {
            return node instanceof AllocationNode allocationNode
                    && allocationNode.id() == allocation.id()
                    && allocationNode.size() == allocation.size()
                    && allocationNode.isHeap() == allocation.isHeap();
        }
        return false;
    }
}
