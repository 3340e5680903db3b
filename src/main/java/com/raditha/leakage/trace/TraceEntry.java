package com.raditha.leakage.trace;

import com.raditha.leakage.model.AllocationNode;
import com.raditha.leakage.model.BranchNode;
import com.raditha.leakage.model.CallNode;
import com.raditha.leakage.model.CallTreeNode;
import com.raditha.leakage.model.ReturnNode;
import com.raditha.leakage.model.SimpleMemoryAccessNode;

/**
 * One execution event of a single testcase, as delivered by the tracer.
 */
public sealed interface TraceEntry {

    /**
     * Creates the call tree node that represents this entry when it is first
     * placed into the tree.
     */
    CallTreeNode toNode();

    /**
     * Short keyword for log messages and reports.
     */
    String kind();

    record CallEntry(long sourceInstructionId, long targetInstructionId, long callStackId) implements TraceEntry {
        @Override
        public CallNode toNode() {
            return new CallNode(sourceInstructionId, targetInstructionId, callStackId);
        }

        @Override
        public String kind() {
            return "call";
        }
    }

    record BranchEntry(long sourceInstructionId, long targetInstructionId, boolean taken) implements TraceEntry {
        @Override
        public BranchNode toNode() {
            return new BranchNode(sourceInstructionId, targetInstructionId, taken);
        }

        @Override
        public String kind() {
            return "branch";
        }
    }

    record ReturnEntry(long sourceInstructionId, long targetInstructionId) implements TraceEntry {
        @Override
        public ReturnNode toNode() {
            return new ReturnNode(sourceInstructionId, targetInstructionId);
        }

        @Override
        public String kind() {
            return "return";
        }
    }

    record MemoryAccessEntry(long instructionId, boolean isWrite, long address) implements TraceEntry {
        @Override
        public SimpleMemoryAccessNode toNode() {
            return new SimpleMemoryAccessNode(instructionId, isWrite, address);
        }

        @Override
        public String kind() {
            return isWrite ? "write" : "read";
        }
    }

    record AllocationEntry(int id, long size, boolean isHeap) implements TraceEntry {
        @Override
        public AllocationNode toNode() {
            return new AllocationNode(id, size, isHeap);
        }

        @Override
        public String kind() {
            return "alloc";
        }
    }
}
