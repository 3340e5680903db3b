package com.raditha.leakage.metrics;

import com.raditha.leakage.model.AllocationNode;
import com.raditha.leakage.model.BranchNode;
import com.raditha.leakage.model.CallNode;
import com.raditha.leakage.model.CallTreeNode;
import com.raditha.leakage.model.InstructionIds;
import com.raditha.leakage.model.ReturnNode;
import com.raditha.leakage.model.RootNode;
import com.raditha.leakage.model.SimpleMemoryAccessNode;
import com.raditha.leakage.model.SplitMemoryAccessNode;
import com.raditha.leakage.model.SplitNode;
import com.raditha.leakage.model.TestcaseIdSet;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * Writes a merged call tree as indented text, one node per line.
 * <p>
 * Split-structured nodes list their testcases, e.g.
 * <pre>
 * root {0-3}
 *   call 0+1a0 -> 0+400 CS-8F3A2C... {0-3}
 *     read 0+404 {0x1000: 0-1, 0x2000: 2-3}
 *     return 0+410 -> 0+1a4
 *   split {0-1}
 *     branch 0+1a8 -> 0+1c0 taken
 *   split {2-3}
 *     branch 0+1a8 -> 0+1b0 not taken
 * </pre>
 */
public class CallTreeDumper {

    private static final String INDENT = "  ";

    private record Item(CallTreeNode node, int depth) {
    }

    public void dump(RootNode root, Path outputFile) throws IOException {
        try (Writer writer = Files.newBufferedWriter(outputFile, StandardCharsets.UTF_8)) {
            dump(root, writer);
        }
    }

    public String dumpToString(RootNode root) {
        StringWriter writer = new StringWriter();
        try {
            dump(root, writer);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return writer.toString();
    }

    /**
     * Writes the tree in depth first order. Successors come before split
     * successors.
     */
    public void dump(RootNode root, Writer writer) throws IOException {
        Deque<Item> pending = new ArrayDeque<>();
        pending.push(new Item(root, 0));

        while (!pending.isEmpty()) {
            Item item = pending.pop();
            writer.write(INDENT.repeat(item.depth()));
            writer.write(describe(item.node()));
            writer.write('\n');

            if (item.node() instanceof SplitNode split) {
                List<Item> children = new ArrayList<>();
                for (CallTreeNode successor : split.successors()) {
                    children.add(new Item(successor, item.depth() + 1));
                }
                for (SplitNode splitSuccessor : split.splitSuccessors()) {
                    children.add(new Item(splitSuccessor, item.depth() + 1));
                }
                for (int i = children.size() - 1; i >= 0; i--) {
                    pending.push(children.get(i));
                }
            }
        }
        writer.flush();
    }

    static String describe(CallTreeNode node) {
        if (node instanceof RootNode root) {
            return "root " + ids(root.testcaseIds());
        } else if (node instanceof CallNode call) {
            return String.format("call %s -> %s CS-%016X %s", InstructionIds.format(call.sourceInstructionId()),
                    InstructionIds.format(call.targetInstructionId()), call.callStackId(), ids(call.testcaseIds()));
        } else if (node instanceof SplitNode split) {
            return "split " + ids(split.testcaseIds());
        } else if (node instanceof BranchNode branch) {
            return String.format("branch %s -> %s %s", InstructionIds.format(branch.sourceInstructionId()),
                    InstructionIds.format(branch.targetInstructionId()), branch.taken() ? "taken" : "not taken");
        } else if (node instanceof ReturnNode ret) {
            return String.format("return %s -> %s", InstructionIds.format(ret.sourceInstructionId()),
                    InstructionIds.format(ret.targetInstructionId()));
        } else if (node instanceof SimpleMemoryAccessNode access) {
            return String.format("%s %s 0x%X", access.isWrite() ? "write" : "read",
                    InstructionIds.format(access.instructionId()), access.targetAddress());
        } else if (node instanceof SplitMemoryAccessNode access) {
            StringBuilder sb = new StringBuilder();
            sb.append(access.isWrite() ? "write " : "read ").append(InstructionIds.format(access.instructionId()));
            sb.append(" {");
            String separator = "";
            for (Map.Entry<Long, TestcaseIdSet> target : access.targets().entrySet()) {
                sb.append(separator).append(String.format("0x%X: ", target.getKey())).append(target.getValue());
                separator = ", ";
            }
            return sb.append('}').toString();
        } else if (node instanceof AllocationNode allocation) {
            return String.format("alloc #%d %d bytes %s", allocation.id(), allocation.size(),
                    allocation.isHeap() ? "heap" : "stack");
        }
        throw new IllegalStateException("Unexpected node type: " + node.getClass().getSimpleName());
    }

    private static String ids(TestcaseIdSet ids) {
        return "{" + ids + "}";
    }
}
