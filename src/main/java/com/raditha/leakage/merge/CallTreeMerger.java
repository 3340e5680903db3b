package com.raditha.leakage.merge;

import com.raditha.leakage.model.CallNode;
import com.raditha.leakage.model.CallTreeNode;
import com.raditha.leakage.model.MemoryAccessNode;
import com.raditha.leakage.model.ReturnNode;
import com.raditha.leakage.model.RootNode;
import com.raditha.leakage.model.SplitNode;
import com.raditha.leakage.trace.TraceEntry;
import com.raditha.leakage.trace.TraceFormatException;
import com.raditha.leakage.trace.TraceValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Folds the traces of individual testcases into one shared call tree.
 * <p>
 * The tree behaves like a radix trie: each split node has a linear list of
 * successors, followed by a set of split successors. It branches when
 * <ol>
 * <li>a call is encountered (one level down), or</li>
 * <li>an entry conflicts with an existing successor (split).</li>
 * </ol>
 * For each trace entry the cursor either
 * <ul>
 * <li>finds a successor at its position: if it matches, continue, otherwise
 * split the chain there;</li>
 * <li>or has exhausted the successors: append if the node belongs to the
 * current testcase alone, descend into a matching split successor, or open a
 * new one.</li>
 * </ul>
 * Merges are serialized; at most one trace is folded into the tree at a time.
 */
public class CallTreeMerger {

    private static final Logger logger = LoggerFactory.getLogger(CallTreeMerger.class);

    private final RootNode root;
    private final DivergenceHandler divergenceHandler;
    private int mergedTestcases;

    public CallTreeMerger() {
        this(new RootNode(), new DivergenceHandler());
    }

    public CallTreeMerger(RootNode root, DivergenceHandler divergenceHandler) {
        this.root = root;
        this.divergenceHandler = divergenceHandler;
    }

    /**
     * Position inside a successor chain.
     */
    private record Cursor(SplitNode node, int position) {
    }

    /**
     * Merges the trace of one testcase into the tree.
     * <p>
     * The call/return nesting is validated before anything is modified, so a
     * rejected trace leaves the tree exactly as it was.
     *
     * @param testcaseId testcase ID, must not have been merged before
     * @param trace      trace entries in execution order
     * @throws TraceFormatException if calls and returns are not properly nested
     */
    public synchronized void mergeTrace(int testcaseId, List<? extends TraceEntry> trace)
            throws TraceFormatException {
        if (testcaseId < 0) {
            throw new IllegalArgumentException("Testcase IDs must be non-negative, got: " + testcaseId);
        }
        if (root.testcaseIds().contains(testcaseId)) {
            throw new IllegalArgumentException("Testcase " + testcaseId + " has already been merged");
        }
        TraceValidator.validate(testcaseId, trace);

        root.addTestcase(testcaseId);

        Deque<Cursor> callStack = new ArrayDeque<>();
        SplitNode current = root;
        int position = 0;
        int entryIndex = -1;
        for (TraceEntry entry : trace) {
            ++entryIndex;

            if (position < current.successors().size()) {
                CallTreeNode existing = current.successors().get(position);
                if (NodeMatcher.matches(existing, entry)) {
                    if (existing instanceof MemoryAccessNode) {
                        divergenceHandler.recordAddress(current, position, address(entry), testcaseId);
                    }
                    ++position;
                } else {
                    current = divergenceHandler.splitAtSuccessor(current, position, testcaseId, entry.toNode());
                    position = 1;
                }
            } else if (current.splitSuccessors().isEmpty() && current.testcaseIds().size() == 1) {
                // Nobody else went here, just extend the chain
                current.appendSuccessor(entry.toNode());
                ++position;
            } else {
                SplitNode match = findSplitSuccessor(current, entry);
                if (match != null) {
                    match.addTestcase(testcaseId);
                    current = match;
                    if (entry instanceof TraceEntry.MemoryAccessEntry access) {
                        divergenceHandler.recordAddress(current, 0, access.address(), testcaseId);
                    }
                } else {
                    if (current.splitSuccessors().isEmpty()) {
                        // The other testcases of this node stopped here without a conflicting entry
                        if (callStack.isEmpty()) {
                            logger.debug("[{}] Testcase {} continues after the end of other traces",
                                    entryIndex, testcaseId);
                        } else {
                            logger.warn("[{}] Testcase {}: other testcases left call level without return entry",
                                    entryIndex, testcaseId);
                        }
                    }
                    current = divergenceHandler.addBranch(current, testcaseId, entry.toNode());
                }
                position = 1;
            }

            // The entry now sits right before the cursor
            CallTreeNode placed = current.successors().get(position - 1);
            if (placed instanceof CallNode callNode) {
                callStack.push(new Cursor(current, position));
                callNode.addTestcase(testcaseId);
                current = callNode;
                position = 0;
            } else if (placed instanceof ReturnNode) {
                Cursor caller = callStack.pop();
                current = caller.node();
                position = caller.position();
            }
        }
        current.recordEnd(testcaseId, position);

        ++mergedTestcases;
        logger.debug("Merged testcase {} ({} entries)", testcaseId, trace.size());
    }

    private static SplitNode findSplitSuccessor(SplitNode node, TraceEntry entry) {
        for (SplitNode splitSuccessor : node.splitSuccessors()) {
            if (!splitSuccessor.successors().isEmpty()
                    && NodeMatcher.matches(splitSuccessor.successors().get(0), entry)) {
                return splitSuccessor;
            }
        }
        return null;
    }

    private static long address(TraceEntry entry) {
        return ((TraceEntry.MemoryAccessEntry) entry).address();
    }

    public RootNode getRoot() {
        return root;
    }

    public synchronized MergeStatistics getStatistics() {
        return new MergeStatistics(mergedTestcases, divergenceHandler.getSplits(), divergenceHandler.getBranches(),
                divergenceHandler.getAddressPromotions());
    }
}
