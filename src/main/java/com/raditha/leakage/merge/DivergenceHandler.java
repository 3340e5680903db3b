package com.raditha.leakage.merge;

import com.raditha.leakage.model.CallTreeNode;
import com.raditha.leakage.model.SimpleMemoryAccessNode;
import com.raditha.leakage.model.SplitMemoryAccessNode;
import com.raditha.leakage.model.SplitNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handles disagreements between the current testcase and the existing tree.
 * <p>
 * Control flow divergences restructure the tree by splitting a successor
 * chain. Address divergences only annotate the memory access node in place,
 * since a data dependent address alone does not change what runs afterwards.
 */
public class DivergenceHandler {

    private static final Logger logger = LoggerFactory.getLogger(DivergenceHandler.class);

    private int splits;
    private int branches;
    private int addressPromotions;

    /**
     * Splits {@code node} at {@code index}: the other testcases keep the old
     * continuation, the current testcase continues in a new branch starting
     * with {@code firstSuccessor}.
     *
     * @return the new branch for the current testcase
     */
    public SplitNode splitAtSuccessor(SplitNode node, int index, int testcaseId, CallTreeNode firstSuccessor) {
        int before = node.testcaseIds().size();
        SplitNode branch = node.splitAtSuccessor(index, testcaseId, firstSuccessor);
        splits++;

        if (logger.isTraceEnabled()) {
            logger.trace("Split at successor {} for testcase {}: {} testcases -> {} + {}", index, testcaseId, before,
                    node.splitSuccessors().get(0).testcaseIds().size(), branch.testcaseIds().size());
        }
        return branch;
    }

    /**
     * Opens a new split successor after an exhausted successor chain.
     */
    public SplitNode addBranch(SplitNode node, int testcaseId, CallTreeNode firstSuccessor) {
        branches++;
        return node.addSplitSuccessor(testcaseId, firstSuccessor);
    }

    /**
     * Records the address the current testcase accessed at the memory access
     * node {@code owner.successors().get(index)}, promoting a simple access
     * to a split access when the address differs. Testcases that ended
     * before the access are not attributed to any address.
     */
    public void recordAddress(SplitNode owner, int index, long address, int testcaseId) {
        CallTreeNode node = owner.successors().get(index);
        if (node instanceof SimpleMemoryAccessNode simple) {
            if (simple.targetAddress() == address) {
                return;
            }
            owner.replaceSuccessor(index,
                    SplitMemoryAccessNode.promote(simple, owner.testcasesReaching(index), address, testcaseId));
            addressPromotions++;
            logger.trace("Promoted memory access {} for testcase {}", simple.instructionId(), testcaseId);
        } else if (node instanceof SplitMemoryAccessNode split) {
            split.addTarget(address, testcaseId);
        } else {
            throw new IllegalStateException("Successor " + index + " is not a memory access: " + node);
        }
    }

    public int getSplits() {
        return splits;
    }

    public int getBranches() {
        return branches;
    }

    public int getAddressPromotions() {
        return addressPromotions;
    }
}
