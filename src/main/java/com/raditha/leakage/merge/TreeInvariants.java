package com.raditha.leakage.merge;

import com.raditha.leakage.model.CallNode;
import com.raditha.leakage.model.CallTreeNode;
import com.raditha.leakage.model.SplitMemoryAccessNode;
import com.raditha.leakage.model.SplitNode;
import com.raditha.leakage.model.TestcaseIdSet;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Read-only checks of the structural invariants of a merged call tree:
 * <ul>
 * <li>the ID sets of the split successors of a node are pairwise disjoint and
 * contained in the node's own set;</li>
 * <li>testcases that ended in a node belong to it and to none of its split
 * successors;</li>
 * <li>a call node's ID set is contained in the set of its owning chain;</li>
 * <li>the target sets of a split memory access are pairwise disjoint and
 * together hold exactly the testcases that reached the access.</li>
 * </ul>
 */
public final class TreeInvariants {

    private TreeInvariants() {
    }

    /**
     * Returns a description of every violation found; empty if the tree is
     * consistent.
     */
    public static List<String> check(SplitNode root) {
        List<String> violations = new ArrayList<>();
        Deque<SplitNode> pending = new ArrayDeque<>();
        pending.push(root);

        while (!pending.isEmpty()) {
            SplitNode node = pending.pop();
            TestcaseIdSet ids = node.testcaseIds();

            List<CallTreeNode> successors = node.successors();
            for (int i = 0; i < successors.size(); i++) {
                CallTreeNode successor = successors.get(i);
                if (successor instanceof CallNode call) {
                    if (!call.testcaseIds().isSubsetOf(ids)) {
                        violations.add("Call node at successor " + i + " has testcases " + call.testcaseIds()
                                + " outside of its chain " + ids);
                    }
                    pending.push(call);
                } else if (successor instanceof SplitMemoryAccessNode access) {
                    checkTargets(access, node.testcasesReaching(i), i, violations);
                }
            }

            TestcaseIdSet ended = new TestcaseIdSet();
            for (TestcaseIdSet endedHere : node.endedTestcases().values()) {
                if (!endedHere.isDisjoint(ended)) {
                    violations.add("Testcases " + endedHere + " ended at several positions");
                }
                ended.addAll(endedHere);
            }
            if (!ended.isSubsetOf(ids)) {
                violations.add("Ended testcases " + ended + " outside of " + ids);
            }

            List<SplitNode> children = node.splitSuccessors();
            for (int i = 0; i < children.size(); i++) {
                TestcaseIdSet childIds = children.get(i).testcaseIds();
                if (!childIds.isSubsetOf(ids)) {
                    violations.add("Split successor " + i + " has testcases " + childIds + " outside of " + ids);
                }
                if (!childIds.isDisjoint(ended)) {
                    violations.add("Split successor " + i + " has testcases " + childIds
                            + " that ended before it: " + ended);
                }
                for (int j = i + 1; j < children.size(); j++) {
                    if (!childIds.isDisjoint(children.get(j).testcaseIds())) {
                        violations.add("Split successors " + i + " and " + j + " overlap: " + childIds + " / "
                                + children.get(j).testcaseIds());
                    }
                }
                pending.push(children.get(i));
            }
        }
        return violations;
    }

    private static void checkTargets(SplitMemoryAccessNode access, TestcaseIdSet reaching, int index,
            List<String> violations) {
        List<TestcaseIdSet> targetSets = new ArrayList<>(access.targets().values());
        TestcaseIdSet covered = new TestcaseIdSet();
        for (int i = 0; i < targetSets.size(); i++) {
            for (int j = i + 1; j < targetSets.size(); j++) {
                if (!targetSets.get(i).isDisjoint(targetSets.get(j))) {
                    violations.add("Memory access at successor " + index + " maps testcases to several addresses");
                }
            }
            covered.addAll(targetSets.get(i));
        }
        if (!covered.equals(reaching)) {
            violations.add("Memory access at successor " + index + " has target testcases " + covered
                    + " but was reached by " + reaching);
        }
    }
}
