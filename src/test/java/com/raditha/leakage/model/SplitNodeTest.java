package com.raditha.leakage.model;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SplitNodeTest {

    private RootNode root;

    @BeforeEach
    void setUp() {
        root = new RootNode();
        root.addTestcase(0);
        root.addTestcase(1);
        root.addTestcase(2);
        root.appendSuccessor(new BranchNode(1, 2, true));
        root.appendSuccessor(new BranchNode(3, 4, true));
        root.appendSuccessor(new ReturnNode(5, 6));
    }

    @Test
    void testSplitAtSuccessorMovesTail() {
        SplitNode inner = root.addSplitSuccessor(1, new BranchNode(7, 8, false));
        BranchNode conflicting = new BranchNode(3, 9, false);

        SplitNode diverging = root.splitAtSuccessor(1, 2, conflicting);

        assertEquals(List.of(new BranchNode(1, 2, true)), root.successors());
        assertEquals(2, root.splitSuccessors().size());

        SplitNode existing = root.splitSuccessors().get(0);
        assertSame(diverging, root.splitSuccessors().get(1));
        assertEquals(TestcaseIdSet.of(0, 1), existing.testcaseIds());
        assertEquals(List.of(new BranchNode(3, 4, true), new ReturnNode(5, 6)), existing.successors());
        assertEquals(1, existing.splitSuccessors().size());
        assertSame(inner, existing.splitSuccessors().get(0));

        assertEquals(TestcaseIdSet.of(2), diverging.testcaseIds());
        assertEquals(List.of(conflicting), diverging.successors());
    }

    @Test
    void testSplitAtSuccessorPartitionsIds() {
        root.splitAtSuccessor(0, 1, new BranchNode(1, 3, false));

        TestcaseIdSet left = root.splitSuccessors().get(0).testcaseIds();
        TestcaseIdSet right = root.splitSuccessors().get(1).testcaseIds();
        assertTrue(left.isDisjoint(right));
        assertEquals(root.testcaseIds().size(), left.size() + right.size());
        assertTrue(root.successors().isEmpty());
    }

    @Test
    void testSplitAtSuccessorRejectsBadIndex() {
        BranchNode node = new BranchNode(0, 0, true);
        assertThrows(IndexOutOfBoundsException.class, () -> root.splitAtSuccessor(4, 0, node));
        assertThrows(IndexOutOfBoundsException.class, () -> root.splitAtSuccessor(-1, 0, node));
    }

    @Test
    void testEndedTestcasesDoNotReachLaterSuccessors() {
        root.recordEnd(0, 1);
        root.recordEnd(1, 3);

        assertEquals(TestcaseIdSet.of(0, 1, 2), root.testcasesReaching(0));
        assertEquals(TestcaseIdSet.of(1, 2), root.testcasesReaching(1));
        assertEquals(TestcaseIdSet.of(1, 2), root.testcasesReaching(2));
        assertEquals(TestcaseIdSet.of(0, 1, 2), root.testcaseIds());
    }

    @Test
    void testSplitMovesOnlyLaterEnds() {
        root.recordEnd(0, 1);
        root.recordEnd(1, 3);

        root.splitAtSuccessor(2, 2, new ReturnNode(5, 9));

        SplitNode existing = root.splitSuccessors().get(0);
        assertEquals(TestcaseIdSet.of(1), existing.testcaseIds());
        assertEquals(Map.of(1, TestcaseIdSet.of(1)), existing.endedTestcases());
        assertEquals(Map.of(1, TestcaseIdSet.of(0)), root.endedTestcases());
    }

    @Test
    void testRecordEndRejectsBadPosition() {
        assertThrows(IndexOutOfBoundsException.class, () -> root.recordEnd(0, 4));
        assertThrows(IndexOutOfBoundsException.class, () -> root.recordEnd(0, -1));
        assertThrows(UnsupportedOperationException.class, () -> root.endedTestcases().clear());
    }

    @Test
    void testValueComparisonIsUnsupported() {
        SplitNode other = new SplitNode();
        CallNode call = new CallNode(1, 2, 3);

        assertThrows(UnsupportedOperationException.class, () -> root.equals(other));
        assertThrows(UnsupportedOperationException.class, root::hashCode);
        assertThrows(UnsupportedOperationException.class, () -> call.equals(call));
        assertDoesNotThrow(root::toString);
    }

    @Test
    void testViewsAreUnmodifiable() {
        assertThrows(UnsupportedOperationException.class, () -> root.successors().clear());
        assertThrows(UnsupportedOperationException.class, () -> root.splitSuccessors().add(new SplitNode()));
    }

    @Test
    void testLeafNodesHaveValueSemantics() {
        assertEquals(new BranchNode(1, 2, true), new BranchNode(1, 2, true));
        assertNotEquals(new BranchNode(1, 2, true), new BranchNode(1, 2, false));
        assertEquals(new AllocationNode(4, 32, true), new AllocationNode(4, 32, true));
        assertNotEquals(new AllocationNode(4, 32, true), new AllocationNode(4, 64, true));
    }
}
