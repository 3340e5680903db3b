package com.raditha.leakage.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SplitMemoryAccessNodeTest {

    @Test
    void testPromoteSplitsOffCurrentTestcase() {
        SimpleMemoryAccessNode simple = new SimpleMemoryAccessNode(10, false, 0x1000);

        SplitMemoryAccessNode split = SplitMemoryAccessNode.promote(simple, TestcaseIdSet.of(0, 1, 2, 3), 0x2000, 3);

        assertEquals(10, split.instructionId());
        assertFalse(split.isWrite());
        assertEquals(Map.of(0x1000L, TestcaseIdSet.of(0, 1, 2), 0x2000L, TestcaseIdSet.of(3)), split.targets());
        assertEquals(List.of(0x1000L, 0x2000L), List.copyOf(split.targets().keySet()));
        assertEquals(4, split.testcaseCount());
    }

    @Test
    void testPromoteWithSameAddressIsRejected() {
        SimpleMemoryAccessNode simple = new SimpleMemoryAccessNode(10, true, 0x1000);
        TestcaseIdSet ids = TestcaseIdSet.of(0, 1);

        assertThrows(IllegalArgumentException.class, () -> SplitMemoryAccessNode.promote(simple, ids, 0x1000, 1));
    }

    @Test
    void testAddTarget() {
        SplitMemoryAccessNode split = SplitMemoryAccessNode.promote(
                new SimpleMemoryAccessNode(10, false, 0x1000), TestcaseIdSet.of(0, 1), 0x2000, 1);

        split.addTarget(0x1000, 2);
        split.addTarget(0x3000, 3);

        assertEquals(TestcaseIdSet.of(0, 2), split.targets().get(0x1000L));
        assertEquals(TestcaseIdSet.of(3), split.targets().get(0x3000L));
        assertEquals(4, split.testcaseCount());
    }

    @Test
    void testTargetsAreUnmodifiable() {
        SplitMemoryAccessNode split = new SplitMemoryAccessNode(1, false);
        assertThrows(UnsupportedOperationException.class, () -> split.targets().put(1L, new TestcaseIdSet()));
    }

    @Test
    void testInstructionIds() {
        long id = InstructionIds.of(2, 0x1a3f);

        assertEquals(2, InstructionIds.imageId(id));
        assertEquals(0x1a3f, InstructionIds.offset(id));
        assertEquals("2+1a3f", InstructionIds.format(id));
    }
}
