package com.raditha.leakage.scoring;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DivergenceEvaluationTest {

    private static final double EPSILON = 1e-9;

    @Test
    void testFullyDistinguishingPartition() {
        DivergenceEvaluation evaluation = DivergenceEvaluation.of(new int[]{1, 1, 1, 1}, 0);

        assertEquals(2.0, evaluation.mutualInformation(), EPSILON);
        assertEquals(1.0, evaluation.conditionalGuessingEntropy(), EPSILON);
        assertEquals(1.0, evaluation.minimumConditionalGuessingEntropy(), EPSILON);
        assertEquals(4, evaluation.testcaseCount());
        assertEquals(4, evaluation.outcomeCount());
    }

    @Test
    void testSingleOutcomeRevealsNothing() {
        DivergenceEvaluation evaluation = DivergenceEvaluation.of(new int[]{8}, 2);

        assertEquals(0.0, evaluation.mutualInformation(), EPSILON);
        assertEquals(4.5, evaluation.conditionalGuessingEntropy(), EPSILON);
        assertEquals(4.5, evaluation.minimumConditionalGuessingEntropy(), EPSILON);
        assertEquals(2, evaluation.depth());
    }

    @Test
    void testSkewedPartition() {
        DivergenceEvaluation evaluation = DivergenceEvaluation.of(new int[]{2, 1, 1}, 0);

        assertEquals(1.5, evaluation.mutualInformation(), EPSILON);
        assertEquals(1.25, evaluation.conditionalGuessingEntropy(), EPSILON);
        assertEquals(1.0, evaluation.minimumConditionalGuessingEntropy(), EPSILON);
        assertEquals(1.5, evaluation.value(LeakageMeasure.MUTUAL_INFORMATION), EPSILON);
    }

    @Test
    void testSymmetricUnderRelabeling() {
        DivergenceEvaluation a = DivergenceEvaluation.of(new int[]{5, 2, 1}, 0);
        DivergenceEvaluation b = DivergenceEvaluation.of(new int[]{1, 5, 2}, 0);

        for (LeakageMeasure measure : LeakageMeasure.values()) {
            assertEquals(a.value(measure), b.value(measure), EPSILON, measure.name());
        }
    }

    @Test
    void testInvalidPopulationsRejected() {
        assertThrows(IllegalArgumentException.class, () -> DivergenceEvaluation.of(new int[0], 0));
        assertThrows(IllegalArgumentException.class, () -> DivergenceEvaluation.of(new int[]{3, 0}, 0));
    }
}
