package com.raditha.leakage.scoring;

import com.raditha.leakage.util.Sequences;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class StatisticsAccumulatorTest {

    @Test
    void testEmpty() {
        StatisticsAccumulator accumulator = new StatisticsAccumulator();

        assertEquals(0, accumulator.getCount());
        assertEquals(0.0, accumulator.getMean());
        assertEquals(0.0, accumulator.getStandardDeviation());
        assertEquals(0.0, accumulator.getMinimum());
        assertEquals(0.0, accumulator.getMaximum());
    }

    @Test
    void testKnownValues() {
        StatisticsAccumulator accumulator = new StatisticsAccumulator();
        for (double v : new double[]{2, 4, 4, 4, 5, 5, 7, 9}) {
            accumulator.add(v);
        }

        assertEquals(8, accumulator.getCount());
        assertEquals(5.0, accumulator.getMean(), 1e-12);
        assertEquals(2.0, accumulator.getStandardDeviation(), 1e-12);
        assertEquals(2.0, accumulator.getMinimum());
        assertEquals(9.0, accumulator.getMaximum());
    }

    @Test
    void testAgreesWithSequences() {
        Random random = new Random(7);
        double[] values = new double[10_000];
        StatisticsAccumulator accumulator = new StatisticsAccumulator();
        for (int i = 0; i < values.length; i++) {
            values[i] = random.nextGaussian() * 3 + 100;
            accumulator.add(values[i]);
        }

        Sequences.MeanAndDeviation expected = Sequences.computeMean(values);
        assertEquals(expected.mean(), accumulator.getMean(), 1e-9);
        assertEquals(expected.standardDeviation(), accumulator.getStandardDeviation(), 1e-9);
    }
}
