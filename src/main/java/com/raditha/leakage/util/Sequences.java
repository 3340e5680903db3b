package com.raditha.leakage.util;

import java.util.Collection;
import java.util.PrimitiveIterator;
import java.util.stream.DoubleStream;
import java.util.stream.IntStream;

/**
 * Numeric helpers shared by the text dumps and the exporters.
 */
public final class Sequences {

    private Sequences() {
    }

    /**
     * Mean and population standard deviation of a list of values.
     *
     * @param mean              arithmetic mean
     * @param standardDeviation population standard deviation
     */
    public record MeanAndDeviation(double mean, double standardDeviation) {
    }

    /**
     * Formats a sequence of integers in compressed form.
     * <p>
     * Example: {@code 1 2 3 4 6 7 8 10} becomes {@code 1-4 6-8 10}.
     *
     * @param sequence numbers in ascending order
     * @return the compressed, space separated sequence; empty string for an
     *         empty input
     */
    public static String formatIntegerSequence(IntStream sequence) {
        StringBuilder result = new StringBuilder();

        PrimitiveIterator.OfInt iterator = sequence.iterator();
        if (!iterator.hasNext()) {
            return "";
        }

        int runStart = iterator.nextInt();
        int runEnd = runStart;
        while (iterator.hasNext()) {
            int value = iterator.nextInt();
            if (value == runEnd + 1) {
                runEnd = value;
                continue;
            }
            appendRun(result, runStart, runEnd);
            runStart = value;
            runEnd = value;
        }
        appendRun(result, runStart, runEnd);

        return result.toString();
    }

    public static String formatIntegerSequence(int... sequence) {
        return formatIntegerSequence(IntStream.of(sequence));
    }

    private static void appendRun(StringBuilder result, int runStart, int runEnd) {
        if (!result.isEmpty()) {
            result.append(' ');
        }
        result.append(runStart);
        if (runEnd > runStart) {
            result.append('-').append(runEnd);
        }
    }

    /**
     * Computes mean and population standard deviation in a single pass
     * (Welford's method).
     *
     * @return {@code (0, 0)} for no values, {@code (v, 0)} for a single value
     */
    public static MeanAndDeviation computeMean(DoubleStream values) {
        double mean = 0.0;
        double sum = 0.0;
        int count = 0;
        PrimitiveIterator.OfDouble iterator = values.iterator();
        while (iterator.hasNext()) {
            double v = iterator.nextDouble();
            ++count;
            double delta = v - mean;
            mean += delta / count;
            sum += delta * (v - mean);
        }

        double standardDeviation = count > 1 ? Math.sqrt(sum / count) : 0.0;
        return new MeanAndDeviation(mean, standardDeviation);
    }

    public static MeanAndDeviation computeMean(double... values) {
        return computeMean(DoubleStream.of(values));
    }

    public static MeanAndDeviation computeMean(Collection<? extends Number> values) {
        return computeMean(values.stream().mapToDouble(Number::doubleValue));
    }
}
