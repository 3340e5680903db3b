package com.raditha.leakage.scoring;

/**
 * Single pass mean/variance/min/max over a stream of values, using Welford's
 * online algorithm. The variance is the population variance.
 */
public class StatisticsAccumulator {

    private int count;
    private double mean;
    private double sumOfSquaredDeltas;
    private double minimum = Double.POSITIVE_INFINITY;
    private double maximum = Double.NEGATIVE_INFINITY;

    public void add(double value) {
        ++count;
        double delta = value - mean;
        mean += delta / count;
        sumOfSquaredDeltas += delta * (value - mean);

        minimum = Math.min(minimum, value);
        maximum = Math.max(maximum, value);
    }

    public int getCount() {
        return count;
    }

    public double getMean() {
        return mean;
    }

    public double getStandardDeviation() {
        return count > 1 ? Math.sqrt(sumOfSquaredDeltas / count) : 0.0;
    }

    /**
     * Smallest value seen, 0 if nothing was added.
     */
    public double getMinimum() {
        return count == 0 ? 0.0 : minimum;
    }

    /**
     * Largest value seen, 0 if nothing was added.
     */
    public double getMaximum() {
        return count == 0 ? 0.0 : maximum;
    }
}
