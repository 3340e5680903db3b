package com.raditha.leakage.scoring;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.jspecify.annotations.Nullable;

/**
 * Aggregated statistics of one measure over all evaluations of a site.
 *
 * @param mean                   mean value
 * @param standardDeviation      population standard deviation
 * @param minimum                smallest value
 * @param maximum                largest value
 * @param score                  mean leakage score in [0, 100], null for
 *                               measures that are not scored
 * @param scoreStandardDeviation standard deviation of the score
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StatisticsEntry(
        double mean,
        double standardDeviation,
        double minimum,
        double maximum,
        @Nullable Double score,
        @Nullable Double scoreStandardDeviation) {

    static StatisticsEntry of(StatisticsAccumulator values) {
        return new StatisticsEntry(values.getMean(), values.getStandardDeviation(), values.getMinimum(),
                values.getMaximum(), null, null);
    }

    static StatisticsEntry of(StatisticsAccumulator values, StatisticsAccumulator scores) {
        return new StatisticsEntry(values.getMean(), values.getStandardDeviation(), values.getMinimum(),
                values.getMaximum(), scores.getMean(), scores.getStandardDeviation());
    }
}
