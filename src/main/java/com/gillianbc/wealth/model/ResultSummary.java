package com.gillianbc.wealth.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Headline statistics over all paths of a {@link SimulationResult}.
 */
@Value
@Builder
public class ResultSummary {

    int paths;
    int years;
    double initialNetWorth;
    double medianFinalNetWorth;
    double medianFinalRealNetWorth;
    /** Share of paths ending above the starting net worth. */
    double probabilityOfGrowth;
    /** Share of paths ending above twice the starting net worth. */
    double probabilityOfDoubling;
    /** Share of paths whose liquid wealth goes below zero in at least one year. */
    double depletionProbability;
    @Singular
    List<PercentileBand> netWorthBands;
    /** Median of each component per year. */
    @Singular
    Map<WealthMetric, double[]> componentMedians;
}
