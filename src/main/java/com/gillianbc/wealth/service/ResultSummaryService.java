package com.gillianbc.wealth.service;

import com.gillianbc.wealth.config.EngineProperties;
import com.gillianbc.wealth.model.PercentileBand;
import com.gillianbc.wealth.model.ResultSummary;
import com.gillianbc.wealth.model.SimulationResult;
import com.gillianbc.wealth.model.WealthMetric;
import lombok.RequiredArgsConstructor;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reduces the path matrices of a run to the figures shown alongside the fan chart: percentile bands,
 * per-component medians and headline probabilities.
 */
@Service
@RequiredArgsConstructor
public class ResultSummaryService {

    private static final WealthMetric[] COMPONENTS = {
            WealthMetric.LIQUID_WEALTH,
            WealthMetric.PENSION_WEALTH,
            WealthMetric.PROPERTY_VALUE,
            WealthMetric.MORTGAGE_BALANCE
    };

    private final EngineProperties properties;

    public ResultSummary summarize(SimulationResult result) {
        Objects.requireNonNull(result, "result must not be null");
        int years = result.getYears();
        double[] initial = result.yearValues(WealthMetric.NET_WORTH, 0);
        double[] finalNetWorth = result.yearValues(WealthMetric.NET_WORTH, years);
        double initialNetWorth = initial.length == 0 ? 0.0 : initial[0];

        ResultSummary.ResultSummaryBuilder summary = ResultSummary.builder()
                .paths(result.getPaths())
                .years(years)
                .initialNetWorth(initialNetWorth)
                .medianFinalNetWorth(median(finalNetWorth))
                .medianFinalRealNetWorth(median(result.yearValues(WealthMetric.REAL_NET_WORTH, years)))
                .probabilityOfGrowth(shareAbove(finalNetWorth, initialNetWorth))
                .probabilityOfDoubling(shareAbove(finalNetWorth, initialNetWorth * 2))
                .depletionProbability(depletionProbability(result))
                .netWorthBands(percentileBands(result, WealthMetric.NET_WORTH));
        for (WealthMetric component : COMPONENTS) {
            summary.componentMedian(component, medians(result, component));
        }
        return summary.build();
    }

    /**
     * One band per configured percentile, each holding that percentile of the metric for every year.
     */
    public List<PercentileBand> percentileBands(SimulationResult result, WealthMetric metric) {
        Objects.requireNonNull(result, "result must not be null");
        Objects.requireNonNull(metric, "metric must not be null");
        List<Double> levels = properties.getSummary().getPercentiles();
        double[][] byLevel = new double[levels.size()][result.getYears() + 1];
        Percentile percentile = new Percentile();
        for (int year = 0; year <= result.getYears(); year++) {
            percentile.setData(result.yearValues(metric, year));
            for (int i = 0; i < levels.size(); i++) {
                byLevel[i][year] = percentile.evaluate(levels.get(i));
            }
        }
        List<PercentileBand> bands = new ArrayList<>(levels.size());
        for (int i = 0; i < levels.size(); i++) {
            bands.add(new PercentileBand(levels.get(i), byLevel[i]));
        }
        return bands;
    }

    public double[] medians(SimulationResult result, WealthMetric metric) {
        double[] medians = new double[result.getYears() + 1];
        for (int year = 0; year <= result.getYears(); year++) {
            medians[year] = median(result.yearValues(metric, year));
        }
        return medians;
    }

    /**
     * Share of paths whose liquid wealth is below zero in at least one simulated year.
     */
    public double depletionProbability(SimulationResult result) {
        if (result.getPaths() == 0) {
            return 0.0;
        }
        int depleted = 0;
        for (int p = 0; p < result.getPaths(); p++) {
            double[] liquid = result.path(WealthMetric.LIQUID_WEALTH, p);
            for (int year = 1; year < liquid.length; year++) {
                if (liquid[year] < 0) {
                    depleted++;
                    break;
                }
            }
        }
        return (double) depleted / result.getPaths();
    }

    private static double median(double[] values) {
        if (values.length == 0) {
            return Double.NaN;
        }
        return new Percentile().evaluate(values, 50.0);
    }

    private static double shareAbove(double[] values, double threshold) {
        if (values.length == 0) {
            return 0.0;
        }
        int count = 0;
        for (double v : values) {
            if (v > threshold) {
                count++;
            }
        }
        return (double) count / values.length;
    }
}
