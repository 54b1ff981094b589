package com.gillianbc.wealth.service;

import com.gillianbc.wealth.config.EngineProperties;
import com.gillianbc.wealth.model.PercentileBand;
import com.gillianbc.wealth.model.ResultSummary;
import com.gillianbc.wealth.model.SimulationResult;
import com.gillianbc.wealth.model.WealthMetric;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

class ResultSummaryServiceTest {

    private final ResultSummaryService service = new ResultSummaryService(new EngineProperties());

    /**
     * Five paths over one year, all starting at 100. Net worth ends at 50, 150, 210, 250 and 300; only
     * the first path runs its liquid wealth below zero.
     */
    private static SimulationResult fivePaths() {
        double[][] netWorth = {{100, 50}, {100, 150}, {100, 210}, {100, 250}, {100, 300}};
        double[][] liquid = {{100, -10}, {100, 0}, {100, 10}, {100, 20}, {100, 30}};
        double[][] zeros = new double[5][2];
        Map<WealthMetric, double[][]> matrices = new EnumMap<>(WealthMetric.class);
        matrices.put(WealthMetric.NET_WORTH, netWorth);
        matrices.put(WealthMetric.REAL_NET_WORTH, netWorth);
        matrices.put(WealthMetric.LIQUID_WEALTH, liquid);
        matrices.put(WealthMetric.PENSION_WEALTH, zeros);
        matrices.put(WealthMetric.PROPERTY_VALUE, zeros);
        matrices.put(WealthMetric.MORTGAGE_BALANCE, zeros);
        return new SimulationResult(matrices, new double[5][1], 1L, List.of());
    }

    @Test
    @DisplayName("Headline probabilities are shares of paths")
    void summarize_probabilities() {
        ResultSummary summary = service.summarize(fivePaths());

        assertEquals(5, summary.getPaths());
        assertEquals(1, summary.getYears());
        assertEquals(100.0, summary.getInitialNetWorth());
        assertEquals(210.0, summary.getMedianFinalNetWorth(), 1e-9);
        assertEquals(210.0, summary.getMedianFinalRealNetWorth(), 1e-9);
        assertEquals(0.8, summary.getProbabilityOfGrowth(), 1e-9);
        assertEquals(0.6, summary.getProbabilityOfDoubling(), 1e-9);
        assertEquals(0.2, summary.getDepletionProbability(), 1e-9);
    }

    @Test
    @DisplayName("One net worth band per configured percentile, each spanning every year")
    void summarize_bands() {
        ResultSummary summary = service.summarize(fivePaths());

        List<PercentileBand> bands = summary.getNetWorthBands();
        assertEquals(5, bands.size());
        assertEquals(10.0, bands.get(0).getPercentile());
        assertArrayEquals(new double[]{100, 50}, bands.get(0).getValues(), 1e-9);
        assertArrayEquals(new double[]{100, 210}, bands.get(2).getValues(), 1e-9);
        assertArrayEquals(new double[]{100, 300}, bands.get(4).getValues(), 1e-9);
    }

    @Test
    @DisplayName("Component medians cover every wealth component")
    void summarize_componentMedians() {
        ResultSummary summary = service.summarize(fivePaths());

        assertEquals(4, summary.getComponentMedians().size());
        assertArrayEquals(new double[]{100, 10}, summary.getComponentMedians().get(WealthMetric.LIQUID_WEALTH), 1e-9);
        assertArrayEquals(new double[]{0, 0}, summary.getComponentMedians().get(WealthMetric.MORTGAGE_BALANCE), 1e-9);
    }
}
