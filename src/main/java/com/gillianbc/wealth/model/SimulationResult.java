package com.gillianbc.wealth.model;

import lombok.Getter;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Output of one stochastic run: one matrix of shape paths x (years + 1) per {@link WealthMetric}, plus
 * the realised inflation rates (paths x years). Accessors hand out copies; the result never changes.
 */
public class SimulationResult {

    private final Map<WealthMetric, double[][]> matrices;
    private final double[][] inflationRates;
    @Getter
    private final int paths;
    @Getter
    private final int years;
    /** Seed the random draws came from, so any run can be repeated. */
    @Getter
    private final long seed;
    @Getter
    private final List<String> warnings;

    public SimulationResult(Map<WealthMetric, double[][]> matrices,
                            double[][] inflationRates,
                            long seed,
                            List<String> warnings) {
        Objects.requireNonNull(matrices, "matrices must not be null");
        this.inflationRates = Objects.requireNonNull(inflationRates, "inflationRates must not be null");
        for (WealthMetric metric : WealthMetric.values()) {
            if (!matrices.containsKey(metric)) {
                throw new IllegalArgumentException("missing matrix for " + metric);
            }
        }
        this.matrices = new EnumMap<>(matrices);
        double[][] netWorth = this.matrices.get(WealthMetric.NET_WORTH);
        this.paths = netWorth.length;
        this.years = paths == 0 ? 0 : netWorth[0].length - 1;
        this.seed = seed;
        this.warnings = List.copyOf(Objects.requireNonNull(warnings, "warnings must not be null"));
    }

    public double valueAt(WealthMetric metric, int path, int year) {
        return matrices.get(metric)[path][year];
    }

    /**
     * Values of every path for one year, i.e. one column of the matrix.
     */
    public double[] yearValues(WealthMetric metric, int year) {
        if (year < 0 || year > years) {
            throw new IndexOutOfBoundsException("year " + year + " outside 0.." + years);
        }
        double[][] m = matrices.get(metric);
        double[] column = new double[paths];
        for (int p = 0; p < paths; p++) {
            column[p] = m[p][year];
        }
        return column;
    }

    public double[] path(WealthMetric metric, int path) {
        return matrices.get(metric)[path].clone();
    }

    public double[][] matrix(WealthMetric metric) {
        return deepCopy(matrices.get(metric));
    }

    public double[][] getInflationRates() {
        return deepCopy(inflationRates);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }


    private static double[][] deepCopy(double[][] source) {
        double[][] copy = new double[source.length][];
        for (int i = 0; i < source.length; i++) {
            copy[i] = source[i].clone();
        }
        return copy;
    }
}
