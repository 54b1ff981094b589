package com.gillianbc.wealth.model;

import lombok.Getter;

import java.util.Objects;

/**
 * One percentile of a metric traced across every year of the horizon.
 */
@Getter
public class PercentileBand {

    private final double percentile;
    private final double[] values;

    public PercentileBand(double percentile, double[] values) {
        this.percentile = percentile;
        this.values = Objects.requireNonNull(values, "values must not be null").clone();
    }

    public double[] getValues() {
        return values.clone();
    }

    public double at(int year) {
        return values[year];
    }
}
