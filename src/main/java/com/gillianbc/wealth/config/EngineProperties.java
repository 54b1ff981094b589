package com.gillianbc.wealth.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Tuning for the projection engines, bound from {@code wealth.engine.*}. Per-household inputs never
 * live here; they arrive with each {@link com.gillianbc.wealth.model.SimulationConfig}.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "wealth.engine")
public class EngineProperties {

    /** Worker threads sharing the path dimension of each simulated year. */
    private int parallelism = Runtime.getRuntime().availableProcessors();
    /** Path ranges smaller than this are not split further. */
    private int minPathsPerTask = 256;
    /** Lowest annual inflation a path may draw. */
    private double inflationFloor = -0.05;
    private int maxPaths = 100_000;
    private int maxYears = 100;

    private Cashflow cashflow = new Cashflow();
    private Summary summary = new Summary();

    @Getter
    @Setter
    public static class Cashflow {
        /** Rows shown in the explanatory table, year 0 included. */
        private int maxRows = 11;
    }

    @Getter
    @Setter
    public static class Summary {
        private List<Double> percentiles = List.of(10.0, 25.0, 50.0, 75.0, 90.0);
    }
}
