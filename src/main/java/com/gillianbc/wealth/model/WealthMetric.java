package com.gillianbc.wealth.model;

/**
 * The per-path series produced by the stochastic engine.
 */
public enum WealthMetric {
    NET_WORTH,
    /** Net worth in year-0 purchasing power. */
    REAL_NET_WORTH,
    LIQUID_WEALTH,
    PENSION_WEALTH,
    PROPERTY_VALUE,
    MORTGAGE_BALANCE
}
