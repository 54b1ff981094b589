package com.gillianbc.wealth.model;

import lombok.Getter;

import java.util.Objects;

/**
 * Recurring income outside employment (rent from a let, dividends, royalties, an annuity).
 * Amounts are nominal; inflation is applied by whoever consumes the stream.
 */
@Getter
public class PassiveIncomeStream {

    private final String name;
    private final int startYear;
    /** Last active year inclusive, or null for an open-ended stream. */
    private final Integer endYear;
    private final double monthlyAmount;
    private final double annualGrowthRate;
    private final boolean taxable;
    /** Null means the household effective tax rate. */
    private final Double taxRate;

    public PassiveIncomeStream(String name,
                               int startYear,
                               Integer endYear,
                               double monthlyAmount,
                               double annualGrowthRate,
                               boolean taxable,
                               Double taxRate) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        if (startYear < 0) {
            throw new IllegalArgumentException("startYear must be >= 0");
        }
        if (endYear != null && endYear < startYear) {
            throw new IllegalArgumentException("endYear must be >= startYear");
        }
        if (!Double.isFinite(monthlyAmount) || monthlyAmount < 0) {
            throw new IllegalArgumentException("monthlyAmount must be a finite amount >= 0");
        }
        if (!Double.isFinite(annualGrowthRate) || annualGrowthRate <= -1) {
            throw new IllegalArgumentException("annualGrowthRate must be finite and > -1");
        }
        if (taxRate != null && (taxRate < 0 || taxRate > 1)) {
            throw new IllegalArgumentException("taxRate must be between 0 and 1");
        }
        this.startYear = startYear;
        this.endYear = endYear;
        this.monthlyAmount = monthlyAmount;
        this.annualGrowthRate = annualGrowthRate;
        this.taxable = taxable;
        this.taxRate = taxRate;
    }

    public boolean isActiveIn(int year) {
        return startYear <= year && (endYear == null || year <= endYear);
    }

    /**
     * After-tax income for the given year, grown from the start year; zero when the stream is inactive.
     *
     * @param year             simulation year
     * @param householdTaxRate rate used when the stream is taxable but carries no rate of its own
     */
    public double annualNetAmount(int year, double householdTaxRate) {
        if (!isActiveIn(year)) {
            return 0.0;
        }
        double gross = monthlyAmount * 12 * Math.pow(1 + annualGrowthRate, year - startYear);
        if (!taxable) {
            return gross;
        }
        double rate = taxRate != null ? taxRate : householdTaxRate;
        return gross * (1 - rate);
    }
}
