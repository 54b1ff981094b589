package com.gillianbc.wealth.model;

import java.util.Arrays;

/**
 * A recurring monthly amount tracked per year. Changes apply from a given year to the end of the
 * horizon and never touch earlier years.
 */
public class ForwardSchedule {

    private final double[] monthly;

    public ForwardSchedule(int years, double initialMonthly) {
        if (years < 0) {
            throw new IllegalArgumentException("years must be >= 0");
        }
        this.monthly = new double[years + 1];
        Arrays.fill(monthly, initialMonthly);
    }

    public double monthlyAt(int year) {
        return monthly[clamp(year)];
    }

    public double annualAt(int year) {
        return monthlyAt(year) * 12;
    }

    public void addFrom(int year, double delta) {
        for (int y = year; y < monthly.length; y++) {
            monthly[y] += delta;
        }
    }

    public void setFrom(int year, double value) {
        if (year < monthly.length) {
            Arrays.fill(monthly, Math.max(year, 0), monthly.length, value);
        }
    }

    public int lastYear() {
        return monthly.length - 1;
    }

    private int clamp(int year) {
        if (year < 0) {
            throw new IndexOutOfBoundsException("year must be >= 0: " + year);
        }
        return Math.min(year, monthly.length - 1);
    }
}
