package com.gillianbc.wealth.model;

import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One year of the deterministic cash-flow table. Amounts are annual, nominal and rounded to 2 dp.
 */
@Value
@Builder
public class CashFlowRow {

    int year;
    int age;
    double takeHome;
    double pensionContribution;
    double passiveIncome;
    double rentalIncome;
    double livingExpenses;
    double mortgage;
    double availableSavings;
    double monthlySavings;
    /** Names of the events falling in this year, comma separated; empty when there are none. */
    String eventNotes;

    /**
     * Column title to display text, in table order.
     */
    public Map<String, String> render(CurrencyFormatter formatter) {
        Objects.requireNonNull(formatter, "formatter must not be null");
        Map<String, String> columns = new LinkedHashMap<>();
        columns.put("Year", Integer.toString(year));
        columns.put("Age", Integer.toString(age));
        columns.put("Take Home", formatter.format(takeHome));
        columns.put("Pension Contrib", formatter.format(pensionContribution));
        columns.put("Passive Income", formatter.format(passiveIncome));
        columns.put("Rental Income", formatter.format(rentalIncome));
        columns.put("Living Expenses", formatter.format(livingExpenses));
        columns.put("Mortgage", formatter.format(mortgage));
        columns.put("Available Savings", formatter.format(availableSavings));
        columns.put("Monthly Savings", formatter.format(monthlySavings));
        columns.put("Events This Year", eventNotes);
        return columns;
    }
}
