package com.gillianbc.wealth.model;

import com.gillianbc.wealth.model.event.FinancialEvent;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Everything one projection needs. All amounts are in a single unit of account; rates are decimals
 * (0.05 = 5%). Built fresh by the caller for each call and never modified afterwards.
 */
@Value
@Builder(toBuilder = true)
public class SimulationConfig {

    double initialLiquidWealth;
    double initialPropertyValue;
    double initialMortgage;

    double grossAnnualIncome;
    double effectiveTaxRate;
    double pensionContributionRate;

    double monthlyExpenses;
    double monthlyMortgagePayment;

    double propertyAppreciation;
    double mortgageInterestRate;

    double expectedReturn;
    double returnVolatility;
    double expectedInflation;
    double inflationVolatility;
    double salaryInflation;

    @Builder.Default
    int years = 30;
    @Builder.Default
    int paths = 1000;

    @Builder.Default
    int startingAge = 30;
    @Builder.Default
    int retirementAge = 65;
    /** Annual pension paid once retired, drawn from the pension pot. Zero leaves the pot untouched. */
    double pensionIncome;

    @Singular
    List<FinancialEvent> events;
    @Singular
    List<PassiveIncomeStream> passiveIncomeStreams;

    /** Null for a single-earner household. */
    Spouse spouse;

    /** Null draws a fresh seed for every run. */
    Long randomSeed;

    public boolean hasSpouse() {
        return spouse != null;
    }

    public double initialNetWorth() {
        return initialLiquidWealth + initialPropertyValue - initialMortgage;
    }
}
