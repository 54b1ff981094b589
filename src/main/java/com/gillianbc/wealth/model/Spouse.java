package com.gillianbc.wealth.model;

import lombok.Builder;
import lombok.Value;

/**
 * Optional second earner. Income is computed exactly like the primary member's, with its own age,
 * retirement age and salary. Tax and pension rates fall back to the household rates when not set.
 */
@Value
@Builder(toBuilder = true)
public class Spouse {

    int age;
    int retirementAge;
    double grossIncome;
    /** Null means the household effective tax rate. */
    Double taxRate;
    /** Null means the household pension contribution rate. */
    Double pensionContributionRate;
    /** Annual pension entitlement received once retired, e.g. a state or defined-benefit pension. */
    double pensionIncome;

    public double taxRateOr(double householdRate) {
        return taxRate != null ? taxRate : householdRate;
    }

    public double pensionContributionRateOr(double householdRate) {
        return pensionContributionRate != null ? pensionContributionRate : householdRate;
    }
}
