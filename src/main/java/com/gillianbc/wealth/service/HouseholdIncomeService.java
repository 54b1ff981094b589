package com.gillianbc.wealth.service;

import com.gillianbc.wealth.model.SimulationConfig;
import com.gillianbc.wealth.model.Spouse;
import org.springframework.stereotype.Service;

import java.util.Objects;

/**
 * Employment and pension income for each household member in a given simulation year.
 * <p>
 * A member is retired from the year their age reaches the retirement age: age == retirement age is
 * the first year without salary. The stochastic engine and the cash-flow table both use this rule.
 */
@Service
public class HouseholdIncomeService {

    public static boolean isRetired(int currentAge, int retirementAge) {
        return currentAge >= retirementAge;
    }

    /**
     * First simulation year in which a member of the given age is retired; 0 when already retired.
     */
    public static int retirementYearOffset(int startingAge, int retirementAge) {
        return Math.max(retirementAge - startingAge, 0);
    }

    /**
     * Income of one member.
     * <p>
     * Working: gross = grossIncome * (1 + salaryInflation)^year, contribution = gross * pensionRate,
     * take-home = gross * (1 - taxRate - pensionRate).
     * Retired: take-home = pensionIncome * pensionIndexation, no contribution.
     *
     * @param pensionIndexation factor applied to the pension, 1.0 for a nominal pension
     */
    public MemberIncome memberIncome(int year,
                                     int startingAge,
                                     int retirementAge,
                                     double grossIncome,
                                     double taxRate,
                                     double pensionRate,
                                     double salaryInflation,
                                     double pensionIncome,
                                     double pensionIndexation) {
        int age = startingAge + year;
        if (isRetired(age, retirementAge)) {
            return new MemberIncome(age, true, 0.0, pensionIncome * pensionIndexation, 0.0);
        }
        double gross = grossIncome * Math.pow(1 + salaryInflation, year);
        double contribution = gross * pensionRate;
        double takeHome = gross * (1 - taxRate - pensionRate);
        return new MemberIncome(age, false, gross, takeHome, contribution);
    }

    /**
     * Primary member plus spouse (if any), each on their own age and retirement age.
     *
     * @param primaryIndexation factor on the primary pension income
     * @param spouseIndexation  factor on the spouse pension income; ignored without a spouse
     */
    public HouseholdIncome householdIncome(SimulationConfig config,
                                           int year,
                                           double primaryIndexation,
                                           double spouseIndexation) {
        Objects.requireNonNull(config, "config must not be null");
        MemberIncome primary = memberIncome(year,
                config.getStartingAge(),
                config.getRetirementAge(),
                config.getGrossAnnualIncome(),
                config.getEffectiveTaxRate(),
                config.getPensionContributionRate(),
                config.getSalaryInflation(),
                config.getPensionIncome(),
                primaryIndexation);
        MemberIncome spouse = null;
        if (config.hasSpouse()) {
            Spouse s = config.getSpouse();
            spouse = memberIncome(year,
                    s.getAge(),
                    s.getRetirementAge(),
                    s.getGrossIncome(),
                    s.taxRateOr(config.getEffectiveTaxRate()),
                    s.pensionContributionRateOr(config.getPensionContributionRate()),
                    config.getSalaryInflation(),
                    s.getPensionIncome(),
                    spouseIndexation);
        }
        return new HouseholdIncome(primary, spouse);
    }

    /** One member's income for one year. */
    public static final class MemberIncome {
        public final int age;
        public final boolean retired;
        /** Salary before tax and pension; zero once retired. */
        public final double gross;
        public final double takeHome;
        public final double pensionContribution;

        public MemberIncome(int age, boolean retired, double gross, double takeHome, double pensionContribution) {
            this.age = age;
            this.retired = retired;
            this.gross = gross;
            this.takeHome = takeHome;
            this.pensionContribution = pensionContribution;
        }
    }

    /** Household totals for one year. */
    public static final class HouseholdIncome {
        public final MemberIncome primary;
        /** Null without a spouse. */
        public final MemberIncome spouse;

        public HouseholdIncome(MemberIncome primary, MemberIncome spouse) {
            this.primary = Objects.requireNonNull(primary, "primary must not be null");
            this.spouse = spouse;
        }

        public double takeHome() {
            return primary.takeHome + (spouse != null ? spouse.takeHome : 0.0);
        }

        public double pensionContribution() {
            return primary.pensionContribution + (spouse != null ? spouse.pensionContribution : 0.0);
        }

        public double gross() {
            return primary.gross + (spouse != null ? spouse.gross : 0.0);
        }

        public boolean spouseRetired() {
            return spouse != null && spouse.retired;
        }
    }
}
