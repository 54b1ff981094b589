package com.gillianbc.wealth.service;

import com.gillianbc.wealth.config.EngineProperties;
import com.gillianbc.wealth.model.SimulationConfig;
import com.gillianbc.wealth.model.Spouse;
import com.gillianbc.wealth.model.event.FinancialEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Objects;

/**
 * Rejects configurations the engines cannot run. Both engines call this first and then trust the
 * config completely.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SimulationConfigValidator {

    private final EngineProperties properties;

    public void validate(SimulationConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(config.getEvents(), "events must not be null");
        Objects.requireNonNull(config.getPassiveIncomeStreams(), "passiveIncomeStreams must not be null");

        if (config.getRetirementAge() <= config.getStartingAge()) {
            throw new InvalidSimulationConfigException("retirementAge (" + config.getRetirementAge()
                    + ") must be greater than startingAge (" + config.getStartingAge() + ")");
        }
        if (config.getStartingAge() < 0) {
            throw new InvalidSimulationConfigException("startingAge must be >= 0");
        }
        requireBetween(config.getYears(), 1, properties.getMaxYears(), "years");
        requireBetween(config.getPaths(), 1, properties.getMaxPaths(), "paths");

        requireNonNegative(config.getInitialLiquidWealth(), "initialLiquidWealth");
        requireNonNegative(config.getInitialPropertyValue(), "initialPropertyValue");
        requireNonNegative(config.getInitialMortgage(), "initialMortgage");
        requireNonNegative(config.getGrossAnnualIncome(), "grossAnnualIncome");
        requireNonNegative(config.getMonthlyExpenses(), "monthlyExpenses");
        requireNonNegative(config.getMonthlyMortgagePayment(), "monthlyMortgagePayment");
        requireNonNegative(config.getPensionIncome(), "pensionIncome");

        requireRate(config.getEffectiveTaxRate(), "effectiveTaxRate");
        requireRate(config.getPensionContributionRate(), "pensionContributionRate");
        if (config.getEffectiveTaxRate() + config.getPensionContributionRate() > 1) {
            throw new InvalidSimulationConfigException(
                    "effectiveTaxRate + pensionContributionRate must not exceed 1");
        }
        requireRate(config.getMortgageInterestRate(), "mortgageInterestRate");

        requireFinite(config.getPropertyAppreciation(), "propertyAppreciation");
        requireFinite(config.getExpectedReturn(), "expectedReturn");
        requireFinite(config.getExpectedInflation(), "expectedInflation");
        requireFinite(config.getSalaryInflation(), "salaryInflation");
        requireNonNegative(config.getReturnVolatility(), "returnVolatility");
        requireNonNegative(config.getInflationVolatility(), "inflationVolatility");

        if (config.hasSpouse()) {
            validateSpouse(config.getSpouse());
        }

        for (FinancialEvent event : config.getEvents()) {
            Objects.requireNonNull(event, "events contains null");
            if (event.getYear() > config.getYears()) {
                log.debug("Event {} falls after the {}-year horizon and will have no effect", event, config.getYears());
            }
        }
        config.getPassiveIncomeStreams().forEach(s -> Objects.requireNonNull(s, "passiveIncomeStreams contains null"));
    }

    private static void validateSpouse(Spouse spouse) {
        if (spouse.getAge() <= 0) {
            throw new InvalidSimulationConfigException("spouse age must be > 0");
        }
        if (spouse.getRetirementAge() <= 0) {
            throw new InvalidSimulationConfigException("spouse retirementAge must be > 0");
        }
        requireNonNegative(spouse.getGrossIncome(), "spouse grossIncome");
        requireNonNegative(spouse.getPensionIncome(), "spouse pensionIncome");
        if (spouse.getTaxRate() != null) {
            requireRate(spouse.getTaxRate(), "spouse taxRate");
        }
        if (spouse.getPensionContributionRate() != null) {
            requireRate(spouse.getPensionContributionRate(), "spouse pensionContributionRate");
        }
    }

    private static void requireBetween(int value, int min, int max, String field) {
        if (value < min || value > max) {
            throw new InvalidSimulationConfigException(
                    field + " must be between " + min + " and " + max + " inclusive, was " + value);
        }
    }

    private static void requireNonNegative(double value, String field) {
        requireFinite(value, field);
        if (value < 0) {
            throw new InvalidSimulationConfigException(field + " must be >= 0, was " + value);
        }
    }

    private static void requireRate(double value, String field) {
        requireFinite(value, field);
        if (value < 0 || value > 1) {
            throw new InvalidSimulationConfigException(field + " must be between 0 and 1, was " + value);
        }
    }

    private static void requireFinite(double value, String field) {
        if (!Double.isFinite(value)) {
            throw new InvalidSimulationConfigException(field + " must be a finite number");
        }
    }
}
