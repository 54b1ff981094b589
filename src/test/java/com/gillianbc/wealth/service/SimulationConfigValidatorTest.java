package com.gillianbc.wealth.service;

import com.gillianbc.wealth.config.EngineProperties;
import com.gillianbc.wealth.model.SimulationConfig;
import com.gillianbc.wealth.model.Spouse;
import com.gillianbc.wealth.model.event.Windfall;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SimulationConfigValidatorTest {

    private final EngineProperties properties = new EngineProperties();
    private final SimulationConfigValidator validator = new SimulationConfigValidator(properties);

    private static SimulationConfig.SimulationConfigBuilder valid() {
        return SimulationConfig.builder()
                .initialLiquidWealth(10_000)
                .grossAnnualIncome(50_000)
                .effectiveTaxRate(0.25)
                .pensionContributionRate(0.05)
                .monthlyExpenses(1_500)
                .expectedReturn(0.05)
                .returnVolatility(0.1);
    }

    @Test
    @DisplayName("A reasonable config passes, including events after the horizon")
    void validate_valid() {
        assertDoesNotThrow(() -> validator.validate(valid().build()));
        assertDoesNotThrow(() -> validator.validate(valid().years(5).event(new Windfall("Late", 8, 1)).build()));
    }

    @Test
    @DisplayName("Retirement must come after the starting age")
    void validate_retirementAge() {
        InvalidSimulationConfigException ex = assertThrows(InvalidSimulationConfigException.class,
                () -> validator.validate(valid().startingAge(65).retirementAge(65).build()));
        assertEquals("retirementAge (65) must be greater than startingAge (65)", ex.getMessage());
    }

    @Test
    @DisplayName("Years and paths must lie within the configured limits")
    void validate_limits() {
        InvalidSimulationConfigException ex = assertThrows(InvalidSimulationConfigException.class,
                () -> validator.validate(valid().years(0).build()));
        assertEquals("years must be between 1 and 100 inclusive, was 0", ex.getMessage());
        assertThrows(InvalidSimulationConfigException.class, () -> validator.validate(valid().years(101).build()));
        assertThrows(InvalidSimulationConfigException.class, () -> validator.validate(valid().paths(0).build()));

        properties.setMaxPaths(50);
        assertThrows(InvalidSimulationConfigException.class, () -> validator.validate(valid().paths(51).build()));
    }

    @Test
    @DisplayName("Amounts must be finite and non-negative")
    void validate_amounts() {
        assertThrows(InvalidSimulationConfigException.class,
                () -> validator.validate(valid().initialLiquidWealth(-1).build()));
        assertThrows(InvalidSimulationConfigException.class,
                () -> validator.validate(valid().monthlyExpenses(Double.NaN).build()));
        assertThrows(InvalidSimulationConfigException.class,
                () -> validator.validate(valid().returnVolatility(-0.1).build()));
        assertThrows(InvalidSimulationConfigException.class,
                () -> validator.validate(valid().expectedReturn(Double.POSITIVE_INFINITY).build()));
    }

    @Test
    @DisplayName("Rates must be decimals in [0, 1] and tax plus pension may not exceed income")
    void validate_rates() {
        assertThrows(InvalidSimulationConfigException.class,
                () -> validator.validate(valid().effectiveTaxRate(25).build()));
        assertThrows(InvalidSimulationConfigException.class,
                () -> validator.validate(valid().effectiveTaxRate(0.7).pensionContributionRate(0.4).build()));
        assertThrows(InvalidSimulationConfigException.class,
                () -> validator.validate(valid().mortgageInterestRate(-0.01).build()));
    }

    @Test
    @DisplayName("Spouse fields are checked when a spouse is present")
    void validate_spouse() {
        Spouse spouse = Spouse.builder().age(40).retirementAge(60).grossIncome(30_000).build();
        assertDoesNotThrow(() -> validator.validate(valid().spouse(spouse).build()));
        assertThrows(InvalidSimulationConfigException.class,
                () -> validator.validate(valid().spouse(spouse.toBuilder().taxRate(1.2).build()).build()));
        assertThrows(InvalidSimulationConfigException.class,
                () -> validator.validate(valid().spouse(spouse.toBuilder().grossIncome(-5).build()).build()));
    }

    @Test
    @DisplayName("Null config is rejected")
    void validate_null() {
        assertThrows(NullPointerException.class, () -> validator.validate(null));
    }
}
