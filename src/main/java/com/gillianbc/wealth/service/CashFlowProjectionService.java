package com.gillianbc.wealth.service;

import com.gillianbc.wealth.config.EngineProperties;
import com.gillianbc.wealth.model.CashFlowProjection;
import com.gillianbc.wealth.model.CashFlowRow;
import com.gillianbc.wealth.model.ForwardSchedule;
import com.gillianbc.wealth.model.LineItem;
import com.gillianbc.wealth.model.PassiveIncomeStream;
import com.gillianbc.wealth.model.SimulationConfig;
import com.gillianbc.wealth.model.Spouse;
import com.gillianbc.wealth.model.Year1Breakdown;
import com.gillianbc.wealth.model.event.ExpenseChange;
import com.gillianbc.wealth.model.event.FinancialEvent;
import com.gillianbc.wealth.model.event.FinancialEventVisitor;
import com.gillianbc.wealth.model.event.OneTimeExpense;
import com.gillianbc.wealth.model.event.PropertyPurchase;
import com.gillianbc.wealth.model.event.PropertySale;
import com.gillianbc.wealth.model.event.RentalIncome;
import com.gillianbc.wealth.model.event.Windfall;
import com.gillianbc.wealth.service.HouseholdIncomeService.HouseholdIncome;
import com.gillianbc.wealth.service.HouseholdIncomeService.MemberIncome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Single deterministic path used to explain the simulation year by year.
 * <p>
 * No randomness and no inflation: salaries grow at the salary inflation rate, passive streams at their
 * own growth rate, pensions are paid at their nominal amount. Events of a year are applied before the
 * row for that year is computed, so the row shows the year as it will be lived. Recurring changes
 * (expenses, rental, mortgage payments) carry forward to every later row.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CashFlowProjectionService {

    private final EngineProperties properties;
    private final HouseholdIncomeService incomeService;
    private final SimulationConfigValidator validator;

    /**
     * Builds rows for years 0 up to the smallest of the simulation length, {@code maxYears} and the
     * configured row cap, together with the Year 1 breakdown.
     *
     * @param maxYears last year the caller wants to see (>= 0)
     */
    public CashFlowProjection buildCashFlowTable(SimulationConfig config, int maxYears) {
        validator.validate(config);
        if (maxYears < 0) {
            throw new IllegalArgumentException("maxYears must be >= 0");
        }
        int lastYear = Math.min(Math.min(config.getYears(), maxYears), properties.getCashflow().getMaxRows() - 1);
        log.debug("Building cash-flow table for years 0..{}", lastYear);

        ScheduleState state = new ScheduleState(config);
        List<CashFlowRow> rows = new ArrayList<>(lastYear + 1);
        for (int year = 0; year <= lastYear; year++) {
            String notes = state.applyEvents(year);
            rows.add(row(config, year, state, notes));
        }
        return new CashFlowProjection(rows, year1Breakdown(config));
    }

    /**
     * Gross Income, - Pension Contrib, - Tax, = Take Home, [+ Passive Income], [+ Rental Income],
     * - Living Expenses, - Mortgage, = Available for Investment.
     * <p>
     * Figures are those of simulation year 0, after any events dated year 0.
     */
    public Year1Breakdown year1Breakdown(SimulationConfig config) {
        validator.validate(config);
        ScheduleState state = new ScheduleState(config);
        state.applyEvents(0);

        HouseholdIncome income = incomeService.householdIncome(config, 0, 1.0, 1.0);
        double grossIncome = grossIncludingPensions(income);
        double pensionContribution = income.pensionContribution();
        double tax = tax(config, income);
        double takeHome = grossIncome - pensionContribution - tax;
        double passive = passiveIncome(config, 0);
        double rental = state.rentals.annualAt(0);
        double expenses = state.expenses.annualAt(0);
        double mortgage = state.mortgagePayments.annualAt(0);

        List<LineItem> items = new ArrayList<>();
        items.add(new LineItem("Gross Income", round2(grossIncome)));
        items.add(new LineItem("- Pension Contrib", round2(pensionContribution)));
        items.add(new LineItem("- Tax", round2(tax)));
        items.add(new LineItem("= Take Home", round2(takeHome)));
        if (passive > 0) {
            items.add(new LineItem("+ Passive Income", round2(passive)));
        }
        if (rental > 0) {
            items.add(new LineItem("+ Rental Income", round2(rental)));
        }
        items.add(new LineItem("- Living Expenses", round2(expenses)));
        items.add(new LineItem("- Mortgage", round2(mortgage)));
        double available = takeHome + passive + rental - expenses - mortgage;
        items.add(new LineItem("= Available for Investment", round2(available)));
        return new Year1Breakdown(items, round2(available));
    }

    private CashFlowRow row(SimulationConfig config, int year, ScheduleState state, String notes) {
        HouseholdIncome income = incomeService.householdIncome(config, year, 1.0, 1.0);
        double passive = passiveIncome(config, year);
        double rental = state.rentals.annualAt(year);
        double expenses = state.expenses.annualAt(year);
        double mortgage = state.mortgagePayments.annualAt(year);
        double available = income.takeHome() + passive + rental - expenses - mortgage;

        return CashFlowRow.builder()
                .year(year)
                .age(config.getStartingAge() + year)
                .takeHome(round2(income.takeHome()))
                .pensionContribution(round2(income.pensionContribution()))
                .passiveIncome(round2(passive))
                .rentalIncome(round2(rental))
                .livingExpenses(round2(expenses))
                .mortgage(round2(mortgage))
                .availableSavings(round2(available))
                .monthlySavings(round2(available / 12))
                .eventNotes(notes)
                .build();
    }

    private static double passiveIncome(SimulationConfig config, int year) {
        double total = 0.0;
        for (PassiveIncomeStream stream : config.getPassiveIncomeStreams()) {
            total += stream.annualNetAmount(year, config.getEffectiveTaxRate());
        }
        return total;
    }

    private static double grossIncludingPensions(HouseholdIncome income) {
        double gross = memberGross(income.primary);
        if (income.spouse != null) {
            gross += memberGross(income.spouse);
        }
        return gross;
    }

    private static double memberGross(MemberIncome member) {
        return member.retired ? member.takeHome : member.gross;
    }

    private static double tax(SimulationConfig config, HouseholdIncome income) {
        double tax = income.primary.gross * config.getEffectiveTaxRate();
        if (income.spouse != null) {
            Spouse spouse = config.getSpouse();
            tax += income.spouse.gross * spouse.taxRateOr(config.getEffectiveTaxRate());
        }
        return tax;
    }

    private static double round2(double value) {
        if (!Double.isFinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    /**
     * Forward schedules of one table build, updated year by year by the events falling in each year.
     */
    private static final class ScheduleState implements FinancialEventVisitor<Void> {

        private final ForwardSchedule expenses;
        private final ForwardSchedule mortgagePayments;
        private final ForwardSchedule rentals;
        private final List<FinancialEvent> events;
        private int year;

        ScheduleState(SimulationConfig config) {
            this.expenses = new ForwardSchedule(config.getYears(), config.getMonthlyExpenses());
            this.mortgagePayments = new ForwardSchedule(config.getYears(), config.getMonthlyMortgagePayment());
            this.rentals = new ForwardSchedule(config.getYears(), 0.0);
            this.events = Objects.requireNonNull(config.getEvents(), "events must not be null");
        }

        /**
         * Applies the events of the given year and returns their names for the notes column.
         */
        String applyEvents(int year) {
            this.year = year;
            List<String> names = new ArrayList<>();
            for (FinancialEvent event : events) {
                if (event.getYear() == year) {
                    names.add(event.displayName());
                    event.accept(this);
                }
            }
            return String.join(", ", names);
        }

        @Override
        public Void visit(PropertyPurchase event) {
            mortgagePayments.addFrom(year, event.getNewMortgagePayment());
            return null;
        }

        @Override
        public Void visit(PropertySale event) {
            mortgagePayments.setFrom(year, 0.0);
            return null;
        }

        // One-off amounts move wealth, not the recurring cash flow shown in the table

        @Override
        public Void visit(OneTimeExpense event) {
            return null;
        }

        @Override
        public Void visit(ExpenseChange event) {
            expenses.addFrom(year, event.getMonthlyChange());
            return null;
        }

        @Override
        public Void visit(RentalIncome event) {
            rentals.addFrom(year, event.getMonthlyRental());
            return null;
        }

        @Override
        public Void visit(Windfall event) {
            return null;
        }
    }
}
