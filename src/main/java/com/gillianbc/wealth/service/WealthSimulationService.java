package com.gillianbc.wealth.service;

import com.gillianbc.wealth.config.EngineProperties;
import com.gillianbc.wealth.model.ForwardSchedule;
import com.gillianbc.wealth.model.PassiveIncomeStream;
import com.gillianbc.wealth.model.SimulationConfig;
import com.gillianbc.wealth.model.SimulationResult;
import com.gillianbc.wealth.model.WealthMetric;
import com.gillianbc.wealth.model.event.ExpenseChange;
import com.gillianbc.wealth.model.event.FinancialEvent;
import com.gillianbc.wealth.model.event.FinancialEventVisitor;
import com.gillianbc.wealth.model.event.OneTimeExpense;
import com.gillianbc.wealth.model.event.PropertyPurchase;
import com.gillianbc.wealth.model.event.PropertySale;
import com.gillianbc.wealth.model.event.RentalIncome;
import com.gillianbc.wealth.model.event.Windfall;
import com.gillianbc.wealth.service.HouseholdIncomeService.HouseholdIncome;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Monte Carlo projection of household wealth.
 * <p>
 * Each path draws its own portfolio return, pension return and inflation for every year; salary,
 * passive income and property appreciation are the same on every path. Years are simulated strictly in
 * order. Within a year the paths are independent and are shared out across a fixed thread pool, so the
 * result for a given seed does not depend on the pool size.
 * <p>
 * Per path and year:
 * <ol>
 *   <li>income, expenses, mortgage payment and rental for the year give the available savings</li>
 *   <li>the pension pot grows, then takes the contributions of every member still working, then pays the
 *   primary member's pension once retired, capped at what the pot holds. A working spouse keeps
 *   contributing after the primary member retires; a spouse's own pension is paid from outside the pot</li>
 *   <li>liquid wealth grows and absorbs the available savings (it may go negative)</li>
 *   <li>property appreciates and the mortgage amortizes</li>
 *   <li>events of the year are applied on top</li>
 * </ol>
 * Year 0 is the starting position and is never changed; events dated year 0 are ignored by this engine.
 */
@Slf4j
@Service
public class WealthSimulationService implements AutoCloseable {

    private final EngineProperties properties;
    private final HouseholdIncomeService incomeService;
    private final MortgageAmortizer amortizer;
    private final SimulationConfigValidator validator;
    /** Null when running single-threaded. */
    private final ExecutorService executor;

    public WealthSimulationService(EngineProperties properties,
                                   HouseholdIncomeService incomeService,
                                   MortgageAmortizer amortizer,
                                   SimulationConfigValidator validator) {
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
        this.incomeService = Objects.requireNonNull(incomeService, "incomeService must not be null");
        this.amortizer = Objects.requireNonNull(amortizer, "amortizer must not be null");
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
        int threads = Math.max(1, properties.getParallelism());
        this.executor = threads > 1 ? Executors.newFixedThreadPool(threads, new WorkerThreadFactory()) : null;
        log.debug("Wealth simulation service using {} worker thread(s)", threads);
    }

    /**
     * Runs every path of the configured simulation.
     *
     * @throws InvalidSimulationConfigException when the config cannot be simulated; nothing is computed
     */
    public SimulationResult runStochasticSimulation(SimulationConfig config) {
        validator.validate(config);
        long seed = config.getRandomSeed() != null ? config.getRandomSeed() : ThreadLocalRandom.current().nextLong();
        log.info("Running stochastic simulation: paths={}, years={}, events={}, seed={}",
                config.getPaths(), config.getYears(), config.getEvents().size(), seed);
        long start = System.nanoTime();

        SimulationRun run = new SimulationRun(config, seed);
        run.aggregate(0, 0, config.getPaths());
        for (int year = 1; year <= config.getYears(); year++) {
            run.advance(year);
        }

        List<String> warnings = new ArrayList<>();
        long nonFinite = run.countNonFinite();
        if (nonFinite > 0) {
            String warning = nonFinite + " non-finite values in simulation results; check volatility and rate inputs";
            log.warn(warning);
            warnings.add(warning);
        }

        log.info("Stochastic simulation finished in {} ms", (System.nanoTime() - start) / 1_000_000);
        return run.toResult(warnings);
    }

    @Override
    public void close() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    /**
     * Mutable state of one call. Never shared between calls.
     */
    private final class SimulationRun {

        private final SimulationConfig config;
        private final long seed;
        private final int paths;
        private final int years;

        private final double[][] liquid;
        private final double[][] pension;
        private final double[][] property;
        private final double[][] mortgage;
        private final double[][] netWorth;
        private final double[][] realNetWorth;

        private final double[][] portfolioReturns;
        private final double[][] pensionReturns;
        private final double[][] inflationRates;

        private final double[] cumulativeInflation;
        /** Inflation realised since each member's retirement year, per path. */
        private final double[] primaryIndexation;
        private final double[] spouseIndexation;
        private final int primaryRetirementOffset;
        private final int spouseRetirementOffset;

        private final ForwardSchedule expenses;
        private final ForwardSchedule mortgagePayments;
        private final ForwardSchedule rentals;

        private final Map<Integer, List<FinancialEvent>> eventsByYear;
        private final EventApplier eventApplier = new EventApplier();

        SimulationRun(SimulationConfig config, long seed) {
            this.config = config;
            this.seed = seed;
            this.paths = config.getPaths();
            this.years = config.getYears();

            liquid = new double[paths][years + 1];
            pension = new double[paths][years + 1];
            property = new double[paths][years + 1];
            mortgage = new double[paths][years + 1];
            netWorth = new double[paths][years + 1];
            realNetWorth = new double[paths][years + 1];
            for (int p = 0; p < paths; p++) {
                liquid[p][0] = config.getInitialLiquidWealth();
                property[p][0] = config.getInitialPropertyValue();
                mortgage[p][0] = config.getInitialMortgage();
            }

            // Draw order is fixed so that a seed always reproduces the same run
            RandomGenerator rng = new MersenneTwister(seed);
            portfolioReturns = drawNormal(rng, config.getExpectedReturn(), config.getReturnVolatility());
            pensionReturns = drawNormal(rng, config.getExpectedReturn(), config.getReturnVolatility());
            inflationRates = drawNormal(rng, config.getExpectedInflation(), config.getInflationVolatility());
            double floor = properties.getInflationFloor();
            for (double[] row : inflationRates) {
                for (int y = 0; y < row.length; y++) {
                    row[y] = Math.max(row[y], floor);
                }
            }

            cumulativeInflation = filled(1.0);
            primaryIndexation = filled(1.0);
            spouseIndexation = filled(1.0);
            primaryRetirementOffset = HouseholdIncomeService.retirementYearOffset(
                    config.getStartingAge(), config.getRetirementAge());
            spouseRetirementOffset = config.hasSpouse()
                    ? HouseholdIncomeService.retirementYearOffset(
                            config.getSpouse().getAge(), config.getSpouse().getRetirementAge())
                    : Integer.MAX_VALUE;

            expenses = new ForwardSchedule(years, config.getMonthlyExpenses());
            mortgagePayments = new ForwardSchedule(years, config.getMonthlyMortgagePayment());
            rentals = new ForwardSchedule(years, 0.0);

            eventsByYear = groupByYear(config.getEvents(), years);
        }

        void advance(int year) {
            // Schedules as they stood entering this year
            double monthlyExpenses = expenses.monthlyAt(year - 1);
            double annualMortgagePayment = mortgagePayments.annualAt(year - 1);
            double monthlyRental = rentals.monthlyAt(year - 1);
            double passiveNominal = passiveIncome(year);
            boolean primaryRetired = HouseholdIncomeService.isRetired(
                    config.getStartingAge() + year, config.getRetirementAge());
            boolean mortgageSettled = amortizer.isSettled(mean(mortgage, year - 1));

            forEachPathRange((from, to) -> {
                for (int p = from; p < to; p++) {
                    double inflation = 1 + inflationRates[p][year - 1];
                    cumulativeInflation[p] *= inflation;
                    if (year - 1 >= primaryRetirementOffset) {
                        primaryIndexation[p] *= inflation;
                    }
                    if (year - 1 >= spouseRetirementOffset) {
                        spouseIndexation[p] *= inflation;
                    }
                    double cumInflation = cumulativeInflation[p];

                    HouseholdIncome income = incomeService.householdIncome(
                            config, year, primaryIndexation[p], spouseIndexation[p]);
                    double annualExpenses = monthlyExpenses * 12 * cumInflation;
                    double annualRental = monthlyRental * 12 * cumInflation;
                    double available = income.takeHome() + annualRental + passiveNominal * cumInflation
                            - annualExpenses - annualMortgagePayment;

                    double pensionAfterGrowth = pension[p][year - 1] * (1 + pensionReturns[p][year - 1])
                            + income.pensionContribution();
                    if (primaryRetired && config.getPensionIncome() > 0) {
                        double withdrawal = Math.min(config.getPensionIncome() * primaryIndexation[p], pensionAfterGrowth);
                        pension[p][year] = pensionAfterGrowth - withdrawal;
                    } else {
                        pension[p][year] = pensionAfterGrowth;
                    }

                    liquid[p][year] = liquid[p][year - 1] * (1 + portfolioReturns[p][year - 1]) + available;
                    property[p][year] = property[p][year - 1] * (1 + config.getPropertyAppreciation());
                    mortgage[p][year] = mortgageSettled
                            ? 0.0
                            : amortizer.amortize(mortgage[p][year - 1], annualMortgagePayment,
                                    config.getMortgageInterestRate()).closingBalance;
                }
            });

            applyEvents(year);
            forEachPathRange((from, to) -> aggregate(year, from, to));
        }

        void applyEvents(int year) {
            for (FinancialEvent event : eventsByYear.getOrDefault(year, Collections.emptyList())) {
                log.debug("Applying {} in year {}", event, year);
                eventApplier.year = year;
                event.accept(eventApplier);
            }
        }

        void aggregate(int year, int from, int to) {
            for (int p = from; p < to; p++) {
                netWorth[p][year] = liquid[p][year] + pension[p][year] + property[p][year] - mortgage[p][year];
                realNetWorth[p][year] = netWorth[p][year] / cumulativeInflation[p];
            }
        }

        private double passiveIncome(int year) {
            double total = 0.0;
            for (PassiveIncomeStream stream : config.getPassiveIncomeStreams()) {
                total += stream.annualNetAmount(year, config.getEffectiveTaxRate());
            }
            return total;
        }

        private double[][] drawNormal(RandomGenerator rng, double mean, double sd) {
            double[][] draws = new double[paths][years];
            if (sd == 0) {
                for (double[] row : draws) {
                    Arrays.fill(row, mean);
                }
                return draws;
            }
            NormalDistribution distribution = new NormalDistribution(rng, mean, sd);
            for (double[] row : draws) {
                for (int y = 0; y < years; y++) {
                    row[y] = distribution.sample();
                }
            }
            return draws;
        }

        private double[] filled(double value) {
            double[] values = new double[paths];
            Arrays.fill(values, value);
            return values;
        }

        private double mean(double[][] matrix, int year) {
            double sum = 0.0;
            for (int p = 0; p < paths; p++) {
                sum += matrix[p][year];
            }
            return sum / paths;
        }

        long countNonFinite() {
            long count = 0;
            for (double[][] matrix : new double[][][]{liquid, pension, property, mortgage, netWorth, realNetWorth}) {
                for (double[] row : matrix) {
                    for (double v : row) {
                        if (!Double.isFinite(v)) {
                            count++;
                        }
                    }
                }
            }
            return count;
        }

        SimulationResult toResult(List<String> warnings) {
            Map<WealthMetric, double[][]> matrices = new EnumMap<>(WealthMetric.class);
            matrices.put(WealthMetric.NET_WORTH, netWorth);
            matrices.put(WealthMetric.REAL_NET_WORTH, realNetWorth);
            matrices.put(WealthMetric.LIQUID_WEALTH, liquid);
            matrices.put(WealthMetric.PENSION_WEALTH, pension);
            matrices.put(WealthMetric.PROPERTY_VALUE, property);
            matrices.put(WealthMetric.MORTGAGE_BALANCE, mortgage);
            return new SimulationResult(matrices, inflationRates, seed, warnings);
        }

        /**
         * Applies one event to every path at the current year. Runs on the calling thread.
         */
        private final class EventApplier implements FinancialEventVisitor<Void> {

            private int year;

            @Override
            public Void visit(PropertyPurchase event) {
                for (int p = 0; p < paths; p++) {
                    liquid[p][year] -= event.getDownPayment();
                    property[p][year] += event.getPropertyPrice();
                    mortgage[p][year] += event.getMortgageAmount();
                }
                mortgagePayments.addFrom(year, event.getNewMortgagePayment());
                return null;
            }

            @Override
            public Void visit(PropertySale event) {
                double balanceBeforeSale = mean(mortgage, year);
                for (int p = 0; p < paths; p++) {
                    liquid[p][year] += event.netProceeds();
                    property[p][year] = 0.0;
                    mortgage[p][year] = Math.max(mortgage[p][year] - event.getMortgagePayoff(), 0.0);
                }
                if (event.getMortgagePayoff() >= balanceBeforeSale) {
                    mortgagePayments.setFrom(year, 0.0);
                }
                return null;
            }

            @Override
            public Void visit(OneTimeExpense event) {
                for (int p = 0; p < paths; p++) {
                    liquid[p][year] -= event.getAmount();
                }
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
                for (int p = 0; p < paths; p++) {
                    liquid[p][year] += event.getAmount();
                }
                return null;
            }
        }

        private void forEachPathRange(PathRangeTask task) {
            int minPerTask = Math.max(1, properties.getMinPathsPerTask());
            if (executor == null || paths < 2 * minPerTask) {
                task.run(0, paths);
                return;
            }
            int tasks = Math.min(Math.max(1, properties.getParallelism()), (paths + minPerTask - 1) / minPerTask);
            int chunk = (paths + tasks - 1) / tasks;
            List<Future<Void>> futures = new ArrayList<>(tasks);
            for (int from = 0; from < paths; from += chunk) {
                int lo = from;
                int hi = Math.min(from + chunk, paths);
                Callable<Void> callable = () -> {
                    task.run(lo, hi);
                    return null;
                };
                futures.add(executor.submit(callable));
            }
            try {
                for (Future<Void> future : futures) {
                    future.get();
                }
            } catch (InterruptedException e) {
                futures.forEach(f -> f.cancel(true));
                Thread.currentThread().interrupt();
                throw new SimulationExecutionException("Simulation interrupted", e);
            } catch (ExecutionException e) {
                futures.forEach(f -> f.cancel(true));
                Throwable cause = e.getCause();
                if (cause instanceof RuntimeException) {
                    throw (RuntimeException) cause;
                }
                throw new SimulationExecutionException("Simulation worker failed", cause);
            }
        }
    }

    private static Map<Integer, List<FinancialEvent>> groupByYear(List<FinancialEvent> events, int years) {
        Map<Integer, List<FinancialEvent>> byYear = new TreeMap<>();
        for (FinancialEvent event : events) {
            if (event.getYear() < 1 || event.getYear() > years) {
                log.debug("Skipping {}: outside simulated years 1..{}", event, years);
                continue;
            }
            byYear.computeIfAbsent(event.getYear(), y -> new ArrayList<>()).add(event);
        }
        return byYear;
    }

    @FunctionalInterface
    private interface PathRangeTask {
        void run(int fromInclusive, int toExclusive);
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "wealth-sim-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
