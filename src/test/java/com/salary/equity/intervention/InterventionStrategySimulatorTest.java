package com.salary.equity.intervention;

import com.salary.equity.core.EquityException;
import com.salary.equity.core.ErrorKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InterventionStrategySimulatorTest {

    private static final double PAYROLL = 10_000_000;

    private InterventionStrategySimulator simulator;

    @BeforeEach
    void setUp() {
        simulator = new InterventionStrategySimulator();
    }

    private static List<EligibleGap> fourEqualGaps() {
        return List.of(
                new EligibleGap("E1", 10_000, 0.10, 100_000),
                new EligibleGap("E2", 10_000, 0.10, 100_000),
                new EligibleGap("E3", 10_000, 0.10, 100_000),
                new EligibleGap("E4", 10_000, 0.10, 100_000));
    }

    private static StrategyResult result(Strategy strategy, double cost, int yearsUsed) {
        return new StrategyResult(strategy, cost, 1, List.of(), cost / PAYROLL, 0.0, yearsUsed, true, true);
    }

    @Test
    @DisplayName("Strategies are listed immediate, gradual by horizon, targeted")
    void declarationOrder() {
        assertEquals(List.of("immediate", "gradual_3_year", "gradual_5_year", "targeted"),
                simulator.strategies().stream().map(Strategy::name).toList());
    }

    @Nested
    @DisplayName("Selection")
    class Selection {

        @Test
        @DisplayName("Equal costs resolve to the earliest strategy using the fewest years")
        void tieGoesToImmediate() {
            StrategyComparison comparison = simulator.compare(fourEqualGaps(), PAYROLL, 0.0, 3, 0.005);

            assertEquals("immediate", comparison.selected().name());
            assertFalse(comparison.infeasible());
            assertEquals(4, comparison.results().size());
            assertEquals(40_000, comparison.totalGap(), 1e-9);
            assertEquals(4, comparison.feasible().size());
            for (StrategyResult result : comparison.results()) {
                double breakdown = result.yearByYearBreakdown().stream().mapToDouble(YearCost::cost).sum();
                assertEquals(result.totalCost(), breakdown, 1e-9, result.name());
            }
        }

        @Test
        @DisplayName("Nothing within budget falls back to the cheapest strategy")
        void infeasibleFallback() {
            StrategyComparison comparison = simulator.compare(fourEqualGaps(), PAYROLL, 0.0, 3, 0.001);

            assertTrue(comparison.infeasible());
            assertTrue(comparison.feasible().isEmpty());
            assertEquals("immediate", comparison.selected().name());
            assertFalse(comparison.selected().withinBudget());
        }

        @Test
        @DisplayName("Targeted wins when immaterial gaps can be left open")
        void targetedIsCheaper() {
            List<EligibleGap> gaps = List.of(
                    new EligibleGap("A", 10_000, 0.10, 100_000),
                    new EligibleGap("B", 1_000, 0.01, 100_000));

            StrategyComparison comparison = simulator.compare(gaps, PAYROLL, 0.01, 3, 0.005);

            assertEquals("targeted", comparison.selected().name());
            assertEquals(10_000, comparison.selected().totalCost(), 1e-9);
            assertEquals(1, comparison.selected().affectedEmployeeCount());
            assertEquals(0.005, comparison.selected().residualGapPercent(), 1e-12);
        }

        @Test
        @DisplayName("Cost ties are measured from the cheapest, whatever the candidate order")
        void tieToleranceIsOrderIndependent() {
            StrategyResult threeYear = result(Strategy.gradual(3), 100.000, 3);
            StrategyResult fiveYear = result(Strategy.gradual(5), 100.004, 2);
            StrategyResult immediate = result(Strategy.immediate(), 100.008, 1);

            List<List<StrategyResult>> orders = List.of(
                    List.of(threeYear, fiveYear, immediate),
                    List.of(threeYear, immediate, fiveYear),
                    List.of(fiveYear, threeYear, immediate),
                    List.of(fiveYear, immediate, threeYear),
                    List.of(immediate, threeYear, fiveYear),
                    List.of(immediate, fiveYear, threeYear));
            for (List<StrategyResult> order : orders) {
                assertEquals("gradual_5_year", InterventionStrategySimulator.cheapest(order).name(),
                        order.stream().map(StrategyResult::name).toList().toString());
            }
        }

        @Test
        @DisplayName("Equal cost and years fall back to declaration order")
        void declarationOrderTieBreak() {
            StrategyResult immediate = result(Strategy.immediate(), 500, 1);
            StrategyResult targeted = result(Strategy.targeted(), 500, 1);

            assertEquals("immediate", InterventionStrategySimulator.cheapest(List.of(targeted, immediate)).name());
            assertEquals("immediate", InterventionStrategySimulator.cheapest(List.of(immediate, targeted)).name());
            assertNull(InterventionStrategySimulator.cheapest(List.of()));
        }

        @Test
        @DisplayName("No eligible gaps selects immediate at zero cost")
        void emptyPopulation() {
            StrategyComparison comparison = simulator.compare(List.of(), PAYROLL, 0.0, 3, 0.005);

            assertEquals("immediate", comparison.selected().name());
            assertEquals(0.0, comparison.selected().totalCost());
            assertFalse(comparison.infeasible());
            assertEquals(0, comparison.eligibleCount());
        }
    }

    @Nested
    @DisplayName("Gradual strategies")
    class Gradual {

        @Test
        @DisplayName("Three-year split front-loads the largest gaps")
        void threeYearBreakdown() {
            StrategyResult result = simulator.simulate(Strategy.gradual(3), fourEqualGaps(), PAYROLL, 0.0, 3, 0.005);

            assertEquals(List.of(3, 1, 0), result.yearByYearBreakdown().stream()
                    .map(YearCost::employeesAffected).toList());
            assertEquals(2, result.yearsUsed());
            assertEquals(30_000, result.yearByYearBreakdown().get(0).cost(), 1e-9);
            assertTrue(result.meetsTarget());
        }

        @Test
        @DisplayName("Largest gaps are remediated first")
        void largestFirst() {
            List<EligibleGap> gaps = List.of(
                    new EligibleGap("S", 1_000, 0.01, 100_000),
                    new EligibleGap("L", 9_000, 0.09, 100_000),
                    new EligibleGap("M", 5_000, 0.05, 100_000));

            StrategyResult result = simulator.simulate(Strategy.gradual(3), gaps, PAYROLL, 0.0, 3, 0.005);

            // 3 heads at 60/30/10 -> 2, 1, 0
            assertEquals(14_000, result.yearByYearBreakdown().get(0).cost(), 1e-9);
            assertEquals(1_000, result.yearByYearBreakdown().get(1).cost(), 1e-9);
        }

        @Test
        @DisplayName("Remediation scheduled past the horizon leaves a residual gap")
        void horizonCutsOff() {
            StrategyResult fiveYear = simulator.simulate(Strategy.gradual(5), fourEqualGaps(), PAYROLL, 0.0, 2, 0.005);
            StrategyResult threeYear = simulator.simulate(Strategy.gradual(3), fourEqualGaps(), PAYROLL, 0.0, 2, 0.005);

            assertEquals(List.of(2, 1, 1, 0, 0), fiveYear.yearByYearBreakdown().stream()
                    .map(YearCost::employeesAffected).toList());
            assertEquals(0.025, fiveYear.residualGapPercent(), 1e-12);
            assertFalse(fiveYear.meetsTarget());
            assertTrue(threeYear.meetsTarget());
        }

        @Test
        @DisplayName("Equal gaps are scheduled by employee id, whatever the input order")
        void equalGapsOrderedById() {
            List<EligibleGap> reversed = List.of(
                    new EligibleGap("E4", 10_000, 0.10, 100_000),
                    new EligibleGap("E3", 10_000, 0.10, 100_000),
                    new EligibleGap("E2", 10_000, 0.10, 100_000),
                    new EligibleGap("E1", 10_000, 0.10, 100_000));

            List<List<EligibleGap>> cohorts = simulator.gradualCohorts(3, reversed);

            assertEquals(List.of("E1", "E2", "E3"), cohorts.get(0).stream().map(EligibleGap::employeeId).toList());
            assertEquals(List.of("E4"), cohorts.get(1).stream().map(EligibleGap::employeeId).toList());
            assertTrue(cohorts.get(2).isEmpty());
        }

        @Test
        @DisplayName("Head counts use largest-remainder rounding")
        void headCounts() {
            List<Double> split = List.of(0.6, 0.3, 0.1);

            assertArrayEquals(new int[]{6, 3, 1}, InterventionStrategySimulator.headCounts(10, split));
            assertArrayEquals(new int[]{4, 2, 1}, InterventionStrategySimulator.headCounts(7, split));
            assertArrayEquals(new int[]{0, 0, 0}, InterventionStrategySimulator.headCounts(0, split));
        }

        @Test
        @DisplayName("Custom splits add their own horizon")
        void customSplit() {
            InterventionStrategySimulator custom = new InterventionStrategySimulator(
                    Map.of(2, List.of(0.5, 0.5)), 0.05);

            assertEquals(List.of("immediate", "gradual_2_year", "targeted"),
                    custom.strategies().stream().map(Strategy::name).toList());
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @ParameterizedTest
        @ValueSource(doubles = {0.0, -0.01})
        @DisplayName("Non-positive budget is rejected")
        void invalidBudget(double budget) {
            EquityException e = assertThrows(EquityException.class,
                    () -> simulator.compare(fourEqualGaps(), PAYROLL, 0.0, 3, budget));
            assertEquals(ErrorKind.INVALID_BUDGET, e.getKind());
        }

        @Test
        @DisplayName("Non-positive horizon is rejected")
        void invalidYears() {
            EquityException e = assertThrows(EquityException.class,
                    () -> simulator.compare(fourEqualGaps(), PAYROLL, 0.0, 0, 0.005));
            assertEquals(ErrorKind.INVALID_YEARS, e.getKind());
        }

        @Test
        @DisplayName("Non-positive payroll is rejected")
        void invalidPayroll() {
            EquityException e = assertThrows(EquityException.class,
                    () -> simulator.compare(fourEqualGaps(), 0.0, 0.0, 3, 0.005));
            assertEquals(ErrorKind.NON_POSITIVE_SALARY, e.getKind());
        }

        @Test
        @DisplayName("Splits must cover the horizon and sum to one")
        void invalidSplits() {
            assertThrows(IllegalArgumentException.class,
                    () -> new InterventionStrategySimulator(Map.of(3, List.of(0.5, 0.5)), 0.05));
            assertThrows(IllegalArgumentException.class,
                    () -> new InterventionStrategySimulator(Map.of(2, List.of(0.7, 0.7)), 0.05));
            assertThrows(IllegalArgumentException.class,
                    () -> new InterventionStrategySimulator(Map.of(1, List.of(1.0)), 0.05));
            assertThrows(IllegalArgumentException.class,
                    () -> new InterventionStrategySimulator(Map.of(), 1.0));
        }

        @Test
        @DisplayName("Strategy years must fit the kind")
        void strategyYears() {
            assertThrows(IllegalArgumentException.class, () -> new Strategy(StrategyKind.IMMEDIATE, 2));
            assertThrows(IllegalArgumentException.class, () -> Strategy.gradual(0));
        }
    }
}
