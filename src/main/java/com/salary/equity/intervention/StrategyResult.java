package com.salary.equity.intervention;

import java.util.List;
import java.util.Objects;

/**
 * Costing of a single strategy against the eligible gaps.
 *
 * <p>{@code residualGapPercent} is the gap left open after
 * {@code min(yearsUsed, maxYears)} years divided by the summed peer medians of
 * every eligible employee.</p>
 */
public record StrategyResult(
        Strategy strategy,
        double totalCost,
        int affectedEmployeeCount,
        List<YearCost> yearByYearBreakdown,
        double percentOfPayroll,
        double residualGapPercent,
        int yearsUsed,
        boolean meetsTarget,
        boolean withinBudget
) {
    public StrategyResult {
        Objects.requireNonNull(strategy, "strategy is required");
        yearByYearBreakdown = yearByYearBreakdown != null ? List.copyOf(yearByYearBreakdown) : List.of();
    }

    public String name() {
        return strategy.name();
    }

    public boolean isFeasible() {
        return meetsTarget && withinBudget;
    }
}
