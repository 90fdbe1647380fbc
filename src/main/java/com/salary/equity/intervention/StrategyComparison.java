package com.salary.equity.intervention;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * All strategy results in declaration order plus the selected one.
 * {@code infeasible} is set when no strategy both met the target and stayed
 * within budget, in which case {@code selected} is the cheapest fallback.
 */
public record StrategyComparison(
        List<StrategyResult> results,
        StrategyResult selected,
        boolean infeasible,
        double totalPayroll,
        double totalGap,
        int eligibleCount
) {
    public StrategyComparison {
        results = results != null ? List.copyOf(results) : List.of();
        Objects.requireNonNull(selected, "selected is required");
    }

    public Optional<StrategyResult> result(String strategyName) {
        return results.stream().filter(r -> r.name().equals(strategyName)).findFirst();
    }

    public List<StrategyResult> feasible() {
        return results.stream().filter(StrategyResult::isFeasible).toList();
    }

    @Override
    public String toString() {
        return "StrategyComparison{" +
                "selected=" + selected.name() +
                ", infeasible=" + infeasible +
                ", eligible=" + eligibleCount +
                ", totalGap=" + totalGap +
                '}';
    }
}
