package com.salary.equity.allocation;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Final recommendations across all managers with before and after KPIs.
 *
 * @param passes number of allocation passes run (more than one when the overall
 *               budget forced caps to be scaled down)
 */
public record AllocationResult(
        List<ManagerAllocation> managers,
        EquityKpis kpisBefore,
        EquityKpis kpisAfter,
        PolicySummary policySummary,
        double totalAllocated,
        double overallBudgetLimit,
        int passes
) {
    public AllocationResult {
        managers = managers != null ? List.copyOf(managers) : List.of();
        Objects.requireNonNull(kpisBefore, "kpisBefore is required");
        Objects.requireNonNull(kpisAfter, "kpisAfter is required");
        Objects.requireNonNull(policySummary, "policySummary is required");
    }

    public List<Recommendation> recommendations() {
        return managers.stream().flatMap(m -> m.recommendations().stream()).toList();
    }

    public Optional<ManagerAllocation> manager(String managerId) {
        return managers.stream().filter(m -> m.managerId().equals(managerId)).findFirst();
    }

    public Optional<Recommendation> recommendationFor(String employeeId) {
        return recommendations().stream().filter(r -> r.getEmployeeId().equals(employeeId)).findFirst();
    }

    public boolean withinOverallBudget() {
        return totalAllocated <= overallBudgetLimit + 1e-6;
    }

    @Override
    public String toString() {
        return "AllocationResult{" +
                "managers=" + managers.size() +
                ", totalAllocated=" + totalAllocated +
                ", overallBudgetLimit=" + overallBudgetLimit +
                ", passes=" + passes +
                '}';
    }
}
