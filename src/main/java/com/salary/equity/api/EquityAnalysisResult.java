package com.salary.equity.api;

import com.salary.equity.allocation.AllocationResult;
import com.salary.equity.convergence.ConvergenceReport;
import com.salary.equity.core.RecordError;
import com.salary.equity.forecast.EmployeeProjection;
import com.salary.equity.intervention.StrategyComparison;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything one analysis run produced. Allocation is absent when the
 * {@link AnalysisCheckpoint} stopped the run.
 *
 * @param runId       id tagged on every log line of the run
 * @param projections per-employee projections, in input order
 * @param failures    records rejected while loading or validating
 */
public record EquityAnalysisResult(
        String runId,
        List<EmployeeProjection> projections,
        ConvergenceReport convergence,
        StrategyComparison strategies,
        Optional<AllocationResult> allocation,
        List<RecordError> failures,
        Duration duration
) {
    public EquityAnalysisResult {
        Objects.requireNonNull(runId, "runId is required");
        Objects.requireNonNull(convergence, "convergence is required");
        Objects.requireNonNull(strategies, "strategies is required");
        projections = projections != null ? List.copyOf(projections) : List.of();
        allocation = allocation != null ? allocation : Optional.empty();
        failures = failures != null ? List.copyOf(failures) : List.of();
    }

    public int failedCount() {
        return failures.size();
    }

    public boolean isAllocated() {
        return allocation.isPresent();
    }

    public Optional<EmployeeProjection> projectionFor(String employeeId) {
        return projections.stream().filter(p -> p.employeeId().equals(employeeId)).findFirst();
    }

    @Override
    public String toString() {
        return "EquityAnalysisResult{" +
                "runId='" + runId + '\'' +
                ", employees=" + convergence.totalEmployees() +
                ", failed=" + failures.size() +
                ", strategy=" + strategies.selected().name() +
                ", allocated=" + allocation.map(AllocationResult::totalAllocated).orElse(0.0) +
                ", duration=" + duration +
                '}';
    }
}
