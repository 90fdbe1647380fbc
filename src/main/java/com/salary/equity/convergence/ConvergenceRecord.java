package com.salary.equity.convergence;

import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Natural, accelerated and intervention convergence for one employee.
 *
 * @param employeeId                the employee
 * @param salary                    current salary
 * @param peerMedian                current peer-group median
 * @param gapAmount                 median minus salary (0 when at or above)
 * @param gapPercent                gap as a fraction of the median
 * @param employeeGrowthRate        annual growth assumed for the employee
 * @param medianGrowthRate          annual drift assumed for the median
 * @param naturalYearsToMedian      years until the curves cross; empty when they never do
 * @param acceleratedGrowthRate     annual growth on the optimistic path
 * @param acceleratedYearsToMedian  years until the optimistic curve crosses; empty when it never does
 * @param interventionYearsToMedian always 0, a one-time adjustment closes the gap
 * @param interventionRequired      true when divergent or slower than the threshold
 * @param recommendedAction         action suggested for this gap
 */
public record ConvergenceRecord(
        String employeeId,
        double salary,
        double peerMedian,
        double gapAmount,
        double gapPercent,
        double employeeGrowthRate,
        double medianGrowthRate,
        OptionalDouble naturalYearsToMedian,
        double acceleratedGrowthRate,
        OptionalDouble acceleratedYearsToMedian,
        int interventionYearsToMedian,
        boolean interventionRequired,
        RecommendedAction recommendedAction
) {
    public ConvergenceRecord {
        Objects.requireNonNull(employeeId, "employeeId is required");
        Objects.requireNonNull(recommendedAction, "recommendedAction is required");
        naturalYearsToMedian = naturalYearsToMedian != null ? naturalYearsToMedian : OptionalDouble.empty();
        acceleratedYearsToMedian = acceleratedYearsToMedian != null
                ? acceleratedYearsToMedian : OptionalDouble.empty();
    }

    /**
     * True when the employee never reaches the median under natural growth.
     */
    public boolean isDivergent() {
        return naturalYearsToMedian.isEmpty();
    }

    public boolean isBelowMedian() {
        return gapAmount > 0;
    }

    /**
     * True when the salary has reached the drifted median after {@code years}
     * under the given scenario.
     */
    public boolean convergedBy(ConvergenceScenario scenario, int years) {
        if (!isBelowMedian()) {
            return true;
        }
        return switch (scenario) {
            case NATURAL -> reached(employeeGrowthRate, years);
            case ACCELERATED -> reached(acceleratedGrowthRate, years);
            case INTERVENTION -> years >= interventionYearsToMedian;
        };
    }

    private boolean reached(double growthRate, int years) {
        return salary * Math.pow(1.0 + growthRate, years) >= peerMedian * Math.pow(1.0 + medianGrowthRate, years);
    }
}
