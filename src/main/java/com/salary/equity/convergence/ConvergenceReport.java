package com.salary.equity.convergence;

import com.salary.equity.core.EquityException;
import com.salary.equity.core.ErrorKind;
import com.salary.equity.core.RecordError;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Population-level result of the median convergence analysis.
 * {@code belowMedianPercent} is a fraction of the analysed (valid) employees.
 */
public record ConvergenceReport(
        PeerGroups peerGroups,
        List<GapClassification> classifications,
        List<ConvergenceRecord> records,
        int totalEmployees,
        int belowMedianCount,
        double belowMedianPercent,
        int interventionRequiredCount,
        int divergentCount,
        GapStatistics gapStatistics,
        GenderGapAnalysis genderAnalysis,
        GapDistribution gapDistribution,
        List<RecordError> failures
) {
    public ConvergenceReport {
        Objects.requireNonNull(peerGroups, "peerGroups is required");
        classifications = classifications != null ? List.copyOf(classifications) : List.of();
        records = records != null ? List.copyOf(records) : List.of();
        failures = failures != null ? List.copyOf(failures) : List.of();
    }

    public int failedCount() {
        return failures.size();
    }

    /**
     * Returns a copy of this report carrying the given record failures.
     */
    public ConvergenceReport withFailures(List<RecordError> recordErrors) {
        return new ConvergenceReport(peerGroups, classifications, records, totalEmployees,
                belowMedianCount, belowMedianPercent, interventionRequiredCount, divergentCount,
                gapStatistics, genderAnalysis, gapDistribution, recordErrors);
    }

    public List<GapClassification> belowMedian() {
        return classifications.stream().filter(GapClassification::belowMedian).toList();
    }

    /**
     * Projects, for each year up to {@code years}, how many of the below-median
     * employees are still below their drifting median under each scenario.
     *
     * @throws EquityException {@link ErrorKind#INVALID_YEARS} if {@code years} is not positive
     */
    public ConvergenceTrends analyzeTrends(int years) {
        if (years <= 0) {
            throw new EquityException(ErrorKind.INVALID_YEARS, "years must be positive, got " + years);
        }
        List<ConvergenceRecord> below = records.stream().filter(ConvergenceRecord::isBelowMedian).toList();
        int initial = below.size();

        Map<ConvergenceScenario, ConvergenceTrends.Timeline> timelines = new EnumMap<>(ConvergenceScenario.class);
        for (ConvergenceScenario scenario : ConvergenceScenario.values()) {
            List<ConvergenceTrends.TrendYear> timeline = new ArrayList<>(years);
            for (int year = 1; year <= years; year++) {
                int converged = 0;
                for (ConvergenceRecord record : below) {
                    if (record.convergedBy(scenario, year)) {
                        converged++;
                    }
                }
                double rate = initial > 0 ? (double) converged / initial : 1.0;
                timeline.add(new ConvergenceTrends.TrendYear(year, initial - converged, converged, rate));
            }
            ConvergenceTrends.TrendYear last = timeline.get(timeline.size() - 1);
            timelines.put(scenario, new ConvergenceTrends.Timeline(scenario, timeline,
                    last.remainingBelowMedian(), last.convergenceRateYear()));
        }
        return new ConvergenceTrends(years, initial, timelines);
    }

    @Override
    public String toString() {
        return "ConvergenceReport{" +
                "employees=" + totalEmployees +
                ", peerGroups=" + peerGroups.size() +
                ", belowMedian=" + belowMedianCount +
                ", interventionRequired=" + interventionRequiredCount +
                ", divergent=" + divergentCount +
                ", failed=" + failures.size() +
                '}';
    }
}
