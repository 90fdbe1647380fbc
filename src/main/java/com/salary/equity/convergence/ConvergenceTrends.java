package com.salary.equity.convergence;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Year-by-year projection of how many below-median employees remain under each
 * {@link ConvergenceScenario}.
 *
 * @param years       projection horizon
 * @param initialCount below-median employees at year zero
 * @param timelines   per-scenario timeline, one entry per year
 */
public record ConvergenceTrends(
        int years,
        int initialCount,
        Map<ConvergenceScenario, Timeline> timelines
) {
    public ConvergenceTrends {
        EnumMap<ConvergenceScenario, Timeline> copy = new EnumMap<>(ConvergenceScenario.class);
        if (timelines != null) {
            copy.putAll(timelines);
        }
        timelines = Collections.unmodifiableMap(copy);
    }

    public Timeline timeline(ConvergenceScenario scenario) {
        Timeline timeline = timelines.get(scenario);
        if (timeline == null) {
            throw new IllegalArgumentException("No timeline for scenario " + scenario.getLabel());
        }
        return timeline;
    }

    /**
     * State of the below-median population at the end of one year.
     *
     * @param convergenceRateYear share of the initial below-median employees converged by this year
     */
    public record TrendYear(int year, int remainingBelowMedian, int converged, double convergenceRateYear) {
    }

    /**
     * @param convergenceRate share of the initial below-median employees converged by the last year
     */
    public record Timeline(ConvergenceScenario scenario, List<TrendYear> years, int finalBelowMedianCount,
                           double convergenceRate) {
        public Timeline {
            years = years != null ? List.copyOf(years) : List.of();
        }
    }
}
