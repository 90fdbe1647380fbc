package com.salary.equity.convergence;

import java.util.OptionalDouble;

/**
 * Action suggested for one employee from the size of their gap and how long
 * natural growth would take to close it.
 */
public enum RecommendedAction {
    IMMEDIATE_INTERVENTION("immediate_intervention"),
    PERFORMANCE_ACCELERATION("performance_acceleration"),
    MONITOR_NATURAL_PROGRESSION("monitor_natural_progression"),
    MODERATE_INTERVENTION("moderate_intervention");

    static final double IMMEDIATE_GAP_PERCENT = 0.25;
    static final double IMMEDIATE_YEARS = 7;
    static final double ACCELERATION_GAP_PERCENT = 0.15;
    static final double ACCELERATION_YEARS = 5;
    static final double MONITOR_YEARS = 3;

    private final String label;

    RecommendedAction(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Picks the action for a gap. A divergent employee (no natural crossing) is
     * treated as never converging.
     *
     * @param gapPercent   gap as a fraction of the peer median
     * @param naturalYears years to the median under natural growth
     */
    public static RecommendedAction of(double gapPercent, OptionalDouble naturalYears) {
        double years = naturalYears.isPresent() ? naturalYears.getAsDouble() : Double.POSITIVE_INFINITY;
        if (gapPercent > IMMEDIATE_GAP_PERCENT || years > IMMEDIATE_YEARS) {
            return IMMEDIATE_INTERVENTION;
        }
        if (gapPercent > ACCELERATION_GAP_PERCENT || years > ACCELERATION_YEARS) {
            return PERFORMANCE_ACCELERATION;
        }
        if (years <= MONITOR_YEARS) {
            return MONITOR_NATURAL_PROGRESSION;
        }
        return MODERATE_INTERVENTION;
    }
}
