package com.salary.equity.forecast;

/**
 * How the three scenarios adjust the performance component of the uplift.
 *
 * @param conservativeMargin               subtracted from the performance component (floored at zero)
 * @param optimisticImprovementProbability probability of moving up one performance tier, in [0, 1]
 */
public record ScenarioAdjustments(double conservativeMargin, double optimisticImprovementProbability) {

    public ScenarioAdjustments {
        if (conservativeMargin < 0) {
            throw new IllegalArgumentException("conservativeMargin must be non-negative");
        }
        if (optimisticImprovementProbability < 0.0 || optimisticImprovementProbability > 1.0) {
            throw new IllegalArgumentException("optimisticImprovementProbability must be between 0.0 and 1.0");
        }
    }

    /**
     * Half a percentage point off for conservative, even odds of a tier improvement for optimistic.
     */
    public static ScenarioAdjustments defaults() {
        return new ScenarioAdjustments(0.005, 0.5);
    }

    /**
     * All three scenarios collapse to the unadjusted rate.
     */
    public static ScenarioAdjustments none() {
        return new ScenarioAdjustments(0.0, 0.0);
    }
}
