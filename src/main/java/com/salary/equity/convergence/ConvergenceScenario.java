package com.salary.equity.convergence;

/**
 * Growth path used when projecting when below-median employees converge.
 */
public enum ConvergenceScenario {
    /** Realistic growth with no action. */
    NATURAL("natural"),
    /** Optimistic growth from improved performance. */
    ACCELERATED("accelerated"),
    /** One-time adjustment to the median. */
    INTERVENTION("intervention");

    private final String label;

    ConvergenceScenario(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
