package com.salary.equity.forecast;

/**
 * Named performance scenario used for salary projections.
 */
public enum Scenario {
    CONSERVATIVE("conservative"),
    REALISTIC("realistic"),
    OPTIMISTIC("optimistic");

    private final String label;

    Scenario(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
