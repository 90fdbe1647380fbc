package com.salary.equity.forecast;

/**
 * Lower and upper bound of a projected salary.
 */
public record ConfidenceInterval(double lower, double upper, double confidenceLevel) {

    public ConfidenceInterval {
        if (lower > upper) {
            throw new IllegalArgumentException("lower must not exceed upper");
        }
    }

    public double width() {
        return upper - lower;
    }

    public boolean contains(double value) {
        return value >= lower && value <= upper;
    }
}
