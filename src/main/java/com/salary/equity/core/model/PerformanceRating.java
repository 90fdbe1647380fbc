package com.salary.equity.core.model;

import com.salary.equity.core.EquityException;
import com.salary.equity.core.ErrorKind;

/**
 * Fixed five-tier performance scale, ordered from lowest to highest.
 */
public enum PerformanceRating {
    NOT_MET("Not met"),
    PARTIALLY_MET("Partially met"),
    ACHIEVING("Achieving"),
    HIGH_PERFORMING("High Performing"),
    EXCEEDING("Exceeding");

    private final String label;

    PerformanceRating(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Returns the next tier up, or this tier when already at the top.
     */
    public PerformanceRating next() {
        PerformanceRating[] values = values();
        return ordinal() + 1 < values.length ? values[ordinal() + 1] : this;
    }

    /**
     * Parses a rating from its display label or enum name, ignoring case.
     *
     * @throws EquityException with {@link ErrorKind#UNKNOWN_PERFORMANCE_RATING} if no tier matches
     */
    public static PerformanceRating fromLabel(String value) {
        if (value != null) {
            String trimmed = value.trim();
            for (PerformanceRating rating : values()) {
                if (rating.label.equalsIgnoreCase(trimmed) || rating.name().equalsIgnoreCase(trimmed)) {
                    return rating;
                }
            }
        }
        throw new EquityException(ErrorKind.UNKNOWN_PERFORMANCE_RATING,
                "Unknown performance rating: " + value);
    }
}
