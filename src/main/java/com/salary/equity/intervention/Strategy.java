package com.salary.equity.intervention;

import java.util.Objects;

/**
 * A remediation strategy. {@code years} is the horizon the strategy spreads its
 * cost over; it is 1 for the immediate and targeted strategies.
 */
public record Strategy(StrategyKind kind, int years) {

    public Strategy {
        Objects.requireNonNull(kind, "kind is required");
        if (years < 1) {
            throw new IllegalArgumentException("years must be at least 1, got " + years);
        }
        if (kind != StrategyKind.GRADUAL && years != 1) {
            throw new IllegalArgumentException(kind + " strategies span exactly one year");
        }
    }

    public static Strategy immediate() {
        return new Strategy(StrategyKind.IMMEDIATE, 1);
    }

    public static Strategy gradual(int years) {
        return new Strategy(StrategyKind.GRADUAL, years);
    }

    public static Strategy targeted() {
        return new Strategy(StrategyKind.TARGETED, 1);
    }

    /**
     * Stable name: {@code immediate}, {@code gradual_N_year} or {@code targeted}.
     */
    public String name() {
        return switch (kind) {
            case IMMEDIATE -> "immediate";
            case GRADUAL -> "gradual_" + years + "_year";
            case TARGETED -> "targeted";
        };
    }

    @Override
    public String toString() {
        return name();
    }
}
