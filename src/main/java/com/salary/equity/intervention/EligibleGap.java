package com.salary.equity.intervention;

import com.salary.equity.convergence.GapClassification;

import java.util.Objects;

/**
 * A below-median employee whose gap a strategy may close.
 */
public record EligibleGap(String employeeId, double gapAmount, double gapPercent, double peerMedian) {

    public EligibleGap {
        Objects.requireNonNull(employeeId, "employeeId is required");
        if (gapAmount < 0) {
            throw new IllegalArgumentException("gapAmount must not be negative: " + gapAmount);
        }
    }

    public static EligibleGap from(GapClassification classification) {
        return new EligibleGap(classification.employeeId(), classification.gapAmount(),
                classification.gapPercent(), classification.peerMedian());
    }
}
