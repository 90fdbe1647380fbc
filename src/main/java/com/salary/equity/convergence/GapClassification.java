package com.salary.equity.convergence;

import com.salary.equity.core.model.PeerGroupKey;

/**
 * Position of one employee relative to the peer-group median.
 * {@code gapPercent} is a fraction of the median: (median - salary) / median.
 */
public record GapClassification(
        String employeeId,
        PeerGroupKey peerGroup,
        double salary,
        double peerMedian,
        boolean belowMedian,
        double gapAmount,
        double gapPercent
) {
    public static GapClassification of(String employeeId, PeerGroupKey peerGroup, double salary, double median) {
        boolean below = salary < median;
        double gapAmount = below ? median - salary : 0.0;
        double gapPercent = below ? gapAmount / median : 0.0;
        return new GapClassification(employeeId, peerGroup, salary, median, below, gapAmount, gapPercent);
    }
}
