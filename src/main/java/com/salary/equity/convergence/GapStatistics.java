package com.salary.equity.convergence;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import java.util.List;

/**
 * Summary statistics over the gaps of below-median employees.
 * Percentages are fractions of the peer median.
 */
public record GapStatistics(
        int count,
        double totalGapAmount,
        double meanGapAmount,
        double medianGapAmount,
        double minGapAmount,
        double maxGapAmount,
        double meanGapPercent,
        double medianGapPercent
) {
    public static GapStatistics empty() {
        return new GapStatistics(0, 0, 0, 0, 0, 0, 0, 0);
    }

    public static GapStatistics of(List<GapClassification> belowMedian) {
        if (belowMedian.isEmpty()) {
            return empty();
        }
        DescriptiveStatistics amounts = new DescriptiveStatistics();
        DescriptiveStatistics percents = new DescriptiveStatistics();
        for (GapClassification gap : belowMedian) {
            amounts.addValue(gap.gapAmount());
            percents.addValue(gap.gapPercent());
        }
        return new GapStatistics(
                belowMedian.size(),
                amounts.getSum(),
                amounts.getMean(),
                amounts.getPercentile(50),
                amounts.getMin(),
                amounts.getMax(),
                percents.getMean(),
                percents.getPercentile(50));
    }
}
