package com.salary.equity.convergence;

import java.util.List;

/**
 * Below-median employees bucketed by gap size:
 * small (0-5%], medium (5-15%], large (15-25%], severe (&gt;25%).
 */
public record GapDistribution(int small, int medium, int large, int severe) {

    public static GapDistribution of(List<GapClassification> belowMedian) {
        int small = 0;
        int medium = 0;
        int large = 0;
        int severe = 0;
        for (GapClassification gap : belowMedian) {
            double pct = gap.gapPercent();
            if (pct <= 0.05) {
                small++;
            } else if (pct <= 0.15) {
                medium++;
            } else if (pct <= 0.25) {
                large++;
            } else {
                severe++;
            }
        }
        return new GapDistribution(small, medium, large, severe);
    }

    public int total() {
        return small + medium + large + severe;
    }
}
