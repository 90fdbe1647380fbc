package com.salary.equity.convergence;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.TreeMap;

/**
 * Below-median patterns per gender.
 *
 * <p>{@code disparity} is the comparison gender's mean gap percent minus the
 * reference gender's, present only when both have below-median employees.
 * A disparity above five percentage points is flagged significant.</p>
 */
public record GenderGapAnalysis(
        Map<String, GenderStats> byGender,
        String referenceGender,
        String comparisonGender,
        OptionalDouble disparity,
        boolean disparitySignificant
) {
    static final double SIGNIFICANT_DISPARITY = 0.05;

    public GenderGapAnalysis {
        byGender = byGender != null ? Collections.unmodifiableMap(new TreeMap<>(byGender)) : Map.of();
        disparity = disparity != null ? disparity : OptionalDouble.empty();
    }

    /**
     * Per-gender count and gap statistics of below-median employees.
     */
    public record GenderStats(int belowMedianCount, double meanGapPercent, double medianGapPercent) {
    }

    public static GenderGapAnalysis of(Map<String, List<GapClassification>> belowMedianByGender,
                                       String referenceGender, String comparisonGender) {
        Map<String, GenderStats> stats = new TreeMap<>();
        for (Map.Entry<String, List<GapClassification>> entry : belowMedianByGender.entrySet()) {
            DescriptiveStatistics percents = new DescriptiveStatistics();
            for (GapClassification gap : entry.getValue()) {
                percents.addValue(gap.gapPercent());
            }
            int n = entry.getValue().size();
            stats.put(entry.getKey(), new GenderStats(n,
                    n > 0 ? percents.getMean() : 0.0,
                    n > 0 ? percents.getPercentile(50) : 0.0));
        }

        GenderStats reference = stats.get(referenceGender);
        GenderStats comparison = stats.get(comparisonGender);
        OptionalDouble disparity = OptionalDouble.empty();
        boolean significant = false;
        if (reference != null && comparison != null
                && reference.belowMedianCount() > 0 && comparison.belowMedianCount() > 0) {
            double value = comparison.meanGapPercent() - reference.meanGapPercent();
            disparity = OptionalDouble.of(value);
            significant = Math.abs(value) > SIGNIFICANT_DISPARITY;
        }
        return new GenderGapAnalysis(stats, referenceGender, comparisonGender, disparity, significant);
    }

    public List<String> genders() {
        return new ArrayList<>(byGender.keySet());
    }
}
