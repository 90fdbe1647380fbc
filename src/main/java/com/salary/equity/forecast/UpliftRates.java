package com.salary.equity.forecast;

import com.salary.equity.core.model.LevelTier;

/**
 * Annual uplift components for one performance tier.
 *
 * @param baseline    cost-of-living component paid to everyone
 * @param performance performance-based component
 * @param competent   bonus for the competent level band
 * @param advanced    bonus for the advanced level band
 * @param expert      bonus for the expert level band
 */
public record UpliftRates(
        double baseline,
        double performance,
        double competent,
        double advanced,
        double expert
) {
    public UpliftRates {
        if (baseline < 0 || performance < 0 || competent < 0 || advanced < 0 || expert < 0) {
            throw new IllegalArgumentException("Uplift components must be non-negative");
        }
    }

    public double tierBonus(LevelTier tier) {
        return switch (tier) {
            case COMPETENT -> competent;
            case ADVANCED -> advanced;
            case EXPERT -> expert;
        };
    }

    /**
     * Total annual rate for the given band with the unadjusted performance component.
     */
    public double totalRate(LevelTier tier) {
        return baseline + performance + tierBonus(tier);
    }
}
