package com.salary.equity.forecast;

import com.salary.equity.core.EquityException;
import com.salary.equity.core.ErrorKind;
import com.salary.equity.core.model.LevelTier;
import com.salary.equity.core.model.PerformanceRating;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Static uplift table keyed by performance tier, with per-band bonuses.
 * Every tier of {@link PerformanceRating} must be present.
 */
public final class UpliftTable {

    private final Map<PerformanceRating, UpliftRates> rates;

    private UpliftTable(Map<PerformanceRating, UpliftRates> rates) {
        EnumMap<PerformanceRating, UpliftRates> copy = new EnumMap<>(PerformanceRating.class);
        copy.putAll(rates);
        for (PerformanceRating rating : PerformanceRating.values()) {
            if (!copy.containsKey(rating)) {
                throw new IllegalArgumentException("Uplift table is missing tier " + rating.getLabel());
            }
        }
        this.rates = Collections.unmodifiableMap(copy);
    }

    public static UpliftTable of(Map<PerformanceRating, UpliftRates> rates) {
        return new UpliftTable(rates);
    }

    /**
     * Default table: 1.25% baseline for everyone, performance component rising
     * with the rating, and a band bonus of 0.5% / 0.75% / 1.0%
     * (competent band gets no bonus below Achieving).
     */
    public static UpliftTable defaults() {
        Map<PerformanceRating, UpliftRates> rates = new EnumMap<>(PerformanceRating.class);
        rates.put(PerformanceRating.NOT_MET, new UpliftRates(0.0125, 0.0, 0.0, 0.0075, 0.01));
        rates.put(PerformanceRating.PARTIALLY_MET, new UpliftRates(0.0125, 0.0, 0.0, 0.0075, 0.01));
        rates.put(PerformanceRating.ACHIEVING, new UpliftRates(0.0125, 0.0125, 0.005, 0.0075, 0.01));
        rates.put(PerformanceRating.HIGH_PERFORMING, new UpliftRates(0.0125, 0.0225, 0.005, 0.0075, 0.01));
        rates.put(PerformanceRating.EXCEEDING, new UpliftRates(0.0125, 0.030, 0.005, 0.0075, 0.01));
        return new UpliftTable(rates);
    }

    public UpliftRates ratesFor(PerformanceRating rating) {
        if (rating == null) {
            throw new EquityException(ErrorKind.UNKNOWN_PERFORMANCE_RATING, "Performance rating is required");
        }
        return rates.get(rating);
    }

    /**
     * Unadjusted annual rate for a rating and level band.
     */
    public double annualRate(PerformanceRating rating, LevelTier tier) {
        return ratesFor(rating).totalRate(tier);
    }

    public Map<PerformanceRating, UpliftRates> asMap() {
        return rates;
    }
}
