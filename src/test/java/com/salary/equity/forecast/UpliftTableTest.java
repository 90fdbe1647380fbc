package com.salary.equity.forecast;

import com.salary.equity.core.EquityException;
import com.salary.equity.core.ErrorKind;
import com.salary.equity.core.model.LevelTier;
import com.salary.equity.core.model.PerformanceRating;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.EnumMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class UpliftTableTest {

    private final UpliftTable table = UpliftTable.defaults();

    @ParameterizedTest
    @CsvSource({
            "NOT_MET,         COMPETENT, 0.0125",
            "NOT_MET,         EXPERT,    0.0225",
            "ACHIEVING,       COMPETENT, 0.030",
            "ACHIEVING,       ADVANCED,  0.0325",
            "HIGH_PERFORMING, ADVANCED,  0.0425",
            "EXCEEDING,       EXPERT,    0.0525"
    })
    @DisplayName("Annual rate is baseline plus performance plus band bonus")
    void annualRate(PerformanceRating rating, LevelTier tier, double expected) {
        assertEquals(expected, table.annualRate(rating, tier), 1e-12);
    }

    @Test
    @DisplayName("Rates never decrease with a better rating")
    void monotonicInRating() {
        for (LevelTier tier : LevelTier.values()) {
            double previous = 0.0;
            for (PerformanceRating rating : PerformanceRating.values()) {
                double rate = table.annualRate(rating, tier);
                assertTrue(rate >= previous, rating + " " + tier);
                previous = rate;
            }
        }
    }

    @Test
    @DisplayName("A table must cover every rating")
    void missingTier() {
        Map<PerformanceRating, UpliftRates> partial = new EnumMap<>(PerformanceRating.class);
        partial.put(PerformanceRating.ACHIEVING, new UpliftRates(0.01, 0.01, 0.0, 0.0, 0.0));

        assertThrows(IllegalArgumentException.class, () -> UpliftTable.of(partial));
        assertThrows(IllegalArgumentException.class, () -> new UpliftRates(-0.01, 0, 0, 0, 0));
    }

    @Test
    void missingRating() {
        EquityException e = assertThrows(EquityException.class, () -> table.ratesFor(null));
        assertEquals(ErrorKind.UNKNOWN_PERFORMANCE_RATING, e.getKind());
    }
}
