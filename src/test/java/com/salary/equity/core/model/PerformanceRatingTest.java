package com.salary.equity.core.model;

import com.salary.equity.core.EquityException;
import com.salary.equity.core.ErrorKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class PerformanceRatingTest {

    @ParameterizedTest
    @CsvSource({
            "Not met,          NOT_MET",
            "partially met,    PARTIALLY_MET",
            "Achieving,        ACHIEVING",
            "'  High Performing ', HIGH_PERFORMING",
            "EXCEEDING,        EXCEEDING",
            "high_performing,  HIGH_PERFORMING"
    })
    @DisplayName("Labels and enum names parse case-insensitively")
    void fromLabel(String label, PerformanceRating expected) {
        assertEquals(expected, PerformanceRating.fromLabel(label));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "Outstanding", "Meets"})
    void unknownLabel(String label) {
        EquityException e = assertThrows(EquityException.class, () -> PerformanceRating.fromLabel(label));
        assertEquals(ErrorKind.UNKNOWN_PERFORMANCE_RATING, e.getKind());
    }

    @Test
    void nullLabel() {
        assertThrows(EquityException.class, () -> PerformanceRating.fromLabel(null));
    }

    @Test
    @DisplayName("Next tier saturates at the top")
    void next() {
        assertEquals(PerformanceRating.PARTIALLY_MET, PerformanceRating.NOT_MET.next());
        assertEquals(PerformanceRating.EXCEEDING, PerformanceRating.HIGH_PERFORMING.next());
        assertEquals(PerformanceRating.EXCEEDING, PerformanceRating.EXCEEDING.next());
    }

    @ParameterizedTest
    @CsvSource({"1, COMPETENT", "2, ADVANCED", "3, EXPERT", "4, COMPETENT", "5, ADVANCED", "6, EXPERT"})
    @DisplayName("Levels map onto repeating bands")
    void levelTier(int level, LevelTier expected) {
        assertEquals(expected, LevelTier.forLevel(level));
    }

    @Test
    void levelTierRejectsNonPositive() {
        EquityException e = assertThrows(EquityException.class, () -> LevelTier.forLevel(0));
        assertEquals(ErrorKind.INVALID_LEVEL, e.getKind());
    }

    @Test
    void peerGroupKeyOrdering() {
        assertTrue(PeerGroupKey.ofLevel(1).compareTo(PeerGroupKey.ofLevel(2)) < 0);
        assertTrue(PeerGroupKey.ofLevel(2).compareTo(new PeerGroupKey(2, "Female")) < 0);
        assertTrue(new PeerGroupKey(2, "Female").compareTo(new PeerGroupKey(2, "Male")) < 0);
        assertEquals("L3/Male", new PeerGroupKey(3, "Male").toString());
    }
}
