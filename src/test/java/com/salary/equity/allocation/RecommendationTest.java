package com.salary.equity.allocation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class RecommendationTest {

    private static Recommendation pending() {
        return Recommendation.builder()
                .employeeId("E1")
                .managerId("M1")
                .currentSalary(50_000)
                .requestedUplift(2_000)
                .gapAmount(2_000)
                .priorityTier(PriorityTier.RECOGNITION)
                .flag(RationaleFlag.BELOW_MEDIAN)
                .build();
    }

    @Test
    @DisplayName("New recommendations are pending with nothing proposed")
    void startsPending() {
        Recommendation recommendation = pending();

        assertEquals(RecommendationState.PENDING, recommendation.getState());
        assertEquals(0.0, recommendation.getProposedUplift());
        assertFalse(recommendation.isFunded());
        assertFalse(recommendation.getState().isTerminal());
    }

    @Test
    @DisplayName("Accepted recommendation raises the proposed salary")
    void accept() {
        Recommendation recommendation = pending();
        recommendation.markEvaluated();
        recommendation.accept(2_000);

        assertEquals(RecommendationState.ACCEPTED, recommendation.getState());
        assertEquals(52_000, recommendation.getProposedSalary(), 1e-9);
        assertTrue(recommendation.isFunded());
        assertTrue(recommendation.getState().isTerminal());
    }

    @Test
    @DisplayName("Trim may not exceed the request")
    void trimBounded() {
        Recommendation recommendation = pending();
        recommendation.markEvaluated();

        assertThrows(IllegalArgumentException.class, () -> recommendation.trim(2_500));
        recommendation.trim(500);
        assertEquals(RecommendationState.TRIMMED, recommendation.getState());
        assertEquals(500, recommendation.getProposedUplift(), 1e-9);
    }

    @Test
    @DisplayName("Pending recommendations can be staged without evaluation")
    void stageFromPending() {
        Recommendation recommendation = pending();
        recommendation.stage();

        assertEquals(RecommendationState.STAGED, recommendation.getState());
        assertFalse(recommendation.isFunded());
        assertThrows(IllegalStateException.class, recommendation::markEvaluated);
    }

    @Test
    @DisplayName("Decisions require evaluation first")
    void acceptRequiresEvaluation() {
        Recommendation recommendation = pending();

        assertThrows(IllegalStateException.class, () -> recommendation.accept(100));
        recommendation.markEvaluated();
        recommendation.accept(100);
        assertThrows(IllegalStateException.class, recommendation::stage);
        assertThrows(IllegalStateException.class, () -> recommendation.trim(50));
    }

    @ParameterizedTest
    @CsvSource({
            "true,  true,  URGENT",
            "false, true,  MONITOR",
            "true,  false, RECOGNITION",
            "false, false, NONE"
    })
    @DisplayName("Priority tier follows gap and performance")
    void priorityTier(boolean belowMedian, boolean highPerformer, PriorityTier expected) {
        assertEquals(expected, PriorityTier.classify(belowMedian, highPerformer));
    }

    @Test
    void equalityUsesEmployeeAndManager() {
        Recommendation a = pending();
        Recommendation b = pending();
        b.stage();

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
    }
}
