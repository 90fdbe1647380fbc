package com.salary.equity.allocation;

/**
 * Lifecycle of a {@link Recommendation}.
 * PENDING moves to EVALUATED or straight to STAGED; EVALUATED ends in
 * ACCEPTED, TRIMMED or STAGED.
 */
public enum RecommendationState {
    PENDING,
    EVALUATED,
    ACCEPTED,
    TRIMMED,
    STAGED;

    public boolean isTerminal() {
        return this == ACCEPTED || this == TRIMMED || this == STAGED;
    }
}
