package com.salary.equity.allocation;

/**
 * Allocation priority of a recommendation, in processing order.
 */
public enum PriorityTier {
    /** Below median and a high performer. */
    URGENT,
    /** High performer at or above median. */
    MONITOR,
    /** Below median, not a high performer. */
    RECOGNITION,
    /** Neither; requests nothing. */
    NONE;

    public static PriorityTier classify(boolean belowMedian, boolean highPerformer) {
        if (belowMedian && highPerformer) {
            return URGENT;
        }
        if (highPerformer) {
            return MONITOR;
        }
        if (belowMedian) {
            return RECOGNITION;
        }
        return NONE;
    }
}
