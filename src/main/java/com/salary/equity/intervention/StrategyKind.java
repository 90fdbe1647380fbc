package com.salary.equity.intervention;

/**
 * The closed set of remediation strategy families.
 */
public enum StrategyKind {
    /** Every eligible gap closed in year one. */
    IMMEDIATE,
    /** Gaps closed over several years, largest gaps first. */
    GRADUAL,
    /** Only material gaps closed, in year one. */
    TARGETED
}
