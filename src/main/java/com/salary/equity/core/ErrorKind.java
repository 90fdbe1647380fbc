package com.salary.equity.core;

/**
 * Kinds of failure reported by the equity engine.
 * Record-level kinds are collected per employee; configuration kinds abort a run.
 */
public enum ErrorKind {
    INVALID_YEARS,
    NON_POSITIVE_SALARY,
    INVALID_CONFIDENCE,
    INVALID_BUDGET,
    UNKNOWN_PERFORMANCE_RATING,
    INSUFFICIENT_POPULATION,
    INVALID_LEVEL,
    INVALID_TENURE,
    MISSING_FIELD,
    DUPLICATE_ID,
    MALFORMED_RECORD
}
