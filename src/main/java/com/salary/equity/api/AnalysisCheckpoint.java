package com.salary.equity.api;

import com.salary.equity.convergence.ConvergenceReport;

/**
 * Hook invoked after classification and before budget allocation.
 * Returning {@code false} ends the run without an allocation.
 */
@FunctionalInterface
public interface AnalysisCheckpoint {

    boolean proceed(ConvergenceReport report);

    AnalysisCheckpoint ALWAYS = report -> true;
}
