package com.salary.equity.metrics;

import com.salary.equity.allocation.PriorityTier;
import com.salary.equity.allocation.RecommendationState;
import com.salary.equity.core.ErrorKind;

import java.time.Duration;

/**
 * No-op implementation used when no metrics backend is configured.
 */
public class NoOpMetricsService implements MetricsService {

    public static final NoOpMetricsService INSTANCE = new NoOpMetricsService();

    @Override
    public void recordPhaseDuration(String phase, Duration duration) {
    }

    @Override
    public void incrementRecordFailed(ErrorKind kind) {
    }

    @Override
    public void incrementRecommendation(RecommendationState state, PriorityTier tier) {
    }

    @Override
    public void recordAllocationAmount(double amount) {
    }

    @Override
    public void recordPopulationSize(int size) {
    }

    @Override
    public void incrementStrategySelected(String strategyName, boolean infeasible) {
    }
}
