package com.salary.equity.metrics;

import com.salary.equity.allocation.PriorityTier;
import com.salary.equity.allocation.RecommendationState;
import com.salary.equity.core.ErrorKind;

import java.time.Duration;

/**
 * Interface for recording equity analysis metrics.
 * The default {@link NoOpMetricsService} does nothing, so the engine works
 * without a meter registry.
 */
public interface MetricsService {

    void recordPhaseDuration(String phase, Duration duration);

    void incrementRecordFailed(ErrorKind kind);

    void incrementRecommendation(RecommendationState state, PriorityTier tier);

    void recordAllocationAmount(double amount);

    void recordPopulationSize(int size);

    void incrementStrategySelected(String strategyName, boolean infeasible);
}
