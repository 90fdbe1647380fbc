package com.salary.equity.metrics;

import com.salary.equity.allocation.PriorityTier;
import com.salary.equity.allocation.RecommendationState;
import com.salary.equity.core.ErrorKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code equity.phase.duration}: Timer (tag: phase)</li>
 *   <li>{@code equity.records.failed}: Counter (tag: kind)</li>
 *   <li>{@code equity.recommendations}: Counter (tags: state, tier)</li>
 *   <li>{@code equity.allocation.amount}: DistributionSummary of funded uplifts</li>
 *   <li>{@code equity.population.size}: DistributionSummary of analysed population sizes</li>
 *   <li>{@code equity.strategy.selected}: Counter (tags: strategy, infeasible)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary allocationAmountSummary;
    private final DistributionSummary populationSizeSummary;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry is required");
        this.allocationAmountSummary = DistributionSummary.builder("equity.allocation.amount")
                .description("Distribution of funded salary uplifts")
                .baseUnit("currency")
                .register(registry);
        this.populationSizeSummary = DistributionSummary.builder("equity.population.size")
                .description("Number of valid employees per analysis run")
                .register(registry);
    }

    @Override
    public void recordPhaseDuration(String phase, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(phase, k ->
                Timer.builder("equity.phase.duration")
                        .description("Duration of analysis phases")
                        .tag("phase", phase)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementRecordFailed(ErrorKind kind) {
        String key = "failed:" + kind.name();
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("equity.records.failed")
                        .description("Employee records rejected by validation")
                        .tag("kind", kind.name())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void incrementRecommendation(RecommendationState state, PriorityTier tier) {
        String key = "recommendation:" + state.name() + ":" + tier.name();
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("equity.recommendations")
                        .description("Recommendations by final state and priority tier")
                        .tag("state", state.name())
                        .tag("tier", tier.name())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordAllocationAmount(double amount) {
        allocationAmountSummary.record(amount);
    }

    @Override
    public void recordPopulationSize(int size) {
        populationSizeSummary.record(size);
    }

    @Override
    public void incrementStrategySelected(String strategyName, boolean infeasible) {
        String key = "strategy:" + strategyName + ":" + infeasible;
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("equity.strategy.selected")
                        .description("Remediation strategies selected")
                        .tag("strategy", strategyName)
                        .tag("infeasible", String.valueOf(infeasible))
                        .register(registry));
        counter.increment();
    }
}
