package com.salary.equity.api;

import com.salary.equity.allocation.AllocationResult;
import com.salary.equity.allocation.ManagerBudgetAllocator;
import com.salary.equity.allocation.Recommendation;
import com.salary.equity.convergence.ConvergenceReport;
import com.salary.equity.convergence.MedianConvergenceAnalyzer;
import com.salary.equity.convergence.PeerGroups;
import com.salary.equity.core.EquityException;
import com.salary.equity.core.ErrorKind;
import com.salary.equity.core.RecordError;
import com.salary.equity.core.model.Employee;
import com.salary.equity.forecast.EmployeeProjection;
import com.salary.equity.forecast.ScenarioProjector;
import com.salary.equity.intervention.EligibleGap;
import com.salary.equity.intervention.InterventionStrategySimulator;
import com.salary.equity.intervention.StrategyComparison;
import com.salary.equity.logging.LogContext;
import com.salary.equity.metrics.MetricsService;
import com.salary.equity.metrics.NoOpMetricsService;
import com.salary.equity.population.EmployeeValidator;
import com.salary.equity.population.PopulationLoadResult;
import com.salary.equity.population.PopulationSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Entry point for an equity analysis run.
 *
 * <p>A run validates the population, projects every employee, classifies them
 * against peer medians, costs the remediation strategies and, unless the
 * {@link AnalysisCheckpoint} says otherwise, allocates manager budgets.
 * Per-employee work and manager pools fan out on a fixed thread pool; each
 * aggregate waits for all of its inputs.</p>
 *
 * <pre>
 * try (EquityEngine engine = EquityEngine.builder().options(EquityAnalysisOptions.defaults()).build()) {
 *     EquityAnalysisResult result = engine.analyze(population);
 * }
 * </pre>
 *
 * <p>Thread-safe: concurrent {@code analyze} calls share the pool but no state.</p>
 */
public class EquityEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(EquityEngine.class);

    static final String PHASE_VALIDATION = "validation";
    static final String PHASE_PROJECTION = "projection";
    static final String PHASE_CONVERGENCE = "convergence";
    static final String PHASE_STRATEGY = "strategy";
    static final String PHASE_ALLOCATION = "allocation";

    private final EquityAnalysisOptions options;
    private final MetricsService metricsService;
    private final AnalysisCheckpoint checkpoint;
    private final ExecutorService executor;
    private final boolean ownsExecutor;

    private final EmployeeValidator validator;
    private final ScenarioProjector projector;
    private final MedianConvergenceAnalyzer analyzer;
    private final InterventionStrategySimulator simulator;
    private final ManagerBudgetAllocator allocator;

    private EquityEngine(Builder builder) {
        this.options = builder.options != null ? builder.options : EquityAnalysisOptions.defaults();
        this.metricsService = builder.metricsService != null ? builder.metricsService : NoOpMetricsService.INSTANCE;
        this.checkpoint = builder.checkpoint != null ? builder.checkpoint : AnalysisCheckpoint.ALWAYS;
        if (builder.executor != null) {
            this.executor = builder.executor;
            this.ownsExecutor = false;
        } else {
            this.executor = Executors.newFixedThreadPool(options.getParallelism(), new WorkerThreadFactory());
            this.ownsExecutor = true;
        }

        this.validator = new EmployeeValidator(options.getMinLevel(), options.getMaxLevel());
        this.projector = new ScenarioProjector(options.getUpliftTable(), options.getScenarioAdjustments(),
                options.getConfidenceLevel(), options.getConfidenceSpread());
        this.analyzer = new MedianConvergenceAnalyzer(options.getConvergenceThresholdYears(),
                options.isGroupByGender(), options.getReferenceGender(), options.getComparisonGender());
        this.simulator = new InterventionStrategySimulator(options.getGradualSplits(),
                options.getMaterialityThreshold());
        this.allocator = ManagerBudgetAllocator.builder()
                .maxDirectReports(options.getMaxDirectReports())
                .budgetConstraintPercent(options.getBudgetConstraintPercent())
                .overallBudgetConstraint(options.getOverallBudgetConstraint())
                .monitorUpliftPercent(options.getMonitorUpliftPercent())
                .highPerformerRatings(options.getHighPerformerRatings())
                .analyzer(analyzer)
                .referenceGender(options.getReferenceGender())
                .comparisonGender(options.getComparisonGender())
                .build();
    }

    /**
     * Analyses an in-memory population.
     *
     * @throws EquityException INSUFFICIENT_POPULATION when no record is valid
     */
    public EquityAnalysisResult analyze(List<Employee> population) {
        Objects.requireNonNull(population, "population is required");
        return run(population, List.of());
    }

    /**
     * Loads the population from {@code source} and analyses it. Records the
     * source could not read are reported as failures alongside validation errors.
     */
    public EquityAnalysisResult analyze(PopulationSource source) {
        Objects.requireNonNull(source, "source is required");
        PopulationLoadResult loaded = source.load();
        return run(loaded.employees(), loaded.recordErrors());
    }

    private EquityAnalysisResult run(List<Employee> population, List<RecordError> loadErrors) {
        String runId = LogContext.generateRunId();
        long start = System.nanoTime();
        try (LogContext ctx = LogContext.forAnalysis(runId)) {
            log.info("analysis.started runId={} records={}", runId, population.size() + loadErrors.size());

            EmployeeValidator.Validation validation = timed(PHASE_VALIDATION,
                    () -> validator.validateAll(population));
            List<RecordError> failures = new ArrayList<>(loadErrors);
            failures.addAll(validation.errors());
            for (RecordError failure : failures) {
                metricsService.incrementRecordFailed(failure.kind());
            }
            List<Employee> valid = validation.valid();
            if (valid.isEmpty()) {
                log.error("analysis.failed runId={} reason=no valid employees failed={}", runId, failures.size());
                throw new EquityException(ErrorKind.INSUFFICIENT_POPULATION,
                        "No valid employees to analyse (" + failures.size() + " records rejected)");
            }
            metricsService.recordPopulationSize(valid.size());

            List<EmployeeProjection> projections = timed(PHASE_PROJECTION,
                    () -> projector.projectAll(valid, options.getProjectionYears(), executor));
            Map<String, EmployeeProjection> projectionById = new HashMap<>();
            for (EmployeeProjection projection : projections) {
                projectionById.put(projection.employeeId(), projection);
            }

            PeerGroups peerGroups = analyzer.buildPeerGroups(valid);
            ConvergenceReport report = timed(PHASE_CONVERGENCE, () -> analyzer.analyze(valid, peerGroups,
                    e -> projectionById.get(e.id()).realisticRate(),
                    e -> projectionById.get(e.id()).optimisticRate(),
                    options.getMedianGrowthRate(), executor))
                    .withFailures(failures);

            double payroll = valid.stream().mapToDouble(Employee::salary).sum();
            List<EligibleGap> eligible = report.belowMedian().stream().map(EligibleGap::from).toList();
            StrategyComparison strategies = timed(PHASE_STRATEGY, () -> simulator.compare(eligible, payroll,
                    options.getTargetGapPercent(), options.getMaxYears(), options.getOverallBudgetConstraint()));
            metricsService.incrementStrategySelected(strategies.selected().name(), strategies.infeasible());

            Optional<AllocationResult> allocation = Optional.empty();
            if (checkpoint.proceed(report)) {
                AllocationResult allocated = timed(PHASE_ALLOCATION,
                        () -> allocator.allocate(valid, peerGroups, executor));
                recordAllocationMetrics(allocated);
                allocation = Optional.of(allocated);
            } else {
                log.info("analysis.checkpoint.stopped runId={} belowMedian={}", runId, report.belowMedianCount());
            }

            Duration duration = Duration.ofNanos(System.nanoTime() - start);
            EquityAnalysisResult result = new EquityAnalysisResult(runId, projections, report, strategies,
                    allocation, failures, duration);
            log.info("analysis.completed runId={} result={}", runId, result);
            return result;
        }
    }

    private void recordAllocationMetrics(AllocationResult allocation) {
        for (Recommendation recommendation : allocation.recommendations()) {
            metricsService.incrementRecommendation(recommendation.getState(), recommendation.getPriorityTier());
            if (recommendation.isFunded()) {
                metricsService.recordAllocationAmount(recommendation.getProposedUplift());
            }
        }
    }

    /**
     * Runs a phase, records its duration and surfaces domain errors thrown on worker threads.
     */
    private <T> T timed(String phase, Supplier<T> work) {
        long start = System.nanoTime();
        try {
            T value = work.get();
            log.debug("analysis.phase phase={} durationMs={}", phase,
                    TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
            return value;
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        } finally {
            metricsService.recordPhaseDuration(phase, Duration.ofNanos(System.nanoTime() - start));
        }
    }

    public EquityAnalysisOptions getOptions() {
        return options;
    }

    @Override
    public void close() {
        if (!ownsExecutor) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private EquityAnalysisOptions options;
        private MetricsService metricsService;
        private AnalysisCheckpoint checkpoint;
        private ExecutorService executor;

        public Builder options(EquityAnalysisOptions options) {
            this.options = options;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder checkpoint(AnalysisCheckpoint checkpoint) {
            this.checkpoint = checkpoint;
            return this;
        }

        /**
         * Uses a caller-managed executor; {@link EquityEngine#close()} then leaves it running.
         */
        public Builder executor(ExecutorService executor) {
            this.executor = executor;
            return this;
        }

        public EquityEngine build() {
            return new EquityEngine(this);
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "equity-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
