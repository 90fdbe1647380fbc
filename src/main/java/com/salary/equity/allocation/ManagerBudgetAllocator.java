package com.salary.equity.allocation;

import com.salary.equity.convergence.GapClassification;
import com.salary.equity.convergence.MedianConvergenceAnalyzer;
import com.salary.equity.convergence.PeerGroups;
import com.salary.equity.core.EquityException;
import com.salary.equity.core.ErrorKind;
import com.salary.equity.core.model.Employee;
import com.salary.equity.core.model.PerformanceRating;
import com.salary.equity.logging.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Greedy, tier-ordered allocation of salary uplifts under per-manager caps.
 *
 * <p>For each manager the highest-priority {@code maxDirectReports} reports form
 * the pool and the rest are staged. The pool's cap is its payroll times
 * {@code budgetConstraintPercent}. Tiers are funded in order URGENT, MONITOR,
 * RECOGNITION; within a tier the largest gap goes first. A tier that starts
 * with the cap already spent is staged. A partial or empty grant inside a tier
 * is a trim. NONE-tier members are accepted with no uplift.</p>
 *
 * <p>If the total across managers exceeds the population payroll times
 * {@code overallBudgetConstraint}, the pass is re-run with every cap scaled
 * down, up to {@value #MAX_PASSES} passes. The result is not guaranteed to be
 * a global optimum.</p>
 */
public class ManagerBudgetAllocator {
    private static final Logger log = LoggerFactory.getLogger(ManagerBudgetAllocator.class);

    public static final int MAX_PASSES = 3;
    private static final double GRANT_EPSILON = 1e-9;

    private static final Comparator<Candidate> PRIORITY_ORDER = Comparator
            .comparing((Candidate c) -> c.tier().ordinal())
            .thenComparing(Comparator.comparingDouble((Candidate c) -> c.gap().gapAmount()).reversed())
            .thenComparing(c -> c.employee().id());

    private final int maxDirectReports;
    private final double budgetConstraintPercent;
    private final double overallBudgetConstraint;
    private final double monitorUpliftPercent;
    private final Set<PerformanceRating> highPerformerRatings;
    private final MedianConvergenceAnalyzer analyzer;
    private final String referenceGender;
    private final String comparisonGender;

    private ManagerBudgetAllocator(Builder builder) {
        if (builder.maxDirectReports <= 0) {
            throw new IllegalArgumentException("maxDirectReports must be positive");
        }
        validateBudget("budgetConstraintPercent", builder.budgetConstraintPercent);
        validateBudget("overallBudgetConstraint", builder.overallBudgetConstraint);
        if (builder.monitorUpliftPercent < 0) {
            throw new IllegalArgumentException("monitorUpliftPercent must not be negative");
        }
        this.maxDirectReports = builder.maxDirectReports;
        this.budgetConstraintPercent = builder.budgetConstraintPercent;
        this.overallBudgetConstraint = builder.overallBudgetConstraint;
        this.monitorUpliftPercent = builder.monitorUpliftPercent;
        this.highPerformerRatings = builder.highPerformerRatings.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(builder.highPerformerRatings));
        this.analyzer = Objects.requireNonNull(builder.analyzer, "analyzer is required");
        this.referenceGender = builder.referenceGender;
        this.comparisonGender = builder.comparisonGender;
    }

    /**
     * Allocates uplifts for every manager's team.
     *
     * @param population valid employees; those without a manager count towards KPIs only
     * @param peerGroups peer groups built from {@code population}
     * @param executor   runs manager pools concurrently
     */
    public AllocationResult allocate(List<Employee> population, PeerGroups peerGroups, Executor executor) {
        Objects.requireNonNull(population, "population is required");
        Objects.requireNonNull(peerGroups, "peerGroups is required");
        Objects.requireNonNull(executor, "executor is required");

        Map<String, List<Candidate>> teams = teams(population, peerGroups);
        double populationPayroll = population.stream().mapToDouble(Employee::salary).sum();
        double overallLimit = populationPayroll * overallBudgetConstraint;

        EquityKpis before = EquityKpis.compute(population, peerGroups, referenceGender, comparisonGender);

        double scale = 1.0;
        double unscaledCapTotal = 0.0;
        List<ManagerAllocation> allocations = List.of();
        double total = 0.0;
        int passes = 0;
        while (passes < MAX_PASSES) {
            passes++;
            allocations = runPass(teams, scale, executor);
            total = allocations.stream().mapToDouble(ManagerAllocation::allocated).sum();
            if (passes == 1) {
                unscaledCapTotal = allocations.stream().mapToDouble(ManagerAllocation::cap).sum();
            }
            if (total <= overallLimit + GRANT_EPSILON || passes == MAX_PASSES) {
                break;
            }
            double nextScale = scale * overallLimit / total;
            if (passes == MAX_PASSES - 1) {
                // last pass: summed caps may not exceed the limit
                nextScale = Math.min(nextScale, overallLimit / unscaledCapTotal);
            }
            log.info("allocation.rescaled pass={} total={} limit={} scale={}", passes, total, overallLimit, nextScale);
            scale = nextScale;
        }
        if (total > overallLimit + GRANT_EPSILON) {
            log.warn("allocation.overBudget passes={} total={} limit={}", passes, total, overallLimit);
        }

        EquityKpis after = kpisAfter(population, allocations);
        PolicySummary summary = PolicySummary.of(allocations, maxDirectReports);

        log.info("allocation.completed managers={} allocated={} limit={} passes={} staged={}",
                allocations.size(), total, overallLimit, passes, summary.stagedCount());
        return new AllocationResult(allocations, before, after, summary, total, overallLimit, passes);
    }

    /**
     * Runs one manager's pass with the cap multiplied by {@code capScale}.
     */
    ManagerAllocation allocateManager(String managerId, List<Candidate> team, double capScale) {
        List<Candidate> ranked = new ArrayList<>(team);
        ranked.sort(PRIORITY_ORDER);

        List<Candidate> pool = ranked.subList(0, Math.min(maxDirectReports, ranked.size()));
        List<Candidate> overflow = ranked.subList(pool.size(), ranked.size());

        List<Recommendation> poolRecommendations = new ArrayList<>(pool.size());
        for (Candidate candidate : pool) {
            poolRecommendations.add(recommendation(managerId, candidate));
        }
        List<Recommendation> overflowRecommendations = new ArrayList<>(overflow.size());
        for (Candidate candidate : overflow) {
            Recommendation recommendation = recommendation(managerId, candidate);
            recommendation.stage();
            overflowRecommendations.add(recommendation);
        }
        if (!overflow.isEmpty()) {
            log.debug("allocation.overflow managerId={} teamSize={} staged={}",
                    managerId, team.size(), overflow.size());
        }

        List<Recommendation> all = new ArrayList<>(team.size());
        double poolPayroll = pool.stream().mapToDouble(c -> c.employee().salary()).sum();
        if (pool.isEmpty() || poolPayroll <= 0) {
            poolRecommendations.forEach(Recommendation::stage);
            all.addAll(poolRecommendations);
            all.addAll(overflowRecommendations);
            log.debug("allocation.noAction managerId={}", managerId);
            return ManagerAllocation.noAction(managerId, team.size(), all);
        }

        ManagerBudget budget = new ManagerBudget(managerId, poolPayroll,
                poolPayroll * budgetConstraintPercent * capScale);

        PriorityTier currentTier = null;
        boolean tierUnreached = false;
        for (Recommendation recommendation : poolRecommendations) {
            if (recommendation.getPriorityTier() != currentTier) {
                currentTier = recommendation.getPriorityTier();
                tierUnreached = budget.isExhausted();
            }
            recommendation.markEvaluated();
            if (currentTier == PriorityTier.NONE) {
                recommendation.accept(0.0);
            } else if (tierUnreached) {
                recommendation.stage();
            } else {
                double requested = recommendation.getRequestedUplift();
                double granted = budget.allocate(requested);
                if (granted >= requested - GRANT_EPSILON) {
                    recommendation.accept(granted);
                } else {
                    recommendation.trim(granted);
                }
            }
            log.trace("allocation.evaluated managerId={} employeeId={} tier={} requested={} proposed={} state={}",
                    managerId, recommendation.getEmployeeId(), recommendation.getPriorityTier(),
                    recommendation.getRequestedUplift(), recommendation.getProposedUplift(),
                    recommendation.getState());
        }

        all.addAll(poolRecommendations);
        all.addAll(overflowRecommendations);
        log.debug("allocation.manager managerId={} pool={} cap={} spent={}",
                managerId, pool.size(), budget.getCap(), budget.getSpent());
        return new ManagerAllocation(managerId, team.size(), pool.size(), poolPayroll,
                budget.getCap(), budget.getSpent(), all, false);
    }

    public boolean isHighPerformer(Employee employee) {
        return highPerformerRatings.contains(employee.performanceRating());
    }

    public int getMaxDirectReports() {
        return maxDirectReports;
    }

    public double getBudgetConstraintPercent() {
        return budgetConstraintPercent;
    }

    public double getOverallBudgetConstraint() {
        return overallBudgetConstraint;
    }

    private List<ManagerAllocation> runPass(Map<String, List<Candidate>> teams, double scale, Executor executor) {
        String runId = LogContext.currentRunId();
        List<CompletableFuture<ManagerAllocation>> futures = new ArrayList<>(teams.size());
        for (Map.Entry<String, List<Candidate>> entry : teams.entrySet()) {
            futures.add(CompletableFuture.supplyAsync(() -> {
                try (LogContext ctx = LogContext.forManager(runId, entry.getKey())) {
                    return allocateManager(entry.getKey(), entry.getValue(), scale);
                }
            }, executor));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<ManagerAllocation> allocations = new ArrayList<>(futures.size());
        for (CompletableFuture<ManagerAllocation> future : futures) {
            allocations.add(future.join());
        }
        return allocations;
    }

    private Map<String, List<Candidate>> teams(List<Employee> population, PeerGroups peerGroups) {
        Map<String, List<Candidate>> teams = new TreeMap<>();
        for (Employee employee : population) {
            if (!employee.hasManager()) {
                continue;
            }
            GapClassification gap = analyzer.classify(employee, peerGroups);
            PriorityTier tier = PriorityTier.classify(gap.belowMedian(), isHighPerformer(employee));
            teams.computeIfAbsent(employee.managerId(), k -> new ArrayList<>())
                    .add(new Candidate(employee, gap, tier));
        }
        return teams;
    }

    private Recommendation recommendation(String managerId, Candidate candidate) {
        Recommendation.Builder builder = Recommendation.builder()
                .employeeId(candidate.employee().id())
                .managerId(managerId)
                .currentSalary(candidate.employee().salary())
                .gapAmount(candidate.gap().gapAmount())
                .priorityTier(candidate.tier())
                .requestedUplift(requestedUplift(candidate));
        if (candidate.gap().belowMedian()) {
            builder.flag(RationaleFlag.BELOW_MEDIAN);
        }
        if (isHighPerformer(candidate.employee())) {
            builder.flag(RationaleFlag.HIGH_PERFORMER);
        }
        return builder.build();
    }

    private double requestedUplift(Candidate candidate) {
        return switch (candidate.tier()) {
            case URGENT, RECOGNITION -> candidate.gap().gapAmount();
            case MONITOR -> candidate.employee().salary() * monitorUpliftPercent;
            case NONE -> 0.0;
        };
    }

    private EquityKpis kpisAfter(List<Employee> population, List<ManagerAllocation> allocations) {
        Map<String, Double> uplifts = new HashMap<>();
        for (ManagerAllocation allocation : allocations) {
            for (Recommendation recommendation : allocation.recommendations()) {
                if (recommendation.isFunded()) {
                    uplifts.merge(recommendation.getEmployeeId(), recommendation.getProposedUplift(), Double::sum);
                }
            }
        }
        List<Employee> updated = new ArrayList<>(population.size());
        for (Employee employee : population) {
            Double uplift = uplifts.get(employee.id());
            updated.add(uplift != null ? employee.withSalary(employee.salary() + uplift) : employee);
        }
        PeerGroups updatedGroups = analyzer.buildPeerGroups(updated);
        return EquityKpis.compute(updated, updatedGroups, referenceGender, comparisonGender);
    }

    private static void validateBudget(String name, double value) {
        if (value <= 0 || value > 1) {
            throw new EquityException(ErrorKind.INVALID_BUDGET, name + " must be in (0, 1], got " + value);
        }
    }

    record Candidate(Employee employee, GapClassification gap, PriorityTier tier) {
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int maxDirectReports = 6;
        private double budgetConstraintPercent = 0.005;
        private double overallBudgetConstraint = 0.005;
        private double monitorUpliftPercent = 0.01;
        private Set<PerformanceRating> highPerformerRatings =
                EnumSet.of(PerformanceRating.HIGH_PERFORMING, PerformanceRating.EXCEEDING);
        private MedianConvergenceAnalyzer analyzer = new MedianConvergenceAnalyzer();
        private String referenceGender = "Male";
        private String comparisonGender = "Female";

        public Builder maxDirectReports(int maxDirectReports) {
            this.maxDirectReports = maxDirectReports;
            return this;
        }

        public Builder budgetConstraintPercent(double budgetConstraintPercent) {
            this.budgetConstraintPercent = budgetConstraintPercent;
            return this;
        }

        public Builder overallBudgetConstraint(double overallBudgetConstraint) {
            this.overallBudgetConstraint = overallBudgetConstraint;
            return this;
        }

        public Builder monitorUpliftPercent(double monitorUpliftPercent) {
            this.monitorUpliftPercent = monitorUpliftPercent;
            return this;
        }

        public Builder highPerformerRatings(Set<PerformanceRating> highPerformerRatings) {
            this.highPerformerRatings = Objects.requireNonNull(highPerformerRatings);
            return this;
        }

        /**
         * Analyzer used to classify gaps and to rebuild peer groups for the after-KPIs.
         */
        public Builder analyzer(MedianConvergenceAnalyzer analyzer) {
            this.analyzer = analyzer;
            return this;
        }

        public Builder referenceGender(String referenceGender) {
            this.referenceGender = referenceGender;
            return this;
        }

        public Builder comparisonGender(String comparisonGender) {
            this.comparisonGender = comparisonGender;
            return this;
        }

        public ManagerBudgetAllocator build() {
            return new ManagerBudgetAllocator(this);
        }
    }
}
