package com.salary.equity.convergence;

import com.salary.equity.core.EquityException;
import com.salary.equity.core.ErrorKind;
import com.salary.equity.core.model.Employee;
import com.salary.equity.core.model.PeerGroup;
import com.salary.equity.core.model.PeerGroupKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.ToDoubleFunction;

/**
 * Computes peer-group medians, classifies employees against them and works out
 * when a below-median employee would catch up under natural growth.
 *
 * <p>Employee salary and peer median both compound:</p>
 * <pre>
 * S(t) = S0 * (1 + re)^t
 * M(t) = M0 * (1 + rm)^t
 * t*   = ln(M0 / S0) / ln((1 + re) / (1 + rm))
 * </pre>
 *
 * <p>When {@code re <= rm} the curves never cross and the employee is divergent.
 * Divergent employees, and those whose {@code t*} exceeds the convergence
 * threshold, require intervention.</p>
 */
public class MedianConvergenceAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(MedianConvergenceAnalyzer.class);

    static final String UNKNOWN_GENDER = "Unknown";

    private static final Comparator<Employee> SALARY_ORDER = Comparator
            .comparingDouble(Employee::salary)
            .thenComparing(Employee::id);

    private final double convergenceThresholdYears;
    private final boolean groupByGender;
    private final String referenceGender;
    private final String comparisonGender;

    public MedianConvergenceAnalyzer() {
        this(5, false, "Male", "Female");
    }

    public MedianConvergenceAnalyzer(double convergenceThresholdYears, boolean groupByGender,
                                     String referenceGender, String comparisonGender) {
        if (convergenceThresholdYears <= 0) {
            throw new IllegalArgumentException("convergenceThresholdYears must be positive");
        }
        this.convergenceThresholdYears = convergenceThresholdYears;
        this.groupByGender = groupByGender;
        this.referenceGender = referenceGender;
        this.comparisonGender = comparisonGender;
    }

    /**
     * Partitions the population by level (and gender when configured) and computes each median.
     * Members are sorted by salary with the employee id as tie-break, so the result is
     * independent of input order.
     */
    public PeerGroups buildPeerGroups(List<Employee> population) {
        Map<PeerGroupKey, List<Employee>> partitions = new TreeMap<>();
        for (Employee employee : population) {
            partitions.computeIfAbsent(PeerGroupKey.of(employee, groupByGender), k -> new ArrayList<>())
                    .add(employee);
        }

        Map<PeerGroupKey, PeerGroup> groups = new HashMap<>();
        for (Map.Entry<PeerGroupKey, List<Employee>> entry : partitions.entrySet()) {
            List<Employee> members = entry.getValue();
            members.sort(SALARY_ORDER);
            groups.put(entry.getKey(), new PeerGroup(entry.getKey(), median(members), members.size()));
        }

        if (log.isDebugEnabled()) {
            for (Map.Entry<PeerGroupKey, List<Employee>> entry : partitions.entrySet()) {
                log.debug("peerGroup key={} members={} median={}", entry.getKey(),
                        entry.getValue().size(), groups.get(entry.getKey()).medianSalary());
            }
        }
        return new PeerGroups(groups, groupByGender);
    }

    /**
     * Classifies one employee against their peer-group median.
     *
     * @throws EquityException {@link ErrorKind#INSUFFICIENT_POPULATION} if the peer group is empty
     */
    public GapClassification classify(Employee employee, PeerGroups peerGroups) {
        PeerGroup group = peerGroups.groupFor(employee);
        return GapClassification.of(employee.id(), group.key(), employee.salary(), group.medianSalary());
    }

    /**
     * Solves for the year the employee's salary meets the drifting peer median.
     * The accelerated path is taken to grow at the natural rate.
     *
     * @param employeeGrowthRate annual growth of the employee's salary
     * @param medianGrowthRate   annual drift of the peer median
     */
    public ConvergenceRecord analyzeConvergence(Employee employee, PeerGroups peerGroups,
                                                double employeeGrowthRate, double medianGrowthRate) {
        return analyzeConvergence(employee, peerGroups, employeeGrowthRate, employeeGrowthRate, medianGrowthRate);
    }

    /**
     * Solves for the year the employee's salary meets the drifting peer median
     * under natural and accelerated growth.
     *
     * @param employeeGrowthRate    annual growth of the employee's salary, typically the realistic rate
     * @param acceleratedGrowthRate annual growth on the optimistic path
     * @param medianGrowthRate      annual drift of the peer median
     */
    public ConvergenceRecord analyzeConvergence(Employee employee, PeerGroups peerGroups, double employeeGrowthRate,
                                                double acceleratedGrowthRate, double medianGrowthRate) {
        GapClassification gap = classify(employee, peerGroups);
        return analyzeConvergence(gap, employeeGrowthRate, acceleratedGrowthRate, medianGrowthRate);
    }

    ConvergenceRecord analyzeConvergence(GapClassification gap, double employeeGrowthRate,
                                         double acceleratedGrowthRate, double medianGrowthRate) {
        if (employeeGrowthRate <= -1.0 || acceleratedGrowthRate <= -1.0 || medianGrowthRate <= -1.0) {
            throw new IllegalArgumentException("Growth rates must be greater than -100%");
        }
        if (!gap.belowMedian()) {
            return new ConvergenceRecord(gap.employeeId(), gap.salary(), gap.peerMedian(), 0.0, 0.0,
                    employeeGrowthRate, medianGrowthRate, OptionalDouble.of(0.0),
                    acceleratedGrowthRate, OptionalDouble.of(0.0), 0, false,
                    RecommendedAction.MONITOR_NATURAL_PROGRESSION);
        }

        OptionalDouble naturalYears = yearsToMedian(gap, employeeGrowthRate, medianGrowthRate);
        OptionalDouble acceleratedYears = yearsToMedian(gap, acceleratedGrowthRate, medianGrowthRate);
        boolean interventionRequired = naturalYears.isEmpty()
                || naturalYears.getAsDouble() > convergenceThresholdYears;
        RecommendedAction action = RecommendedAction.of(gap.gapPercent(), naturalYears);

        log.trace("convergence employeeId={} gap={} re={} ra={} rm={} years={} intervention={} action={}",
                gap.employeeId(), gap.gapAmount(), employeeGrowthRate, acceleratedGrowthRate, medianGrowthRate,
                naturalYears.isPresent() ? naturalYears.getAsDouble() : "divergent", interventionRequired,
                action.getLabel());

        return new ConvergenceRecord(gap.employeeId(), gap.salary(), gap.peerMedian(),
                gap.gapAmount(), gap.gapPercent(), employeeGrowthRate, medianGrowthRate,
                naturalYears, acceleratedGrowthRate, acceleratedYears, 0, interventionRequired, action);
    }

    /**
     * Closed-form crossing time; empty when the salary grows no faster than the median.
     */
    private static OptionalDouble yearsToMedian(GapClassification gap, double growthRate, double medianGrowthRate) {
        if (growthRate <= medianGrowthRate) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(Math.log(gap.peerMedian() / gap.salary())
                / Math.log((1.0 + growthRate) / (1.0 + medianGrowthRate)));
    }

    /**
     * Classifies the whole population and builds the convergence report.
     * Per-employee work fans out on {@code executor}; the aggregation runs on the
     * calling thread once every task has completed, ordered by employee id.
     *
     * @param growthRate       annual growth rate per employee, typically the realistic scenario rate
     * @param medianGrowthRate annual drift of every peer median
     */
    public ConvergenceReport analyze(List<Employee> population, PeerGroups peerGroups,
                                     ToDoubleFunction<Employee> growthRate, double medianGrowthRate,
                                     Executor executor) {
        return analyze(population, peerGroups, growthRate, growthRate, medianGrowthRate, executor);
    }

    /**
     * As {@link #analyze(List, PeerGroups, ToDoubleFunction, double, Executor)} with a
     * separate optimistic growth rate for the accelerated path.
     */
    public ConvergenceReport analyze(List<Employee> population, PeerGroups peerGroups,
                                     ToDoubleFunction<Employee> growthRate,
                                     ToDoubleFunction<Employee> acceleratedGrowthRate,
                                     double medianGrowthRate, Executor executor) {
        List<CompletableFuture<Analysed>> futures = population.stream()
                .map(employee -> CompletableFuture.supplyAsync(() -> {
                    GapClassification gap = classify(employee, peerGroups);
                    ConvergenceRecord record = gap.belowMedian()
                            ? analyzeConvergence(gap, growthRate.applyAsDouble(employee),
                                    acceleratedGrowthRate.applyAsDouble(employee), medianGrowthRate)
                            : null;
                    return new Analysed(employee, gap, record);
                }, executor))
                .toList();

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<Analysed> analysed = new ArrayList<>(futures.size());
        for (CompletableFuture<Analysed> future : futures) {
            analysed.add(future.join());
        }
        analysed.sort(Comparator.comparing(a -> a.employee().id()));

        List<GapClassification> classifications = new ArrayList<>(analysed.size());
        List<GapClassification> below = new ArrayList<>();
        List<ConvergenceRecord> records = new ArrayList<>();
        Map<String, List<GapClassification>> belowByGender = new TreeMap<>();
        int interventionRequired = 0;
        int divergent = 0;

        for (Analysed a : analysed) {
            classifications.add(a.gap());
            String gender = a.employee().gender() != null ? a.employee().gender() : UNKNOWN_GENDER;
            belowByGender.computeIfAbsent(gender, g -> new ArrayList<>());
            if (a.gap().belowMedian()) {
                below.add(a.gap());
                belowByGender.get(gender).add(a.gap());
                records.add(a.record());
                if (a.record().interventionRequired()) {
                    interventionRequired++;
                }
                if (a.record().isDivergent()) {
                    divergent++;
                }
            }
        }

        int total = analysed.size();
        double belowPercent = total > 0 ? (double) below.size() / total : 0.0;

        ConvergenceReport report = new ConvergenceReport(
                peerGroups,
                classifications,
                records,
                total,
                below.size(),
                belowPercent,
                interventionRequired,
                divergent,
                GapStatistics.of(below),
                GenderGapAnalysis.of(belowByGender, referenceGender, comparisonGender),
                GapDistribution.of(below),
                List.of());

        log.info("convergence.analyzed employees={} belowMedian={} interventionRequired={} divergent={}",
                total, below.size(), interventionRequired, divergent);
        return report;
    }

    public double getConvergenceThresholdYears() {
        return convergenceThresholdYears;
    }

    public boolean isGroupByGender() {
        return groupByGender;
    }

    private static double median(List<Employee> sorted) {
        int n = sorted.size();
        if (n == 0) {
            throw new EquityException(ErrorKind.INSUFFICIENT_POPULATION, "Peer group has no members");
        }
        if (n % 2 == 1) {
            return sorted.get(n / 2).salary();
        }
        return (sorted.get(n / 2 - 1).salary() + sorted.get(n / 2).salary()) / 2.0;
    }

    private record Analysed(Employee employee, GapClassification gap, ConvergenceRecord record) {
    }
}
