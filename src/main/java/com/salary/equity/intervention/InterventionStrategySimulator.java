package com.salary.equity.intervention;

import com.salary.equity.core.EquityException;
import com.salary.equity.core.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Costs the remediation strategies over a set of below-median gaps and picks one.
 *
 * <p>Strategies are evaluated in declaration order: immediate, one gradual
 * strategy per configured horizon (ascending), targeted. Selection prefers the
 * cheapest strategy that meets the residual gap target within budget; costs
 * within {@link #COST_TIE_TOLERANCE} of the lowest are ties, broken by fewer
 * years used and then by declaration order. When nothing is feasible the cheapest strategy is
 * returned and the comparison is flagged infeasible.</p>
 */
public class InterventionStrategySimulator {
    private static final Logger log = LoggerFactory.getLogger(InterventionStrategySimulator.class);

    public static final double COST_TIE_TOLERANCE = 0.005;
    public static final double DEFAULT_MATERIALITY_THRESHOLD = 0.05;

    private static final Comparator<EligibleGap> LARGEST_GAP_FIRST = Comparator
            .comparingDouble(EligibleGap::gapAmount).reversed()
            .thenComparing(EligibleGap::employeeId);

    private static final Comparator<StrategyResult> TIE_BREAK = Comparator
            .comparingInt(StrategyResult::yearsUsed)
            .thenComparing((StrategyResult r) -> r.strategy().kind())
            .thenComparingInt(r -> r.strategy().years());

    private final Map<Integer, List<Double>> gradualSplits;
    private final double materialityThreshold;

    public InterventionStrategySimulator() {
        this(defaultGradualSplits(), DEFAULT_MATERIALITY_THRESHOLD);
    }

    /**
     * @param gradualSplits        horizon in years to the fraction of eligible head count
     *                             remediated in each year
     * @param materialityThreshold gap percent a gap must exceed to be targeted
     */
    public InterventionStrategySimulator(Map<Integer, List<Double>> gradualSplits, double materialityThreshold) {
        this.gradualSplits = validateSplits(gradualSplits);
        if (materialityThreshold < 0 || materialityThreshold >= 1) {
            throw new IllegalArgumentException("materialityThreshold must be in [0, 1), got " + materialityThreshold);
        }
        this.materialityThreshold = materialityThreshold;
    }

    /**
     * Front-loaded head-count splits: three years 60/30/10, five years 40/25/15/10/10.
     */
    public static Map<Integer, List<Double>> defaultGradualSplits() {
        Map<Integer, List<Double>> splits = new TreeMap<>();
        splits.put(3, List.of(0.6, 0.3, 0.1));
        splits.put(5, List.of(0.4, 0.25, 0.15, 0.1, 0.1));
        return Collections.unmodifiableMap(splits);
    }

    /**
     * Strategies in declaration order.
     */
    public List<Strategy> strategies() {
        List<Strategy> strategies = new ArrayList<>();
        strategies.add(Strategy.immediate());
        for (Integer horizon : gradualSplits.keySet()) {
            strategies.add(Strategy.gradual(horizon));
        }
        strategies.add(Strategy.targeted());
        return strategies;
    }

    /**
     * Evaluates every strategy and selects one.
     *
     * @param eligible         below-median gaps
     * @param totalPayroll     payroll of the whole analysed population
     * @param targetGapPercent residual gap the strategy must reach
     * @param maxYears         horizon within which remediation counts
     * @param budgetConstraint maximum cost as a fraction of payroll
     * @throws EquityException INVALID_BUDGET, INVALID_YEARS or NON_POSITIVE_SALARY for bad inputs
     */
    public StrategyComparison compare(List<EligibleGap> eligible, double totalPayroll,
                                      double targetGapPercent, int maxYears, double budgetConstraint) {
        validate(totalPayroll, maxYears, budgetConstraint);

        List<StrategyResult> results = new ArrayList<>();
        for (Strategy strategy : strategies()) {
            results.add(simulate(strategy, eligible, totalPayroll, targetGapPercent, maxYears, budgetConstraint));
        }

        StrategyResult selected = cheapest(results.stream().filter(StrategyResult::isFeasible).toList());
        boolean infeasible = selected == null;
        if (infeasible) {
            selected = cheapest(results);
            log.warn("strategy.infeasible fallback={} cost={} target={} budget={}",
                    selected.name(), selected.totalCost(), targetGapPercent, budgetConstraint);
        }

        double totalGap = eligible.stream().mapToDouble(EligibleGap::gapAmount).sum();
        log.info("strategy.selected name={} cost={} percentOfPayroll={} eligible={} infeasible={}",
                selected.name(), selected.totalCost(), selected.percentOfPayroll(), eligible.size(), infeasible);
        return new StrategyComparison(results, selected, infeasible, totalPayroll, totalGap, eligible.size());
    }

    /**
     * Costs a single strategy.
     */
    public StrategyResult simulate(Strategy strategy, List<EligibleGap> eligible, double totalPayroll,
                                   double targetGapPercent, int maxYears, double budgetConstraint) {
        validate(totalPayroll, maxYears, budgetConstraint);

        List<List<EligibleGap>> cohorts = cohorts(strategy, eligible);

        List<YearCost> breakdown = new ArrayList<>(cohorts.size());
        double totalCost = 0.0;
        double remediatedWithinHorizon = 0.0;
        int affected = 0;
        int yearsUsed = 0;
        for (int i = 0; i < cohorts.size(); i++) {
            int year = i + 1;
            List<EligibleGap> cohort = cohorts.get(i);
            double cost = cohort.stream().mapToDouble(EligibleGap::gapAmount).sum();
            breakdown.add(new YearCost(year, cost, cohort.size()));
            totalCost += cost;
            affected += cohort.size();
            if (!cohort.isEmpty()) {
                yearsUsed = year;
            }
            if (year <= maxYears) {
                remediatedWithinHorizon += cost;
            }
        }

        double totalGap = eligible.stream().mapToDouble(EligibleGap::gapAmount).sum();
        double medianBase = eligible.stream().mapToDouble(EligibleGap::peerMedian).sum();
        double residualGap = Math.max(0.0, totalGap - remediatedWithinHorizon);
        double residualGapPercent = medianBase > 0 ? residualGap / medianBase : 0.0;

        boolean remediatesSomething = eligible.isEmpty() || remediatedWithinHorizon > 0;
        boolean meetsTarget = residualGapPercent <= targetGapPercent && remediatesSomething;
        double percentOfPayroll = totalCost / totalPayroll;
        boolean withinBudget = percentOfPayroll <= budgetConstraint;

        log.debug("strategy.simulated name={} cost={} years={} residual={} meetsTarget={} withinBudget={}",
                strategy.name(), totalCost, yearsUsed, residualGapPercent, meetsTarget, withinBudget);

        return new StrategyResult(strategy, totalCost, affected, breakdown, percentOfPayroll,
                residualGapPercent, yearsUsed, meetsTarget, withinBudget);
    }

    /**
     * Splits {@code count} employees into head counts per year using largest-remainder
     * rounding; earlier years win remainder ties.
     */
    static int[] headCounts(int count, List<Double> weights) {
        double weightSum = weights.stream().mapToDouble(Double::doubleValue).sum();
        int[] counts = new int[weights.size()];
        double[] remainders = new double[weights.size()];
        int assigned = 0;
        for (int i = 0; i < weights.size(); i++) {
            double quota = count * weights.get(i) / weightSum;
            counts[i] = (int) Math.floor(quota);
            remainders[i] = quota - counts[i];
            assigned += counts[i];
        }
        int left = count - assigned;
        while (left > 0) {
            int best = 0;
            for (int i = 1; i < remainders.length; i++) {
                if (remainders[i] > remainders[best]) {
                    best = i;
                }
            }
            counts[best]++;
            remainders[best] = -1.0;
            left--;
        }
        return counts;
    }

    public Map<Integer, List<Double>> getGradualSplits() {
        return gradualSplits;
    }

    public double getMaterialityThreshold() {
        return materialityThreshold;
    }

    private List<List<EligibleGap>> cohorts(Strategy strategy, List<EligibleGap> eligible) {
        return switch (strategy.kind()) {
            case IMMEDIATE -> List.of(List.copyOf(eligible));
            case TARGETED -> List.of(eligible.stream()
                    .filter(gap -> gap.gapPercent() > materialityThreshold)
                    .toList());
            case GRADUAL -> gradualCohorts(strategy.years(), eligible);
        };
    }

    List<List<EligibleGap>> gradualCohorts(int years, List<EligibleGap> eligible) {
        List<Double> weights = gradualSplits.get(years);
        if (weights == null) {
            throw new IllegalArgumentException("No gradual split configured for " + years + " years");
        }
        List<EligibleGap> sorted = new ArrayList<>(eligible);
        sorted.sort(LARGEST_GAP_FIRST);

        int[] counts = headCounts(sorted.size(), weights);
        List<List<EligibleGap>> cohorts = new ArrayList<>(years);
        int from = 0;
        for (int count : counts) {
            cohorts.add(List.copyOf(sorted.subList(from, from + count)));
            from += count;
        }
        return cohorts;
    }

    /**
     * Cheapest candidate. Every candidate within {@link #COST_TIE_TOLERANCE} of the
     * lowest cost ties; ties go to fewer years used, then declaration order.
     * Returns null when there are no candidates.
     */
    static StrategyResult cheapest(List<StrategyResult> candidates) {
        if (candidates.isEmpty()) {
            return null;
        }
        double floor = candidates.stream().mapToDouble(StrategyResult::totalCost).min().getAsDouble();
        return candidates.stream()
                .filter(candidate -> candidate.totalCost() - floor <= COST_TIE_TOLERANCE)
                .min(TIE_BREAK)
                .orElseThrow();
    }

    private static void validate(double totalPayroll, int maxYears, double budgetConstraint) {
        if (budgetConstraint <= 0) {
            throw new EquityException(ErrorKind.INVALID_BUDGET,
                    "budgetConstraint must be positive, got " + budgetConstraint);
        }
        if (maxYears <= 0) {
            throw new EquityException(ErrorKind.INVALID_YEARS, "maxYears must be positive, got " + maxYears);
        }
        if (totalPayroll <= 0) {
            throw new EquityException(ErrorKind.NON_POSITIVE_SALARY,
                    "totalPayroll must be positive, got " + totalPayroll);
        }
    }

    private static Map<Integer, List<Double>> validateSplits(Map<Integer, List<Double>> splits) {
        if (splits == null) {
            throw new IllegalArgumentException("gradualSplits is required");
        }
        Map<Integer, List<Double>> copy = new TreeMap<>();
        for (Map.Entry<Integer, List<Double>> entry : splits.entrySet()) {
            int horizon = entry.getKey();
            List<Double> weights = entry.getValue();
            if (horizon < 2) {
                throw new IllegalArgumentException("Gradual horizon must be at least 2 years, got " + horizon);
            }
            if (weights == null || weights.size() != horizon) {
                throw new IllegalArgumentException("Gradual split for " + horizon
                        + " years needs exactly " + horizon + " weights");
            }
            double sum = 0.0;
            for (Double weight : weights) {
                if (weight == null || weight < 0) {
                    throw new IllegalArgumentException("Gradual split weights must be non-negative");
                }
                sum += weight;
            }
            if (Math.abs(sum - 1.0) > 1e-6) {
                throw new IllegalArgumentException("Gradual split for " + horizon
                        + " years must sum to 1.0, got " + sum);
            }
            copy.put(horizon, List.copyOf(weights));
        }
        return Collections.unmodifiableMap(copy);
    }
}
