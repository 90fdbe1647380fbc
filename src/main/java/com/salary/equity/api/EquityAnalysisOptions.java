package com.salary.equity.api;

import com.salary.equity.core.EquityException;
import com.salary.equity.core.ErrorKind;
import com.salary.equity.core.model.PerformanceRating;
import com.salary.equity.forecast.ForecastMath;
import com.salary.equity.forecast.ScenarioAdjustments;
import com.salary.equity.forecast.UpliftTable;
import com.salary.equity.intervention.InterventionStrategySimulator;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Options for an equity analysis run.
 * Configures forecasting rates, convergence thresholds, strategy costing and
 * manager budget policy. Percentages are fractions (0.005 is half a percent).
 * Invalid values are rejected when set, so a built instance is always usable.
 */
public class EquityAnalysisOptions {

    private static final int DEFAULT_MAX_DIRECT_REPORTS = 6;
    private static final double DEFAULT_BUDGET_CONSTRAINT_PERCENT = 0.005;
    private static final double DEFAULT_OVERALL_BUDGET_CONSTRAINT = 0.005;
    private static final double DEFAULT_TARGET_GAP_PERCENT = 0.0;
    private static final int DEFAULT_MAX_YEARS = 5;
    private static final double DEFAULT_CONVERGENCE_THRESHOLD_YEARS = 5.0;
    private static final double DEFAULT_CONFIDENCE_LEVEL = 0.95;
    private static final double DEFAULT_CONFIDENCE_SPREAD = 0.05;
    private static final double DEFAULT_MEDIAN_GROWTH_RATE = 0.025;
    private static final int DEFAULT_PROJECTION_YEARS = 5;
    private static final double DEFAULT_MONITOR_UPLIFT_PERCENT = 0.01;

    private final int maxDirectReports;
    private final double budgetConstraintPercent;
    private final double overallBudgetConstraint;
    private final double targetGapPercent;
    private final int maxYears;
    private final double convergenceThresholdYears;
    private final double confidenceLevel;
    private final double confidenceSpread;
    private final double medianGrowthRate;
    private final int projectionYears;
    private final UpliftTable upliftTable;
    private final ScenarioAdjustments scenarioAdjustments;
    private final Map<Integer, List<Double>> gradualSplits;
    private final double materialityThreshold;
    private final double monitorUpliftPercent;
    private final Set<PerformanceRating> highPerformerRatings;
    private final boolean groupByGender;
    private final int minLevel;
    private final int maxLevel;
    private final String referenceGender;
    private final String comparisonGender;
    private final int parallelism;

    private EquityAnalysisOptions(Builder builder) {
        this.maxDirectReports = builder.maxDirectReports;
        this.budgetConstraintPercent = builder.budgetConstraintPercent;
        this.overallBudgetConstraint = builder.overallBudgetConstraint;
        this.targetGapPercent = builder.targetGapPercent;
        this.maxYears = builder.maxYears;
        this.convergenceThresholdYears = builder.convergenceThresholdYears;
        this.confidenceLevel = builder.confidenceLevel;
        this.confidenceSpread = builder.confidenceSpread;
        this.medianGrowthRate = builder.medianGrowthRate;
        this.projectionYears = builder.projectionYears;
        this.upliftTable = builder.upliftTable;
        this.scenarioAdjustments = builder.scenarioAdjustments;
        this.gradualSplits = builder.gradualSplits;
        this.materialityThreshold = builder.materialityThreshold;
        this.monitorUpliftPercent = builder.monitorUpliftPercent;
        this.highPerformerRatings = Collections.unmodifiableSet(EnumSet.copyOf(builder.highPerformerRatings));
        this.groupByGender = builder.groupByGender;
        this.minLevel = builder.minLevel;
        this.maxLevel = builder.maxLevel;
        this.referenceGender = builder.referenceGender;
        this.comparisonGender = builder.comparisonGender;
        this.parallelism = builder.parallelism;
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

    public double getTargetGapPercent() {
        return targetGapPercent;
    }

    public int getMaxYears() {
        return maxYears;
    }

    public double getConvergenceThresholdYears() {
        return convergenceThresholdYears;
    }

    public double getConfidenceLevel() {
        return confidenceLevel;
    }

    public double getConfidenceSpread() {
        return confidenceSpread;
    }

    public double getMedianGrowthRate() {
        return medianGrowthRate;
    }

    public int getProjectionYears() {
        return projectionYears;
    }

    public UpliftTable getUpliftTable() {
        return upliftTable;
    }

    public ScenarioAdjustments getScenarioAdjustments() {
        return scenarioAdjustments;
    }

    public Map<Integer, List<Double>> getGradualSplits() {
        return gradualSplits;
    }

    public double getMaterialityThreshold() {
        return materialityThreshold;
    }

    public double getMonitorUpliftPercent() {
        return monitorUpliftPercent;
    }

    public Set<PerformanceRating> getHighPerformerRatings() {
        return highPerformerRatings;
    }

    public boolean isGroupByGender() {
        return groupByGender;
    }

    public int getMinLevel() {
        return minLevel;
    }

    public int getMaxLevel() {
        return maxLevel;
    }

    public String getReferenceGender() {
        return referenceGender;
    }

    public String getComparisonGender() {
        return comparisonGender;
    }

    public int getParallelism() {
        return parallelism;
    }

    /**
     * Creates default options.
     */
    public static EquityAnalysisOptions defaults() {
        return builder().build();
    }

    /**
     * Gender-specific peer groups, a three-year convergence window and a
     * 99% confidence band.
     */
    public static EquityAnalysisOptions strict() {
        return builder()
                .groupByGender(true)
                .convergenceThresholdYears(3)
                .maxYears(3)
                .confidenceLevel(0.99)
                .materialityThreshold(0.02)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int maxDirectReports = DEFAULT_MAX_DIRECT_REPORTS;
        private double budgetConstraintPercent = DEFAULT_BUDGET_CONSTRAINT_PERCENT;
        private double overallBudgetConstraint = DEFAULT_OVERALL_BUDGET_CONSTRAINT;
        private double targetGapPercent = DEFAULT_TARGET_GAP_PERCENT;
        private int maxYears = DEFAULT_MAX_YEARS;
        private double convergenceThresholdYears = DEFAULT_CONVERGENCE_THRESHOLD_YEARS;
        private double confidenceLevel = DEFAULT_CONFIDENCE_LEVEL;
        private double confidenceSpread = DEFAULT_CONFIDENCE_SPREAD;
        private double medianGrowthRate = DEFAULT_MEDIAN_GROWTH_RATE;
        private int projectionYears = DEFAULT_PROJECTION_YEARS;
        private UpliftTable upliftTable = UpliftTable.defaults();
        private ScenarioAdjustments scenarioAdjustments = ScenarioAdjustments.defaults();
        private Map<Integer, List<Double>> gradualSplits = InterventionStrategySimulator.defaultGradualSplits();
        private double materialityThreshold = InterventionStrategySimulator.DEFAULT_MATERIALITY_THRESHOLD;
        private double monitorUpliftPercent = DEFAULT_MONITOR_UPLIFT_PERCENT;
        private Set<PerformanceRating> highPerformerRatings =
                EnumSet.of(PerformanceRating.HIGH_PERFORMING, PerformanceRating.EXCEEDING);
        private boolean groupByGender = false;
        private int minLevel = 1;
        private int maxLevel = 6;
        private String referenceGender = "Male";
        private String comparisonGender = "Female";
        private int parallelism = Math.max(1, Runtime.getRuntime().availableProcessors());

        public Builder maxDirectReports(int maxDirectReports) {
            if (maxDirectReports <= 0) {
                throw new IllegalArgumentException("maxDirectReports must be positive");
            }
            this.maxDirectReports = maxDirectReports;
            return this;
        }

        public Builder budgetConstraintPercent(double budgetConstraintPercent) {
            validateBudget(budgetConstraintPercent, "budgetConstraintPercent");
            this.budgetConstraintPercent = budgetConstraintPercent;
            return this;
        }

        public Builder overallBudgetConstraint(double overallBudgetConstraint) {
            validateBudget(overallBudgetConstraint, "overallBudgetConstraint");
            this.overallBudgetConstraint = overallBudgetConstraint;
            return this;
        }

        public Builder targetGapPercent(double targetGapPercent) {
            if (targetGapPercent < 0.0 || targetGapPercent >= 1.0) {
                throw new IllegalArgumentException("targetGapPercent must be in [0.0, 1.0)");
            }
            this.targetGapPercent = targetGapPercent;
            return this;
        }

        public Builder maxYears(int maxYears) {
            validateYears(maxYears, "maxYears");
            this.maxYears = maxYears;
            return this;
        }

        public Builder convergenceThresholdYears(double convergenceThresholdYears) {
            if (convergenceThresholdYears <= 0) {
                throw new IllegalArgumentException("convergenceThresholdYears must be positive");
            }
            this.convergenceThresholdYears = convergenceThresholdYears;
            return this;
        }

        public Builder confidenceLevel(double confidenceLevel) {
            ForecastMath.zScore(confidenceLevel);
            this.confidenceLevel = confidenceLevel;
            return this;
        }

        public Builder confidenceSpread(double confidenceSpread) {
            if (confidenceSpread < 0) {
                throw new IllegalArgumentException("confidenceSpread must not be negative");
            }
            this.confidenceSpread = confidenceSpread;
            return this;
        }

        public Builder medianGrowthRate(double medianGrowthRate) {
            if (medianGrowthRate <= -1.0) {
                throw new IllegalArgumentException("medianGrowthRate must be greater than -1.0");
            }
            this.medianGrowthRate = medianGrowthRate;
            return this;
        }

        public Builder projectionYears(int projectionYears) {
            validateYears(projectionYears, "projectionYears");
            this.projectionYears = projectionYears;
            return this;
        }

        public Builder upliftTable(UpliftTable upliftTable) {
            this.upliftTable = Objects.requireNonNull(upliftTable, "upliftTable is required");
            return this;
        }

        public Builder scenarioAdjustments(ScenarioAdjustments scenarioAdjustments) {
            this.scenarioAdjustments = Objects.requireNonNull(scenarioAdjustments, "scenarioAdjustments is required");
            return this;
        }

        /**
         * Horizon in years to the head-count fraction remediated each year.
         * Each list must have one weight per year and sum to 1.
         */
        public Builder gradualSplits(Map<Integer, List<Double>> gradualSplits) {
            this.gradualSplits = Objects.requireNonNull(gradualSplits, "gradualSplits is required");
            return this;
        }

        public Builder materialityThreshold(double materialityThreshold) {
            if (materialityThreshold < 0.0 || materialityThreshold >= 1.0) {
                throw new IllegalArgumentException("materialityThreshold must be in [0.0, 1.0)");
            }
            this.materialityThreshold = materialityThreshold;
            return this;
        }

        public Builder monitorUpliftPercent(double monitorUpliftPercent) {
            if (monitorUpliftPercent < 0.0 || monitorUpliftPercent > 1.0) {
                throw new IllegalArgumentException("monitorUpliftPercent must be between 0.0 and 1.0");
            }
            this.monitorUpliftPercent = monitorUpliftPercent;
            return this;
        }

        public Builder highPerformerRatings(Set<PerformanceRating> highPerformerRatings) {
            if (highPerformerRatings == null || highPerformerRatings.isEmpty()) {
                throw new IllegalArgumentException("highPerformerRatings must not be empty");
            }
            this.highPerformerRatings = EnumSet.copyOf(highPerformerRatings);
            return this;
        }

        public Builder groupByGender(boolean groupByGender) {
            this.groupByGender = groupByGender;
            return this;
        }

        public Builder levelRange(int minLevel, int maxLevel) {
            if (minLevel < 1 || maxLevel < minLevel) {
                throw new IllegalArgumentException("Invalid level range [" + minLevel + ", " + maxLevel + "]");
            }
            this.minLevel = minLevel;
            this.maxLevel = maxLevel;
            return this;
        }

        public Builder referenceGender(String referenceGender) {
            this.referenceGender = Objects.requireNonNull(referenceGender, "referenceGender is required");
            return this;
        }

        public Builder comparisonGender(String comparisonGender) {
            this.comparisonGender = Objects.requireNonNull(comparisonGender, "comparisonGender is required");
            return this;
        }

        public Builder parallelism(int parallelism) {
            if (parallelism <= 0) {
                throw new IllegalArgumentException("parallelism must be positive");
            }
            this.parallelism = parallelism;
            return this;
        }

        public EquityAnalysisOptions build() {
            if (referenceGender.equals(comparisonGender)) {
                throw new IllegalArgumentException("referenceGender and comparisonGender must differ");
            }
            // rejects malformed splits and keeps an immutable copy
            gradualSplits = new InterventionStrategySimulator(gradualSplits, materialityThreshold).getGradualSplits();
            return new EquityAnalysisOptions(this);
        }

        private static void validateBudget(double value, String name) {
            if (value <= 0.0 || value > 1.0) {
                throw new EquityException(ErrorKind.INVALID_BUDGET,
                        name + " must be in (0.0, 1.0], got " + value);
            }
        }

        private static void validateYears(int value, String name) {
            if (value <= 0) {
                throw new EquityException(ErrorKind.INVALID_YEARS, name + " must be positive, got " + value);
            }
        }
    }
}
