package com.salary.equity.forecast;

import com.salary.equity.core.EquityException;
import com.salary.equity.core.ErrorKind;
import org.apache.commons.math3.distribution.NormalDistribution;

/**
 * Closed-form growth primitives used by the projector and the convergence analyzer.
 *
 * <p>Formulas:</p>
 * <pre>
 * cagr     = (end / start)^(1 / years) - 1
 * project  = initial * (1 + rate)^years
 * interval = base * (1 -/+ z(confidence) * spread)
 * </pre>
 *
 * <p>All methods are side-effect free and safe to share between threads.</p>
 */
public final class ForecastMath {

    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(null, 0.0, 1.0);

    private ForecastMath() {
    }

    /**
     * Compound annual growth rate between two salaries.
     *
     * @throws EquityException {@link ErrorKind#INVALID_YEARS} when years &lt;= 0,
     *                         {@link ErrorKind#NON_POSITIVE_SALARY} when either salary is not positive
     */
    public static double cagr(double start, double end, double years) {
        if (years <= 0) {
            throw new EquityException(ErrorKind.INVALID_YEARS, "years must be positive, got " + years);
        }
        if (start <= 0 || end <= 0) {
            throw new EquityException(ErrorKind.NON_POSITIVE_SALARY,
                    "start and end must be positive, got " + start + " and " + end);
        }
        return Math.pow(end / start, 1.0 / years) - 1.0;
    }

    /**
     * Compounds {@code initial} at {@code annualRate} for {@code years} years.
     */
    public static double project(double initial, double annualRate, double years) {
        return initial * Math.pow(1.0 + annualRate, years);
    }

    /**
     * Symmetric interval around {@code base} using the two-sided standard normal quantile.
     *
     * @param base            central estimate
     * @param confidenceLevel two-sided confidence level in (0, 1)
     * @param spread          relative standard deviation, e.g. 0.05
     * @throws EquityException {@link ErrorKind#INVALID_CONFIDENCE} when the level is outside (0, 1)
     */
    public static ConfidenceInterval confidenceInterval(double base, double confidenceLevel, double spread) {
        double z = zScore(confidenceLevel);
        double halfWidth = z * Math.abs(spread);
        double a = base * (1.0 - halfWidth);
        double b = base * (1.0 + halfWidth);
        return new ConfidenceInterval(Math.min(a, b), Math.max(a, b), confidenceLevel);
    }

    /**
     * Two-sided standard normal quantile, e.g. 1.96 for 0.95.
     */
    public static double zScore(double confidenceLevel) {
        if (!(confidenceLevel > 0.0 && confidenceLevel < 1.0)) {
            throw new EquityException(ErrorKind.INVALID_CONFIDENCE,
                    "confidenceLevel must be in (0, 1), got " + confidenceLevel);
        }
        return STANDARD_NORMAL.inverseCumulativeProbability(1.0 - (1.0 - confidenceLevel) / 2.0);
    }

    /**
     * Years needed for {@code current} to reach {@code target} at a constant annual rate.
     * Result may be fractional.
     */
    public static double yearsToTarget(double current, double target, double annualRate) {
        if (current <= 0 || target <= 0) {
            throw new EquityException(ErrorKind.NON_POSITIVE_SALARY,
                    "current and target must be positive");
        }
        if (target <= current) {
            throw new IllegalArgumentException("target must exceed current salary");
        }
        if (annualRate <= 0) {
            throw new IllegalArgumentException("annualRate must be positive to reach a higher target");
        }
        return Math.log(target / current) / Math.log(1.0 + annualRate);
    }
}
