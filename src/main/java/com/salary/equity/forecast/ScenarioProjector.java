package com.salary.equity.forecast;

import com.salary.equity.core.EquityException;
import com.salary.equity.core.ErrorKind;
import com.salary.equity.core.model.Employee;
import com.salary.equity.core.model.LevelTier;
import com.salary.equity.core.model.PerformanceRating;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Builds multi-year salary paths for one employee under the conservative,
 * realistic and optimistic scenarios.
 *
 * <p>Each scenario compounds a constant annual rate:</p>
 * <pre>
 * rate = baseline + adjusted(performance) + bandBonus(level)
 * </pre>
 *
 * <p>The projector only reads the employee and the static uplift table, so
 * projections for different employees can run on any thread in any order.</p>
 */
public class ScenarioProjector {
    private static final Logger log = LoggerFactory.getLogger(ScenarioProjector.class);

    private final UpliftTable upliftTable;
    private final ScenarioAdjustments adjustments;
    private final double confidenceLevel;
    private final double confidenceSpread;

    public ScenarioProjector() {
        this(UpliftTable.defaults(), ScenarioAdjustments.defaults(), 0.95, 0.05);
    }

    public ScenarioProjector(UpliftTable upliftTable, ScenarioAdjustments adjustments,
                             double confidenceLevel, double confidenceSpread) {
        this.upliftTable = Objects.requireNonNull(upliftTable, "upliftTable is required");
        this.adjustments = Objects.requireNonNull(adjustments, "adjustments is required");
        // rejects an out-of-range confidence level
        ForecastMath.zScore(confidenceLevel);
        if (confidenceSpread < 0) {
            throw new IllegalArgumentException("confidenceSpread must be non-negative");
        }
        this.confidenceLevel = confidenceLevel;
        this.confidenceSpread = confidenceSpread;
    }

    /**
     * Projects one employee over {@code years} years under every scenario.
     *
     * @throws EquityException {@link ErrorKind#INVALID_YEARS} when years &lt;= 0
     */
    public EmployeeProjection project(Employee employee, int years) {
        if (years <= 0) {
            throw new EquityException(ErrorKind.INVALID_YEARS, employee.id(),
                    "Projection horizon must be positive, got " + years);
        }
        if (employee.salary() <= 0) {
            throw new EquityException(ErrorKind.NON_POSITIVE_SALARY, employee.id(),
                    "Salary must be positive, got " + employee.salary());
        }

        Map<Scenario, ScenarioProjection> scenarios = new EnumMap<>(Scenario.class);
        for (Scenario scenario : Scenario.values()) {
            double rate = annualRate(employee, scenario);
            scenarios.put(scenario, buildPath(employee.salary(), rate, years, scenario));
        }

        double realisticFinal = scenarios.get(Scenario.REALISTIC).finalSalary();
        ConfidenceInterval interval = ForecastMath.confidenceInterval(
                realisticFinal, confidenceLevel, confidenceSpread);

        log.trace("projection employeeId={} years={} conservative={} realistic={} optimistic={}",
                employee.id(), years,
                scenarios.get(Scenario.CONSERVATIVE).finalSalary(),
                realisticFinal,
                scenarios.get(Scenario.OPTIMISTIC).finalSalary());

        return new EmployeeProjection(employee.id(), employee.salary(), years, scenarios, interval);
    }

    /**
     * Projects a whole population, fanning out one task per employee.
     * Results are returned in input order.
     */
    public List<EmployeeProjection> projectAll(List<Employee> population, int years, Executor executor) {
        List<CompletableFuture<EmployeeProjection>> futures = population.stream()
                .map(employee -> CompletableFuture.supplyAsync(() -> project(employee, years), executor))
                .toList();

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<EmployeeProjection> projections = new ArrayList<>(futures.size());
        for (CompletableFuture<EmployeeProjection> future : futures) {
            projections.add(future.join());
        }
        log.debug("projection.batch size={} years={}", projections.size(), years);
        return projections;
    }

    /**
     * Annual uplift rate for the employee under one scenario.
     */
    public double annualRate(Employee employee, Scenario scenario) {
        PerformanceRating rating = employee.performanceRating();
        UpliftRates rates = upliftTable.ratesFor(rating);
        LevelTier tier = LevelTier.forLevel(employee.level());

        double performance = switch (scenario) {
            case CONSERVATIVE -> Math.max(0.0, rates.performance() - adjustments.conservativeMargin());
            case REALISTIC -> rates.performance();
            case OPTIMISTIC -> {
                double nextPerformance = upliftTable.ratesFor(rating.next()).performance();
                double improvement = Math.max(0.0, nextPerformance - rates.performance());
                yield rates.performance() + adjustments.optimisticImprovementProbability() * improvement;
            }
        };
        return rates.baseline() + performance + rates.tierBonus(tier);
    }

    private ScenarioProjection buildPath(double salary, double rate, int years, Scenario scenario) {
        List<Double> path = new ArrayList<>(years + 1);
        for (int year = 0; year <= years; year++) {
            path.add(ForecastMath.project(salary, rate, year));
        }
        double finalSalary = path.get(years);
        double cagr = ForecastMath.cagr(salary, finalSalary, years);
        return new ScenarioProjection(scenario, rate, path, finalSalary, cagr, finalSalary - salary);
    }

    public UpliftTable getUpliftTable() {
        return upliftTable;
    }

    public ScenarioAdjustments getAdjustments() {
        return adjustments;
    }
}
