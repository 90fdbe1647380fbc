package com.salary.equity.forecast;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * All scenario projections for one employee.
 */
public record EmployeeProjection(
        String employeeId,
        double currentSalary,
        int years,
        Map<Scenario, ScenarioProjection> scenarios,
        ConfidenceInterval realisticFinalInterval
) {
    public EmployeeProjection {
        Objects.requireNonNull(employeeId, "employeeId is required");
        EnumMap<Scenario, ScenarioProjection> copy = new EnumMap<>(Scenario.class);
        if (scenarios != null) {
            copy.putAll(scenarios);
        }
        scenarios = Collections.unmodifiableMap(copy);
    }

    public ScenarioProjection scenario(Scenario scenario) {
        ScenarioProjection projection = scenarios.get(scenario);
        if (projection == null) {
            throw new IllegalArgumentException("No projection for scenario " + scenario.getLabel());
        }
        return projection;
    }

    public ScenarioProjection realistic() {
        return scenario(Scenario.REALISTIC);
    }

    /**
     * Annual growth rate of the realistic scenario, used for convergence math.
     */
    public double realisticRate() {
        return realistic().annualRate();
    }

    /**
     * Annual growth rate of the optimistic scenario, used for accelerated convergence.
     */
    public double optimisticRate() {
        return scenario(Scenario.OPTIMISTIC).annualRate();
    }
}
