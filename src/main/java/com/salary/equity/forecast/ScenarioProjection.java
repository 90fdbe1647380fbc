package com.salary.equity.forecast;

import java.util.List;
import java.util.Objects;

/**
 * Year-by-year salary path of one employee under one scenario.
 *
 * @param scenario      the scenario
 * @param annualRate    constant uplift rate applied each year
 * @param salaryPath    salaries for year 0 (current) through the horizon
 * @param finalSalary   salary at the horizon
 * @param cagr          compound annual growth rate over the horizon
 * @param totalIncrease final salary minus current salary
 */
public record ScenarioProjection(
        Scenario scenario,
        double annualRate,
        List<Double> salaryPath,
        double finalSalary,
        double cagr,
        double totalIncrease
) {
    public ScenarioProjection {
        Objects.requireNonNull(scenario, "scenario is required");
        salaryPath = salaryPath != null ? List.copyOf(salaryPath) : List.of();
    }

    public int years() {
        return Math.max(0, salaryPath.size() - 1);
    }

    public double salaryInYear(int year) {
        return salaryPath.get(year);
    }
}
