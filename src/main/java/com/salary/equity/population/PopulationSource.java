package com.salary.equity.population;

import com.salary.equity.core.model.Employee;

import java.util.List;
import java.util.Objects;

/**
 * Supplies the employee population for one analysis run.
 */
@FunctionalInterface
public interface PopulationSource {

    PopulationLoadResult load();

    /**
     * A source over an in-memory list.
     */
    static PopulationSource of(List<Employee> employees) {
        Objects.requireNonNull(employees, "employees is required");
        return () -> PopulationLoadResult.of(employees);
    }
}
