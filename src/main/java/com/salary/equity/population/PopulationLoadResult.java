package com.salary.equity.population;

import com.salary.equity.core.ErrorKind;
import com.salary.equity.core.RecordError;
import com.salary.equity.core.model.Employee;

import java.util.List;

/**
 * Employees read from a population source plus the records that could not be read.
 *
 * @param employees    successfully parsed employees, in input order
 * @param errors       per-record failures
 * @param totalRecords number of records in the input
 */
public record PopulationLoadResult(List<Employee> employees, List<LoadError> errors, long totalRecords) {

    public PopulationLoadResult {
        employees = employees != null ? List.copyOf(employees) : List.of();
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public static PopulationLoadResult of(List<Employee> employees) {
        return new PopulationLoadResult(employees, List.of(), employees.size());
    }

    public long errorCount() {
        return errors.size();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public List<RecordError> recordErrors() {
        return errors.stream().map(LoadError::toRecordError).toList();
    }

    /**
     * A record that failed to load.
     *
     * @param index      0-based position in the input, or -1 for document-level failures
     * @param employeeId the id if it could be read, otherwise null
     * @param kind       failure kind
     * @param message    detail
     */
    public record LoadError(long index, String employeeId, ErrorKind kind, String message) {
        public RecordError toRecordError() {
            return new RecordError(employeeId, kind, message);
        }
    }

    @Override
    public String toString() {
        return "PopulationLoadResult{total=" + totalRecords +
                ", loaded=" + employees.size() +
                ", errors=" + errors.size() + '}';
    }
}
