package com.salary.equity.population;

import com.salary.equity.core.EquityException;
import com.salary.equity.core.ErrorKind;
import com.salary.equity.core.RecordError;
import com.salary.equity.core.model.Employee;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks employee records before they enter a run: non-blank id, positive salary,
 * level within bounds, rating present, non-negative tenure, unique id.
 * Invalid records are reported and left out; they never abort the batch.
 */
public class EmployeeValidator {
    private static final Logger log = LoggerFactory.getLogger(EmployeeValidator.class);

    private final int minLevel;
    private final int maxLevel;

    public EmployeeValidator() {
        this(1, 6);
    }

    public EmployeeValidator(int minLevel, int maxLevel) {
        if (minLevel < 1 || maxLevel < minLevel) {
            throw new IllegalArgumentException("Invalid level bounds [" + minLevel + ", " + maxLevel + "]");
        }
        this.minLevel = minLevel;
        this.maxLevel = maxLevel;
    }

    /**
     * Validates one record.
     *
     * @throws EquityException describing the first violated rule
     */
    public void validate(Employee employee) {
        String id = employee.id();
        if (id.isBlank()) {
            throw new EquityException(ErrorKind.MISSING_FIELD, id, "employee id is blank");
        }
        if (!(employee.salary() > 0) || Double.isInfinite(employee.salary())) {
            throw new EquityException(ErrorKind.NON_POSITIVE_SALARY, id,
                    "salary must be positive, got " + employee.salary());
        }
        if (employee.level() < minLevel || employee.level() > maxLevel) {
            throw new EquityException(ErrorKind.INVALID_LEVEL, id,
                    "level " + employee.level() + " outside [" + minLevel + ", " + maxLevel + "]");
        }
        if (employee.performanceRating() == null) {
            throw new EquityException(ErrorKind.UNKNOWN_PERFORMANCE_RATING, id, "performance rating is missing");
        }
        if (employee.tenureYears() < 0) {
            throw new EquityException(ErrorKind.INVALID_TENURE, id,
                    "tenure must not be negative, got " + employee.tenureYears());
        }
    }

    /**
     * Validates a population, keeping the first record for each id. A null entry
     * is reported as malformed.
     */
    public Validation validateAll(List<Employee> population) {
        List<Employee> valid = new ArrayList<>(population.size());
        List<RecordError> errors = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < population.size(); i++) {
            Employee employee = population.get(i);
            if (employee == null) {
                errors.add(new RecordError(null, ErrorKind.MALFORMED_RECORD, "record " + i + " is null"));
                log.warn("record.rejected index={} kind={} error=null record", i, ErrorKind.MALFORMED_RECORD);
                continue;
            }
            try {
                validate(employee);
                if (!seen.add(employee.id())) {
                    throw new EquityException(ErrorKind.DUPLICATE_ID, employee.id(),
                            "duplicate employee id " + employee.id());
                }
                valid.add(employee);
            } catch (EquityException e) {
                errors.add(e.toRecordError());
                log.warn("record.rejected employeeId={} kind={} error={}", e.getEmployeeId(), e.getKind(), e.getMessage());
            }
        }
        return new Validation(valid, errors);
    }

    public int getMinLevel() {
        return minLevel;
    }

    public int getMaxLevel() {
        return maxLevel;
    }

    /**
     * Valid employees in input order and the rejected records.
     */
    public record Validation(List<Employee> valid, List<RecordError> errors) {
        public Validation {
            valid = List.copyOf(valid);
            errors = List.copyOf(errors);
        }
    }
}
