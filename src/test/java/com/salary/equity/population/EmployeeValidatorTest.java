package com.salary.equity.population;

import com.salary.equity.core.EquityException;
import com.salary.equity.core.ErrorKind;
import com.salary.equity.core.RecordError;
import com.salary.equity.core.model.Employee;
import com.salary.equity.core.model.PerformanceRating;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EmployeeValidatorTest {

    private final EmployeeValidator validator = new EmployeeValidator();

    private static Employee.Builder valid(String id) {
        return Employee.builder()
                .id(id)
                .level(2)
                .salary(55_000)
                .gender("Female")
                .performanceRating(PerformanceRating.ACHIEVING)
                .tenureYears(3);
    }

    private static ErrorKind kindOf(Employee employee, EmployeeValidator validator) {
        EquityException e = assertThrows(EquityException.class, () -> validator.validate(employee));
        assertEquals(employee.id(), e.getEmployeeId());
        return e.getKind();
    }

    @Test
    void acceptsValidEmployee() {
        assertDoesNotThrow(() -> validator.validate(valid("E1").build()));
    }

    @ParameterizedTest
    @ValueSource(doubles = {0.0, -100.0, Double.NaN, Double.POSITIVE_INFINITY})
    @DisplayName("Salary must be positive and finite")
    void rejectsSalary(double salary) {
        assertEquals(ErrorKind.NON_POSITIVE_SALARY, kindOf(valid("E1").salary(salary).build(), validator));
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 7, -1})
    @DisplayName("Level must be within the configured range")
    void rejectsLevel(int level) {
        assertEquals(ErrorKind.INVALID_LEVEL, kindOf(valid("E1").level(level).build(), validator));
    }

    @Test
    void customLevelRange() {
        EmployeeValidator wide = new EmployeeValidator(1, 9);
        assertDoesNotThrow(() -> wide.validate(valid("E1").level(8).build()));
        assertThrows(IllegalArgumentException.class, () -> new EmployeeValidator(3, 2));
    }

    @Test
    void rejectsMissingRatingAndNegativeTenure() {
        assertEquals(ErrorKind.UNKNOWN_PERFORMANCE_RATING,
                kindOf(valid("E1").performanceRating(null).build(), validator));
        assertEquals(ErrorKind.INVALID_TENURE, kindOf(valid("E1").tenureYears(-1).build(), validator));
        assertEquals(ErrorKind.MISSING_FIELD, kindOf(valid(" ").build(), validator));
    }

    @Test
    @DisplayName("Batch validation keeps valid records and the first of duplicate ids")
    void validateAll() {
        List<Employee> population = List.of(
                valid("E1").build(),
                valid("E2").salary(0).build(),
                valid("E1").salary(99_000).build(),
                valid("E3").level(12).build(),
                valid("E4").build());

        EmployeeValidator.Validation validation = validator.validateAll(population);

        assertEquals(List.of("E1", "E4"), validation.valid().stream().map(Employee::id).toList());
        assertEquals(55_000, validation.valid().get(0).salary());
        assertEquals(List.of(ErrorKind.NON_POSITIVE_SALARY, ErrorKind.DUPLICATE_ID, ErrorKind.INVALID_LEVEL),
                validation.errors().stream().map(RecordError::kind).toList());
        assertEquals(List.of("E2", "E1", "E3"),
                validation.errors().stream().map(RecordError::employeeId).toList());
    }

    @Test
    @DisplayName("A builder without level or rating produces a record the validator rejects")
    void builderHasNoLevelOrRatingDefault() {
        Employee bare = Employee.builder().id("E9").salary(50_000).build();

        assertEquals(0, bare.level());
        assertNull(bare.performanceRating());
        assertEquals(ErrorKind.INVALID_LEVEL, kindOf(bare, validator));

        Employee noRating = Employee.builder().id("E10").level(2).salary(50_000).build();
        assertEquals(ErrorKind.UNKNOWN_PERFORMANCE_RATING, kindOf(noRating, validator));
        assertTrue(validator.validateAll(List.of(bare, noRating)).valid().isEmpty());
    }

    @Test
    @DisplayName("A null entry is reported as malformed and the batch continues")
    void nullEntry() {
        EmployeeValidator.Validation validation = validator.validateAll(
                Arrays.asList(valid("E1").build(), null, valid("E2").build()));

        assertEquals(List.of("E1", "E2"), validation.valid().stream().map(Employee::id).toList());
        assertEquals(1, validation.errors().size());
        assertEquals(ErrorKind.MALFORMED_RECORD, validation.errors().get(0).kind());
        assertNull(validation.errors().get(0).employeeId());
    }
}
