package com.salary.equity.population;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.salary.equity.core.EquityException;
import com.salary.equity.core.ErrorKind;
import com.salary.equity.core.model.Employee;
import com.salary.equity.core.model.PerformanceRating;
import com.salary.equity.logging.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a population from a JSON array of employee objects.
 *
 * <pre>
 * [
 *   {"employee_id": "E1", "level": 3, "salary": 60000, "gender": "Female",
 *    "performance_rating": "High Performing", "tenure_years": 4, "manager_id": "M1"}
 * ]
 * </pre>
 *
 * <p>{@code employee_id}, {@code level}, {@code salary} and {@code performance_rating}
 * are required; {@code tenure_years} defaults to 0. A record that cannot be read is
 * reported with its index and the rest of the array is still loaded. A fractional
 * {@code level} or {@code tenure_years} is malformed, never truncated. Value rules
 * (salary, level bounds) are left to {@link EmployeeValidator}.</p>
 */
public class JsonPopulationReader {
    private static final Logger log = LoggerFactory.getLogger(JsonPopulationReader.class);
    private static final int PROGRESS_INTERVAL = 100;

    private final ObjectMapper objectMapper;
    private final ObjectReader recordReader;

    public JsonPopulationReader() {
        this(new ObjectMapper());
    }

    public JsonPopulationReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.recordReader = objectMapper.readerFor(EmployeeRecord.class)
                .without(DeserializationFeature.ACCEPT_FLOAT_AS_INT);
    }

    public PopulationLoadResult read(Reader reader) {
        return read(reader, ProgressCallback.NOOP);
    }

    /**
     * Reads every record from {@code reader}. The reader is not closed.
     */
    public PopulationLoadResult read(Reader reader, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        List<Employee> employees = new ArrayList<>();
        List<PopulationLoadResult.LoadError> errors = new ArrayList<>();
        long total = 0;

        try (LogContext ctx = LogContext.forPopulationLoad("json")) {
            JsonNode root;
            try {
                root = objectMapper.readTree(reader);
            } catch (IOException e) {
                log.error("population.load.failed error={}", e.getMessage());
                errors.add(new PopulationLoadResult.LoadError(-1, null, ErrorKind.MALFORMED_RECORD,
                        "Unreadable population document: " + e.getMessage()));
                return new PopulationLoadResult(employees, errors, 0);
            }
            if (root == null || !root.isArray()) {
                log.error("population.load.failed error=root is not a JSON array");
                errors.add(new PopulationLoadResult.LoadError(-1, null, ErrorKind.MALFORMED_RECORD,
                        "Population document must be a JSON array"));
                return new PopulationLoadResult(employees, errors, 0);
            }

            total = root.size();
            for (int i = 0; i < root.size(); i++) {
                JsonNode node = root.get(i);
                String id = node.hasNonNull("employee_id") ? node.get("employee_id").asText() : null;
                try {
                    employees.add(toEmployee(node));
                } catch (EquityException e) {
                    errors.add(new PopulationLoadResult.LoadError(i, id, e.getKind(), e.getMessage()));
                    log.warn("population.record.error index={} employeeId={} kind={} error={}",
                            i, id, e.getKind(), e.getMessage());
                }
                if ((i + 1) % PROGRESS_INTERVAL == 0) {
                    cb.onProgress(i + 1, total, "Read " + (i + 1) + " records");
                }
            }

            PopulationLoadResult result = new PopulationLoadResult(employees, errors, total);
            cb.onProgress(total, total, "Population loaded");
            log.info("population.loaded result={}", result);
            return result;
        }
    }

    /**
     * Wraps a reader as a one-shot {@link PopulationSource}.
     */
    public PopulationSource source(Reader reader) {
        return () -> read(reader);
    }

    Employee toEmployee(JsonNode node) {
        if (!node.isObject()) {
            throw new EquityException(ErrorKind.MALFORMED_RECORD, "Record is not a JSON object");
        }
        EmployeeRecord record;
        try {
            record = recordReader.readValue(node);
        } catch (IOException e) {
            throw new EquityException(ErrorKind.MALFORMED_RECORD, "Record has a field of the wrong type", e);
        }

        String id = record.employeeId();
        if (id == null || id.isBlank()) {
            throw new EquityException(ErrorKind.MISSING_FIELD, "employee_id is required");
        }
        if (record.level() == null) {
            throw new EquityException(ErrorKind.MISSING_FIELD, id, "level is required");
        }
        if (record.salary() == null) {
            throw new EquityException(ErrorKind.MISSING_FIELD, id, "salary is required");
        }
        if (record.performanceRating() == null) {
            throw new EquityException(ErrorKind.MISSING_FIELD, id, "performance_rating is required");
        }
        PerformanceRating rating;
        try {
            rating = PerformanceRating.fromLabel(record.performanceRating());
        } catch (EquityException e) {
            throw new EquityException(e.getKind(), id, e.getMessage());
        }

        return Employee.builder()
                .id(id)
                .level(record.level())
                .salary(record.salary())
                .gender(record.gender())
                .performanceRating(rating)
                .tenureYears(record.tenureYears() != null ? record.tenureYears() : 0)
                .managerId(record.managerId())
                .build();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record EmployeeRecord(
            @JsonProperty("employee_id") String employeeId,
            @JsonProperty("level") Integer level,
            @JsonProperty("salary") Double salary,
            @JsonProperty("gender") String gender,
            @JsonProperty("performance_rating") String performanceRating,
            @JsonProperty("tenure_years") Integer tenureYears,
            @JsonProperty("manager_id") String managerId
    ) {
    }
}
