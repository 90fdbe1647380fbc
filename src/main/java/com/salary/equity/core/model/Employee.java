package com.salary.equity.core.model;

import java.util.Objects;

/**
 * Read-only snapshot of one employee as supplied by the population source.
 * Field invariants (positive salary, level bounds, tenure) are checked by
 * {@code EmployeeValidator} so that a bad record can be reported instead of
 * failing the whole batch.
 *
 * @param id                unique employee id
 * @param level             job level (1-6 by default)
 * @param salary            current annual salary
 * @param gender            categorical gender label
 * @param performanceRating current performance tier
 * @param tenureYears       completed years of service
 * @param managerId         id of the direct manager, or null
 */
public record Employee(
        String id,
        int level,
        double salary,
        String gender,
        PerformanceRating performanceRating,
        int tenureYears,
        String managerId
) {
    public Employee {
        Objects.requireNonNull(id, "id is required");
    }

    public boolean hasManager() {
        return managerId != null && !managerId.isBlank();
    }

    public LevelTier levelTier() {
        return LevelTier.forLevel(level);
    }

    /**
     * Returns a copy of this employee with a different salary.
     */
    public Employee withSalary(double newSalary) {
        return new Employee(id, level, newSalary, gender, performanceRating, tenureYears, managerId);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Level and rating have no defaults; a record built without them fails validation.
     */
    public static class Builder {
        private String id;
        private int level;
        private double salary;
        private String gender;
        private PerformanceRating performanceRating;
        private int tenureYears;
        private String managerId;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder level(int level) {
            this.level = level;
            return this;
        }

        public Builder salary(double salary) {
            this.salary = salary;
            return this;
        }

        public Builder gender(String gender) {
            this.gender = gender;
            return this;
        }

        public Builder performanceRating(PerformanceRating performanceRating) {
            this.performanceRating = performanceRating;
            return this;
        }

        public Builder tenureYears(int tenureYears) {
            this.tenureYears = tenureYears;
            return this;
        }

        public Builder managerId(String managerId) {
            this.managerId = managerId;
            return this;
        }

        public Employee build() {
            return new Employee(id, level, salary, gender, performanceRating, tenureYears, managerId);
        }
    }
}
