package com.salary.equity.intervention;

/**
 * Cost of one year of a strategy.
 */
public record YearCost(int year, double cost, int employeesAffected) {
}
