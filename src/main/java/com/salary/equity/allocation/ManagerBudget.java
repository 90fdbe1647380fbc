package com.salary.equity.allocation;

import java.util.Objects;

/**
 * Spend tracker for one manager's pool during a single allocation pass.
 * {@link #allocate(double)} is synchronized and never lets {@code spent} exceed {@code cap}.
 */
public class ManagerBudget {

    private static final double EXHAUSTED_EPSILON = 1e-9;

    private final String managerId;
    private final double teamPayroll;
    private final double cap;
    private double spent;

    public ManagerBudget(String managerId, double teamPayroll, double cap) {
        this.managerId = Objects.requireNonNull(managerId, "managerId is required");
        if (teamPayroll < 0 || cap < 0) {
            throw new IllegalArgumentException("teamPayroll and cap must not be negative");
        }
        this.teamPayroll = teamPayroll;
        this.cap = cap;
    }

    /**
     * Grants up to {@code requested} from the remaining capacity.
     *
     * @return the granted amount, between 0 and {@code requested}
     */
    public synchronized double allocate(double requested) {
        if (requested < 0) {
            throw new IllegalArgumentException("requested must not be negative: " + requested);
        }
        double granted = Math.min(requested, cap - spent);
        if (granted < 0) {
            granted = 0.0;
        }
        spent += granted;
        return granted;
    }

    public String getManagerId() {
        return managerId;
    }

    public double getTeamPayroll() {
        return teamPayroll;
    }

    public double getCap() {
        return cap;
    }

    public synchronized double getSpent() {
        return spent;
    }

    public synchronized double getRemaining() {
        return Math.max(0.0, cap - spent);
    }

    public synchronized boolean isExhausted() {
        return cap - spent <= EXHAUSTED_EPSILON;
    }

    public synchronized double utilization() {
        return cap > 0 ? spent / cap : 0.0;
    }

    @Override
    public synchronized String toString() {
        return "ManagerBudget{" +
                "managerId='" + managerId + '\'' +
                ", cap=" + cap +
                ", spent=" + spent +
                '}';
    }
}
