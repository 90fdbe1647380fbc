package com.salary.equity.allocation;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * A proposed salary adjustment for one employee in a manager's pool.
 *
 * <p>State changes go through the package-private transition methods, which
 * reject anything outside PENDING &rarr; EVALUATED &rarr; {ACCEPTED, TRIMMED, STAGED}
 * or PENDING &rarr; STAGED. Terminal recommendations never change again.</p>
 */
public class Recommendation {

    private final String employeeId;
    private final String managerId;
    private final double currentSalary;
    private final double requestedUplift;
    private final double gapAmount;
    private final PriorityTier priorityTier;
    private final Set<RationaleFlag> rationale;
    private RecommendationState state;
    private double proposedUplift;

    private Recommendation(Builder builder) {
        this.employeeId = Objects.requireNonNull(builder.employeeId, "employeeId is required");
        this.managerId = Objects.requireNonNull(builder.managerId, "managerId is required");
        this.priorityTier = Objects.requireNonNull(builder.priorityTier, "priorityTier is required");
        if (builder.requestedUplift < 0) {
            throw new IllegalArgumentException("requestedUplift must not be negative");
        }
        this.currentSalary = builder.currentSalary;
        this.requestedUplift = builder.requestedUplift;
        this.gapAmount = builder.gapAmount;
        this.rationale = builder.rationale.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(builder.rationale));
        this.state = RecommendationState.PENDING;
    }

    public String getEmployeeId() {
        return employeeId;
    }

    public String getManagerId() {
        return managerId;
    }

    public double getCurrentSalary() {
        return currentSalary;
    }

    public double getRequestedUplift() {
        return requestedUplift;
    }

    public synchronized double getProposedUplift() {
        return proposedUplift;
    }

    public double getGapAmount() {
        return gapAmount;
    }

    public PriorityTier getPriorityTier() {
        return priorityTier;
    }

    public Set<RationaleFlag> getRationale() {
        return rationale;
    }

    public synchronized RecommendationState getState() {
        return state;
    }

    public synchronized double getProposedSalary() {
        return currentSalary + proposedUplift;
    }

    /**
     * True when the recommendation ended with money attached.
     */
    public synchronized boolean isFunded() {
        return (state == RecommendationState.ACCEPTED || state == RecommendationState.TRIMMED)
                && proposedUplift > 0;
    }

    public boolean hasFlag(RationaleFlag flag) {
        return rationale.contains(flag);
    }

    synchronized void markEvaluated() {
        requireState(RecommendationState.PENDING, RecommendationState.EVALUATED);
        this.state = RecommendationState.EVALUATED;
    }

    synchronized void accept(double uplift) {
        requireState(RecommendationState.EVALUATED, RecommendationState.ACCEPTED);
        this.proposedUplift = uplift;
        this.state = RecommendationState.ACCEPTED;
    }

    synchronized void trim(double uplift) {
        requireState(RecommendationState.EVALUATED, RecommendationState.TRIMMED);
        if (uplift > requestedUplift) {
            throw new IllegalArgumentException("Trimmed uplift " + uplift
                    + " exceeds requested " + requestedUplift);
        }
        this.proposedUplift = uplift;
        this.state = RecommendationState.TRIMMED;
    }

    synchronized void stage() {
        if (state != RecommendationState.PENDING && state != RecommendationState.EVALUATED) {
            throw illegal(RecommendationState.STAGED);
        }
        this.proposedUplift = 0.0;
        this.state = RecommendationState.STAGED;
    }

    private void requireState(RecommendationState expected, RecommendationState target) {
        if (state != expected) {
            throw illegal(target);
        }
    }

    private IllegalStateException illegal(RecommendationState target) {
        return new IllegalStateException("Recommendation for " + employeeId
                + " cannot move from " + state + " to " + target);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Recommendation that = (Recommendation) o;
        return employeeId.equals(that.employeeId) && managerId.equals(that.managerId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(employeeId, managerId);
    }

    @Override
    public synchronized String toString() {
        return "Recommendation{" +
                "employeeId='" + employeeId + '\'' +
                ", managerId='" + managerId + '\'' +
                ", tier=" + priorityTier +
                ", requested=" + requestedUplift +
                ", proposed=" + proposedUplift +
                ", state=" + state +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String employeeId;
        private String managerId;
        private double currentSalary;
        private double requestedUplift;
        private double gapAmount;
        private PriorityTier priorityTier;
        private final Set<RationaleFlag> rationale = EnumSet.noneOf(RationaleFlag.class);

        public Builder employeeId(String employeeId) {
            this.employeeId = employeeId;
            return this;
        }

        public Builder managerId(String managerId) {
            this.managerId = managerId;
            return this;
        }

        public Builder currentSalary(double currentSalary) {
            this.currentSalary = currentSalary;
            return this;
        }

        public Builder requestedUplift(double requestedUplift) {
            this.requestedUplift = requestedUplift;
            return this;
        }

        public Builder gapAmount(double gapAmount) {
            this.gapAmount = gapAmount;
            return this;
        }

        public Builder priorityTier(PriorityTier priorityTier) {
            this.priorityTier = priorityTier;
            return this;
        }

        public Builder flag(RationaleFlag flag) {
            this.rationale.add(flag);
            return this;
        }

        public Recommendation build() {
            return new Recommendation(this);
        }
    }
}
