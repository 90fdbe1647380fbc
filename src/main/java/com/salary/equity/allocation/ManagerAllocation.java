package com.salary.equity.allocation;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of one manager's allocation pass.
 *
 * @param teamSize         direct reports with a valid record
 * @param poolSize         reports evaluated (at most {@code maxDirectReports})
 * @param poolPayroll      summed salary of the pool
 * @param cap              spend limit for the pool
 * @param allocated        total proposed uplift
 * @param recommendations  every report's recommendation, pool first, in processing order
 * @param noAction         true when the pool had no members or no payroll
 */
public record ManagerAllocation(
        String managerId,
        int teamSize,
        int poolSize,
        double poolPayroll,
        double cap,
        double allocated,
        List<Recommendation> recommendations,
        boolean noAction
) {
    public ManagerAllocation {
        Objects.requireNonNull(managerId, "managerId is required");
        recommendations = recommendations != null ? List.copyOf(recommendations) : List.of();
    }

    public static ManagerAllocation noAction(String managerId, int teamSize, List<Recommendation> recommendations) {
        return new ManagerAllocation(managerId, teamSize, 0, 0.0, 0.0, 0.0, recommendations, true);
    }

    public double utilization() {
        return cap > 0 ? allocated / cap : 0.0;
    }

    public boolean isOverLimit(int maxDirectReports) {
        return teamSize > maxDirectReports;
    }

    public List<Recommendation> withState(RecommendationState state) {
        return recommendations.stream().filter(r -> r.getState() == state).toList();
    }
}
