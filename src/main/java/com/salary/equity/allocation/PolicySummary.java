package com.salary.equity.allocation;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Manager-policy compliance and budget use across all managers.
 * A manager is compliant when the team does not exceed {@code maxDirectReports}.
 */
public record PolicySummary(
        int totalManagers,
        int compliantManagers,
        int overLimitManagers,
        int maxDirectReports,
        double totalCap,
        double totalAllocated,
        double utilization,
        Map<PriorityTier, Integer> fundedByTier,
        int stagedCount
) {
    public PolicySummary {
        fundedByTier = fundedByTier != null
                ? Collections.unmodifiableMap(new EnumMap<>(fundedByTier))
                : Map.of();
    }

    public static PolicySummary of(List<ManagerAllocation> allocations, int maxDirectReports) {
        int compliant = 0;
        double cap = 0.0;
        double allocated = 0.0;
        int staged = 0;
        Map<PriorityTier, Integer> funded = new EnumMap<>(PriorityTier.class);
        for (PriorityTier tier : PriorityTier.values()) {
            funded.put(tier, 0);
        }
        for (ManagerAllocation allocation : allocations) {
            if (!allocation.isOverLimit(maxDirectReports)) {
                compliant++;
            }
            cap += allocation.cap();
            allocated += allocation.allocated();
            for (Recommendation recommendation : allocation.recommendations()) {
                if (recommendation.isFunded()) {
                    funded.merge(recommendation.getPriorityTier(), 1, Integer::sum);
                } else if (recommendation.getState() == RecommendationState.STAGED) {
                    staged++;
                }
            }
        }
        int total = allocations.size();
        return new PolicySummary(total, compliant, total - compliant, maxDirectReports, cap, allocated,
                cap > 0 ? allocated / cap : 0.0, funded, staged);
    }

    public double complianceRate() {
        return totalManagers > 0 ? (double) compliantManagers / totalManagers : 1.0;
    }
}
