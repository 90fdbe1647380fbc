package com.salary.equity.core.model;

import java.util.Objects;

/**
 * Comparison cohort for median salary, computed once per analysis run.
 *
 * @param key          level (and optional gender) of the cohort
 * @param medianSalary median salary of the members
 * @param memberCount  number of members, always positive
 */
public record PeerGroup(PeerGroupKey key, double medianSalary, int memberCount) {

    public PeerGroup {
        Objects.requireNonNull(key, "key is required");
        if (memberCount <= 0) {
            throw new IllegalArgumentException("memberCount must be positive");
        }
        if (medianSalary <= 0) {
            throw new IllegalArgumentException("medianSalary must be positive");
        }
    }
}
