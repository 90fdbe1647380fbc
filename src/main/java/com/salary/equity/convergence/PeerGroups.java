package com.salary.equity.convergence;

import com.salary.equity.core.EquityException;
import com.salary.equity.core.ErrorKind;
import com.salary.equity.core.model.Employee;
import com.salary.equity.core.model.PeerGroup;
import com.salary.equity.core.model.PeerGroupKey;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Immutable set of peer groups computed from one population snapshot.
 * Iteration follows {@link PeerGroupKey} order (level, then gender).
 */
public final class PeerGroups {

    private final Map<PeerGroupKey, PeerGroup> groups;
    private final boolean byGender;

    PeerGroups(Map<PeerGroupKey, PeerGroup> groups, boolean byGender) {
        this.groups = Collections.unmodifiableMap(new TreeMap<>(groups));
        this.byGender = byGender;
    }

    public boolean isByGender() {
        return byGender;
    }

    public Optional<PeerGroup> find(PeerGroupKey key) {
        return Optional.ofNullable(groups.get(key));
    }

    /**
     * Returns the peer group the employee belongs to.
     *
     * @throws EquityException {@link ErrorKind#INSUFFICIENT_POPULATION} if the group has no members
     */
    public PeerGroup groupFor(Employee employee) {
        PeerGroupKey key = PeerGroupKey.of(employee, byGender);
        PeerGroup group = groups.get(key);
        if (group == null) {
            throw new EquityException(ErrorKind.INSUFFICIENT_POPULATION, employee.id(),
                    "No peer group members for " + key);
        }
        return group;
    }

    public double medianFor(Employee employee) {
        return groupFor(employee).medianSalary();
    }

    public Collection<PeerGroup> all() {
        return groups.values();
    }

    public Map<PeerGroupKey, PeerGroup> asMap() {
        return groups;
    }

    public int size() {
        return groups.size();
    }

    public boolean isEmpty() {
        return groups.isEmpty();
    }
}
