package com.salary.equity.core.model;

import java.util.Comparator;

/**
 * Key of a peer group: the level, optionally narrowed by gender.
 *
 * @param level  job level
 * @param gender gender label, or null when peer groups are level-only
 */
public record PeerGroupKey(int level, String gender) implements Comparable<PeerGroupKey> {

    private static final Comparator<PeerGroupKey> ORDER = Comparator
            .comparingInt(PeerGroupKey::level)
            .thenComparing(PeerGroupKey::gender, Comparator.nullsFirst(Comparator.naturalOrder()));

    public static PeerGroupKey ofLevel(int level) {
        return new PeerGroupKey(level, null);
    }

    public static PeerGroupKey of(Employee employee, boolean byGender) {
        return new PeerGroupKey(employee.level(), byGender ? employee.gender() : null);
    }

    public boolean isGenderSpecific() {
        return gender != null;
    }

    @Override
    public int compareTo(PeerGroupKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return gender == null ? "L" + level : "L" + level + "/" + gender;
    }
}
