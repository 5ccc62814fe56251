package com.threatintel.auth.domain;

import java.util.Comparator;
import java.util.Objects;

/**
 * Organization {@code orgId} may see subsource {@code subsourceId} in {@code zone}.
 * <p>
 * Natural order: organization id, then subsource id, then zone name.
 */
public record AccessFact(String orgId, String subsourceId, AccessZone zone) implements Comparable<AccessFact> {

    private static final Comparator<AccessFact> ORDER = Comparator
            .comparing(AccessFact::orgId)
            .thenComparing(AccessFact::subsourceId)
            .thenComparing(fact -> fact.zone().getZoneName());

    public AccessFact {
        Objects.requireNonNull(orgId, "orgId");
        Objects.requireNonNull(subsourceId, "subsourceId");
        Objects.requireNonNull(zone, "zone");
    }

    @Override
    public int compareTo(AccessFact other) {
        return ORDER.compare(this, other);
    }
}
