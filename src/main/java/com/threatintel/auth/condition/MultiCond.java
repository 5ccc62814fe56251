package com.threatintel.auth.condition;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Base of the n-ary connectives {@link AndCond} and {@link OrCond}.
 * <p>
 * Operands are kept in insertion order (so that rendering is deterministic) but
 * compared as a set.
 */
public abstract class MultiCond extends Cond {

    private final Set<Cond> subconditions;

    MultiCond(Set<Cond> subconditions) {
        this.subconditions = Collections.unmodifiableSet(new LinkedHashSet<>(subconditions));
    }

    public Set<Cond> getSubconditions() {
        return subconditions;
    }

    /**
     * The value that leaves this connective unchanged when added as an operand
     * ({@code TRUE} for AND, {@code FALSE} for OR).
     */
    public abstract boolean neutralValue();

    abstract String keyword();

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (other == null || other.getClass() != getClass()) return false;
        return subconditions.equals(((MultiCond) other).subconditions);
    }

    @Override
    public int hashCode() {
        return 31 * getClass().hashCode() + subconditions.hashCode();
    }

    @Override
    public String toString() {
        return subconditions.stream()
                .map(Cond::toString)
                .collect(Collectors.joining(" " + keyword() + " ", "(", ")"));
    }
}
