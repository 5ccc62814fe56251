package com.threatintel.auth.condition;

import java.util.Objects;

/**
 * Negation of a condition. Never wraps a {@link FixedCond} or another {@link NotCond}.
 */
public final class NotCond extends Cond {

    private final Cond subcondition;

    NotCond(Cond subcondition) {
        this.subcondition = Objects.requireNonNull(subcondition, "subcondition");
    }

    public Cond getSubcondition() {
        return subcondition;
    }

    @Override
    public <R> R accept(CondVisitor<R> visitor) {
        return visitor.visitNot(this);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        return other instanceof NotCond that && subcondition.equals(that.subcondition);
    }

    @Override
    public int hashCode() {
        return ~subcondition.hashCode();
    }

    @Override
    public String toString() {
        return "NOT " + subcondition;
    }
}
