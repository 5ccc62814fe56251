package com.threatintel.auth.condition;

import java.util.Set;

/**
 * Disjunction of two or more conditions.
 */
public final class OrCond extends MultiCond {

    OrCond(Set<Cond> subconditions) {
        super(subconditions);
    }

    @Override
    public boolean neutralValue() {
        return false;
    }

    @Override
    String keyword() {
        return "OR";
    }

    @Override
    public <R> R accept(CondVisitor<R> visitor) {
        return visitor.visitOr(this);
    }
}
