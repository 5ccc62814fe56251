package com.threatintel.auth.condition;

import java.util.Set;

/**
 * Conjunction of two or more conditions.
 */
public final class AndCond extends MultiCond {

    AndCond(Set<Cond> subconditions) {
        super(subconditions);
    }

    @Override
    public boolean neutralValue() {
        return true;
    }

    @Override
    String keyword() {
        return "AND";
    }

    @Override
    public <R> R accept(CondVisitor<R> visitor) {
        return visitor.visitAnd(this);
    }
}
