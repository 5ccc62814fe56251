package com.threatintel.auth.condition;

/**
 * Immutable node of a boolean condition tree over event record fields.
 * <p>
 * Instances are created exclusively through {@link CondBuilder}, which applies
 * the structural reductions (flattening, de-duplication, constant folding) at
 * construction time. Two conditions are equal when they are structurally equal;
 * the operands of {@link AndCond} and {@link OrCond} compare as sets.
 *
 * @see CondVisitor
 * @see CondTransformer
 */
public abstract class Cond {

    Cond() {
    }

    /**
     * Dispatches to the visitor method for the concrete node type.
     */
    public abstract <R> R accept(CondVisitor<R> visitor);

    @Override
    public abstract boolean equals(Object other);

    @Override
    public abstract int hashCode();

    /**
     * Debug rendering; not meant to be parsed.
     */
    @Override
    public abstract String toString();
}
