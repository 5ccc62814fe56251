package com.threatintel.auth.condition;

/**
 * Visitor over condition trees.
 *
 * @param <R> result type
 */
public interface CondVisitor<R> {

    R visitAnd(AndCond cond);

    R visitOr(OrCond cond);

    R visitNot(NotCond cond);

    R visitField(FieldCond cond);

    R visitFixed(FixedCond cond);
}
