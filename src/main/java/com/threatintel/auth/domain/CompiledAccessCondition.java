package com.threatintel.auth.domain;

import com.threatintel.auth.condition.Cond;

import java.util.Objects;

/**
 * An access condition after the optimize/harden steps, together with its compiled form.
 * <p>
 * Exactly one of {@link #getQueryExpression()} and {@link #getPredicate()} is
 * non-null, depending on the configured compile target. Equality is based on
 * the condition tree only, so equal inputs give equal access infos regardless
 * of the compiled artifacts.
 */
public final class CompiledAccessCondition {

    private final Cond cond;
    private final QueryExpression queryExpression;
    private final CompiledCondition predicate;

    private CompiledAccessCondition(Cond cond, QueryExpression queryExpression, CompiledCondition predicate) {
        this.cond = Objects.requireNonNull(cond, "cond");
        this.queryExpression = queryExpression;
        this.predicate = predicate;
    }

    public static CompiledAccessCondition ofQueryExpression(Cond cond, QueryExpression queryExpression) {
        return new CompiledAccessCondition(cond, Objects.requireNonNull(queryExpression), null);
    }

    public static CompiledAccessCondition ofPredicate(Cond cond, CompiledCondition predicate) {
        return new CompiledAccessCondition(cond, null, Objects.requireNonNull(predicate));
    }

    public Cond getCond() {
        return cond;
    }

    public QueryExpression getQueryExpression() {
        return queryExpression;
    }

    public CompiledCondition getPredicate() {
        return predicate;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        return other instanceof CompiledAccessCondition that && cond.equals(that.cond);
    }

    @Override
    public int hashCode() {
        return cond.hashCode();
    }

    @Override
    public String toString() {
        return queryExpression != null ? queryExpression.toInlineSql() : cond.toString();
    }
}
