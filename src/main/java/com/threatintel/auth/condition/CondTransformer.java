package com.threatintel.auth.condition;

import java.util.ArrayList;
import java.util.List;

/**
 * Base for rewrites of condition trees.
 * <p>
 * The default behaviour rebuilds connectives from their (recursively transformed)
 * operands through {@link CondBuilder}, so the reductions are re-applied at every
 * level, and returns leaves and constants unchanged. Subclasses override the
 * {@code visit*} methods for the node types they rewrite and call
 * {@link #subvisit} to delegate to the default.
 */
public abstract class CondTransformer implements CondVisitor<Cond> {

    public Cond apply(Cond cond) {
        return cond.accept(this);
    }

    @Override
    public Cond visitAnd(AndCond cond) {
        return subvisit(cond);
    }

    @Override
    public Cond visitOr(OrCond cond) {
        return subvisit(cond);
    }

    @Override
    public Cond visitNot(NotCond cond) {
        return subvisit(cond);
    }

    @Override
    public Cond visitField(FieldCond cond) {
        return cond;
    }

    @Override
    public Cond visitFixed(FixedCond cond) {
        return cond;
    }

    protected Cond subvisit(MultiCond cond) {
        List<Cond> transformed = new ArrayList<>(cond.getSubconditions().size());
        for (Cond sub : cond.getSubconditions()) {
            transformed.add(apply(sub));
        }
        return CondBuilder.connect(cond instanceof AndCond, transformed);
    }

    protected Cond subvisit(NotCond cond) {
        return CondBuilder.not(apply(cond.getSubcondition()));
    }
}
