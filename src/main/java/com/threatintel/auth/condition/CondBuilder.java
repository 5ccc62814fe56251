package com.threatintel.auth.condition;

import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Factory for condition trees.
 * <p>
 * All reductions are applied at construction time, so every {@link Cond} in
 * circulation is already in reduced form:
 * <ul>
 *   <li>nested AND/OR of the same kind are flattened and duplicate operands dropped
 *       (first occurrence wins the position)</li>
 *   <li>a neutral constant operand is dropped; an absorbing one absorbs the whole connective</li>
 *   <li>an operand together with its own negation makes the connective absorbing</li>
 *   <li>a connective with one operand is that operand; with none, its neutral constant</li>
 *   <li>NOT of a constant is the inverted constant; NOT NOT x is x</li>
 *   <li>IN over no values is {@code FALSE}; IN over one value is an equality</li>
 * </ul>
 */
public final class CondBuilder {

    public static final Cond TRUE = FixedCond.TRUE;
    public static final Cond FALSE = FixedCond.FALSE;

    private CondBuilder() {}

    public static Cond fixed(boolean value) {
        return FixedCond.of(value);
    }

    public static Cond eq(String field, Object value) {
        return FieldCond.scalar(field, FieldCond.Operator.EQUAL, value);
    }

    public static Cond gt(String field, Object value) {
        return FieldCond.scalar(field, FieldCond.Operator.GREATER, value);
    }

    public static Cond ge(String field, Object value) {
        return FieldCond.scalar(field, FieldCond.Operator.GREATER_OR_EQUAL, value);
    }

    public static Cond lt(String field, Object value) {
        return FieldCond.scalar(field, FieldCond.Operator.LESS, value);
    }

    public static Cond le(String field, Object value) {
        return FieldCond.scalar(field, FieldCond.Operator.LESS_OR_EQUAL, value);
    }

    public static Cond in(String field, Collection<?> values) {
        Set<Object> unique = new LinkedHashSet<>();
        for (Object value : values) {
            if (value == null) {
                throw new IllegalArgumentException("IN value for field '" + field + "' must not be null");
            }
            unique.add(FieldCond.normalize(value));
        }
        if (unique.isEmpty()) {
            return FALSE;
        }
        if (unique.size() == 1) {
            return eq(field, unique.iterator().next());
        }
        return FieldCond.in(field, unique);
    }

    public static Cond between(String field, Object min, Object max) {
        if (min == null || max == null) {
            throw new IllegalArgumentException("BETWEEN bounds for field '" + field + "' must not be null");
        }
        return FieldCond.between(field, min, max);
    }

    public static Cond isTrue(String field) {
        return FieldCond.unary(field, FieldCond.Operator.IS_TRUE);
    }

    public static Cond isNull(String field) {
        return FieldCond.unary(field, FieldCond.Operator.IS_NULL);
    }

    public static Cond not(Cond cond) {
        if (cond instanceof FixedCond fixed) {
            return fixed(!fixed.getValue());
        }
        if (cond instanceof NotCond negation) {
            return negation.getSubcondition();
        }
        return new NotCond(cond);
    }

    public static Cond and(Cond... conds) {
        return and(Arrays.asList(conds));
    }

    public static Cond and(Collection<? extends Cond> conds) {
        return connect(true, conds);
    }

    public static Cond or(Cond... conds) {
        return or(Arrays.asList(conds));
    }

    public static Cond or(Collection<? extends Cond> conds) {
        return connect(false, conds);
    }

    /**
     * Builds the connective of the given kind ({@code true} for AND).
     */
    public static Cond connect(boolean conjunction, Collection<? extends Cond> conds) {
        boolean neutral = conjunction;
        Set<Cond> operands = new LinkedHashSet<>();
        for (Cond cond : conds) {
            if (!collect(conjunction, cond, operands)) {
                return fixed(!neutral);
            }
        }
        for (Cond operand : operands) {
            if (!(operand instanceof NotCond) && operands.contains(new NotCond(operand))) {
                return fixed(!neutral);
            }
        }
        if (operands.isEmpty()) {
            return fixed(neutral);
        }
        if (operands.size() == 1) {
            return operands.iterator().next();
        }
        return conjunction ? new AndCond(operands) : new OrCond(operands);
    }

    // Returns false when an absorbing constant was met.
    private static boolean collect(boolean conjunction, Cond cond, Set<Cond> operands) {
        if (cond instanceof FixedCond fixed) {
            return fixed.getValue() == conjunction;
        }
        boolean sameKind = conjunction ? cond instanceof AndCond : cond instanceof OrCond;
        if (sameKind) {
            operands.addAll(((MultiCond) cond).getSubconditions());
        } else {
            operands.add(cond);
        }
        return true;
    }
}
