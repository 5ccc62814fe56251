package com.threatintel.auth.condition;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Leaf condition: a single operator applied to a named event field.
 * <p>
 * Parameter shape depends on the operator:
 * <ul>
 *   <li>{@code EQUAL}, {@code GREATER}, ... - a single scalar value</li>
 *   <li>{@code IN} - an ordered set of scalar values (at least two, see {@link CondBuilder#in})</li>
 *   <li>{@code BETWEEN} - a {@link Range}</li>
 *   <li>{@code IS_TRUE}, {@code IS_NULL} - no parameter</li>
 * </ul>
 * Integral parameters are normalized to {@link Long} so that {@code 1} and {@code 1L}
 * compare equal.
 */
public final class FieldCond extends Cond {

    /**
     * Leaf operators.
     */
    public enum Operator {
        EQUAL("="),
        GREATER(">"),
        GREATER_OR_EQUAL(">="),
        LESS("<"),
        LESS_OR_EQUAL("<="),
        IN("IN"),
        BETWEEN("BETWEEN"),
        IS_TRUE("IS TRUE"),
        IS_NULL("IS NULL");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String getSymbol() {
            return symbol;
        }

        public boolean isComparison() {
            return this == GREATER || this == GREATER_OR_EQUAL || this == LESS || this == LESS_OR_EQUAL;
        }
    }

    /**
     * Inclusive range parameter of a {@code BETWEEN} condition.
     */
    public record Range(Object min, Object max) {
        public Range {
            Objects.requireNonNull(min, "min");
            Objects.requireNonNull(max, "max");
        }
    }

    private final String field;
    private final Operator operator;
    private final Object param;

    FieldCond(String field, Operator operator, Object param) {
        this.field = Objects.requireNonNull(field, "field");
        this.operator = Objects.requireNonNull(operator, "operator");
        this.param = param;
    }

    static FieldCond scalar(String field, Operator operator, Object value) {
        if (value == null) {
            throw new IllegalArgumentException("Condition value for field '" + field + "' must not be null");
        }
        return new FieldCond(field, operator, normalize(value));
    }

    static FieldCond in(String field, Set<Object> values) {
        return new FieldCond(field, Operator.IN, Collections.unmodifiableSet(new LinkedHashSet<>(values)));
    }

    static FieldCond between(String field, Object min, Object max) {
        return new FieldCond(field, Operator.BETWEEN, new Range(normalize(min), normalize(max)));
    }

    static FieldCond unary(String field, Operator operator) {
        return new FieldCond(field, operator, null);
    }

    static Object normalize(Object value) {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        return value;
    }

    public String getField() {
        return field;
    }

    public Operator getOperator() {
        return operator;
    }

    /**
     * Scalar parameter of single-value operators.
     */
    public Object getValue() {
        return param;
    }

    /**
     * Values of an {@code IN} condition, in first-seen order.
     */
    @SuppressWarnings("unchecked")
    public Set<Object> getValues() {
        if (operator != Operator.IN) {
            throw new IllegalStateException("Not an IN condition: " + this);
        }
        return (Set<Object>) param;
    }

    public Range getRange() {
        if (operator != Operator.BETWEEN) {
            throw new IllegalStateException("Not a BETWEEN condition: " + this);
        }
        return (Range) param;
    }

    @Override
    public <R> R accept(CondVisitor<R> visitor) {
        return visitor.visitField(this);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof FieldCond that)) return false;
        return field.equals(that.field)
                && operator == that.operator
                && Objects.equals(param, that.param);
    }

    @Override
    public int hashCode() {
        return Objects.hash(field, operator, param);
    }

    @Override
    public String toString() {
        return switch (operator) {
            case IS_TRUE, IS_NULL -> "<" + field + " " + operator.getSymbol() + ">";
            case BETWEEN -> "<" + field + " BETWEEN " + getRange().min() + " AND " + getRange().max() + ">";
            default -> "<" + field + " " + operator.getSymbol() + " " + param + ">";
        };
    }
}
