package com.threatintel.auth.engine;

import com.threatintel.auth.condition.AndCond;
import com.threatintel.auth.condition.Cond;
import com.threatintel.auth.condition.CondVisitor;
import com.threatintel.auth.condition.FieldCond;
import com.threatintel.auth.condition.FixedCond;
import com.threatintel.auth.condition.NotCond;
import com.threatintel.auth.condition.OrCond;
import com.threatintel.auth.domain.CompiledCondition;
import com.threatintel.auth.domain.EventRecord;

import java.util.List;
import java.util.Set;

/**
 * Compiles conditions into executable lambdas over {@link EventRecord}s.
 * <p>
 * Leaf semantics for multi-valued fields: a leaf holds when <em>any</em> value of
 * the field satisfies it; every leaf other than {@code IS NULL} is false for an
 * absent field. Numbers compare by numeric value, other values by natural order.
 */
public class PredicateCompiler implements CondVisitor<CompiledCondition> {

    public CompiledCondition compile(Cond cond) {
        return cond.accept(this);
    }

    @Override
    public CompiledCondition visitAnd(AndCond cond) {
        CompiledCondition[] compiled = compileAll(cond.getSubconditions());
        return event -> {
            for (CompiledCondition c : compiled) {
                if (!c.matches(event)) {
                    return false;
                }
            }
            return true;
        };
    }

    @Override
    public CompiledCondition visitOr(OrCond cond) {
        CompiledCondition[] compiled = compileAll(cond.getSubconditions());
        return event -> {
            for (CompiledCondition c : compiled) {
                if (c.matches(event)) {
                    return true;
                }
            }
            return false;
        };
    }

    @Override
    public CompiledCondition visitNot(NotCond cond) {
        return compile(cond.getSubcondition()).not();
    }

    @Override
    public CompiledCondition visitFixed(FixedCond cond) {
        boolean value = cond.getValue();
        return event -> value;
    }

    @Override
    public CompiledCondition visitField(FieldCond cond) {
        String field = cond.getField();
        return switch (cond.getOperator()) {
            case EQUAL -> compileEquals(field, cond.getValue());
            case GREATER -> compileComparison(field, cond.getValue(), c -> c > 0);
            case GREATER_OR_EQUAL -> compileComparison(field, cond.getValue(), c -> c >= 0);
            case LESS -> compileComparison(field, cond.getValue(), c -> c < 0);
            case LESS_OR_EQUAL -> compileComparison(field, cond.getValue(), c -> c <= 0);
            case IN -> compileIn(field, cond.getValues());
            case BETWEEN -> compileBetween(field, cond.getRange());
            case IS_TRUE -> event -> event.getValues(field).contains(Boolean.TRUE);
            case IS_NULL -> event -> event.getValues(field).isEmpty();
        };
    }

    private CompiledCondition[] compileAll(Set<Cond> conds) {
        return conds.stream()
                .map(this::compile)
                .toArray(CompiledCondition[]::new);
    }

    private static CompiledCondition compileEquals(String field, Object expected) {
        return event -> {
            for (Object actual : event.getValues(field)) {
                if (valueEquals(actual, expected)) {
                    return true;
                }
            }
            return false;
        };
    }

    private static CompiledCondition compileIn(String field, Set<Object> expected) {
        List<Object> candidates = List.copyOf(expected);
        return event -> {
            for (Object actual : event.getValues(field)) {
                for (Object candidate : candidates) {
                    if (valueEquals(actual, candidate)) {
                        return true;
                    }
                }
            }
            return false;
        };
    }

    private static CompiledCondition compileBetween(String field, FieldCond.Range range) {
        return event -> {
            for (Object actual : event.getValues(field)) {
                Integer lower = compareValues(actual, range.min());
                Integer upper = compareValues(actual, range.max());
                if (lower != null && upper != null && lower >= 0 && upper <= 0) {
                    return true;
                }
            }
            return false;
        };
    }

    private static CompiledCondition compileComparison(String field, Object threshold, ComparisonTest test) {
        return event -> {
            for (Object actual : event.getValues(field)) {
                Integer result = compareValues(actual, threshold);
                if (result != null && test.accept(result)) {
                    return true;
                }
            }
            return false;
        };
    }

    @FunctionalInterface
    private interface ComparisonTest {
        boolean accept(int comparison);
    }

    static boolean valueEquals(Object actual, Object expected) {
        if (actual instanceof Number a && expected instanceof Number e) {
            return Double.compare(a.doubleValue(), e.doubleValue()) == 0;
        }
        return actual.equals(expected);
    }

    /**
     * @return the comparison result, or null if the values are not comparable
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    static Integer compareValues(Object actual, Object expected) {
        if (actual instanceof Number a && expected instanceof Number e) {
            return Double.compare(a.doubleValue(), e.doubleValue());
        }
        if (actual instanceof Comparable comparable && actual.getClass() == expected.getClass()) {
            return comparable.compareTo(expected);
        }
        return null;
    }
}
