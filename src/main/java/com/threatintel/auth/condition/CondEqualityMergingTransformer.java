package com.threatintel.auth.condition;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Merges equality tests on the same field, recursively:
 * <pre>
 *   x = a OR x IN (b, c) OR x = c                 ->   x IN (a, b, c)
 *   NOT x = a AND NOT x IN (b, c) AND NOT x = c   ->   NOT x IN (a, b, c)
 * </pre>
 * The merged condition takes the position of the first merged operand.
 */
public class CondEqualityMergingTransformer extends CondTransformer {

    @Override
    public Cond visitAnd(AndCond cond) {
        return merge(subvisit(cond));
    }

    @Override
    public Cond visitOr(OrCond cond) {
        return merge(subvisit(cond));
    }

    private Cond merge(Cond cond) {
        if (!(cond instanceof MultiCond multi)) {
            return cond;
        }
        boolean negated = multi instanceof AndCond;

        Map<Cond, String> fieldBySubcond = new LinkedHashMap<>();
        Map<String, List<FieldCond>> mergeableByField = new LinkedHashMap<>();
        for (Cond subcond : multi.getSubconditions()) {
            FieldCond mergeable = asMergeable(subcond, negated);
            if (mergeable != null) {
                fieldBySubcond.put(subcond, mergeable.getField());
                mergeableByField.computeIfAbsent(mergeable.getField(), k -> new ArrayList<>()).add(mergeable);
            }
        }
        boolean anythingToMerge = mergeableByField.values().stream().anyMatch(list -> list.size() > 1);
        if (!anythingToMerge) {
            return cond;
        }

        List<Cond> newSubconditions = new ArrayList<>();
        for (Cond subcond : multi.getSubconditions()) {
            String field = fieldBySubcond.get(subcond);
            if (field == null) {
                newSubconditions.add(subcond);
                continue;
            }
            List<FieldCond> group = mergeableByField.remove(field);
            if (group != null) {
                Cond merged = CondBuilder.in(field, collectValues(group));
                newSubconditions.add(negated ? CondBuilder.not(merged) : merged);
            }
        }
        return CondBuilder.connect(negated, newSubconditions);
    }

    private static FieldCond asMergeable(Cond cond, boolean negated) {
        Cond candidate = cond;
        if (negated) {
            if (!(cond instanceof NotCond not)) {
                return null;
            }
            candidate = not.getSubcondition();
        }
        if (candidate instanceof FieldCond field
                && (field.getOperator() == FieldCond.Operator.EQUAL || field.getOperator() == FieldCond.Operator.IN)) {
            return field;
        }
        return null;
    }

    private static Set<Object> collectValues(List<FieldCond> group) {
        Set<Object> values = new LinkedHashSet<>();
        for (FieldCond cond : group) {
            if (cond.getOperator() == FieldCond.Operator.IN) {
                values.addAll(cond.getValues());
            } else {
                values.add(cond.getValue());
            }
        }
        return values;
    }
}
