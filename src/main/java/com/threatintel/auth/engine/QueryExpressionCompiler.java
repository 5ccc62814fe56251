package com.threatintel.auth.engine;

import com.threatintel.auth.condition.AndCond;
import com.threatintel.auth.condition.Cond;
import com.threatintel.auth.condition.FieldCond;
import com.threatintel.auth.condition.FixedCond;
import com.threatintel.auth.condition.MultiCond;
import com.threatintel.auth.condition.NotCond;
import com.threatintel.auth.domain.QueryExpression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Compiles conditions into parameterized query-language expressions.
 * <p>
 * Negated leaves get their dedicated negative forms ({@code !=}, {@code NOT IN},
 * {@code IS NOT NULL}, ...); any other negation is rendered as {@code NOT (...)}.
 * Nested connectives are parenthesized.
 */
public class QueryExpressionCompiler {

    private static final Pattern FIELD_NAME = Pattern.compile("[a-z_][a-z0-9_]*");

    public QueryExpression compile(Cond cond) {
        List<Object> params = new ArrayList<>();
        String sql = render(cond, params);
        return new QueryExpression(sql, params);
    }

    private String render(Cond cond, List<Object> params) {
        if (cond instanceof FixedCond fixed) {
            return fixed.getValue() ? "TRUE" : "FALSE";
        }
        if (cond instanceof MultiCond multi) {
            String keyword = multi instanceof AndCond ? " AND " : " OR ";
            List<String> parts = new ArrayList<>(multi.getSubconditions().size());
            for (Cond sub : multi.getSubconditions()) {
                String rendered = render(sub, params);
                parts.add(sub instanceof MultiCond ? "(" + rendered + ")" : rendered);
            }
            return String.join(keyword, parts);
        }
        if (cond instanceof NotCond not) {
            if (not.getSubcondition() instanceof FieldCond leaf) {
                return renderLeaf(leaf, true, params);
            }
            return "NOT (" + render(not.getSubcondition(), params) + ")";
        }
        if (cond instanceof FieldCond leaf) {
            return renderLeaf(leaf, false, params);
        }
        throw new IllegalArgumentException("Unsupported condition type: " + cond.getClass().getName());
    }

    private String renderLeaf(FieldCond leaf, boolean negated, List<Object> params) {
        String field = column(leaf.getField());
        switch (leaf.getOperator()) {
            case EQUAL -> {
                params.add(leaf.getValue());
                return field + (negated ? " != ?" : " = ?");
            }
            case IN -> {
                params.addAll(leaf.getValues());
                String placeholders = String.join(", ", Collections.nCopies(leaf.getValues().size(), "?"));
                return field + (negated ? " NOT IN (" : " IN (") + placeholders + ")";
            }
            case BETWEEN -> {
                params.add(leaf.getRange().min());
                params.add(leaf.getRange().max());
                return field + (negated ? " NOT BETWEEN ? AND ?" : " BETWEEN ? AND ?");
            }
            case IS_NULL -> {
                return field + (negated ? " IS NOT NULL" : " IS NULL");
            }
            case IS_TRUE -> {
                return negated ? "NOT (" + field + " IS TRUE)" : field + " IS TRUE";
            }
            default -> {
                params.add(leaf.getValue());
                String comparison = field + " " + leaf.getOperator().getSymbol() + " ?";
                return negated ? "NOT (" + comparison + ")" : comparison;
            }
        }
    }

    private static String column(String field) {
        if (!FIELD_NAME.matcher(field).matches()) {
            throw new IllegalArgumentException("Illegal field name in condition: " + field);
        }
        return field;
    }
}
