package com.threatintel.auth.domain;

import java.util.List;
import java.util.Objects;

/**
 * A compiled query-language expression with positional ({@code ?}) parameters.
 *
 * @param sql    the expression text
 * @param params parameter values, in placeholder order
 */
public record QueryExpression(String sql, List<Object> params) {

    public QueryExpression {
        Objects.requireNonNull(sql, "sql");
        params = List.copyOf(params);
    }

    /**
     * Renders the expression with parameters inlined as literals (for logs and tests).
     */
    public String toInlineSql() {
        StringBuilder result = new StringBuilder(sql.length() + params.size() * 8);
        int paramIndex = 0;
        for (int i = 0; i < sql.length(); i++) {
            char ch = sql.charAt(i);
            if (ch == '?') {
                result.append(literal(params.get(paramIndex++)));
            } else {
                result.append(ch);
            }
        }
        return result.toString();
    }

    private static String literal(Object value) {
        if (value instanceof String s) {
            return "'" + s.replace("'", "''") + "'";
        }
        if (value instanceof Boolean b) {
            return b ? "TRUE" : "FALSE";
        }
        return String.valueOf(value);
    }
}
