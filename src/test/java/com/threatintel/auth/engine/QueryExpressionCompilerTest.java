package com.threatintel.auth.engine;

import com.threatintel.auth.condition.Cond;
import com.threatintel.auth.condition.CondBuilder;
import com.threatintel.auth.domain.QueryExpression;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.threatintel.auth.condition.CondBuilder.and;
import static com.threatintel.auth.condition.CondBuilder.between;
import static com.threatintel.auth.condition.CondBuilder.eq;
import static com.threatintel.auth.condition.CondBuilder.in;
import static com.threatintel.auth.condition.CondBuilder.isNull;
import static com.threatintel.auth.condition.CondBuilder.isTrue;
import static com.threatintel.auth.condition.CondBuilder.not;
import static com.threatintel.auth.condition.CondBuilder.or;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QueryExpressionCompilerTest {

    private final QueryExpressionCompiler compiler = new QueryExpressionCompiler();

    @Test
    void compilesParameterizedLeaves() {
        QueryExpression expression = compiler.compile(and(eq("source", "x"), in("asn", List.of(1, 2))));

        assertThat(expression.sql()).isEqualTo("source = ? AND asn IN (?, ?)");
        assertThat(expression.params()).containsExactly("x", 1L, 2L);
    }

    @Test
    void compilesNegatedLeavesToNegativeForms() {
        assertThat(compiler.compile(not(eq("cc", "PL"))).sql()).isEqualTo("cc != ?");
        assertThat(compiler.compile(not(in("asn", List.of(1, 2)))).sql()).isEqualTo("asn NOT IN (?, ?)");
        assertThat(compiler.compile(not(isNull("asn"))).sql()).isEqualTo("asn IS NOT NULL");
        assertThat(compiler.compile(not(between("ip", 1L, 3L))).sql()).isEqualTo("ip NOT BETWEEN ? AND ?");
        assertThat(compiler.compile(not(isTrue("ignored"))).sql()).isEqualTo("NOT (ignored IS TRUE)");
        assertThat(compiler.compile(not(CondBuilder.gt("confidence", 5))).sql()).isEqualTo("NOT (confidence > ?)");
    }

    @Test
    void parenthesizesNestedConnectives() {
        Cond cond = and(eq("source", "x"), or(isNull("asn"), not(in("asn", List.of(1, 2)))));

        assertThat(compiler.compile(cond).sql()).isEqualTo("source = ? AND (asn IS NULL OR asn NOT IN (?, ?))");
    }

    @Test
    void negationOfConnectiveIsRenderedAsNot() {
        assertThat(compiler.compile(not(and(eq("a", 1), eq("b", 2)))).sql()).isEqualTo("NOT (a = ? AND b = ?)");
    }

    @Test
    void compilesConstants() {
        assertThat(compiler.compile(CondBuilder.TRUE).sql()).isEqualTo("TRUE");
        assertThat(compiler.compile(CondBuilder.FALSE).sql()).isEqualTo("FALSE");
    }

    @Test
    void rejectsIllegalFieldNames() {
        assertThatThrownBy(() -> compiler.compile(eq("asn; DROP TABLE event", 1)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Illegal field name");
    }

    @Test
    void inlineRenderingQuotesStrings() {
        QueryExpression expression = compiler.compile(and(eq("name", "o'brien"), isTrue("ignored")));

        assertThat(expression.toInlineSql()).isEqualTo("name = 'o''brien' AND ignored IS TRUE");
    }
}
