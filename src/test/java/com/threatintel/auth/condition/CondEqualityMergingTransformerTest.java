package com.threatintel.auth.condition;

import org.junit.jupiter.api.Test;

import java.util.List;

import static com.threatintel.auth.condition.CondBuilder.and;
import static com.threatintel.auth.condition.CondBuilder.eq;
import static com.threatintel.auth.condition.CondBuilder.in;
import static com.threatintel.auth.condition.CondBuilder.not;
import static com.threatintel.auth.condition.CondBuilder.or;
import static org.assertj.core.api.Assertions.assertThat;

class CondEqualityMergingTransformerTest {

    private final CondEqualityMergingTransformer transformer = new CondEqualityMergingTransformer();

    @Test
    void mergesEqualitiesInDisjunction() {
        Cond result = transformer.apply(or(eq("x", "a"), in("x", List.of("b", "c")), eq("x", "c")));

        assertThat(result).isInstanceOf(FieldCond.class);
        assertThat(((FieldCond) result).getValues()).containsExactly("a", "b", "c");
    }

    @Test
    void mergesNegatedEqualitiesInConjunction() {
        Cond result = transformer.apply(and(not(eq("x", "a")), eq("y", 1), not(eq("x", "b"))));

        assertThat(result).isEqualTo(and(not(in("x", List.of("a", "b"))), eq("y", 1)));
        assertThat(((AndCond) result).getSubconditions()).first().isEqualTo(not(in("x", List.of("a", "b"))));
    }

    @Test
    void doesNotMergePositiveEqualitiesInConjunction() {
        Cond cond = and(eq("x", "a"), eq("x", "b"));

        assertThat(transformer.apply(cond)).isEqualTo(cond);
    }

    @Test
    void doesNotMergeAcrossFields() {
        Cond cond = or(eq("x", "a"), eq("y", "a"));

        assertThat(transformer.apply(cond)).isEqualTo(cond);
    }

    @Test
    void mergesInsideNestedConnectives() {
        Cond result = transformer.apply(and(eq("z", 1), or(eq("x", "a"), eq("x", "b"))));

        assertThat(result).isEqualTo(and(eq("z", 1), in("x", List.of("a", "b"))));
    }
}
