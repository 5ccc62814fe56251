package com.threatintel.auth.condition;

import org.junit.jupiter.api.Test;

import static com.threatintel.auth.condition.CondBuilder.and;
import static com.threatintel.auth.condition.CondBuilder.eq;
import static com.threatintel.auth.condition.CondBuilder.or;
import static org.assertj.core.api.Assertions.assertThat;

class CondFactoringTransformerTest {

    private final CondFactoringTransformer transformer = new CondFactoringTransformer();

    private final Cond x = eq("source", "x");
    private final Cond a = eq("a", 1);
    private final Cond b = eq("b", 2);
    private final Cond c = eq("c", 3);
    private final Cond e = eq("e", 5);

    @Test
    void factorsSharedOperandOutOfDisjunction() {
        Cond result = transformer.apply(or(and(x, a), and(x, b), and(x, c)));

        assertThat(result).isEqualTo(and(x, or(a, b, c)));
    }

    @Test
    void keepsUnrelatedOperands() {
        Cond result = transformer.apply(or(and(x, a), and(x, b), e));

        assertThat(result).isEqualTo(or(e, and(x, or(a, b))));
    }

    @Test
    void factorsSharedOperandOutOfConjunction() {
        Cond result = transformer.apply(and(or(x, a), or(x, b), e));

        assertThat(result).isEqualTo(and(e, or(x, and(a, b))));
    }

    @Test
    void absorbsOperandThatIsItsOwnParent() {
        Cond result = transformer.apply(or(and(x, a), x));

        assertThat(result).isEqualTo(x);
    }

    @Test
    void leavesConditionWithoutSharedOperandsUnchanged() {
        Cond cond = or(and(x, a), and(b, c));

        assertThat(transformer.apply(cond)).isEqualTo(cond);
    }

    @Test
    void factorsInsideNestedConnectives() {
        Cond cond = and(e, or(and(x, a), and(x, b)));

        assertThat(transformer.apply(cond)).isEqualTo(and(e, x, or(a, b)));
    }
}
