package com.threatintel.auth.condition;

import java.util.ArrayList;
import java.util.List;

/**
 * Pushes negations down to the leaves, recursively:
 * <pre>
 *   NOT (a AND b)   ->   NOT a OR NOT b
 *   NOT (a OR b)    ->   NOT a AND NOT b
 * </pre>
 */
public class CondDeMorganTransformer extends CondTransformer {

    @Override
    public Cond visitNot(NotCond cond) {
        Cond subcondition = cond.getSubcondition();
        if (subcondition instanceof MultiCond multi) {
            List<Cond> negated = new ArrayList<>(multi.getSubconditions().size());
            for (Cond sub : multi.getSubconditions()) {
                negated.add(CondBuilder.not(sub));
            }
            return apply(CondBuilder.connect(!(multi instanceof AndCond), negated));
        }
        return subvisit(cond);
    }
}
