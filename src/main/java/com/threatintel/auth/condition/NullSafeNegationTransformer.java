package com.threatintel.auth.condition;

import java.util.Set;

/**
 * Makes negated leaves hold for events where the tested field is absent.
 * <p>
 * In a three-valued query language {@code NOT asn = 1} is unknown (hence not
 * selected) for an event without {@code asn}, whereas the intended meaning is
 * "not known to be 1". Each negated leaf over a nullable field is rewritten:
 * <pre>
 *   NOT x = a   ->   x IS NULL OR NOT x = a
 * </pre>
 * Expects negations already pushed down to the leaves (see {@link CondDeMorganTransformer}).
 */
public class NullSafeNegationTransformer extends CondTransformer {

    /**
     * Fields guaranteed to be present in every stored event.
     */
    public static final Set<String> NEVER_NULL_FIELDS = Set.of(
            "id", "source", "restriction", "confidence", "category",
            "time", "ip", "dip", "modified");

    private final Set<String> neverNullFields;

    public NullSafeNegationTransformer() {
        this(NEVER_NULL_FIELDS);
    }

    public NullSafeNegationTransformer(Set<String> neverNullFields) {
        this.neverNullFields = Set.copyOf(neverNullFields);
    }

    @Override
    public Cond visitNot(NotCond cond) {
        if (cond.getSubcondition() instanceof FieldCond leaf
                && leaf.getOperator() != FieldCond.Operator.IS_NULL
                && !neverNullFields.contains(leaf.getField())) {
            return CondBuilder.or(CondBuilder.isNull(leaf.getField()), cond);
        }
        return subvisit(cond);
    }
}
