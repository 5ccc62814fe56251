package com.threatintel.auth.condition;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Factors shared operands out of connectives, recursively:
 * <pre>
 *   (x AND a) OR (x AND b) OR (x AND c) OR e   ->   (x AND (a OR b OR c)) OR e
 *   (x OR a) AND (x OR b) AND (x OR c) AND e   ->   (x OR (a AND b AND c)) AND e
 * </pre>
 * At each step the second-level operands shared by the largest number of
 * top-level operands are extracted; among equally shared ones, those that first
 * appeared earlier win. A top-level operand that is not of the inner connective
 * kind counts as its own (sole) second-level operand. The output is always
 * logically equivalent to the input.
 */
public class CondFactoringTransformer extends CondTransformer {

    @Override
    public Cond visitAnd(AndCond cond) {
        Cond factored = factorOut(cond, false);
        return factored != null ? apply(factored) : subvisit(cond);
    }

    @Override
    public Cond visitOr(OrCond cond) {
        Cond factored = factorOut(cond, true);
        return factored != null ? apply(factored) : subvisit(cond);
    }

    /**
     * @param cond      the connective being visited
     * @param innerAnd  whether the top-level operands of interest are ANDs (i.e. {@code cond} is an OR)
     * @return the rewritten condition, or null if no operand is shared
     */
    private Cond factorOut(MultiCond cond, boolean innerAnd) {
        boolean outerAnd = !innerAnd;

        Map<Cond, List<Cond>> parentsBySubcond = new LinkedHashMap<>();
        for (Cond parent : cond.getSubconditions()) {
            for (Cond subcond : secondLevel(parent, innerAnd)) {
                parentsBySubcond.computeIfAbsent(subcond, k -> new ArrayList<>()).add(parent);
            }
        }

        List<Cond> shared = new ArrayList<>();
        for (Map.Entry<Cond, List<Cond>> entry : parentsBySubcond.entrySet()) {
            if (entry.getValue().size() > 1) {
                shared.add(entry.getKey());
            }
        }
        if (shared.isEmpty()) {
            return null;
        }
        // List.sort is stable: ties keep first-seen order
        shared.sort((a, b) -> Integer.compare(parentsBySubcond.get(b).size(), parentsBySubcond.get(a).size()));

        List<Cond> theirParents = parentsBySubcond.get(shared.get(0));
        Set<Cond> extracted = new LinkedHashSet<>();
        for (Cond subcond : shared) {
            if (!parentsBySubcond.get(subcond).equals(theirParents)) {
                break;
            }
            extracted.add(subcond);
        }

        Cond factoredOut = CondBuilder.connect(innerAnd, extracted);
        List<Cond> remainders = new ArrayList<>(theirParents.size());
        for (Cond parent : theirParents) {
            List<Cond> rest = new ArrayList<>();
            for (Cond subcond : secondLevel(parent, innerAnd)) {
                if (!extracted.contains(subcond)) {
                    rest.add(subcond);
                }
            }
            // empty rest yields the absorbing constant of the outer connective
            remainders.add(CondBuilder.connect(innerAnd, rest));
        }
        Cond inBracket = CondBuilder.connect(outerAnd, remainders);
        Cond replacing = CondBuilder.connect(innerAnd, List.of(factoredOut, inBracket));

        Set<Cond> replaced = new LinkedHashSet<>(theirParents);
        List<Cond> newSubconditions = new ArrayList<>();
        for (Cond subcond : cond.getSubconditions()) {
            if (!replaced.contains(subcond)) {
                newSubconditions.add(subcond);
            }
        }
        newSubconditions.add(replacing);
        return CondBuilder.connect(outerAnd, newSubconditions);
    }

    private static Set<Cond> secondLevel(Cond parent, boolean innerAnd) {
        boolean matchesInner = innerAnd ? parent instanceof AndCond : parent instanceof OrCond;
        if (matchesInner) {
            return ((MultiCond) parent).getSubconditions();
        }
        return Set.of(parent);
    }
}
