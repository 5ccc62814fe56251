package com.threatintel.auth.config;

import java.util.Objects;

/**
 * Options of the access-condition pipeline (optimize, harden, compile).
 *
 * @param optimize      whether factoring and equality merging run before hardening
 * @param negationMode  how negations are hardened against absent fields
 * @param compileTarget the form conditions are compiled to
 */
public record ConditionPipelineSettings(boolean optimize, NegationMode negationMode, CompileTarget compileTarget) {

    public enum NegationMode {
        /** Push negations to leaves and make negated leaves over nullable fields hold when the field is absent. */
        NULL_SAFE,
        /** Keep negations where they are (three-valued semantics for absent fields). */
        LEGACY
    }

    public enum CompileTarget {
        /** Parameterized query-language expression for the event database. */
        QUERY_EXPRESSION,
        /** In-process predicate over event records. */
        PREDICATE
    }

    public ConditionPipelineSettings {
        Objects.requireNonNull(negationMode, "negationMode");
        Objects.requireNonNull(compileTarget, "compileTarget");
    }

    public static ConditionPipelineSettings defaults() {
        return new ConditionPipelineSettings(true, NegationMode.NULL_SAFE, CompileTarget.QUERY_EXPRESSION);
    }

    public ConditionPipelineSettings withCompileTarget(CompileTarget target) {
        return new ConditionPipelineSettings(optimize, negationMode, target);
    }
}
