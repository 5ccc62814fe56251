package com.threatintel.auth.engine;

import com.threatintel.auth.condition.Cond;
import com.threatintel.auth.config.ConditionPipelineSettings;
import com.threatintel.auth.config.ConditionPipelineSettings.CompileTarget;
import com.threatintel.auth.config.ConditionPipelineSettings.NegationMode;
import com.threatintel.auth.domain.CompiledAccessCondition;
import com.threatintel.auth.domain.EventRecord;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.threatintel.auth.condition.CondBuilder.and;
import static com.threatintel.auth.condition.CondBuilder.eq;
import static com.threatintel.auth.condition.CondBuilder.in;
import static com.threatintel.auth.condition.CondBuilder.not;
import static com.threatintel.auth.condition.CondBuilder.or;
import static org.assertj.core.api.Assertions.assertThat;

class ConditionPipelineTest {

    private final Cond raw = or(
            and(eq("source", "x"), eq("asn", 1)),
            and(eq("source", "x"), eq("asn", 2)),
            and(eq("source", "x"), not(eq("cc", "PL"))));

    @Test
    void optimizesHardensAndCompilesToQueryExpression() {
        ConditionPipeline pipeline = new ConditionPipeline(ConditionPipelineSettings.defaults());

        CompiledAccessCondition compiled = pipeline.process(raw);

        assertThat(compiled.getPredicate()).isNull();
        assertThat(compiled.getQueryExpression().toInlineSql())
                .isEqualTo("source = 'x' AND (asn IN (1, 2) OR cc IS NULL OR cc != 'PL')");
    }

    @Test
    void skipsOptimizationWhenDisabled() {
        ConditionPipeline pipeline = new ConditionPipeline(
                new ConditionPipelineSettings(false, NegationMode.NULL_SAFE, CompileTarget.QUERY_EXPRESSION));

        Cond prepared = pipeline.prepare(or(eq("asn", 1), eq("asn", 2)));

        assertThat(prepared).isEqualTo(or(eq("asn", 1), eq("asn", 2)));
    }

    @Test
    void legacyModeKeepsNegationsAsTheyAre() {
        ConditionPipeline pipeline = new ConditionPipeline(
                new ConditionPipelineSettings(true, NegationMode.LEGACY, CompileTarget.QUERY_EXPRESSION));

        CompiledAccessCondition compiled = pipeline.process(not(and(eq("asn", 1), eq("cc", "PL"))));

        assertThat(compiled.toString()).isEqualTo("NOT (asn = 1 AND cc = 'PL')");
    }

    @Test
    void compilesToPredicate() {
        ConditionPipeline pipeline = new ConditionPipeline(
                ConditionPipelineSettings.defaults().withCompileTarget(CompileTarget.PREDICATE));

        CompiledAccessCondition compiled = pipeline.process(and(eq("source", "x"), not(in("asn", List.of(1, 2)))));

        assertThat(compiled.getQueryExpression()).isNull();
        EventRecord withoutAsn = EventRecord.builder().field("source", "x").build();
        EventRecord excludedAsn = EventRecord.builder().field("source", "x").address("1.2.3.4", 2L, null).build();
        assertThat(compiled.getPredicate().matches(withoutAsn)).isTrue();
        assertThat(compiled.getPredicate().matches(excludedAsn)).isFalse();
    }

    @Test
    void equalConditionsGiveEqualResultsRegardlessOfTarget() {
        ConditionPipeline queries = new ConditionPipeline(ConditionPipelineSettings.defaults());
        ConditionPipeline predicates = new ConditionPipeline(
                ConditionPipelineSettings.defaults().withCompileTarget(CompileTarget.PREDICATE));

        assertThat(queries.process(raw)).isEqualTo(predicates.process(raw));
        assertThat(queries.process(raw)).hasSameHashCodeAs(predicates.process(raw));
    }
}
