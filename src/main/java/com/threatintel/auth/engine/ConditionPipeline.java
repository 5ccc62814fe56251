package com.threatintel.auth.engine;

import com.threatintel.auth.condition.Cond;
import com.threatintel.auth.condition.CondDeMorganTransformer;
import com.threatintel.auth.condition.CondEqualityMergingTransformer;
import com.threatintel.auth.condition.CondFactoringTransformer;
import com.threatintel.auth.condition.NullSafeNegationTransformer;
import com.threatintel.auth.config.ConditionPipelineSettings;
import com.threatintel.auth.config.ConditionPipelineSettings.CompileTarget;
import com.threatintel.auth.config.ConditionPipelineSettings.NegationMode;
import com.threatintel.auth.domain.CompiledAccessCondition;

/**
 * Turns a raw access condition into its final compiled form:
 * <ol>
 *   <li>optimize (optional): factor out shared operands, then merge equality tests</li>
 *   <li>harden: push negations to the leaves and make them null-safe
 *       (skipped in {@link NegationMode#LEGACY} mode)</li>
 *   <li>compile to the configured target</li>
 * </ol>
 * Instances are immutable and safe to share between threads.
 */
public class ConditionPipeline {

    private final ConditionPipelineSettings settings;
    private final CondFactoringTransformer factoring = new CondFactoringTransformer();
    private final CondEqualityMergingTransformer equalityMerging = new CondEqualityMergingTransformer();
    private final CondDeMorganTransformer deMorgan = new CondDeMorganTransformer();
    private final NullSafeNegationTransformer nullSafeNegation = new NullSafeNegationTransformer();
    private final QueryExpressionCompiler queryCompiler = new QueryExpressionCompiler();
    private final PredicateCompiler predicateCompiler = new PredicateCompiler();

    public ConditionPipeline(ConditionPipelineSettings settings) {
        this.settings = settings;
    }

    public ConditionPipelineSettings getSettings() {
        return settings;
    }

    public CompiledAccessCondition process(Cond cond) {
        Cond prepared = prepare(cond);
        if (settings.compileTarget() == CompileTarget.PREDICATE) {
            return CompiledAccessCondition.ofPredicate(prepared, predicateCompiler.compile(prepared));
        }
        return CompiledAccessCondition.ofQueryExpression(prepared, queryCompiler.compile(prepared));
    }

    /**
     * Runs the optimize and harden steps only.
     */
    public Cond prepare(Cond cond) {
        Cond result = cond;
        if (settings.optimize()) {
            result = factoring.apply(result);
            result = equalityMerging.apply(result);
        }
        if (settings.negationMode() == NegationMode.NULL_SAFE) {
            result = deMorgan.apply(result);
            result = nullSafeNegation.apply(result);
        }
        return result;
    }
}
