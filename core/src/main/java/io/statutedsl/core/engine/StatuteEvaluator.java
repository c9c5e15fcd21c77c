package io.statutedsl.core.engine;

import io.statutedsl.core.model.EffectOutcome;
import io.statutedsl.core.model.Entity;
import io.statutedsl.core.model.ExceptionClause;
import io.statutedsl.core.model.LegalResult;
import io.statutedsl.core.model.Statute;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates a statute against an entity.
 *
 * <p>Order of checks:
 *
 * <ol>
 *   <li>a {@code DISCRETION} clause yields judicial discretion whatever the facts;</li>
 *   <li>with an as-of date, a statute not in force on that date is Void;</li>
 *   <li>an exception whose condition is deterministically true makes the statute Void;</li>
 *   <li>preconditions: true applies the effect, false is Void ("preconditions not met"),
 *       anything else propagates.</li>
 * </ol>
 *
 * <p>Evaluation is total: every statute/entity pair yields one of the three outcomes. The
 * evaluator holds no mutable state and may be shared across threads.
 */
public final class StatuteEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(StatuteEvaluator.class);

    static final String PRECONDITIONS_NOT_MET = "preconditions not met";
    static final String EXCEPTION_TRIGGERED = "exception triggered";

    private final EvaluationOptions defaultOptions;

    public StatuteEvaluator() {
        this(EvaluationOptions.DEFAULT);
    }

    public StatuteEvaluator(EvaluationOptions defaultOptions) {
        this.defaultOptions = defaultOptions;
    }

    public LegalResult<EffectOutcome> evaluate(Statute statute, Entity entity) {
        return evaluate(statute, entity, defaultOptions);
    }

    public LegalResult<EffectOutcome> evaluate(Statute statute, Entity entity, EvaluationOptions options) {
        LegalResult<EffectOutcome> result = decide(statute, entity, options);
        LOG.debug("statute.evaluated statute_id={} outcome={}", statute.id(), result.outcome());
        return result;
    }

    /** Evaluates every statute against one entity, keyed by statute id in input order. */
    public Map<String, LegalResult<EffectOutcome>> evaluateAll(List<Statute> statutes, Entity entity) {
        Map<String, LegalResult<EffectOutcome>> results = new LinkedHashMap<>();
        for (Statute statute : statutes) {
            results.putIfAbsent(statute.id(), evaluate(statute, entity));
        }
        return results;
    }

    private LegalResult<EffectOutcome> decide(Statute statute, Entity entity, EvaluationOptions options) {
        if (statute.hasDiscretion()) {
            return LegalResult.discretion(statute.discretionLogic(), List.of());
        }
        if (options.asOf() != null && !statute.inForceOn(options.asOf())) {
            return LegalResult.voided("statute not in force on " + options.asOf());
        }

        ConditionEvaluator conditions =
                new ConditionEvaluator(entity, statute.defaults(), options.globCaseSensitive());
        for (ExceptionClause exception : statute.exceptions()) {
            if (TruthTable.isTrue(conditions.evaluate(exception.condition()))) {
                String reason = exception.description() != null
                        ? EXCEPTION_TRIGGERED + ": " + exception.description()
                        : EXCEPTION_TRIGGERED;
                return LegalResult.voided(reason);
            }
        }

        LegalResult<Boolean> holds = statute.preconditions() != null
                ? conditions.evaluate(statute.preconditions())
                : TruthTable.of(true);
        if (TruthTable.isTrue(holds)) {
            return LegalResult.deterministic(
                    new EffectOutcome(statute.id(), statute.effect(), conditions.defaultsApplied()));
        }
        if (TruthTable.isFalse(holds)) {
            return LegalResult.voided(PRECONDITIONS_NOT_MET);
        }
        // discretion and Void carry no payload
        return holds.map(ignored -> null);
    }
}
