package com.market.anomaly.engine;

import com.market.anomaly.model.EventSubtype;
import com.market.anomaly.window.WindowQueryException;

/**
 * Interface for all anomaly rule evaluators.
 * Each implementation detects one EventSubtype.
 */
public interface RuleEvaluator {

    /**
     * The anomaly pattern this evaluator detects.
     */
    EventSubtype getSubtype();

    /**
     * Evaluate the predicate for one instrument at one tick.
     *
     * @param context window access, the instrument under evaluation and its per-rule memory
     * @return the evaluation result; {@code triggered=false} when the predicate does not hold
     * @throws WindowQueryException when a required window query has no real reading,
     *                              which the engine treats as "does not fire"
     */
    RuleResult evaluate(EvaluationContext context) throws WindowQueryException;
}
