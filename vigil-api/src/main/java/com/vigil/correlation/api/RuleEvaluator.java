package com.vigil.correlation.api;

import com.vigil.correlation.api.model.CorrelationContext;
import com.vigil.correlation.api.model.EvaluationResult;
import com.vigil.correlation.api.model.Event;
import com.vigil.correlation.api.model.Rule;

/**
 * Decides whether a rule's conditions hold for an event.
 *
 * <p>Implementations must be thread-safe: the engine calls them concurrently
 * from its worker pools and fan-out executor. Exceptions are caught per rule
 * and never abort the evaluation of other candidates.
 */
@FunctionalInterface
public interface RuleEvaluator {

    EvaluationResult evaluate(Rule rule, Event event, CorrelationContext context);
}
