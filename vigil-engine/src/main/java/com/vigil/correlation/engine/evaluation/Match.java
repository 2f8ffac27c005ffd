package com.vigil.correlation.engine.evaluation;

import com.vigil.correlation.api.model.EvaluationResult;
import com.vigil.correlation.api.model.Rule;

/**
 * A rule that matched an event, with the verdict that said so.
 */
public record Match(Rule rule, EvaluationResult result) {
}
