package com.vigil.correlation.engine.evaluation;

import java.util.List;

/**
 * What evaluating one event against its candidate rules produced.
 *
 * @param path           the evaluation path taken
 * @param matches        matching rules, in candidate order
 * @param candidateCount number of candidates the index returned
 * @param anyFailed      whether at least one rule evaluation threw
 */
public record EvaluationOutcome(EvaluationPath path, List<Match> matches, int candidateCount, boolean anyFailed) {

    public EvaluationOutcome {
        matches = List.copyOf(matches);
    }
}
