package com.vigil.correlation.engine.evaluation;

public enum EvaluationPath {
    /** Fast path served from the "already handled" marker; nothing evaluated. */
    FAST_CACHED,
    FAST,
    STANDARD_PARALLEL,
    STANDARD_SEQUENTIAL,
    STREAM
}
