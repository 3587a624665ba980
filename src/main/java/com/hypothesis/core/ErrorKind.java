package com.hypothesis.core;

/**
 * Failure categories recorded on failed step results and carried by research exceptions.
 */
public enum ErrorKind {
    CLASSIFICATION_AMBIGUOUS(false, false),
    PLAN_GENERATION(false, false),
    UNKNOWN_TOOL(false, false),
    MALFORMED_ORACLE_OUTPUT(true, false),
    QUERY_SYNTAX(true, false),
    QUERY_TIMEOUT(true, false),
    CONNECTION(false, true),
    FILTER_SYNTAX(true, false),
    DATASET_UNAVAILABLE(false, true),
    ANALYSIS_PARAMETER(false, false),
    REFLECTION_REJECTED(true, false),
    DEPENDENCY_FAILED(false, false),
    ORACLE_UNAVAILABLE(false, true),
    INTERNAL(false, false);

    private final boolean retryableByDefault;
    private final boolean fatal;

    ErrorKind(boolean retryableByDefault, boolean fatal) {
        this.retryableByDefault = retryableByDefault;
        this.fatal = fatal;
    }

    public boolean isRetryableByDefault() {
        return retryableByDefault;
    }

    /**
     * Backend-level failures that count towards the session's degraded-service signal.
     */
    public boolean isFatal() {
        return fatal;
    }
}
