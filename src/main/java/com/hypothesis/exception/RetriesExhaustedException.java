package com.hypothesis.exception;

/**
 * The bounded generate/execute loop ran out of attempts. Carries the kind of the last failure.
 */
public class RetriesExhaustedException extends ResearchException {

    public RetriesExhaustedException(String toolName, int attempts, ResearchException lastError) {
        super(lastError.getKind(),
            toolName + " failed after " + attempts + " attempt(s): " + lastError.getMessage(),
            false, lastError);
        atAttempt(attempts);
    }
}
