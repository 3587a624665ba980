package com.hypothesis.exception;

/**
 * The client abandoned the turn; remaining plan steps are not dispatched.
 */
public class TurnAbandonedException extends RuntimeException {

    public TurnAbandonedException(String sessionId, int completedSteps) {
        super("Turn abandoned for session " + sessionId + " after " + completedSteps + " step(s)");
    }
}
