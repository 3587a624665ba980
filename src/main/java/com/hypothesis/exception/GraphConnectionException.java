package com.hypothesis.exception;

import com.hypothesis.core.ErrorKind;

/**
 * Graph store unreachable or refused the credentials. Not retried.
 */
public class GraphConnectionException extends ResearchException {

    public GraphConnectionException(String message) {
        super(ErrorKind.CONNECTION, message);
    }

    public GraphConnectionException(String message, Throwable cause) {
        super(ErrorKind.CONNECTION, message, cause);
    }
}
