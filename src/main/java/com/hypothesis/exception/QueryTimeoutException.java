package com.hypothesis.exception;

import com.hypothesis.core.ErrorKind;

/**
 * Graph store did not answer within the per-call timeout.
 */
public class QueryTimeoutException extends ResearchException {

    public QueryTimeoutException(String message) {
        super(ErrorKind.QUERY_TIMEOUT, message);
    }

    public QueryTimeoutException(String message, Throwable cause) {
        super(ErrorKind.QUERY_TIMEOUT, message, cause);
    }
}
