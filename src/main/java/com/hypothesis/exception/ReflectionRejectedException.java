package com.hypothesis.exception;

import com.hypothesis.core.ErrorKind;

/**
 * The reflection pass judged the results unfit for the sub-query.
 */
public class ReflectionRejectedException extends ResearchException {

    public ReflectionRejectedException(String message) {
        super(ErrorKind.REFLECTION_REJECTED, message);
    }

    public ReflectionRejectedException(String message, Throwable cause) {
        super(ErrorKind.REFLECTION_REJECTED, message, cause);
    }
}
