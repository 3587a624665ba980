package com.hypothesis.exception;

import com.hypothesis.core.ErrorKind;

/**
 * The language model endpoint could not be reached or returned an error status.
 */
public class OracleUnavailableException extends ResearchException {

    public OracleUnavailableException(String message, Throwable cause) {
        super(ErrorKind.ORACLE_UNAVAILABLE, message, cause);
    }
}
