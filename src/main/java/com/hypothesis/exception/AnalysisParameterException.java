package com.hypothesis.exception;

import com.hypothesis.core.ErrorKind;

/**
 * Graph analysis inputs are missing or do not fit the materialized graph.
 *
 * <p>A missing prior graph query result is never retryable; a node name the oracle got wrong is.
 */
public class AnalysisParameterException extends ResearchException {

    public AnalysisParameterException(String message, boolean retryable) {
        super(ErrorKind.ANALYSIS_PARAMETER, message, retryable, null);
    }

    public static AnalysisParameterException missingInput(String message) {
        return new AnalysisParameterException(message, false);
    }

    public static AnalysisParameterException badParameter(String message) {
        return new AnalysisParameterException(message, true);
    }
}
