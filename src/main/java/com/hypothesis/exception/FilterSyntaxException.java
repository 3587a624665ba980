package com.hypothesis.exception;

import com.hypothesis.core.ErrorKind;

/**
 * Generated annotation filter references an unknown column or operator.
 */
public class FilterSyntaxException extends ResearchException {

    public FilterSyntaxException(String message) {
        super(ErrorKind.FILTER_SYNTAX, message);
    }

    public FilterSyntaxException(String message, Throwable cause) {
        super(ErrorKind.FILTER_SYNTAX, message, cause);
    }
}
