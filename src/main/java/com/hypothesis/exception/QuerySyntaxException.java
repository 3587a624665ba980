package com.hypothesis.exception;

import com.hypothesis.core.ErrorKind;

/**
 * Generated Cypher statement was rejected by the graph store.
 */
public class QuerySyntaxException extends ResearchException {

    public QuerySyntaxException(String message) {
        super(ErrorKind.QUERY_SYNTAX, message);
    }

    public QuerySyntaxException(String message, Throwable cause) {
        super(ErrorKind.QUERY_SYNTAX, message, cause);
    }
}
