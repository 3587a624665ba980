package com.hypothesis.exception;

import com.hypothesis.core.ErrorKind;
import lombok.Getter;

/**
 * Language model output that does not match the expected structure.
 */
@Getter
public class OracleResponseException extends ResearchException {

    private final String agentName;

    public OracleResponseException(String agentName, String message) {
        super(ErrorKind.MALFORMED_ORACLE_OUTPUT, agentName + ": " + message);
        this.agentName = agentName;
    }

    public OracleResponseException(String agentName, String message, Throwable cause) {
        super(ErrorKind.MALFORMED_ORACLE_OUTPUT, agentName + ": " + message, cause);
        this.agentName = agentName;
    }
}
