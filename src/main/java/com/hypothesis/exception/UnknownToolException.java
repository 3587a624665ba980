package com.hypothesis.exception;

import com.hypothesis.core.ErrorKind;
import lombok.Getter;

/**
 * A plan step names a tool that is not in the registry. Raised before any backend call.
 */
@Getter
public class UnknownToolException extends ResearchException {

    private final String toolName;

    public UnknownToolException(String toolName, String validTools) {
        super(ErrorKind.UNKNOWN_TOOL, "Tool '" + toolName + "' does not exist. Valid tools: " + validTools);
        this.toolName = toolName;
    }
}
