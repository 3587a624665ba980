package com.hypothesis.exception;

import com.hypothesis.core.ErrorKind;

public class PlanGenerationException extends ResearchException {

    public PlanGenerationException(String message) {
        super(ErrorKind.PLAN_GENERATION, message);
    }

    public PlanGenerationException(String message, Throwable cause) {
        super(ErrorKind.PLAN_GENERATION, message, cause);
    }
}
