package com.hypothesis.core;

/**
 * Outcome of executing one plan step. Aligned with the plan by {@code index}.
 */
public record StepResult(
    int index,
    String tool,
    StepStatus status,
    StepPayload payload,
    ErrorKind errorKind,
    String message,
    int attempts,
    String executedQuery
) {

    public static StepResult success(PlanStep step, StepPayload payload, int attempts, String executedQuery) {
        return new StepResult(step.index(), step.tool(), StepStatus.SUCCEEDED, payload, null,
            "Returned " + payload.size() + " item(s)", attempts, executedQuery);
    }

    public static StepResult failure(PlanStep step, ErrorKind kind, String message, int attempts) {
        return new StepResult(step.index(), step.tool(), StepStatus.FAILED, null, kind, message, attempts, null);
    }

    public boolean isSuccess() {
        return status == StepStatus.SUCCEEDED;
    }
}
