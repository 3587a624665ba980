package com.hypothesis.agent.tool;

import com.hypothesis.core.GraphQueryPayload;
import com.hypothesis.core.PlanStep;
import com.hypothesis.core.StepResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * What a tool may see while answering a step: its session, the step and the results recorded before it.
 *
 * @param sessionId    owning session, for logging
 * @param step         the step being answered
 * @param priorResults results of all earlier steps, in plan order
 */
public record ToolContext(String sessionId, PlanStep step, List<StepResult> priorResults) {

    public ToolContext {
        priorResults = priorResults == null ? List.of() : List.copyOf(priorResults);
    }

    /**
     * Results of the steps this step depends on.
     */
    public List<StepResult> dependencyResults() {
        List<StepResult> results = new ArrayList<>();
        for (int index : step.dependsOn()) {
            if (index >= 0 && index < priorResults.size()) {
                results.add(priorResults.get(index));
            }
        }
        return results;
    }

    /**
     * Graph query payload to analyse: the given step if set, otherwise the latest successful graph query
     * among the dependencies, then among all earlier steps.
     */
    public Optional<GraphQueryPayload> graphQueryPayload(Integer sourceStep) {
        if (sourceStep != null) {
            if (sourceStep < 0 || sourceStep >= priorResults.size()) {
                return Optional.empty();
            }
            return asGraphQuery(priorResults.get(sourceStep));
        }
        Optional<GraphQueryPayload> fromDependencies = latestGraphQuery(dependencyResults());
        return fromDependencies.isPresent() ? fromDependencies : latestGraphQuery(priorResults);
    }

    private static Optional<GraphQueryPayload> latestGraphQuery(List<StepResult> results) {
        for (int i = results.size() - 1; i >= 0; i--) {
            Optional<GraphQueryPayload> payload = asGraphQuery(results.get(i));
            if (payload.isPresent()) {
                return payload;
            }
        }
        return Optional.empty();
    }

    private static Optional<GraphQueryPayload> asGraphQuery(StepResult result) {
        if (result.isSuccess() && result.payload() instanceof GraphQueryPayload payload) {
            return Optional.of(payload);
        }
        return Optional.empty();
    }
}
