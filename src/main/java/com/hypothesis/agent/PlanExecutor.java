package com.hypothesis.agent;

import com.hypothesis.agent.tool.Capability;
import com.hypothesis.agent.tool.CapabilityDescriptor;
import com.hypothesis.agent.tool.ToolAnswer;
import com.hypothesis.agent.tool.ToolContext;
import com.hypothesis.agent.tool.ToolDispatcher;
import com.hypothesis.agent.tool.ToolRegistry;
import com.hypothesis.core.ErrorKind;
import com.hypothesis.core.Plan;
import com.hypothesis.core.PlanStep;
import com.hypothesis.core.Session;
import com.hypothesis.core.StepPayload;
import com.hypothesis.core.StepResult;
import com.hypothesis.exception.PlanGenerationException;
import com.hypothesis.exception.ResearchException;
import com.hypothesis.exception.TurnAbandonedException;
import com.hypothesis.exception.UnknownToolException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Runs plan steps one after another and records one result per step.
 *
 * <p>The whole plan is checked against the registry before the first dispatch. Tool failures become
 * failed results and never abort the plan; a step whose dependency failed is recorded as failed without
 * calling its tool. The only early exit is an abandoned turn, checked between steps.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PlanExecutor {

    private final ToolRegistry registry;
    private final ToolDispatcher dispatcher;

    /**
     * @return results aligned with {@code plan.steps()}
     * @throws UnknownToolException    a step names an unregistered tool; nothing was dispatched
     * @throws PlanGenerationException a step depends on itself or a later step; nothing was dispatched
     * @throws TurnAbandonedException  the session abandoned the turn between two steps
     */
    public List<StepResult> execute(Plan plan, Session session) {
        List<Capability> capabilities = validate(plan);
        List<StepResult> results = new ArrayList<>(plan.size());

        for (PlanStep step : plan.steps()) {
            if (session.isAbandoned()) {
                log.info("[{}] turn abandoned before step {}", session.getId(), step.index());
                throw new TurnAbandonedException(session.getId(), results.size());
            }
            StepResult result = runStep(step, capabilities.get(step.index()), results, session);
            results.add(result);
            log.info("[{}] step {} ({}) {} after {} attempt(s): {}", session.getId(), step.index(), step.tool(),
                result.status(), result.attempts(), result.message());
        }
        return results;
    }

    private List<Capability> validate(Plan plan) {
        List<Capability> capabilities = new ArrayList<>(plan.size());
        for (int i = 0; i < plan.size(); i++) {
            PlanStep step = plan.steps().get(i);
            if (step.index() != i) {
                throw new PlanGenerationException("Step at position " + i + " has index " + step.index());
            }
            CapabilityDescriptor descriptor = registry.lookup(step.tool())
                .orElseThrow(() -> new UnknownToolException(step.tool(), registry.validToolNames()));
            for (int dependency : step.dependsOn()) {
                if (dependency < 0 || dependency >= step.index()) {
                    throw new PlanGenerationException("Step " + step.index() + " depends on step " + dependency
                        + ", which does not come before it");
                }
            }
            capabilities.add(descriptor.capability());
        }
        return capabilities;
    }

    private StepResult runStep(PlanStep step, Capability capability, List<StepResult> earlier, Session session) {
        List<StepResult> failedDependencies = step.dependsOn().stream()
            .map(earlier::get)
            .filter(result -> !result.isSuccess())
            .collect(Collectors.toList());

        if (!failedDependencies.isEmpty()) {
            ErrorKind kind = capability == Capability.GRAPH_ANALYSIS
                ? ErrorKind.ANALYSIS_PARAMETER
                : ErrorKind.DEPENDENCY_FAILED;
            String failed = failedDependencies.stream()
                .map(r -> "step " + r.index() + " (" + r.tool() + ", " + r.errorKind() + ")")
                .collect(Collectors.joining(", "));
            return StepResult.failure(step, kind, "Required input missing: " + failed + " did not succeed", 0);
        }

        ToolContext context = new ToolContext(session.getId(), step, earlier);
        try {
            ToolAnswer<? extends StepPayload> answer = dispatcher.dispatch(capability, step.query(), context);
            return StepResult.success(step, answer.payload(), answer.attempts(), answer.executedQuery());

        } catch (ResearchException e) {
            int attempts = e.getAttempts();
            if (e.getKind().isFatal()) {
                int fatal = session.recordFatalFailure();
                log.error("[{}] step {} hit fatal {} (session total {}): {}", session.getId(), step.index(),
                    e.getKind(), fatal, e.getMessage());
            }
            return StepResult.failure(step, e.getKind(), e.getMessage(), attempts);

        } catch (RuntimeException e) {
            log.error("[{}] step {} failed unexpectedly", session.getId(), step.index(), e);
            return StepResult.failure(step, ErrorKind.INTERNAL, e.getClass().getSimpleName() + ": " + e.getMessage(), 1);
        }
    }
}
