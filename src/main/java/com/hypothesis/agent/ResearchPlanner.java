package com.hypothesis.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.hypothesis.agent.tool.Capability;
import com.hypothesis.agent.tool.ToolRegistry;
import com.hypothesis.agent.tool.ToolSelectionPolicy;
import com.hypothesis.configuration.ResearchProperties;
import com.hypothesis.core.Plan;
import com.hypothesis.core.PlanStep;
import com.hypothesis.core.Session;
import com.hypothesis.exception.OracleResponseException;
import com.hypothesis.exception.OracleUnavailableException;
import com.hypothesis.exception.PlanGenerationException;
import com.hypothesis.exception.ResearchException;
import com.hypothesis.exception.UnknownToolException;
import com.hypothesis.service.LanguageModelGateway;
import com.hypothesis.service.OracleResponseParser;
import com.hypothesis.util.TranscriptFormatter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Decomposes a research question into tool-routed steps.
 *
 * <p>The plan is validated as a whole: any step without a registered tool, without a sub-query or with a
 * forward dependency rejects the plan with {@link PlanGenerationException}. Nothing is guessed.
 *
 * <p>With reflection enabled, the model reviews each valid plan. A rejected plan is regenerated with the
 * rejection as feedback, up to {@code app.research.max-plan-attempts} times.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ResearchPlanner {

    static final String AGENT_NAME = "ResearchPlanner";
    static final String REFLECTION_AGENT_NAME = "PlanReflection";

    private final LanguageModelGateway gateway;
    private final ToolSelectionPolicy selectionPolicy;
    private final ResearchProperties properties;

    public Plan plan(String question, ToolRegistry capabilities, Session session) {
        String history = TranscriptFormatter.format(session.recentTurns(properties.getPromptHistoryTurns()));
        Map<String, Object> variables = new HashMap<>();
        variables.put("question", question);
        variables.put("tools", capabilities.describe());
        variables.put("maxSteps", properties.getMaxPlanSteps());
        variables.put("history", history);

        int maxAttempts = properties.getMaxPlanAttempts();
        String feedback = "";
        String lastRejection = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            variables.put("feedback", feedback);
            Plan plan = generate(variables, question, capabilities, session);

            Optional<String> rejection = properties.isReflectionEnabled()
                ? reflect(question, history, plan, session)
                : Optional.empty();
            if (rejection.isEmpty()) {
                log.info("[{}] plan '{}' with {} step(s) on attempt {}: {}", session.getId(), plan.objective(),
                    plan.size(), attempt, plan.steps().stream().map(PlanStep::tool).toList());
                return plan;
            }

            lastRejection = rejection.get();
            feedback = "Your previous plan was:\n" + gateway.getParser().toJson(plan)
                + "\nIt was rejected because: " + lastRejection + "\nRevise the plan.";
            log.warn("[{}] plan attempt {}/{} rejected on reflection: {}", session.getId(), attempt, maxAttempts,
                lastRejection);
        }
        throw new PlanGenerationException("Plan rejected after " + maxAttempts + " attempt(s): " + lastRejection);
    }

    private Plan generate(Map<String, Object> variables, String question, ToolRegistry capabilities,
                          Session session) {
        JsonNode response;
        try {
            response = gateway.completeJson("research-planner", variables, AGENT_NAME, session.getId());
        } catch (ResearchException e) {
            throw new PlanGenerationException("Planner output unusable: " + e.getMessage(), e);
        }

        try {
            return parse(response, question, capabilities);
        } catch (OracleResponseException e) {
            throw new PlanGenerationException("Malformed plan: " + e.getMessage(), e);
        }
    }

    /**
     * Asks the model whether the plan serves the question.
     *
     * @return the rejection reason, empty on acceptance or when no verdict could be obtained
     */
    private Optional<String> reflect(String question, String history, Plan plan, Session session) {
        Map<String, Object> variables = new HashMap<>();
        variables.put("question", question);
        variables.put("history", history);
        variables.put("plan", gateway.getParser().toJson(plan));

        JsonNode verdict;
        try {
            verdict = gateway.completeJson("plan-reflection", variables, REFLECTION_AGENT_NAME, session.getId());
        } catch (OracleResponseException | OracleUnavailableException e) {
            log.warn("[{}] no usable plan reflection, accepting plan: {}", session.getId(), e.getMessage());
            return Optional.empty();
        }

        JsonNode acceptance = verdict.get("acceptance");
        if (acceptance != null && acceptance.isBoolean() && !acceptance.booleanValue()) {
            return Optional.of(gateway.getParser().optionalText(verdict, "reflection")
                .orElse("the plan does not answer the question"));
        }
        return Optional.empty();
    }

    private Plan parse(JsonNode response, String question, ToolRegistry capabilities) {
        OracleResponseParser parser = gateway.getParser();
        String objective = parser.optionalText(response, "objective").orElse(question);

        JsonNode stepsNode = response.get("steps");
        if (stepsNode == null || !stepsNode.isArray() || stepsNode.isEmpty()) {
            throw new PlanGenerationException("Plan has no steps");
        }
        if (stepsNode.size() > properties.getMaxPlanSteps()) {
            throw new PlanGenerationException("Plan has " + stepsNode.size() + " steps, limit is "
                + properties.getMaxPlanSteps());
        }

        List<PlanStep> steps = new ArrayList<>();
        for (int index = 0; index < stepsNode.size(); index++) {
            JsonNode stepNode = stepsNode.get(index);
            if (!stepNode.isObject()) {
                throw new PlanGenerationException("Step " + index + " is not an object");
            }
            String tool = resolveTool(stepNode, index, capabilities);
            String query = parser.optionalText(stepNode, "query").orElse(null);
            if (query == null) {
                throw new PlanGenerationException("Step " + index + " has no query");
            }
            List<Integer> dependsOn = dependencies(stepNode, index);

            if (dependsOn.isEmpty() && Capability.GRAPH_ANALYSIS.getToolName().equals(tool)) {
                dependsOn = latestGraphQuery(steps);
            }
            steps.add(new PlanStep(index, tool, query, dependsOn));
        }
        return new Plan(objective, steps);
    }

    private String resolveTool(JsonNode stepNode, int index, ToolRegistry capabilities) {
        List<String> candidates = gateway.getParser().stringList(stepNode,
            stepNode.has("tools") ? "tools" : "tool", AGENT_NAME);
        if (candidates.isEmpty()) {
            throw new PlanGenerationException("Step " + index + " names no tool");
        }

        List<String> unknown = candidates.stream().filter(name -> !capabilities.contains(name)).toList();
        if (unknown.size() == candidates.size()) {
            throw new PlanGenerationException("Step " + index + " names unknown tool(s) " + unknown,
                new UnknownToolException(unknown.get(0), capabilities.validToolNames()));
        }
        if (!unknown.isEmpty()) {
            log.warn("Step {} candidate tool(s) {} are not registered, ignoring them", index, unknown);
        }

        String chosen = selectionPolicy.choose(candidates).orElseThrow();
        if (candidates.size() > 1) {
            log.debug("Step {} candidates {} resolved to {}", index, candidates, chosen);
        }
        return chosen;
    }

    private List<Integer> dependencies(JsonNode stepNode, int index) {
        JsonNode node = stepNode.get("dependsOn");
        List<Integer> dependsOn = new ArrayList<>();
        if (node == null || node.isNull()) {
            return dependsOn;
        }
        List<JsonNode> items = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(items::add);
        } else if (node.isNumber()) {
            items.add(node);
        } else {
            throw new PlanGenerationException("Step " + index + " has a malformed dependsOn");
        }
        for (JsonNode item : items) {
            if (!item.canConvertToInt()) {
                throw new PlanGenerationException("Step " + index + " has a non-numeric dependency " + item);
            }
            int dependency = item.asInt();
            if (dependency < 0 || dependency >= index) {
                throw new PlanGenerationException("Step " + index + " depends on step " + dependency
                    + ", which does not come before it");
            }
            if (!dependsOn.contains(dependency)) {
                dependsOn.add(dependency);
            }
        }
        return dependsOn;
    }

    private static List<Integer> latestGraphQuery(List<PlanStep> earlier) {
        for (int i = earlier.size() - 1; i >= 0; i--) {
            if (Capability.GRAPH_QUERY.getToolName().equals(earlier.get(i).tool())) {
                return List.of(earlier.get(i).index());
            }
        }
        return List.of();
    }
}
