package com.hypothesis.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.hypothesis.core.AnalysisPayload;
import com.hypothesis.core.Hypothesis;
import com.hypothesis.core.Plan;
import com.hypothesis.core.PlanStep;
import com.hypothesis.core.StepResult;
import com.hypothesis.exception.OracleResponseException;
import com.hypothesis.exception.ResearchException;
import com.hypothesis.service.LanguageModelGateway;
import com.hypothesis.util.ExternalCallLogger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns the question, plan and step results into the final answer.
 *
 * <p>The narrative comes from the language model. Two sections are always appended by code: what could not
 * be determined (one line per failed step not already mentioned) and which fields each successful step
 * returned. If the model call fails the narrative is replaced by a summary of the results.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HypothesisSynthesizer {

    static final String AGENT_NAME = "HypothesisSynthesizer";
    static final String UNDETERMINED_HEADER = "Could not determine:";
    static final String EVIDENCE_HEADER = "Evidence used:";

    private static final int RESULT_CHARS = 3000;

    private final LanguageModelGateway gateway;

    public Hypothesis synthesize(String question, Plan plan, List<StepResult> results, String sessionId) {
        String narrative;
        List<String> followUps = new ArrayList<>();

        try {
            JsonNode response = gateway.completeFinalJson("hypothesis-synthesizer",
                variables(question, plan, results), AGENT_NAME, sessionId);
            narrative = gateway.getParser().requireText(response, "hypothesis", AGENT_NAME);
            followUps.addAll(followUps(response, sessionId));
        } catch (ResearchException e) {
            log.warn("[{}] synthesis failed ({}), summarising results instead: {}", sessionId, e.getKind(),
                e.getMessage());
            narrative = fallbackNarrative(question, plan, results);
        }

        StringBuilder text = new StringBuilder(narrative.trim());
        appendUndetermined(text, narrative, plan, results);
        appendEvidence(text, results);
        return new Hypothesis(text.toString(), followUps);
    }

    /**
     * Follow-ups are optional: malformed ones are dropped without losing the narrative.
     */
    private List<String> followUps(JsonNode response, String sessionId) {
        try {
            return gateway.getParser().stringList(response, "followUps", AGENT_NAME);
        } catch (OracleResponseException e) {
            log.warn("[{}] ignoring malformed follow-up questions: {}", sessionId, e.getMessage());
            return List.of();
        }
    }

    private Map<String, Object> variables(String question, Plan plan, List<StepResult> results) {
        Map<String, Object> variables = new HashMap<>();
        variables.put("question", question);
        variables.put("objective", plan.objective());

        StringBuilder steps = new StringBuilder();
        for (StepResult result : results) {
            PlanStep step = plan.steps().get(result.index());
            steps.append("[step ").append(result.index()).append("] ").append(result.tool())
                .append(": ").append(step.query()).append('\n');
            if (result.isSuccess()) {
                steps.append("  fields: ").append(result.payload().fields()).append('\n')
                    .append("  data: ").append(ExternalCallLogger.truncate(
                        gateway.getParser().toJson(result.payload()), RESULT_CHARS)).append('\n');
            } else {
                steps.append("  FAILED (").append(result.errorKind()).append("): ")
                    .append(result.message()).append('\n');
            }
        }
        variables.put("steps", steps.toString());
        return variables;
    }

    /**
     * Lists failed steps the narrative does not already mention by step or by query.
     */
    private void appendUndetermined(StringBuilder text, String narrative, Plan plan, List<StepResult> results) {
        String lower = narrative.toLowerCase(Locale.ROOT);
        List<String> lines = new ArrayList<>();
        for (StepResult result : results) {
            if (result.isSuccess()) {
                continue;
            }
            String query = plan.steps().get(result.index()).query();
            if (lower.contains(query.toLowerCase(Locale.ROOT)) && lower.contains("could not")) {
                continue;
            }
            lines.add("- " + query + " (" + result.tool() + ", " + result.errorKind() + ": "
                + ExternalCallLogger.truncate(result.message(), 200) + ")");
        }
        if (!lines.isEmpty()) {
            text.append("\n\n").append(UNDETERMINED_HEADER).append('\n').append(String.join("\n", lines));
        }
    }

    private void appendEvidence(StringBuilder text, List<StepResult> results) {
        List<String> lines = new ArrayList<>();
        for (StepResult result : results) {
            if (result.isSuccess()) {
                String line = "- step " + result.index() + " (" + result.tool() + "): " + result.payload().size()
                    + " result(s), fields " + String.join(", ", result.payload().fields());
                if (result.payload() instanceof AnalysisPayload analysis && analysis.partialGraph()) {
                    line += ", computed on a partial graph";
                }
                lines.add(line);
            }
        }
        if (!lines.isEmpty()) {
            text.append("\n\n").append(EVIDENCE_HEADER).append('\n').append(String.join("\n", lines));
        }
    }

    private String fallbackNarrative(String question, Plan plan, List<StepResult> results) {
        long succeeded = results.stream().filter(StepResult::isSuccess).count();
        StringBuilder sb = new StringBuilder();
        sb.append("I could not write a full hypothesis for \"").append(question).append("\". ");
        sb.append("Of ").append(plan.size()).append(" research step(s), ").append(succeeded)
            .append(" returned data.");
        for (StepResult result : results) {
            if (result.isSuccess()) {
                sb.append("\n- ").append(plan.steps().get(result.index()).query()).append(": ")
                    .append(result.message());
            }
        }
        return sb.toString();
    }
}
