package com.hypothesis.agent.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.hypothesis.configuration.ResearchProperties;
import com.hypothesis.core.StepPayload;
import com.hypothesis.core.StepResult;
import com.hypothesis.exception.OracleResponseException;
import com.hypothesis.exception.OracleUnavailableException;
import com.hypothesis.exception.ReflectionRejectedException;
import com.hypothesis.exception.ResearchException;
import com.hypothesis.exception.RetriesExhaustedException;
import com.hypothesis.service.LanguageModelGateway;
import com.hypothesis.util.ExternalCallLogger;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Generate, validate, execute and reflect, with bounded retry.
 *
 * <p>Each attempt asks the language model for a query of type {@code Q}, parses it strictly and runs it.
 * Retryable failures are fed back into the next generation; anything else escalates immediately. After
 * {@code app.research.max-query-attempts} generations the step fails with {@link RetriesExhaustedException},
 * unless an earlier attempt produced a result that reflection rejected, in which case that result is kept.
 *
 * @param <Q> generated query type
 * @param <P> payload type
 */
@Slf4j
public abstract class AbstractGenerativeTool<Q, P extends StepPayload> implements ResearchTool<P> {

    private static final int PREVIEW_CHARS = 2000;

    protected final LanguageModelGateway gateway;
    protected final ResearchProperties properties;

    protected AbstractGenerativeTool(LanguageModelGateway gateway, ResearchProperties properties) {
        this.gateway = gateway;
        this.properties = properties;
    }

    /**
     * Prompt template that turns a sub-query into a query.
     */
    protected abstract String templateName();

    /**
     * Tool-specific prompt variables (schema, tips).
     */
    protected abstract Map<String, Object> templateVariables(String subQuery, ToolContext context);

    /**
     * Strict parse of the model output.
     *
     * @throws ResearchException retryable on malformed output
     */
    protected abstract Q parseQuery(JsonNode response);

    /**
     * Query as text, for feedback, logging and the step result.
     */
    protected abstract String render(Q query);

    protected abstract P execute(Q query, ToolContext context);

    /**
     * Checks that do not depend on the generated query. Failures here are never retried.
     */
    protected void checkPreconditions(ToolContext context) {
    }

    protected String agentName() {
        return getClass().getSimpleName();
    }

    @Override
    public final ToolAnswer<P> answer(String subQuery, ToolContext context) {
        checkPreconditions(context);

        int maxAttempts = properties.getMaxQueryAttempts();
        String feedback = "";
        ResearchException lastError = null;
        ToolAnswer<P> rejected = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            String queryText = null;
            try {
                Map<String, Object> variables = new HashMap<>(templateVariables(subQuery, context));
                variables.put("subQuery", subQuery);
                variables.put("feedback", feedback);
                variables.put("dependencies", describeDependencies(context));

                JsonNode response = gateway.completeJson(templateName(), variables, agentName(), context.sessionId());
                Q query = parseQuery(response);
                queryText = render(query);
                log.info("[{}] attempt {}/{}: {}", agentName(), attempt, maxAttempts,
                    ExternalCallLogger.truncate(queryText, 200));

                P payload = execute(query, context);
                ToolAnswer<P> answer = new ToolAnswer<>(payload, attempt, queryText);

                Optional<String> rejection = properties.isReflectionEnabled() && attempt < maxAttempts
                    ? reflect(subQuery, queryText, payload, context)
                    : Optional.empty();
                if (rejection.isEmpty()) {
                    return answer;
                }

                rejected = answer;
                lastError = new ReflectionRejectedException(rejection.get());
                feedback = feedback(queryText, lastError);
                log.warn("[{}] attempt {}/{} rejected on reflection: {}", agentName(), attempt, maxAttempts,
                    rejection.get());

            } catch (ResearchException e) {
                if (!e.isRetryable()) {
                    log.error("[{}] attempt {}/{} failed ({}), not retrying: {}", agentName(), attempt,
                        maxAttempts, e.getKind(), e.getMessage());
                    throw e.atAttempt(attempt);
                }
                lastError = e;
                feedback = feedback(queryText, e);
                log.warn("[{}] attempt {}/{} failed ({}): {}", agentName(), attempt, maxAttempts,
                    e.getKind(), e.getMessage());
            }
        }

        if (rejected != null) {
            log.info("[{}] keeping result of attempt {} after {} attempts", agentName(), rejected.attempts(),
                maxAttempts);
            return new ToolAnswer<>(rejected.payload(), maxAttempts, rejected.executedQuery());
        }
        throw new RetriesExhaustedException(getDescriptor().name(), maxAttempts, lastError);
    }

    /**
     * Asks the model whether the payload answers the sub-query.
     *
     * @return the rejection reason, empty on acceptance or when no verdict could be obtained
     */
    private Optional<String> reflect(String subQuery, String queryText, P payload, ToolContext context) {
        Map<String, Object> variables = new HashMap<>();
        variables.put("subQuery", subQuery);
        variables.put("query", queryText);
        variables.put("rowCount", payload.size());
        variables.put("result", ExternalCallLogger.truncate(gateway.getParser().toJson(payload), PREVIEW_CHARS));

        JsonNode verdict;
        try {
            verdict = gateway.completeJson("result-reflection", variables, "ResultReflection", context.sessionId());
        } catch (OracleResponseException | OracleUnavailableException e) {
            log.warn("[{}] no usable reflection, accepting result: {}", agentName(), e.getMessage());
            return Optional.empty();
        }

        JsonNode satisfied = verdict.get("satisfied");
        if (satisfied != null && satisfied.isBoolean() && !satisfied.booleanValue()) {
            return Optional.of(gateway.getParser().optionalText(verdict, "feedback")
                .orElse("the result does not answer the question"));
        }
        return Optional.empty();
    }

    private String describeDependencies(ToolContext context) {
        List<StepResult> dependencies = context.dependencyResults();
        if (dependencies.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (StepResult result : dependencies) {
            sb.append("[step ").append(result.index()).append("] ").append(result.tool()).append(": ");
            if (result.isSuccess()) {
                sb.append(ExternalCallLogger.truncate(gateway.getParser().toJson(result.payload()), PREVIEW_CHARS));
            } else {
                sb.append("FAILED - ").append(result.message());
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    private static String feedback(String queryText, ResearchException e) {
        if (queryText == null) {
            return "Your previous answer could not be used: " + e.getMessage();
        }
        return "Your previous query was:\n" + queryText + "\nIt failed with: " + e.getMessage()
            + "\nFix the problem and try again.";
    }
}
