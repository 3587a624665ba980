package com.hypothesis.configuration;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Tunables of the research pipeline.
 *
 * <p>Properties are loaded from the {@code app.research} namespace in application.yml:
 * <pre>
 * app:
 *   research:
 *     max-query-attempts: 3
 *     history-window: 20
 *     prompt-history-turns: 10
 *     max-plan-steps: 8
 *     max-plan-attempts: 3
 *     max-result-rows: 50
 *     max-graph-edges: 5000
 *     graph-query-timeout: 30s
 *     degraded-threshold: 3
 *     reflection-enabled: true
 *     tool-preference: [graph_analysis, graph_query, annotation_query]
 * </pre>
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.research")
public class ResearchProperties {

    /**
     * Query generations per step before the step is recorded as failed. Never zero.
     */
    @Min(1)
    @Max(10)
    private int maxQueryAttempts = 3;

    /**
     * Turns kept per session; older turns are evicted.
     */
    @Min(2)
    private int historyWindow = 20;

    /**
     * Turns rendered into classifier, planner and reply prompts.
     */
    @Min(0)
    private int promptHistoryTurns = 10;

    @Min(1)
    private int maxPlanSteps = 8;

    /**
     * Plan generations when reflection keeps rejecting the plan.
     */
    @Min(1)
    @Max(10)
    private int maxPlanAttempts = 3;

    /**
     * Rows kept per step result; the rest are counted but dropped.
     */
    @Min(1)
    private int maxResultRows = 50;

    /**
     * Edges collected per graph query for graph analysis, independent of {@code maxResultRows}.
     */
    @Min(1)
    private int maxGraphEdges = 5000;

    /**
     * Row limit applied to annotation filters that do not set one.
     */
    @Min(1)
    private int defaultAnnotationLimit = 10;

    @NotNull
    private Duration graphQueryTimeout = Duration.ofSeconds(30);

    /**
     * Fatal backend failures after which turn responses carry the degraded flag.
     */
    @Min(1)
    private int degradedThreshold = 3;

    /**
     * Ask the language model whether each plan and each result answers its question before accepting it.
     */
    private boolean reflectionEnabled = true;

    /**
     * Tie-break order when a planned step names several candidate tools. Most specific first.
     */
    @NotEmpty
    private List<String> toolPreference = new ArrayList<>(List.of("graph_analysis", "graph_query", "annotation_query"));
}
