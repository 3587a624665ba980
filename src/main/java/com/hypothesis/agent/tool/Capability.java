package com.hypothesis.agent.tool;

import java.util.Arrays;
import java.util.Optional;

/**
 * Closed set of research capabilities. Each has exactly one tool.
 */
public enum Capability {
    GRAPH_QUERY("graph_query"),
    ANNOTATION_QUERY("annotation_query"),
    GRAPH_ANALYSIS("graph_analysis");

    private final String toolName;

    Capability(String toolName) {
        this.toolName = toolName;
    }

    /**
     * Name used in plans and prompts.
     */
    public String getToolName() {
        return toolName;
    }

    public static Optional<Capability> fromToolName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
            .filter(c -> c.toolName.equals(name.trim()))
            .findFirst();
    }
}
