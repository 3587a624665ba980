package com.hypothesis.analysis;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Fixed catalogue of analyses over a materialized pathway fragment.
 */
public enum GraphAnalysis {

    /**
     * Shortest directed path between two nodes, falling back to an undirected path.
     */
    SHORTEST_PATH("shortest_path", List.of("source", "target"),
        "Shortest path between two genes. Parameters: source, target."),

    /**
     * Normalized degree of one node, or the top ranked nodes.
     */
    DEGREE_CENTRALITY("degree_centrality", List.of(),
        "Degree centrality ranking. Parameters: node (optional), top (optional, default 10)."),

    /**
     * Neighbourhood of a node up to a depth.
     */
    SUBGRAPH("subgraph", List.of("node"),
        "Neighbourhood of a gene. Parameters: node, depth (optional, default 1, max 5)."),

    /**
     * Downstream impact metrics of a node.
     */
    IMPACT("impact", List.of("node"),
        "Downstream impact of perturbing a gene: subtree ratio, root and leaf distances, directly impacted nodes. "
            + "Parameters: node.");

    private final String name;
    private final List<String> requiredParameters;
    private final String description;

    GraphAnalysis(String name, List<String> requiredParameters, String description) {
        this.name = name;
        this.requiredParameters = requiredParameters;
        this.description = description;
    }

    public String getName() {
        return name;
    }

    public List<String> getRequiredParameters() {
        return requiredParameters;
    }

    public String getDescription() {
        return description;
    }

    public static Optional<GraphAnalysis> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
            .filter(a -> a.name.equalsIgnoreCase(name.trim()))
            .findFirst();
    }

    /**
     * Catalogue text for prompts.
     */
    public static String catalogue() {
        StringBuilder sb = new StringBuilder();
        for (GraphAnalysis analysis : values()) {
            sb.append("- ").append(analysis.name).append(": ").append(analysis.description).append('\n');
        }
        return sb.toString();
    }
}
