package com.hypothesis.core;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Directed edges materialized by a graph query step, consumed by graph analysis steps.
 *
 * <p>A row contributes an edge when it has {@code source} and {@code target} values. Node values may be
 * plain strings or node property maps, in which case {@code name}, {@code symbol} or {@code id} is used.
 * {@code truncated} marks a fragment cut off at the edge limit; analyses over it see part of the graph.
 */
public record GraphFragment(List<Edge> edges, boolean truncated) {

    public static final String SOURCE = "source";
    public static final String TARGET = "target";
    public static final String RELATION = "relation";

    public GraphFragment {
        edges = edges == null ? List.of() : List.copyOf(edges);
    }

    public GraphFragment(List<Edge> edges) {
        this(edges, false);
    }

    public static GraphFragment fromRows(List<Map<String, Object>> rows) {
        return fromRows(rows, false);
    }

    public static GraphFragment fromRows(List<Map<String, Object>> rows, boolean truncated) {
        List<Edge> edges = new ArrayList<>();
        for (Map<String, Object> row : rows) {
            String source = nodeName(row.get(SOURCE));
            String target = nodeName(row.get(TARGET));
            if (source != null && target != null) {
                Object relation = row.get(RELATION);
                edges.add(new Edge(source, target, relation != null ? relation.toString() : null));
            }
        }
        return new GraphFragment(edges, truncated);
    }

    public Set<String> nodes() {
        Set<String> nodes = new LinkedHashSet<>();
        for (Edge edge : edges) {
            nodes.add(edge.source());
            nodes.add(edge.target());
        }
        return nodes;
    }

    public boolean isEmpty() {
        return edges.isEmpty();
    }

    private static String nodeName(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Map<?, ?> properties) {
            for (String key : List.of("name", "symbol", "id")) {
                Object candidate = properties.get(key);
                if (candidate != null) {
                    return candidate.toString();
                }
            }
            return null;
        }
        String text = value.toString();
        return text.isBlank() ? null : text;
    }

    public record Edge(String source, String target, String relation) {
    }
}
