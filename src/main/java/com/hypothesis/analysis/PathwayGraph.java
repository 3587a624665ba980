package com.hypothesis.analysis;

import com.google.common.graph.GraphBuilder;
import com.google.common.graph.Graphs;
import com.google.common.graph.ImmutableGraph;
import com.google.common.graph.MutableGraph;
import com.hypothesis.core.GraphFragment;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Directed, immutable view of a graph fragment with breadth-first distance helpers.
 */
public final class PathwayGraph {

    private final ImmutableGraph<String> graph;
    private final Map<String, String> byLowerCase = new HashMap<>();

    private PathwayGraph(ImmutableGraph<String> graph) {
        this.graph = graph;
        for (String node : graph.nodes()) {
            byLowerCase.putIfAbsent(node.toLowerCase(Locale.ROOT), node);
        }
    }

    public static PathwayGraph of(GraphFragment fragment) {
        MutableGraph<String> graph = GraphBuilder.directed().allowsSelfLoops(true).build();
        for (GraphFragment.Edge edge : fragment.edges()) {
            graph.putEdge(edge.source(), edge.target());
        }
        return new PathwayGraph(ImmutableGraph.copyOf(graph));
    }

    public ImmutableGraph<String> graph() {
        return graph;
    }

    public int nodeCount() {
        return graph.nodes().size();
    }

    public int edgeCount() {
        return graph.edges().size();
    }

    /**
     * Exact node name, or a case-insensitive match.
     */
    public Optional<String> resolve(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String trimmed = name.trim();
        if (graph.nodes().contains(trimmed)) {
            return Optional.of(trimmed);
        }
        return Optional.ofNullable(byLowerCase.get(trimmed.toLowerCase(Locale.ROOT)));
    }

    /**
     * Nodes with no incoming edges.
     */
    public List<String> roots() {
        List<String> roots = new ArrayList<>();
        for (String node : graph.nodes()) {
            if (graph.inDegree(node) == 0) {
                roots.add(node);
            }
        }
        return roots;
    }

    /**
     * Nodes with no outgoing edges.
     */
    public List<String> leaves() {
        List<String> leaves = new ArrayList<>();
        for (String node : graph.nodes()) {
            if (graph.outDegree(node) == 0) {
                leaves.add(node);
            }
        }
        return leaves;
    }

    /**
     * Nodes reachable from {@code node} along edge direction, including itself.
     */
    public Set<String> reachableFrom(String node) {
        return Graphs.reachableNodes(graph, node);
    }

    /**
     * Breadth-first hop counts from {@code start} following edge direction.
     */
    public Map<String, Integer> distancesFrom(String start) {
        return bfs(start, graph::successors, new HashMap<>());
    }

    /**
     * Shortest path as node list, empty if unreachable.
     *
     * @param directed follow edge direction, or treat edges as undirected
     */
    public List<String> shortestPath(String source, String target, boolean directed) {
        Function<String, Set<String>> next = directed ? graph::successors : graph::adjacentNodes;
        Map<String, String> parents = new HashMap<>();
        Map<String, Integer> distances = bfs(source, next, parents);
        if (!distances.containsKey(target)) {
            return List.of();
        }
        List<String> path = new ArrayList<>();
        for (String at = target; at != null; at = parents.get(at)) {
            path.add(at);
        }
        Collections.reverse(path);
        return path;
    }

    /**
     * Nodes within {@code depth} hops in either direction.
     */
    public Set<String> neighbourhood(String node, int depth) {
        Map<String, Integer> distances = bfs(node, graph::adjacentNodes, new HashMap<>());
        Map<String, Integer> within = new LinkedHashMap<>();
        distances.forEach((n, d) -> {
            if (d <= depth) {
                within.put(n, d);
            }
        });
        return within.keySet();
    }

    private Map<String, Integer> bfs(String start, Function<String, Set<String>> next, Map<String, String> parents) {
        Map<String, Integer> distances = new LinkedHashMap<>();
        Deque<String> queue = new ArrayDeque<>();
        distances.put(start, 0);
        queue.add(start);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            int distance = distances.get(current);
            for (String neighbour : next.apply(current)) {
                if (!distances.containsKey(neighbour)) {
                    distances.put(neighbour, distance + 1);
                    parents.put(neighbour, current);
                    queue.add(neighbour);
                }
            }
        }
        return distances;
    }
}
