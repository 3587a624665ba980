package com.hypothesis.analysis;

import com.hypothesis.core.AnalysisPayload;
import com.hypothesis.core.GraphFragment;
import com.hypothesis.exception.AnalysisParameterException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.IntSummaryStatistics;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Runs catalogue analyses over a graph fragment produced by an earlier graph query.
 *
 * <p>Parameter problems the language model can fix (unknown node, missing parameter) are retryable;
 * an empty fragment is not.
 */
@Slf4j
@Component
public class GraphAnalyzer {

    private static final int DEFAULT_TOP = 10;
    private static final int MAX_DEPTH = 5;

    public AnalysisPayload analyze(AnalysisRequest request, GraphFragment fragment) {
        GraphAnalysis analysis = GraphAnalysis.fromName(request.analysis())
            .orElseThrow(() -> AnalysisParameterException.badParameter("Unknown analysis '" + request.analysis()
                + "'. Available: shortest_path, degree_centrality, subgraph, impact"));

        for (String required : analysis.getRequiredParameters()) {
            if (!request.parameters().containsKey(required)) {
                throw AnalysisParameterException.badParameter(
                    analysis.getName() + " requires parameter '" + required + "'");
            }
        }

        if (fragment == null || fragment.isEmpty()) {
            throw AnalysisParameterException.missingInput(
                "The graph query step returned no source/target edges to analyse");
        }

        PathwayGraph graph = PathwayGraph.of(fragment);
        log.debug("Running {} over {} nodes / {} edges", analysis.getName(), graph.nodeCount(), graph.edgeCount());

        Map<String, Object> metrics = switch (analysis) {
            case SHORTEST_PATH -> shortestPath(graph, request.parameters());
            case DEGREE_CENTRALITY -> degreeCentrality(graph, request.parameters());
            case SUBGRAPH -> subgraph(graph, request.parameters());
            case IMPACT -> impact(graph, request.parameters());
        };

        if (fragment.truncated()) {
            log.warn("{} computed over a truncated graph of {} edges", analysis.getName(), graph.edgeCount());
        }
        return new AnalysisPayload(analysis.getName(), request.parameters(), metrics, fragment.truncated());
    }

    private Map<String, Object> shortestPath(PathwayGraph graph, Map<String, Object> params) {
        String source = node(graph, params, "source");
        String target = node(graph, params, "target");

        boolean directed = true;
        List<String> path = graph.shortestPath(source, target, true);
        if (path.isEmpty()) {
            directed = false;
            path = graph.shortestPath(source, target, false);
        }

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("path", path);
        metrics.put("length", path.isEmpty() ? -1 : path.size() - 1);
        metrics.put("reachable", !path.isEmpty());
        metrics.put("directed", !path.isEmpty() && directed);
        return metrics;
    }

    private Map<String, Object> degreeCentrality(PathwayGraph graph, Map<String, Object> params) {
        int n = graph.nodeCount();
        double norm = n > 1 ? n - 1 : 1;

        List<Map<String, Object>> ranking = graph.graph().nodes().stream()
            .map(node -> {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("node", node);
                entry.put("degree", graph.graph().degree(node));
                entry.put("inDegree", graph.graph().inDegree(node));
                entry.put("outDegree", graph.graph().outDegree(node));
                entry.put("centrality", round(graph.graph().degree(node) / norm));
                return entry;
            })
            .sorted(Comparator.comparing((Map<String, Object> e) -> (Integer) e.get("degree")).reversed()
                .thenComparing(e -> (String) e.get("node")))
            .collect(Collectors.toList());

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("nodeCount", n);
        metrics.put("edgeCount", graph.edgeCount());

        if (params.containsKey("node")) {
            String node = node(graph, params, "node");
            for (int i = 0; i < ranking.size(); i++) {
                if (node.equals(ranking.get(i).get("node"))) {
                    metrics.put("node", ranking.get(i));
                    metrics.put("rank", i + 1);
                    break;
                }
            }
        } else {
            int top = intParam(params, "top", DEFAULT_TOP);
            metrics.put("top", ranking.subList(0, Math.min(top, ranking.size())));
        }
        return metrics;
    }

    private Map<String, Object> subgraph(PathwayGraph graph, Map<String, Object> params) {
        String node = node(graph, params, "node");
        int depth = Math.min(intParam(params, "depth", 1), MAX_DEPTH);

        Set<String> nodes = graph.neighbourhood(node, depth);
        List<Map<String, Object>> edges = new ArrayList<>();
        graph.graph().edges().forEach(pair -> {
            if (nodes.contains(pair.source()) && nodes.contains(pair.target())) {
                Map<String, Object> edge = new LinkedHashMap<>();
                edge.put("source", pair.source());
                edge.put("target", pair.target());
                edges.add(edge);
            }
        });

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("center", node);
        metrics.put("depth", depth);
        metrics.put("nodes", new ArrayList<>(nodes));
        metrics.put("edges", edges);
        return metrics;
    }

    /**
     * Subtree ratio, root/leaf distances and direct successors of a node.
     */
    private Map<String, Object> impact(PathwayGraph graph, Map<String, Object> params) {
        String node = node(graph, params, "node");

        Set<String> subtree = graph.reachableFrom(node);
        Map<String, Integer> downstream = graph.distancesFrom(node);

        List<Integer> rootToNode = new ArrayList<>();
        for (String root : graph.roots()) {
            if (!root.equals(node)) {
                Integer d = graph.distancesFrom(root).get(node);
                if (d != null) {
                    rootToNode.add(d);
                }
            }
        }

        List<String> leaves = graph.leaves();
        List<Integer> nodeToLeaf = new ArrayList<>();
        for (String leaf : leaves) {
            Integer d = downstream.get(leaf);
            if (d != null && !leaf.equals(node)) {
                nodeToLeaf.add(d);
            }
        }

        List<Integer> rootToLeaf = new ArrayList<>();
        for (String root : graph.roots()) {
            Map<String, Integer> fromRoot = graph.distancesFrom(root);
            for (String leaf : leaves) {
                Integer d = fromRoot.get(leaf);
                if (d != null && d > 0) {
                    rootToLeaf.add(d);
                }
            }
        }

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("node", node);
        metrics.put("subtreeRatio", round((double) subtree.size() / graph.nodeCount()));
        metrics.put("subtreeSize", subtree.size());
        metrics.put("rootToNode", minMax(rootToNode));
        metrics.put("nodeToLeaf", minMax(nodeToLeaf));
        metrics.put("rootToLeaf", minMax(rootToLeaf));
        metrics.put("directlyImpactedNodes", new ArrayList<>(graph.graph().successors(node)));
        return metrics;
    }

    private String node(PathwayGraph graph, Map<String, Object> params, String key) {
        Object value = params.get(key);
        if (value == null) {
            throw AnalysisParameterException.badParameter("Missing parameter '" + key + "'");
        }
        return graph.resolve(value.toString()).orElseThrow(() -> AnalysisParameterException.badParameter(
            "Node '" + value + "' is not in the fetched graph. Known nodes include: "
                + graph.graph().nodes().stream().limit(15).collect(Collectors.joining(", "))));
    }

    private int intParam(Map<String, Object> params, String key, int defaultValue) {
        Object value = params.get(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            int parsed = value instanceof Number number ? number.intValue() : Integer.parseInt(value.toString().trim());
            if (parsed < 1) {
                throw AnalysisParameterException.badParameter("Parameter '" + key + "' must be positive: " + value);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw AnalysisParameterException.badParameter("Parameter '" + key + "' is not a number: " + value);
        }
    }

    private static Map<String, Object> minMax(List<Integer> values) {
        Map<String, Object> range = new LinkedHashMap<>();
        if (values.isEmpty()) {
            range.put("min", null);
            range.put("max", null);
            return range;
        }
        IntSummaryStatistics stats = values.stream().mapToInt(Integer::intValue).summaryStatistics();
        range.put("min", stats.getMin());
        range.put("max", stats.getMax());
        return range;
    }

    private static double round(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }
}
