package com.hypothesis.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Metrics computed by one graph analysis routine.
 *
 * @param partialGraph the source fragment was cut off at the edge limit, so the metrics cover part of the graph
 */
public record AnalysisPayload(String analysis, Map<String, Object> parameters,
                              Map<String, Object> metrics, boolean partialGraph) implements StepPayload {

    public AnalysisPayload(String analysis, Map<String, Object> parameters, Map<String, Object> metrics) {
        this(analysis, parameters, metrics, false);
    }

    @Override
    public List<String> fields() {
        return new ArrayList<>(metrics.keySet());
    }

    @Override
    public int size() {
        return metrics.size();
    }
}
