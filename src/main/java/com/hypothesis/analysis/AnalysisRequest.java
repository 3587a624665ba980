package com.hypothesis.analysis;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Analysis chosen by the language model for a sub-query.
 *
 * @param analysis   catalogue name, see {@link GraphAnalysis}
 * @param parameters analysis parameters, e.g. {@code {"node": "INSR"}}
 * @param sourceStep index of the graph query step whose rows form the graph; null for the latest one
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AnalysisRequest(String analysis, Map<String, Object> parameters, Integer sourceStep) {

    public AnalysisRequest {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (parameters != null) {
            parameters.forEach((key, value) -> {
                if (value != null) {
                    copy.put(key, value);
                }
            });
        }
        parameters = Collections.unmodifiableMap(copy);
    }
}
