package com.hypothesis.core;

import com.hypothesis.annotation.AnnotationFilter;

import java.util.List;
import java.util.Map;

/**
 * Rows or aggregates selected from the genome annotation table.
 *
 * @param filter      the filter that produced the rows
 * @param columns     output columns, in order
 * @param rows        result rows, after limit
 * @param matchedRows rows that matched before grouping and limit
 */
public record AnnotationPayload(AnnotationFilter filter, List<String> columns,
                                List<Map<String, Object>> rows, int matchedRows) implements StepPayload {

    @Override
    public List<String> fields() {
        return columns;
    }

    @Override
    public int size() {
        return rows.size();
    }
}
