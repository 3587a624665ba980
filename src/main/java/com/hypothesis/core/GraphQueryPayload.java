package com.hypothesis.core;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rows returned by a Cypher statement against the pathway graph.
 *
 * @param cypher    the statement that produced the rows
 * @param rows      result rows, capped
 * @param totalRows row count before capping
 * @param fragment  edges derived from {@code source}/{@code target} columns, possibly empty
 */
public record GraphQueryPayload(String cypher, List<Map<String, Object>> rows, int totalRows,
                                GraphFragment fragment) implements StepPayload {

    @Override
    public List<String> fields() {
        Set<String> keys = new LinkedHashSet<>();
        rows.forEach(row -> keys.addAll(row.keySet()));
        return new ArrayList<>(keys);
    }

    @Override
    public int size() {
        return rows.size();
    }
}
