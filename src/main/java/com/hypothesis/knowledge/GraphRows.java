package com.hypothesis.knowledge;

import java.util.List;
import java.util.Map;

/**
 * Rows read from the pathway graph, capped, with the uncapped count.
 *
 * <p>{@code edgeRows} holds the {@code source}/{@code target}/{@code relation} columns of rows that have
 * both endpoints, under a separate, larger cap, so graph analysis is not limited to the rows shown to the
 * language model.
 *
 * @param rows       result rows, capped at the row limit
 * @param totalRows  row count before capping
 * @param edgeRows   edge columns of rows with both endpoints, capped at the edge limit
 * @param totalEdges edge row count before capping
 */
public record GraphRows(List<Map<String, Object>> rows, int totalRows,
                        List<Map<String, Object>> edgeRows, int totalEdges) {

    public GraphRows {
        rows = List.copyOf(rows);
        edgeRows = List.copyOf(edgeRows);
    }

    /**
     * Rows that are their own edge list, for results small enough to be kept whole.
     */
    public GraphRows(List<Map<String, Object>> rows, int totalRows) {
        this(rows, totalRows, rows, rows.size());
    }

    public boolean isTruncated() {
        return totalRows > rows.size();
    }

    public boolean isEdgesTruncated() {
        return totalEdges > edgeRows.size();
    }
}
