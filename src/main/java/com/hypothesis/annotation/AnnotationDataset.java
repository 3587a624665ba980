package com.hypothesis.annotation;

import com.hypothesis.core.AnnotationPayload;

import java.util.List;

/**
 * Read-only genome annotation table.
 *
 * <p>Implementations must be safe for concurrent queries.
 */
public interface AnnotationDataset {

    /**
     * Column names, including derived columns.
     *
     * @throws com.hypothesis.exception.DatasetUnavailableException if the table cannot be loaded
     */
    List<String> columns();

    /**
     * Column list with a few example values, for query generation prompts.
     */
    String describeSchema();

    /**
     * Apply a filter.
     *
     * @param filter       validated against {@link #columns()} and the operator set
     * @param defaultLimit row limit used when the filter has none
     * @throws com.hypothesis.exception.FilterSyntaxException on unknown columns, operators or limits
     * @throws com.hypothesis.exception.DatasetUnavailableException if the table cannot be loaded
     */
    AnnotationPayload query(AnnotationFilter filter, int defaultLimit);
}
