package com.hypothesis.core;

import java.util.List;

/**
 * Tool-specific success payload of a step.
 */
public interface StepPayload {

    /**
     * Names of the fields this payload carries (column names, metric names).
     */
    List<String> fields();

    /**
     * Number of rows or metrics, for logging and summaries.
     */
    int size();
}
