package com.hypothesis.agent.tool;

import com.hypothesis.core.StepPayload;

/**
 * Successful tool answer.
 *
 * @param payload       tool-specific result
 * @param attempts      query generations used, at least 1
 * @param executedQuery text of the query that produced the payload
 */
public record ToolAnswer<P extends StepPayload>(P payload, int attempts, String executedQuery) {
}
