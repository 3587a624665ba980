package com.hypothesis.agent.tool;

import com.hypothesis.core.StepPayload;

/**
 * A backend adapter: turns a natural-language sub-query into a typed payload.
 *
 * <p>Example:
 * <pre>
 * ToolAnswer&lt;AnnotationPayload&gt; answer = annotationTool.answer(
 *     "GO terms annotated to BRCA1 with their evidence codes", context);
 * </pre>
 *
 * @param <P> payload type
 */
public interface ResearchTool<P extends StepPayload> {

    CapabilityDescriptor getDescriptor();

    /**
     * Answer one sub-query.
     *
     * @throws com.hypothesis.exception.ResearchException classified failure; retryable failures have
     *         already been retried
     */
    ToolAnswer<P> answer(String subQuery, ToolContext context);
}
