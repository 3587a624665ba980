package com.hypothesis.agent.tool;

import com.hypothesis.core.AnalysisPayload;
import com.hypothesis.core.AnnotationPayload;
import com.hypothesis.core.GraphQueryPayload;
import com.hypothesis.core.StepPayload;

/**
 * One method per capability. Steps reach adapters only through {@link #dispatch}, which switches over
 * the closed capability set.
 */
public interface ToolDispatcher {

    ToolAnswer<GraphQueryPayload> answerGraphQuery(String subQuery, ToolContext context);

    ToolAnswer<AnnotationPayload> answerAnnotationQuery(String subQuery, ToolContext context);

    ToolAnswer<AnalysisPayload> answerGraphAnalysis(String subQuery, ToolContext context);

    default ToolAnswer<? extends StepPayload> dispatch(Capability capability, String subQuery, ToolContext context) {
        return switch (capability) {
            case GRAPH_QUERY -> answerGraphQuery(subQuery, context);
            case ANNOTATION_QUERY -> answerAnnotationQuery(subQuery, context);
            case GRAPH_ANALYSIS -> answerGraphAnalysis(subQuery, context);
        };
    }
}
