package com.hypothesis.agent.tools;

import com.hypothesis.agent.tool.ToolAnswer;
import com.hypothesis.agent.tool.ToolContext;
import com.hypothesis.agent.tool.ToolDispatcher;
import com.hypothesis.core.AnalysisPayload;
import com.hypothesis.core.AnnotationPayload;
import com.hypothesis.core.GraphQueryPayload;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Binds each capability to its tool bean.
 */
@Component
@RequiredArgsConstructor
public class ResearchToolDispatcher implements ToolDispatcher {

    private final GraphQueryTool graphQueryTool;
    private final AnnotationQueryTool annotationQueryTool;
    private final GraphAnalysisTool graphAnalysisTool;

    @Override
    public ToolAnswer<GraphQueryPayload> answerGraphQuery(String subQuery, ToolContext context) {
        return graphQueryTool.answer(subQuery, context);
    }

    @Override
    public ToolAnswer<AnnotationPayload> answerAnnotationQuery(String subQuery, ToolContext context) {
        return annotationQueryTool.answer(subQuery, context);
    }

    @Override
    public ToolAnswer<AnalysisPayload> answerGraphAnalysis(String subQuery, ToolContext context) {
        return graphAnalysisTool.answer(subQuery, context);
    }
}
