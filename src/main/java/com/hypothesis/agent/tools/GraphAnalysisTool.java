package com.hypothesis.agent.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.hypothesis.agent.tool.AbstractGenerativeTool;
import com.hypothesis.agent.tool.Capability;
import com.hypothesis.agent.tool.CapabilityDescriptor;
import com.hypothesis.agent.tool.ToolContext;
import com.hypothesis.analysis.AnalysisRequest;
import com.hypothesis.analysis.GraphAnalysis;
import com.hypothesis.analysis.GraphAnalyzer;
import com.hypothesis.configuration.ResearchProperties;
import com.hypothesis.core.AnalysisPayload;
import com.hypothesis.core.GraphQueryPayload;
import com.hypothesis.exception.AnalysisParameterException;
import com.hypothesis.exception.OracleResponseException;
import com.hypothesis.service.LanguageModelGateway;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Runs catalogue analyses over the graph fetched by an earlier graph query step.
 *
 * <p>The language model only chooses the analysis and its parameters; the computation is deterministic.
 */
@Component
public class GraphAnalysisTool extends AbstractGenerativeTool<AnalysisRequest, AnalysisPayload> {

    private static final int NODE_SAMPLE = 100;

    private static final CapabilityDescriptor DESCRIPTOR = new CapabilityDescriptor(
        Capability.GRAPH_ANALYSIS,
        "Network analysis (shortest_path, degree_centrality, subgraph, impact) over edges returned by an "
            + "earlier graph_query step with source/target columns. Must depend on that step. Use for "
            + "centrality, path and impact-scoring questions.",
        CapabilityDescriptor.QueryShape.STRUCTURED_FILTER,
        3);

    private final GraphAnalyzer analyzer;

    public GraphAnalysisTool(LanguageModelGateway gateway, ResearchProperties properties, GraphAnalyzer analyzer) {
        super(gateway, properties);
        this.analyzer = analyzer;
    }

    @Override
    public CapabilityDescriptor getDescriptor() {
        return DESCRIPTOR;
    }

    @Override
    protected void checkPreconditions(ToolContext context) {
        GraphQueryPayload source = context.graphQueryPayload(null)
            .orElseThrow(() -> AnalysisParameterException.missingInput(
                "Graph analysis needs a successful earlier graph_query step"));
        if (source.fragment().isEmpty()) {
            throw AnalysisParameterException.missingInput(
                "The graph_query step returned no source/target edges to analyse");
        }
    }

    @Override
    protected String templateName() {
        return "graph-analysis-selector";
    }

    @Override
    protected Map<String, Object> templateVariables(String subQuery, ToolContext context) {
        GraphQueryPayload source = context.graphQueryPayload(null).orElseThrow();
        Map<String, Object> variables = new HashMap<>();
        variables.put("catalogue", GraphAnalysis.catalogue());
        variables.put("nodes", source.fragment().nodes().stream().limit(NODE_SAMPLE)
            .collect(Collectors.joining(", ")));
        variables.put("edgeCount", source.fragment().edges().size());
        variables.put("truncated", source.fragment().truncated());
        return variables;
    }

    @Override
    protected AnalysisRequest parseQuery(JsonNode response) {
        gateway.getParser().requireText(response, "analysis", agentName());
        JsonNode parameters = response.get("parameters");
        if (parameters != null && !parameters.isNull() && !parameters.isObject()) {
            throw new OracleResponseException(agentName(), "field 'parameters' is not an object");
        }
        return gateway.getParser().convert(response, AnalysisRequest.class, agentName());
    }

    @Override
    protected String render(AnalysisRequest request) {
        return gateway.getParser().toJson(request);
    }

    @Override
    protected AnalysisPayload execute(AnalysisRequest request, ToolContext context) {
        GraphQueryPayload source = context.graphQueryPayload(request.sourceStep())
            .orElseThrow(() -> AnalysisParameterException.badParameter(
                "Step " + request.sourceStep() + " is not a successful graph_query step"));
        return analyzer.analyze(request, source.fragment());
    }
}
