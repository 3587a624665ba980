package com.hypothesis.agent.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.hypothesis.agent.tool.AbstractGenerativeTool;
import com.hypothesis.agent.tool.Capability;
import com.hypothesis.agent.tool.CapabilityDescriptor;
import com.hypothesis.agent.tool.ToolContext;
import com.hypothesis.configuration.ResearchProperties;
import com.hypothesis.core.GraphFragment;
import com.hypothesis.core.GraphQueryPayload;
import com.hypothesis.knowledge.GraphRows;
import com.hypothesis.knowledge.PathwayGraphStore;
import com.hypothesis.service.LanguageModelGateway;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Answers sub-queries with generated Cypher over the KEGG pathway graph.
 */
@Slf4j
@Component
public class GraphQueryTool extends AbstractGenerativeTool<String, GraphQueryPayload> {

    static final String TIPS = """
        - use the `pathway_titles` attribute (a list) to filter for diseases and pathways
        - don't be overly specific with the query
        - use lower case when matching names, e.g. toLower(toString(x)) = 'cancer'
        - always use toString() in string comparisons
        - normalise names and try known synonyms of the terms in the question
        - escape single or double quotes inside search strings with a backslash
        - to feed graph_analysis, return edges as `source`, `target` (node names) and optionally `relation`
        - never write to the graph
        """;

    private static final CapabilityDescriptor DESCRIPTOR = new CapabilityDescriptor(
        Capability.GRAPH_QUERY,
        "Cypher query over the KEGG pathway graph (genes, pathways, GO terms; regulates, participates-in and "
            + "annotated-with relationships). Use for gene-to-pathway and regulation questions. Rows with "
            + "source/target columns become the graph that graph_analysis works on.",
        CapabilityDescriptor.QueryShape.FREE_TEXT,
        2);

    private final PathwayGraphStore graphStore;

    public GraphQueryTool(LanguageModelGateway gateway, ResearchProperties properties, PathwayGraphStore graphStore) {
        super(gateway, properties);
        this.graphStore = graphStore;
    }

    @Override
    public CapabilityDescriptor getDescriptor() {
        return DESCRIPTOR;
    }

    @Override
    protected String templateName() {
        return "graph-query-generator";
    }

    @Override
    protected Map<String, Object> templateVariables(String subQuery, ToolContext context) {
        Map<String, Object> variables = new HashMap<>();
        variables.put("schema", graphStore.getSchema());
        variables.put("tips", TIPS);
        variables.put("maxRows", properties.getMaxResultRows());
        return variables;
    }

    @Override
    protected String parseQuery(JsonNode response) {
        String cypher = gateway.getParser().requireText(response, "query", agentName()).trim();
        while (cypher.endsWith(";")) {
            cypher = cypher.substring(0, cypher.length() - 1).trim();
        }
        gateway.getParser().optionalText(response, "explanation")
            .ifPresent(explanation -> log.debug("Query explanation: {}", explanation));
        return cypher;
    }

    @Override
    protected String render(String query) {
        return query;
    }

    @Override
    protected GraphQueryPayload execute(String cypher, ToolContext context) {
        GraphRows rows = graphStore.executeRead(cypher, properties.getMaxResultRows(), properties.getMaxGraphEdges());
        if (rows.isEdgesTruncated()) {
            log.warn("Graph query returned {} edges, keeping {} for analysis", rows.totalEdges(),
                rows.edgeRows().size());
        }
        return new GraphQueryPayload(cypher, rows.rows(), rows.totalRows(),
            GraphFragment.fromRows(rows.edgeRows(), rows.isEdgesTruncated()));
    }
}
