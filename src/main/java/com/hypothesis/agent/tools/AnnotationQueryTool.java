package com.hypothesis.agent.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.hypothesis.agent.tool.AbstractGenerativeTool;
import com.hypothesis.agent.tool.Capability;
import com.hypothesis.agent.tool.CapabilityDescriptor;
import com.hypothesis.agent.tool.ToolContext;
import com.hypothesis.annotation.AnnotationDataset;
import com.hypothesis.annotation.AnnotationFilter;
import com.hypothesis.annotation.EvidenceCodes;
import com.hypothesis.configuration.ResearchProperties;
import com.hypothesis.core.AnnotationPayload;
import com.hypothesis.exception.OracleResponseException;
import com.hypothesis.service.LanguageModelGateway;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Answers sub-queries with generated filters over the GO annotation table.
 */
@Component
public class AnnotationQueryTool extends AbstractGenerativeTool<AnnotationFilter, AnnotationPayload> {

    static final String TIPS = """
        - use the `DB_Object_Symbol` column to filter for gene symbols
        - `GO_ID` holds GO term identifiers such as GO:0006281
        - `Aspect` is P (biological process), F (molecular function) or C (cellular component)
        - `Qualifier` may be negated, e.g. NOT|enables
        - prefer `distinct` when listing terms, and `groupBy` with a count to summarise
        """;

    private static final CapabilityDescriptor DESCRIPTOR = new CapabilityDescriptor(
        Capability.ANNOTATION_QUERY,
        "Filter and count rows of the GO annotation (GAF) table: gene symbol, GO term, evidence code, aspect, "
            + "qualifier. Use for gene-to-GO-term and evidence questions.",
        CapabilityDescriptor.QueryShape.STRUCTURED_FILTER,
        1);

    private final AnnotationDataset dataset;

    public AnnotationQueryTool(LanguageModelGateway gateway, ResearchProperties properties,
                               AnnotationDataset dataset) {
        super(gateway, properties);
        this.dataset = dataset;
    }

    @Override
    public CapabilityDescriptor getDescriptor() {
        return DESCRIPTOR;
    }

    @Override
    protected String templateName() {
        return "annotation-filter-generator";
    }

    @Override
    protected Map<String, Object> templateVariables(String subQuery, ToolContext context) {
        Map<String, Object> variables = new HashMap<>();
        variables.put("schema", dataset.describeSchema());
        variables.put("tips", TIPS);
        variables.put("defaultLimit", properties.getDefaultAnnotationLimit());
        variables.put("evidenceCodes", EvidenceCodes.all().entrySet().stream()
            .map(e -> e.getKey() + " = " + e.getValue())
            .collect(Collectors.joining(", ")));
        return variables;
    }

    @Override
    protected AnnotationFilter parseQuery(JsonNode response) {
        JsonNode filter = response.get("filter");
        if (filter == null || !filter.isObject()) {
            throw new OracleResponseException(agentName(), "missing object field 'filter'");
        }
        return gateway.getParser().convert(filter, AnnotationFilter.class, agentName());
    }

    @Override
    protected String render(AnnotationFilter filter) {
        return gateway.getParser().toJson(filter);
    }

    @Override
    protected AnnotationPayload execute(AnnotationFilter filter, ToolContext context) {
        AnnotationPayload payload = dataset.query(filter, properties.getDefaultAnnotationLimit());
        int maxRows = properties.getMaxResultRows();
        if (payload.rows().size() <= maxRows) {
            return payload;
        }
        return new AnnotationPayload(filter, payload.columns(), payload.rows().subList(0, maxRows),
            payload.matchedRows());
    }
}
