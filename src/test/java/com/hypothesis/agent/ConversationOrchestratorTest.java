package com.hypothesis.agent;

import com.hypothesis.agent.tool.ToolRegistry;
import com.hypothesis.agent.tool.ToolSelectionPolicy;
import com.hypothesis.agent.tools.AnnotationQueryTool;
import com.hypothesis.agent.tools.GraphAnalysisTool;
import com.hypothesis.agent.tools.GraphQueryTool;
import com.hypothesis.agent.tools.ResearchToolDispatcher;
import com.hypothesis.analysis.GraphAnalyzer;
import com.hypothesis.configuration.ResearchProperties;
import com.hypothesis.core.ErrorKind;
import com.hypothesis.core.Mode;
import com.hypothesis.core.Session;
import com.hypothesis.core.StepResult;
import com.hypothesis.core.TurnState;
import com.hypothesis.exception.GraphConnectionException;
import com.hypothesis.exception.QueryTimeoutException;
import com.hypothesis.knowledge.GraphRows;
import com.hypothesis.knowledge.PathwayGraphStore;
import com.hypothesis.service.LanguageModelGateway;
import com.hypothesis.service.SessionService;
import com.hypothesis.support.ScriptedLLMProvider;
import com.hypothesis.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Whole turns through the real pipeline, with a scripted language model, the sample GAF file and a
 * mocked graph store.
 */
@DisplayName("Conversation Orchestrator Tests")
class ConversationOrchestratorTest {

    private static final String CLASSIFIER = ModeClassifier.AGENT_NAME;
    private static final String PLANNER = ResearchPlanner.AGENT_NAME;
    private static final String SYNTHESIZER = HypothesisSynthesizer.AGENT_NAME;
    private static final String REPLY = "ConversationalReply";

    private static final String RESEARCH = "{\"mode\": \"research\"}";
    private static final String CONVERSATIONAL = "{\"mode\": \"conversational\"}";

    private static final String BRCA1_PLAN = """
        {"objective": "List GO terms annotated to BRCA1 with their evidence",
         "steps": [{"tool": "annotation_query", "query": "GO terms annotated to BRCA1 with evidence codes"}]}
        """;
    private static final String BRCA1_FILTER = """
        {"filter": {"where": [{"column": "DB_Object_Symbol", "op": "eq", "value": "BRCA1"}],
                    "select": ["GO_ID", "Evidence", "Aspect"], "distinct": true}}
        """;
    private static final String INSR_CYPHER = "{\"query\": \"MATCH (a:Gene)-[:REGULATES]->(b:Gene) "
        + "WHERE 'insulin signaling pathway' IN a.pathway_titles RETURN a.name AS source, b.name AS target\"}";

    private ScriptedLLMProvider llm;
    private PathwayGraphStore store;
    private ResearchProperties properties;
    private SessionService sessions;
    private ConversationOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        llm = new ScriptedLLMProvider();
        store = mock(PathwayGraphStore.class);
        when(store.getSchema()).thenReturn("{\"Gene\": {\"type\": \"node\"}}");
        properties = TestFixtures.properties();

        LanguageModelGateway gateway = TestFixtures.gateway(llm);
        GraphQueryTool graphQueryTool = new GraphQueryTool(gateway, properties, store);
        AnnotationQueryTool annotationQueryTool = new AnnotationQueryTool(gateway, properties,
            TestFixtures.sampleDataset());
        GraphAnalysisTool graphAnalysisTool = new GraphAnalysisTool(gateway, properties, new GraphAnalyzer());
        ToolRegistry registry = new ToolRegistry(List.of(graphQueryTool, annotationQueryTool, graphAnalysisTool));

        sessions = new SessionService(properties);
        orchestrator = new ConversationOrchestrator(
            sessions,
            new ModeClassifier(gateway, properties),
            new ResearchPlanner(gateway, new ToolSelectionPolicy(registry, properties), properties),
            new PlanExecutor(registry,
                new ResearchToolDispatcher(graphQueryTool, annotationQueryTool, graphAnalysisTool)),
            new HypothesisSynthesizer(gateway),
            registry,
            gateway,
            properties);
    }

    @Test
    @DisplayName("Should answer small talk without planning")
    void handleTurn_shouldReplyConversationally() {
        // Given
        llm.reply(CLASSIFIER, CONVERSATIONAL);
        llm.reply(REPLY, "Hello! Ask me about genes, pathways or GO terms.");

        // When
        TurnResponse response = orchestrator.handleTurn("s-chat", "Hi there!");

        // Then
        assertThat(response.getMode()).isEqualTo(Mode.CONVERSATIONAL);
        assertThat(response.getText()).isEqualTo("Hello! Ask me about genes, pathways or GO terms.");
        assertThat(response.getPlan()).isNull();
        assertThat(llm.count(PLANNER)).isZero();
        verifyNoInteractions(store);

        Session session = sessions.find("s-chat").orElseThrow();
        assertThat(session.getTurns()).hasSize(2);
        assertThat(session.getState()).isEqualTo(TurnState.IDLE);
    }

    @Test
    @DisplayName("Should answer the BRCA1 question from GO annotations and cite the evidence")
    void handleTurn_shouldResearchBrca1() {
        // Given
        llm.reply(CLASSIFIER, RESEARCH);
        llm.reply(PLANNER, BRCA1_PLAN);
        llm.reply("AnnotationQueryTool", BRCA1_FILTER);
        llm.reply(SYNTHESIZER, """
            {"hypothesis": "BRCA1 is annotated to DNA binding (GO:0003677, Evidence IDA) and DNA repair (GO:0006281).",
             "followUps": ["Which KEGG pathways include BRCA1?"]}
            """);

        // When
        TurnResponse response = orchestrator.handleTurn("s-brca1",
            "What GO terms are annotated to BRCA1, and with what evidence?");

        // Then
        assertThat(response.getMode()).isEqualTo(Mode.RESEARCH);
        assertThat(response.getPlan().steps()).hasSize(1);
        assertThat(response.getResults()).hasSize(1);
        StepResult result = response.getResults().get(0);
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.tool()).isEqualTo("annotation_query");
        assertThat(result.payload().fields()).contains("GO_ID", "Evidence");
        assertThat(response.getText()).contains("Evidence").contains("GO_ID");
        assertThat(response.getFollowUps()).containsExactly("Which KEGG pathways include BRCA1?");
        assertThat(response.isDegraded()).isFalse();
        verifyNoInteractions(store);

        Session session = sessions.find("s-brca1").orElseThrow();
        assertThat(session.lastResearchTurn()).isPresent();
    }

    @Test
    @DisplayName("Should apologise when the plan names an unknown tool, without touching any backend")
    void handleTurn_shouldApologiseForUnknownTool() {
        // Given
        llm.reply(CLASSIFIER, RESEARCH);
        llm.reply(PLANNER, """
            {"objective": "Look up INSR", "steps": [{"tool": "kegg_lookup_v2", "query": "INSR pathways"}]}
            """);

        // When
        TurnResponse response = orchestrator.handleTurn("s-unknown", "Which pathways contain INSR?");

        // Then
        assertThat(response.isPlanningFailed()).isTrue();
        assertThat(response.getMode()).isEqualTo(Mode.CONVERSATIONAL);
        assertThat(response.getText()).isEqualTo(ConversationOrchestrator.PLANNING_APOLOGY);
        assertThat(response.getResults()).isEmpty();
        assertThat(llm.count("GraphQueryTool")).isZero();
        assertThat(llm.count("AnnotationQueryTool")).isZero();
        assertThat(llm.count(SYNTHESIZER)).isZero();
        assertThat(sessions.find("s-unknown").orElseThrow().getMode()).isEqualTo(Mode.CONVERSATIONAL);
        verifyNoInteractions(store);
    }

    @Test
    @DisplayName("Should report what could not be determined when a graph query times out")
    void handleTurn_shouldReportTimeoutAndSkipAnalysis() {
        // Given
        llm.reply(CLASSIFIER, RESEARCH);
        llm.reply(PLANNER, """
            {"objective": "Score IRS1 in insulin signaling",
             "steps": [
               {"tool": "graph_query", "query": "Regulatory edges of the insulin signaling pathway"},
               {"tool": "graph_analysis", "query": "Impact of IRS1 in the insulin signaling network"}
             ]}
            """);
        llm.replyAlways("GraphQueryTool", INSR_CYPHER);
        when(store.executeRead(anyString(), anyInt(), anyInt())).thenThrow(new QueryTimeoutException("Graph query timed out"));
        llm.reply(SYNTHESIZER, "{\"hypothesis\": \"The available data is not enough to score IRS1.\"}");

        // When
        TurnResponse response = orchestrator.handleTurn("s-timeout", "How important is IRS1 for insulin signaling?");

        // Then
        assertThat(response.getResults()).hasSize(2);
        assertThat(response.getResults().get(0).errorKind()).isEqualTo(ErrorKind.QUERY_TIMEOUT);
        assertThat(response.getResults().get(0).attempts()).isEqualTo(3);
        assertThat(response.getResults().get(1).errorKind()).isEqualTo(ErrorKind.ANALYSIS_PARAMETER);
        assertThat(llm.count("GraphAnalysisTool")).isZero();
        assertThat(response.getText()).contains("Could not determine")
            .contains("Regulatory edges of the insulin signaling pathway")
            .contains("Impact of IRS1 in the insulin signaling network");
    }

    @Test
    @DisplayName("Should flag degraded service after repeated connection failures")
    void handleTurn_shouldSignalDegradedService() {
        // Given
        llm.replyAlways(CLASSIFIER, RESEARCH);
        llm.replyAlways(PLANNER, "{\"steps\": [{\"tool\": \"graph_query\", \"query\": \"INSR regulators\"}]}");
        llm.replyAlways("GraphQueryTool", INSR_CYPHER);
        llm.replyAlways(SYNTHESIZER, "{\"hypothesis\": \"I could not reach the pathway graph.\"}");
        when(store.executeRead(anyString(), anyInt(), anyInt()))
            .thenThrow(new GraphConnectionException("Graph database unavailable"));

        // When
        TurnResponse first = orchestrator.handleTurn("s-down", "Which genes regulate INSR?");
        TurnResponse second = orchestrator.handleTurn("s-down", "Which genes regulate INSR?");
        TurnResponse third = orchestrator.handleTurn("s-down", "Which genes regulate INSR?");

        // Then
        assertThat(first.getResults().get(0).errorKind()).isEqualTo(ErrorKind.CONNECTION);
        assertThat(first.getResults().get(0).attempts()).isEqualTo(1);
        assertThat(first.isDegraded()).isFalse();
        assertThat(second.isDegraded()).isFalse();
        assertThat(third.isDegraded()).isTrue();
        assertThat(llm.count("GraphQueryTool")).isEqualTo(3);

        // When
        boolean cleared = orchestrator.clearSession("s-down");

        // Then
        assertThat(cleared).isTrue();
        Session session = sessions.find("s-down").orElseThrow();
        assertThat(session.getTurns()).isEmpty();
        assertThat(session.getFatalFailures()).isZero();
        assertThat(orchestrator.clearSession("no-such-session")).isFalse();
    }

    @Test
    @DisplayName("Should discard partial results when the turn is abandoned between steps")
    void handleTurn_shouldStopWhenAbandoned() {
        // Given
        llm.reply(CLASSIFIER, RESEARCH);
        llm.reply(PLANNER, """
            {"steps": [
               {"tool": "graph_query", "query": "INSR regulators"},
               {"tool": "annotation_query", "query": "GO terms of INSR"}
             ]}
            """);
        llm.reply("GraphQueryTool", INSR_CYPHER);
        when(store.executeRead(anyString(), anyInt(), anyInt())).thenAnswer(invocation -> {
            orchestrator.abandonTurn("s-abandon");
            return new GraphRows(TestFixtures.edgeRows("IRS1 -> INSR"), 1);
        });

        // When
        TurnResponse response = orchestrator.handleTurn("s-abandon", "Tell me about INSR");

        // Then
        assertThat(response.getText()).isEqualTo(ConversationOrchestrator.ABANDONED);
        assertThat(response.getResults()).isEmpty();
        assertThat(llm.count("AnnotationQueryTool")).isZero();
        assertThat(llm.count(SYNTHESIZER)).isZero();
        verify(store).executeRead(anyString(), anyInt(), anyInt());
    }

    @Test
    @DisplayName("Should apologise when the conversational reply fails")
    void handleTurn_shouldApologiseWhenReplyFails() {
        llm.reply(CLASSIFIER, CONVERSATIONAL);

        TurnResponse response = orchestrator.handleTurn("s-quiet", "Thanks!");

        assertThat(response.getText()).isEqualTo(ConversationOrchestrator.REPLY_APOLOGY);
        assertThat(sessions.find("s-quiet").orElseThrow().getTurns()).hasSize(2);
    }

    @Test
    @DisplayName("Should give the planner the earlier turns for follow-up questions")
    void handleTurn_shouldCarryHistoryIntoFollowUps() {
        // Given
        llm.reply(CLASSIFIER, RESEARCH, RESEARCH);
        llm.reply(PLANNER, BRCA1_PLAN, BRCA1_PLAN);
        llm.replyAlways("AnnotationQueryTool", BRCA1_FILTER);
        llm.replyAlways(SYNTHESIZER, "{\"hypothesis\": \"BRCA1 is annotated to DNA repair.\"}");
        orchestrator.handleTurn("s-follow", "What GO terms are annotated to BRCA1?");

        // When
        orchestrator.handleTurn("s-follow", "And which of those are experimental?");

        // Then
        String secondPlannerPrompt = llm.callsFor(PLANNER).get(1).prompt();
        assertThat(secondPlannerPrompt).contains("user: What GO terms are annotated to BRCA1?")
            .contains("research objective: List GO terms annotated to BRCA1 with their evidence");
    }

    @Test
    @DisplayName("Should create a session when none is given")
    void handleTurn_shouldCreateSession() {
        llm.reply(CLASSIFIER, CONVERSATIONAL);
        llm.reply(REPLY, "Hi!");

        TurnResponse response = orchestrator.handleTurn(null, "Hello");

        assertThat(response.getSessionId()).isNotBlank();
        assertThat(sessions.find(response.getSessionId())).isPresent();
    }
}
