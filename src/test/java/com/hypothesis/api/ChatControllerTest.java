package com.hypothesis.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hypothesis.client.LLMProviderFactory;
import com.hypothesis.knowledge.PathwayGraphStore;
import com.hypothesis.support.ScriptedLLMProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Integration tests for ChatController.
 *
 * Runs the full Spring context with the sample GAF file, a scripted language model and a mocked graph store.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Chat Controller Tests")
class ChatControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private LLMProviderFactory providerFactory;

    @MockBean
    private PathwayGraphStore graphStore;

    private ScriptedLLMProvider llm;

    @BeforeEach
    void setUp() {
        llm = new ScriptedLLMProvider();
        when(providerFactory.getStructuredProvider()).thenReturn(llm);
        when(providerFactory.getFinalResponseProvider()).thenReturn(llm);
    }

    private String body(String message, String sessionId) throws Exception {
        return objectMapper.writeValueAsString(ChatRequest.builder().message(message).sessionId(sessionId).build());
    }

    private void greet(String sessionId) throws Exception {
        llm.reply("ModeClassifier", "{\"mode\": \"conversational\"}");
        llm.reply("ConversationalReply", "Hello! Ask me about genes, pathways or GO terms.");
        mockMvc.perform(post("/api/v1/chat")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body("hi", sessionId)))
            .andExpect(status().isOk());
    }

    @Test
    @DisplayName("Should start a session and reply conversationally")
    void chat_shouldReplyAndReturnSessionId() throws Exception {
        // Given
        llm.reply("ModeClassifier", "{\"mode\": \"conversational\"}");
        llm.reply("ConversationalReply", "Hello! Ask me about genes, pathways or GO terms.");

        // When / Then
        mockMvc.perform(post("/api/v1/chat")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body("hi", null)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.sessionId").isNotEmpty())
            .andExpect(jsonPath("$.mode").value("conversational"))
            .andExpect(jsonPath("$.response").value("Hello! Ask me about genes, pathways or GO terms."))
            .andExpect(jsonPath("$.steps").isEmpty());

        assertThat(llm.count("ResearchPlanner")).isZero();
    }

    @Test
    @DisplayName("Should return the research steps and the data they used")
    void chat_shouldReturnResearchSteps() throws Exception {
        // Given
        llm.reply("ModeClassifier", "{\"mode\": \"research\"}");
        llm.reply("ResearchPlanner", """
            {"objective": "List GO terms annotated to BRCA1",
             "steps": [{"tool": "annotation_query", "query": "GO terms annotated to BRCA1 with evidence codes"}]}
            """);
        llm.reply("AnnotationQueryTool", """
            {"filter": {"where": [{"column": "DB_Object_Symbol", "op": "eq", "value": "BRCA1"}],
                        "select": ["GO_ID", "Evidence"], "distinct": true}}
            """);
        llm.reply("HypothesisSynthesizer", """
            {"hypothesis": "BRCA1 is annotated to DNA repair (GO:0006281).", "followUps": ["What about TP53?"]}
            """);

        // When / Then
        mockMvc.perform(post("/api/v1/chat")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body("What GO terms are annotated to BRCA1?", "api-research")))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.mode").value("research"))
            .andExpect(jsonPath("$.objective").value("List GO terms annotated to BRCA1"))
            .andExpect(jsonPath("$.degraded").value(false))
            .andExpect(jsonPath("$.followUps[0]").value("What about TP53?"))
            .andExpect(jsonPath("$.steps[0].tool").value("annotation_query"))
            .andExpect(jsonPath("$.steps[0].status").value("SUCCEEDED"))
            .andExpect(jsonPath("$.steps[0].attempts").value(1))
            .andExpect(jsonPath("$.steps[0].data.columns[0]").value("GO_ID"))
            .andExpect(jsonPath("$.steps[0].data.rows.length()").value(4));
    }

    @Test
    @DisplayName("Should reject an empty message")
    void chat_shouldRejectBlankMessage() throws Exception {
        mockMvc.perform(post("/api/v1/chat")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body("   ", null)))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.success").value(false))
            .andExpect(jsonPath("$.error").value("Message is required"));
    }

    @Test
    @DisplayName("Should return 500 with an error body on unexpected failures")
    void chat_shouldReportUnexpectedFailure() throws Exception {
        llm.fail("ModeClassifier", new IllegalStateException("boom"));

        mockMvc.perform(post("/api/v1/chat")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body("hi", "api-broken")))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.success").value(false))
            .andExpect(jsonPath("$.error").value("Internal error: boom"));
    }

    @Test
    @DisplayName("Should return and clear the session history")
    void history_shouldListAndClearTurns() throws Exception {
        // Given
        greet("api-history");

        // When / Then
        mockMvc.perform(get("/api/v1/chat/api-history/history"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.sessionId").value("api-history"))
            .andExpect(jsonPath("$.messages.length()").value(2))
            .andExpect(jsonPath("$.messages[0].role").value("user"))
            .andExpect(jsonPath("$.messages[0].content").value("hi"))
            .andExpect(jsonPath("$.messages[1].role").value("assistant"));

        mockMvc.perform(delete("/api/v1/chat/api-history/history"))
            .andExpect(status().isNoContent());

        mockMvc.perform(get("/api/v1/chat/api-history/history"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.messages.length()").value(0));
    }

    @Test
    @DisplayName("Should return 404 for unknown sessions")
    void sessionEndpoints_shouldReturnNotFound() throws Exception {
        mockMvc.perform(get("/api/v1/chat/missing/history")).andExpect(status().isNotFound());
        mockMvc.perform(delete("/api/v1/chat/missing/history")).andExpect(status().isNotFound());
        mockMvc.perform(post("/api/v1/chat/missing/abandon")).andExpect(status().isNotFound());
        mockMvc.perform(delete("/api/v1/chat/missing")).andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Should accept an abandon request and end a session")
    void session_shouldBeAbandonedAndDeleted() throws Exception {
        // Given
        greet("api-lifecycle");

        // When / Then
        mockMvc.perform(post("/api/v1/chat/api-lifecycle/abandon"))
            .andExpect(status().isAccepted());

        mockMvc.perform(delete("/api/v1/chat/api-lifecycle"))
            .andExpect(status().isNoContent());

        mockMvc.perform(get("/api/v1/chat/api-lifecycle/history"))
            .andExpect(status().isNotFound());
    }
}
