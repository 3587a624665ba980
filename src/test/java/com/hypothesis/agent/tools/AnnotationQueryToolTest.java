package com.hypothesis.agent.tools;

import com.hypothesis.agent.tool.ToolAnswer;
import com.hypothesis.agent.tool.ToolContext;
import com.hypothesis.annotation.AnnotationDataset;
import com.hypothesis.configuration.ResearchProperties;
import com.hypothesis.core.AnnotationPayload;
import com.hypothesis.core.ErrorKind;
import com.hypothesis.core.PlanStep;
import com.hypothesis.exception.DatasetUnavailableException;
import com.hypothesis.exception.RetriesExhaustedException;
import com.hypothesis.support.ScriptedLLMProvider;
import com.hypothesis.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("Annotation Query Tool Tests")
class AnnotationQueryToolTest {

    private static final String AGENT = "AnnotationQueryTool";
    private static final String REFLECTION = "ResultReflection";

    private static final String BRCA1_FILTER = """
        {"filter": {"where": [{"column": "DB_Object_Symbol", "op": "eq", "value": "BRCA1"}],
                    "select": ["DB_Object_Symbol", "GO_ID", "Evidence"], "limit": 20},
         "explanation": "GO terms annotated to BRCA1"}
        """;

    private static final String BAD_COLUMN_FILTER = """
        {"filter": {"where": [{"column": "Gene", "op": "eq", "value": "BRCA1"}]}}
        """;

    private ScriptedLLMProvider llm;
    private ResearchProperties properties;
    private ToolContext context;

    @BeforeEach
    void setUp() {
        llm = new ScriptedLLMProvider();
        properties = TestFixtures.properties();
        context = new ToolContext("s-1", new PlanStep(0, "annotation_query", "GO terms annotated to BRCA1"), List.of());
    }

    private AnnotationQueryTool tool() {
        return new AnnotationQueryTool(TestFixtures.gateway(llm), properties, TestFixtures.sampleDataset());
    }

    @Test
    @DisplayName("Should answer BRCA1 GO terms on the first attempt")
    void answer_shouldReturnRowsWithEvidence() {
        // Given
        llm.reply(AGENT, BRCA1_FILTER);

        // When
        ToolAnswer<AnnotationPayload> answer = tool().answer("GO terms annotated to BRCA1", context);

        // Then
        assertThat(answer.attempts()).isEqualTo(1);
        assertThat(answer.payload().rows()).hasSize(4);
        assertThat(answer.payload().fields()).contains("GO_ID", "Evidence");
        assertThat(answer.executedQuery()).contains("BRCA1");
        assertThat(llm.callsFor(AGENT).get(0).prompt()).contains("GO terms annotated to BRCA1")
            .contains("DB_Object_Symbol")
            .contains("IDA = Inferred from Direct Assay");
    }

    @Test
    @DisplayName("Should feed the filter error back and succeed on retry")
    void answer_shouldRetryWithFeedback() {
        // Given
        llm.reply(AGENT, BAD_COLUMN_FILTER, BRCA1_FILTER);

        // When
        ToolAnswer<AnnotationPayload> answer = tool().answer("GO terms annotated to BRCA1", context);

        // Then
        assertThat(answer.attempts()).isEqualTo(2);
        assertThat(llm.count(AGENT)).isEqualTo(2);
        assertThat(llm.callsFor(AGENT).get(0).prompt()).doesNotContain("Your previous query was");
        assertThat(llm.callsFor(AGENT).get(1).prompt())
            .contains("Your previous query was")
            .contains("Unknown column 'Gene'");
    }

    @Test
    @DisplayName("Should stop after exactly the configured number of attempts")
    void answer_shouldBoundAttempts() {
        // Given
        llm.replyAlways(AGENT, BAD_COLUMN_FILTER);

        // When / Then
        assertThatThrownBy(() -> tool().answer("GO terms annotated to BRCA1", context))
            .isInstanceOf(RetriesExhaustedException.class)
            .satisfies(e -> {
                RetriesExhaustedException error = (RetriesExhaustedException) e;
                assertThat(error.getAttempts()).isEqualTo(3);
                assertThat(error.getKind()).isEqualTo(ErrorKind.FILTER_SYNTAX);
                assertThat(error.isRetryable()).isFalse();
            });
        assertThat(llm.count(AGENT)).isEqualTo(3);
    }

    @Test
    @DisplayName("Should honour a lower attempt bound")
    void answer_shouldHonourConfiguredBound() {
        properties.setMaxQueryAttempts(1);
        llm.replyAlways(AGENT, "I cannot write that filter");

        assertThatThrownBy(() -> tool().answer("GO terms annotated to BRCA1", context))
            .isInstanceOf(RetriesExhaustedException.class)
            .satisfies(e -> assertThat(((RetriesExhaustedException) e).getKind())
                .isEqualTo(ErrorKind.MALFORMED_ORACLE_OUTPUT));
        assertThat(llm.count(AGENT)).isEqualTo(1);
    }

    @Test
    @DisplayName("Should regenerate when reflection rejects the result")
    void answer_shouldRetryAfterReflectionRejects() {
        // Given
        properties.setReflectionEnabled(true);
        llm.reply(AGENT, BRCA1_FILTER, BRCA1_FILTER);
        llm.reply(REFLECTION,
            "{\"satisfied\": false, \"feedback\": \"only experimental evidence codes were asked for\"}",
            "{\"satisfied\": true, \"feedback\": \"\"}");

        // When
        ToolAnswer<AnnotationPayload> answer = tool().answer("GO terms annotated to BRCA1", context);

        // Then
        assertThat(answer.attempts()).isEqualTo(2);
        assertThat(llm.count(REFLECTION)).isEqualTo(2);
        assertThat(llm.callsFor(AGENT).get(1).prompt()).contains("only experimental evidence codes were asked for");
    }

    @Test
    @DisplayName("Should keep a rejected result when later attempts fail")
    void answer_shouldKeepRejectedResult() {
        // Given
        properties.setReflectionEnabled(true);
        llm.reply(AGENT, BRCA1_FILTER, BRCA1_FILTER, BAD_COLUMN_FILTER);
        llm.replyAlways(REFLECTION, "{\"satisfied\": false, \"feedback\": \"add the Aspect column\"}");

        // When
        ToolAnswer<AnnotationPayload> answer = tool().answer("GO terms annotated to BRCA1", context);

        // Then
        assertThat(answer.attempts()).isEqualTo(3);
        assertThat(answer.payload().rows()).hasSize(4);
        assertThat(llm.count(REFLECTION)).isEqualTo(2);
    }

    @Test
    @DisplayName("Should accept the result when reflection output is unusable")
    void answer_shouldAcceptOnMalformedReflection() {
        properties.setReflectionEnabled(true);
        llm.reply(AGENT, BRCA1_FILTER);
        llm.reply(REFLECTION, "looks fine to me");

        ToolAnswer<AnnotationPayload> answer = tool().answer("GO terms annotated to BRCA1", context);

        assertThat(answer.attempts()).isEqualTo(1);
        assertThat(llm.count(AGENT)).isEqualTo(1);
    }

    @Test
    @DisplayName("Should fail without retrying when the dataset is unavailable")
    void answer_shouldNotRetryMissingDataset() {
        // Given
        AnnotationDataset missing = mock(AnnotationDataset.class);
        when(missing.describeSchema()).thenThrow(new DatasetUnavailableException("GAF file not found"));
        AnnotationQueryTool tool = new AnnotationQueryTool(TestFixtures.gateway(llm), properties, missing);
        llm.replyAlways(AGENT, BRCA1_FILTER);

        // When / Then
        assertThatThrownBy(() -> tool.answer("GO terms annotated to BRCA1", context))
            .isInstanceOf(DatasetUnavailableException.class);
        assertThat(llm.count(AGENT)).isZero();
    }
}
