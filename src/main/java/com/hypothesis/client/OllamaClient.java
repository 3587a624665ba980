package com.hypothesis.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.hypothesis.exception.OracleUnavailableException;
import com.hypothesis.util.CallContext;
import com.hypothesis.util.ExternalCallLogger;
import com.hypothesis.util.ServiceType;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Ollama provider using the local {@code /api/chat} endpoint.
 */
@Slf4j
@Component
public class OllamaClient implements LLMProvider {

    private static final String SYSTEM_JSON = "You are a biomedical research assistant. Output only valid JSON. "
        + "Do not include conversational filler.";
    private static final String SYSTEM_TEXT = "You are a biomedical research assistant with access to KEGG pathway "
        + "and GO annotation data.";

    private WebClient ollamaWebClient;

    @Value("${app.ollama.base-url:http://localhost:11434}")
    private String baseUrl;

    @Value("${app.ollama.chat-model:qwen2.5:32b}")
    private String chatModel;

    @Value("${app.ollama.num-ctx:32768}")
    private int numCtx;

    @Value("${app.ollama.response-timeout:10m}")
    private Duration responseTimeout;

    @PostConstruct
    public void init() {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10000)
            .responseTimeout(responseTimeout)
            .doOnConnected(conn -> conn
                .addHandlerLast(new ReadTimeoutHandler(responseTimeout.toSeconds(), TimeUnit.SECONDS))
                .addHandlerLast(new WriteTimeoutHandler(60, TimeUnit.SECONDS)));

        this.ollamaWebClient = WebClient.builder()
            .baseUrl(baseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .build();
    }

    @Override
    public String getProviderName() {
        return "Ollama (" + chatModel + ")";
    }

    @Override
    public String chat(String prompt, OutputFormat format, String agentName, String sessionId) {
        CallContext call = ExternalCallLogger.startCall(ServiceType.OLLAMA, "chat", log);
        call.logRequest("Chat completion",
            "Agent", agentName,
            "Session", sessionId != null ? sessionId : "N/A",
            "Model", chatModel,
            "Format", format,
            "Prompt", ExternalCallLogger.truncate(prompt, 500));

        Map<String, Object> body = new HashMap<>();
        body.put("model", chatModel);
        body.put("messages", List.of(
            Map.of("role", "system", "content", format == OutputFormat.JSON ? SYSTEM_JSON : SYSTEM_TEXT),
            Map.of("role", "user", "content", prompt)));
        body.put("stream", false);
        body.put("options", Map.of(
            "num_ctx", numCtx,
            "temperature", format == OutputFormat.JSON ? 0.0 : 0.7));
        if (format == OutputFormat.JSON) {
            body.put("format", "json");
        }

        try {
            JsonNode response = ollamaWebClient.post()
                .uri("/api/chat")
                .bodyValue(body)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .block();

            String content = response == null ? "" : response.path("message").path("content").asText("");
            call.logResponse("Chat completed",
                "Response Length", content.length() + " chars",
                "Response", ExternalCallLogger.truncate(content, 500));
            return content;

        } catch (Exception e) {
            call.logError("Ollama call failed for model " + chatModel, e);
            throw new OracleUnavailableException("Ollama call failed for agent " + agentName
                + ". Ensure " + chatModel + " is downloaded and Ollama is running.", e);
        }
    }
}
