package com.hypothesis.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hypothesis.configuration.GeminiProperties;
import com.hypothesis.exception.OracleUnavailableException;
import com.hypothesis.util.CallContext;
import com.hypothesis.util.ExternalCallLogger;
import com.hypothesis.util.ServiceType;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Google Gemini provider over the {@code generateContent} REST endpoint.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GeminiClient implements LLMProvider {

    private final GeminiProperties props;
    private final ObjectMapper objectMapper;

    private WebClient geminiWebClient;

    @PostConstruct
    public void init() {
        this.geminiWebClient = WebClient.builder()
            .baseUrl(props.getBaseUrl())
            .defaultHeader("x-goog-api-key", props.getApiKey() != null ? props.getApiKey() : "")
            .exchangeStrategies(ExchangeStrategies.builder()
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
                .build())
            .build();
    }

    @Override
    public String getProviderName() {
        return "Gemini (" + props.getChatModel() + ")";
    }

    @Override
    public String chat(String prompt, OutputFormat format, String agentName, String sessionId) {
        CallContext call = ExternalCallLogger.startCall(ServiceType.GEMINI, "generateContent", log);
        String model = props.getChatModel();
        call.logRequest("Generating text",
            "Agent", agentName,
            "Session", sessionId != null ? sessionId : "N/A",
            "Model", model,
            "Format", format,
            "Prompt", ExternalCallLogger.truncate(prompt, 500));

        Map<String, Object> generationConfig = new HashMap<>();
        if (format == OutputFormat.JSON) {
            generationConfig.put("temperature", props.getJsonTemperature());
            generationConfig.put("responseMimeType", "application/json");
        } else {
            generationConfig.put("temperature", props.getDefaultTemperature());
        }
        Map<String, Object> body = Map.of(
            "contents", List.of(Map.of("parts", List.of(Map.of("text", prompt)))),
            "generationConfig", generationConfig);

        String url = String.format("/%s/models/%s:generateContent", props.getApiVersion(), model);
        try {
            String json = geminiWebClient.post().uri(url).bodyValue(body)
                .retrieve().bodyToMono(String.class)
                .retryWhen(buildRetrySpec())
                .block();

            JsonNode root = objectMapper.readTree(json);
            String response = root.path("candidates").path(0)
                .path("content").path("parts").path(0)
                .path("text").asText("");

            JsonNode usage = root.path("usageMetadata");
            call.logResponse("Text generated",
                "Tokens", usage.path("promptTokenCount").asInt(0) + " in + "
                    + usage.path("candidatesTokenCount").asInt(0) + " out",
                "Response", ExternalCallLogger.truncate(response, 500));
            return response;

        } catch (WebClientResponseException e) {
            call.logError(e.getStatusCode() + ": " + e.getMessage(), e);
            throw new OracleUnavailableException("Gemini API call failed for agent " + agentName, e);
        } catch (Exception e) {
            call.logError("Unexpected error", e);
            throw new OracleUnavailableException("Gemini API call failed for agent " + agentName, e);
        }
    }

    private Retry buildRetrySpec() {
        GeminiProperties.RetryConfig retry = props.getRetry();
        return Retry.backoff(retry.getMaxAttempts(), Duration.ofSeconds(retry.getInitialBackoffSeconds()))
            .maxBackoff(Duration.ofSeconds(retry.getMaxBackoffSeconds()))
            .filter(this::isRetryable);
    }

    private boolean isRetryable(Throwable ex) {
        if (!(ex instanceof WebClientResponseException webEx)) {
            return false;
        }
        return props.getRetry().getRetryableStatusCodes().contains(webEx.getStatusCode().value());
    }
}
