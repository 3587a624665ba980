package com.hypothesis.client;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Selects the active language model provider from {@code app.llm-provider}.
 *
 * <p>In {@code hybrid} mode the local model handles structured calls (classification, planning,
 * query generation) and Gemini writes the user-facing text.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LLMProviderFactory {

    private final GeminiClient geminiProvider;
    private final OllamaClient ollamaProvider;

    @Value("${app.llm-provider:ollama}")
    private String providerName;

    @PostConstruct
    public void init() {
        log.info("LLM provider configured: {} (structured: {}, final: {})", providerName,
            getStructuredProvider().getProviderName(), getFinalResponseProvider().getProviderName());
    }

    public LLMProvider getProvider() {
        return switch (providerName.toLowerCase()) {
            case "ollama" -> ollamaProvider;
            case "gemini", "hybrid" -> geminiProvider;
            default -> {
                log.warn("Unknown LLM provider: {}, falling back to Ollama", providerName);
                yield ollamaProvider;
            }
        };
    }

    /**
     * Provider for JSON calls: classification, planning, query generation and reflection.
     */
    public LLMProvider getStructuredProvider() {
        if ("hybrid".equalsIgnoreCase(providerName)) {
            return ollamaProvider;
        }
        return getProvider();
    }

    /**
     * Provider for conversational replies and hypotheses.
     */
    public LLMProvider getFinalResponseProvider() {
        return getProvider();
    }
}
