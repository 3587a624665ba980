package com.hypothesis.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.hypothesis.client.LLMProvider;
import com.hypothesis.client.LLMProviderFactory;
import com.hypothesis.client.OutputFormat;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Single entry point for language model calls: renders the prompt, picks the provider, parses the output.
 */
@Service
@RequiredArgsConstructor
public class LanguageModelGateway {

    private final LLMProviderFactory providerFactory;
    private final PromptLibraryService promptLibrary;

    @Getter
    private final OracleResponseParser parser;

    /**
     * Structured call. The result is always a JSON object.
     *
     * @throws com.hypothesis.exception.OracleResponseException on malformed output
     * @throws com.hypothesis.exception.OracleUnavailableException when the provider fails
     */
    public JsonNode completeJson(String templateName, Map<String, Object> variables,
                                 String agentName, String sessionId) {
        String prompt = promptLibrary.render(templateName, variables);
        LLMProvider provider = providerFactory.getStructuredProvider();
        String raw = provider.chat(prompt, OutputFormat.JSON, agentName, sessionId);
        return parser.parseObject(raw, agentName);
    }

    /**
     * Free-text call used for conversational replies.
     */
    public String completeText(String templateName, Map<String, Object> variables,
                               String agentName, String sessionId) {
        String prompt = promptLibrary.render(templateName, variables);
        LLMProvider provider = providerFactory.getFinalResponseProvider();
        return provider.chat(prompt, OutputFormat.TEXT, agentName, sessionId);
    }

    /**
     * Structured call routed to the final-response provider (hypothesis synthesis).
     */
    public JsonNode completeFinalJson(String templateName, Map<String, Object> variables,
                                      String agentName, String sessionId) {
        String prompt = promptLibrary.render(templateName, variables);
        LLMProvider provider = providerFactory.getFinalResponseProvider();
        String raw = provider.chat(prompt, OutputFormat.JSON, agentName, sessionId);
        return parser.parseObject(raw, agentName);
    }
}
