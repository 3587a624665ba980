package com.hypothesis.client;

/**
 * Unified interface for language model providers (Ollama, Gemini).
 *
 * <p>Output is untrusted: callers parse and validate every response.
 */
public interface LLMProvider {

    /**
     * Execute a chat completion.
     *
     * @param prompt    the rendered prompt
     * @param format    expected output shape
     * @param agentName name of the calling component (for logging)
     * @param sessionId session the call belongs to, may be null
     * @return raw response text
     * @throws com.hypothesis.exception.OracleUnavailableException when the provider cannot be reached
     */
    String chat(String prompt, OutputFormat format, String agentName, String sessionId);

    /**
     * Provider name for logging.
     */
    String getProviderName();
}
