package com.hypothesis.configuration;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Google Gemini settings, {@code app.gemini} namespace.
 *
 * <p>The API key is only required when {@code app.llm-provider} is {@code gemini}.
 */
@Data
@ConfigurationProperties(prefix = "app.gemini")
public class GeminiProperties {

    private String apiKey;

    private String chatModel = "gemini-1.5-pro";

    private String baseUrl = "https://generativelanguage.googleapis.com";

    private String apiVersion = "v1beta";

    /**
     * Temperature for free-text replies.
     */
    private double defaultTemperature = 0.7;

    /**
     * Temperature for structured (JSON) calls: classification, planning, query generation.
     */
    private double jsonTemperature = 0.0;

    private RetryConfig retry = new RetryConfig();

    /**
     * HTTP-level retry for transient Gemini failures. Independent of query regeneration.
     */
    @Data
    public static class RetryConfig {

        private int maxAttempts = 3;

        private long initialBackoffSeconds = 1;

        private long maxBackoffSeconds = 10;

        private List<Integer> retryableStatusCodes = new ArrayList<>(List.of(429, 500, 502, 503, 504));
    }
}
