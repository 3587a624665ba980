package com.hypothesis.util;

/**
 * External services the agent talks to, for unified call logging.
 *
 * @see ExternalCallLogger
 */
public enum ServiceType {
    OLLAMA("🟣", "Ollama"),
    GEMINI("🔴", "Gemini"),
    NEO4J("🟢", "Neo4j"),
    GAF("🟡", "GAF");

    private final String emoji;
    private final String name;

    ServiceType(String emoji, String name) {
        this.emoji = emoji;
        this.name = name;
    }

    public String getEmoji() {
        return emoji;
    }

    public String getName() {
        return name;
    }
}
