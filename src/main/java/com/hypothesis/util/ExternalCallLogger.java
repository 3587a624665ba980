package com.hypothesis.util;

import org.slf4j.Logger;

import java.util.Map;

/**
 * Consistent request/response logging for calls to the language model, Neo4j and the GAF dataset.
 */
public final class ExternalCallLogger {

    private ExternalCallLogger() {
    }

    public static CallContext startCall(ServiceType service, String operation, Logger logger) {
        return new CallContext(service, operation, logger);
    }

    /**
     * Truncate large strings for logging and prompts.
     */
    public static String truncate(String text, int maxLength) {
        if (text == null) {
            return "(null)";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + "... [+" + (text.length() - maxLength) + " chars]";
    }

    public static String formatMap(Map<?, ?> map) {
        if (map == null || map.isEmpty()) {
            return "{}";
        }
        if (map.size() <= 5) {
            return map.toString();
        }
        return "{" + map.size() + " entries}";
    }
}
