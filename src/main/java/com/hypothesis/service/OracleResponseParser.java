package com.hypothesis.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hypothesis.exception.OracleResponseException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Turns raw language model output into JSON, failing with {@link OracleResponseException} on any deviation.
 *
 * <p>Markdown code fences and prose around the outermost object are tolerated; everything else is not.
 */
@Component
@RequiredArgsConstructor
public class OracleResponseParser {

    private static final Pattern CODE_FENCE = Pattern.compile("```[a-zA-Z0-9]*");

    private final ObjectMapper objectMapper;

    public JsonNode parseObject(String raw, String agentName) {
        if (raw == null || raw.isBlank()) {
            throw new OracleResponseException(agentName, "empty response");
        }
        String json = extractJson(CODE_FENCE.matcher(raw).replaceAll(""));
        if (json == null) {
            throw new OracleResponseException(agentName, "no JSON object in response");
        }
        try {
            JsonNode node = objectMapper.readTree(json);
            if (node == null || !node.isObject()) {
                throw new OracleResponseException(agentName, "response is not a JSON object");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new OracleResponseException(agentName, "invalid JSON: " + e.getOriginalMessage(), e);
        }
    }

    public String requireText(JsonNode node, String field, String agentName) {
        return optionalText(node, field)
            .orElseThrow(() -> new OracleResponseException(agentName, "missing text field '" + field + "'"));
    }

    public Optional<String> optionalText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || !value.isValueNode()) {
            return Optional.empty();
        }
        String text = value.asText().trim();
        return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }

    /**
     * String array field; a missing field is an empty list, non-string elements are a format error.
     */
    public List<String> stringList(JsonNode node, String field, String agentName) {
        JsonNode value = node.get(field);
        List<String> items = new ArrayList<>();
        if (value == null || value.isNull()) {
            return items;
        }
        if (value.isTextual()) {
            items.add(value.asText());
            return items;
        }
        if (!value.isArray()) {
            throw new OracleResponseException(agentName, "field '" + field + "' is not a list");
        }
        for (JsonNode element : value) {
            if (!element.isTextual()) {
                throw new OracleResponseException(agentName, "field '" + field + "' contains a non-string item");
            }
            if (!element.asText().isBlank()) {
                items.add(element.asText().trim());
            }
        }
        return items;
    }

    public <T> T convert(JsonNode node, Class<T> type, String agentName) {
        try {
            return objectMapper.treeToValue(node, type);
        } catch (JsonProcessingException e) {
            throw new OracleResponseException(agentName,
                "cannot read " + type.getSimpleName() + ": " + e.getOriginalMessage(), e);
        }
    }

    public String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }

    private String extractJson(String text) {
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start >= 0 && end > start) {
            return text.substring(start, end + 1);
        }
        return null;
    }
}
