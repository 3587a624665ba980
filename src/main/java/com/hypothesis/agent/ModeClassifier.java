package com.hypothesis.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.hypothesis.configuration.ResearchProperties;
import com.hypothesis.core.ErrorKind;
import com.hypothesis.core.Mode;
import com.hypothesis.core.Session;
import com.hypothesis.exception.ResearchException;
import com.hypothesis.service.LanguageModelGateway;
import com.hypothesis.util.TranscriptFormatter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Decides per utterance whether to chat or to research.
 *
 * <p>Anything other than exactly one known label falls back to {@link Mode#CONVERSATIONAL}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ModeClassifier {

    static final String AGENT_NAME = "ModeClassifier";

    private final LanguageModelGateway gateway;
    private final ResearchProperties properties;

    public Mode classify(Session session, String utterance) {
        Map<String, Object> variables = new HashMap<>();
        variables.put("history", TranscriptFormatter.format(session.recentTurns(properties.getPromptHistoryTurns())));
        variables.put("utterance", utterance);

        try {
            JsonNode response = gateway.completeJson("mode-classifier", variables, AGENT_NAME, session.getId());
            String label = gateway.getParser().optionalText(response, "mode").orElse(null);
            return Mode.fromLabel(label).map(mode -> {
                log.info("[{}] classified as {}", session.getId(), mode);
                return mode;
            }).orElseGet(() -> ambiguous(session, "unexpected label '" + label + "'"));

        } catch (ResearchException e) {
            return ambiguous(session, e.getKind() + ": " + e.getMessage());
        }
    }

    private Mode ambiguous(Session session, String reason) {
        log.warn("[{}] {} ({}), defaulting to {}", session.getId(), ErrorKind.CLASSIFICATION_AMBIGUOUS, reason,
            Mode.CONVERSATIONAL);
        return Mode.CONVERSATIONAL;
    }
}
