package com.hypothesis.core;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Operating mode of a single turn.
 *
 * <p>Modes are not sticky: every utterance is classified again.
 */
public enum Mode {

    /**
     * Direct reply from the language model, no backend access.
     */
    CONVERSATIONAL("conversational"),

    /**
     * Planner, executor and synthesizer over the biomedical data sources.
     */
    RESEARCH("research");

    private final String label;

    Mode(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Exact, case-insensitive label match. Anything else is empty.
     */
    public static Optional<Mode> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(mode -> mode.label.equals(normalized))
            .findFirst();
    }
}
