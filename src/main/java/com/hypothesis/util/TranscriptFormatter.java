package com.hypothesis.util;

import com.hypothesis.core.Turn;

import java.util.List;

/**
 * Renders turns as a plain transcript for prompts.
 */
public final class TranscriptFormatter {

    private static final int MAX_TURN_CHARS = 1200;

    private TranscriptFormatter() {
    }

    public static String format(List<Turn> turns) {
        if (turns.isEmpty()) {
            return "(no previous messages)";
        }
        StringBuilder sb = new StringBuilder();
        for (Turn turn : turns) {
            sb.append(turn.speaker().getRole()).append(": ")
                .append(ExternalCallLogger.truncate(turn.text(), MAX_TURN_CHARS));
            if (turn.isResearch()) {
                sb.append("\n  (research objective: ").append(turn.plan().objective()).append(')');
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}
