package com.hypothesis.core;

import java.time.Instant;
import java.util.List;

/**
 * Immutable conversation turn. Research turns carry their plan and step results.
 */
public record Turn(
    Speaker speaker,
    String text,
    Mode mode,
    Instant timestamp,
    Plan plan,
    List<StepResult> results,
    List<String> followUps
) {

    public Turn {
        results = results == null ? List.of() : List.copyOf(results);
        followUps = followUps == null ? List.of() : List.copyOf(followUps);
    }

    public static Turn user(String text) {
        return new Turn(Speaker.USER, text, null, Instant.now(), null, null, null);
    }

    public static Turn conversational(String text) {
        return new Turn(Speaker.SYSTEM, text, Mode.CONVERSATIONAL, Instant.now(), null, null, null);
    }

    public static Turn research(Hypothesis hypothesis, Plan plan, List<StepResult> results) {
        return new Turn(Speaker.SYSTEM, hypothesis.text(), Mode.RESEARCH, Instant.now(),
            plan, results, hypothesis.followUps());
    }

    public boolean isResearch() {
        return plan != null;
    }
}
