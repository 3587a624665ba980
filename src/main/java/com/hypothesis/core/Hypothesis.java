package com.hypothesis.core;

import java.util.List;

/**
 * Final synthesized answer of a research turn.
 */
public record Hypothesis(String text, List<String> followUps) {

    public Hypothesis {
        followUps = followUps == null ? List.of() : List.copyOf(followUps);
    }
}
