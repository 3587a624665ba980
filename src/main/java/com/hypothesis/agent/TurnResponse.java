package com.hypothesis.agent;

import com.hypothesis.core.Mode;
import com.hypothesis.core.Plan;
import com.hypothesis.core.StepResult;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * What one turn produced.
 */
@Value
@Builder
public class TurnResponse {
    String sessionId;
    Mode mode;
    String text;
    @Builder.Default
    List<String> followUps = List.of();
    Plan plan;
    @Builder.Default
    List<StepResult> results = List.of();

    /**
     * The session has seen enough fatal backend failures that answers are likely partial.
     */
    boolean degraded;

    /**
     * The research pipeline was attempted but the planner gave up; {@code text} is an apology.
     */
    boolean planningFailed;
}
