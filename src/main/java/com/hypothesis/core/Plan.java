package com.hypothesis.core;

import java.util.List;

/**
 * Ordered research plan. Never mutated once produced by the planner.
 *
 * @param objective short restatement of the research goal
 * @param steps     steps in execution order
 */
public record Plan(String objective, List<PlanStep> steps) {

    public Plan {
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    public int size() {
        return steps.size();
    }

    public boolean isEmpty() {
        return steps.isEmpty();
    }
}
