package com.hypothesis.core;

import java.util.List;

/**
 * One tool-routed sub-query of a research plan.
 *
 * @param index     zero-based position in the plan
 * @param tool      registry name of the tool that answers this step
 * @param query     natural-language sub-query handed to the tool
 * @param dependsOn indexes of earlier steps whose results this step consumes
 */
public record PlanStep(int index, String tool, String query, List<Integer> dependsOn) {

    public PlanStep {
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
    }

    public PlanStep(int index, String tool, String query) {
        this(index, tool, query, List.of());
    }

    public boolean hasDependencies() {
        return !dependsOn.isEmpty();
    }
}
