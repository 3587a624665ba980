package com.hypothesis.agent.tool;

import com.hypothesis.configuration.ResearchProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Picks one tool when the planner proposes several for a step.
 *
 * <p>Order follows {@code app.research.tool-preference}; registered tools missing from that list rank
 * after the listed ones, by specificity. Unregistered names are never chosen.
 */
@Component
@RequiredArgsConstructor
public class ToolSelectionPolicy {

    private final ToolRegistry registry;
    private final ResearchProperties properties;

    public Optional<String> choose(List<String> candidates) {
        return candidates.stream()
            .map(registry::lookup)
            .flatMap(Optional::stream)
            .distinct()
            .min(Comparator.comparingInt(this::preferenceRank)
                .thenComparing(Comparator.comparingInt(CapabilityDescriptor::specificity).reversed()))
            .map(CapabilityDescriptor::name);
    }

    private int preferenceRank(CapabilityDescriptor descriptor) {
        int rank = properties.getToolPreference().indexOf(descriptor.name());
        return rank < 0 ? Integer.MAX_VALUE : rank;
    }
}
