package com.hypothesis.agent.tool;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Process-wide registry of capability descriptors, built once from the tool beans.
 *
 * <p>Immutable after construction and read concurrently without locking.
 */
@Slf4j
@Component
public class ToolRegistry {

    private final Map<Capability, CapabilityDescriptor> byCapability;

    public ToolRegistry(List<ResearchTool<?>> tools) {
        Map<Capability, CapabilityDescriptor> registered = new EnumMap<>(Capability.class);
        for (ResearchTool<?> tool : tools) {
            CapabilityDescriptor descriptor = tool.getDescriptor();
            CapabilityDescriptor previous = registered.put(descriptor.capability(), descriptor);
            Preconditions.checkState(previous == null,
                "Capability %s registered twice", descriptor.capability());
        }
        for (Capability capability : Capability.values()) {
            Preconditions.checkState(registered.containsKey(capability),
                "No tool registered for capability %s", capability);
        }

        this.byCapability = ImmutableMap.copyOf(registered);

        log.info("Tool registry initialized with {} tools: {}", byCapability.size(), validToolNames());
    }

    public Optional<CapabilityDescriptor> lookup(String toolName) {
        return Capability.fromToolName(toolName).map(byCapability::get);
    }

    public boolean contains(String toolName) {
        return lookup(toolName).isPresent();
    }

    public Collection<CapabilityDescriptor> descriptors() {
        return byCapability.values();
    }

    public String validToolNames() {
        return byCapability.values().stream()
            .map(CapabilityDescriptor::name)
            .collect(Collectors.joining(", "));
    }

    /**
     * Tool list for planner prompts.
     */
    public String describe() {
        StringBuilder sb = new StringBuilder();
        for (CapabilityDescriptor descriptor : byCapability.values()) {
            sb.append("- ").append(descriptor.name())
                .append(" [").append(descriptor.queryShape() == CapabilityDescriptor.QueryShape.FREE_TEXT
                    ? "free-text question" : "structured filter question").append("]: ")
                .append(descriptor.description()).append('\n');
        }
        return sb.toString();
    }
}
