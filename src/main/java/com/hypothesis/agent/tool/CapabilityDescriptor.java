package com.hypothesis.agent.tool;

/**
 * Registry entry describing one tool to the planner.
 *
 * @param capability  the capability the tool implements
 * @param description what questions the tool answers
 * @param queryShape  shape of the sub-query it accepts
 * @param specificity higher is more specific; informs the default tie-break order
 */
public record CapabilityDescriptor(Capability capability, String description, QueryShape queryShape,
                                   int specificity) {

    public String name() {
        return capability.getToolName();
    }

    public enum QueryShape {
        /**
         * Natural-language question the tool translates itself.
         */
        FREE_TEXT,

        /**
         * Question the tool turns into a structured filter or parameter set.
         */
        STRUCTURED_FILTER
    }
}
