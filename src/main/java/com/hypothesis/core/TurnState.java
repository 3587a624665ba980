package com.hypothesis.core;

/**
 * Orchestrator state for the turn a session is currently processing.
 *
 * <pre>
 * IDLE -> CLASSIFYING -> CONVERSATIONAL_REPLY | RESEARCH_PIPELINE -> IDLE
 * </pre>
 */
public enum TurnState {
    IDLE,
    CLASSIFYING,
    CONVERSATIONAL_REPLY,
    RESEARCH_PIPELINE
}
