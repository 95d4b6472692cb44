package com.agentweave.workflow.model;

import com.agentweave.workflow.error.ConfigurationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Executor role assigned to a subtask. JSON uses the lower-case name; unknown names are a
 * configuration error rather than a silent fallback, so a typo in a step definition is
 * rejected before any executor runs.
 */
public enum AgentType {
    /** Tier-1 researcher in the hierarchical pattern. */
    WORKER,
    /** Tier-2 grouped synthesis; also the summarizer for swarm and iterative passes. */
    SYNTHESIZER,
    /** Tier-3 executive synthesis over all tier-2 outputs. */
    EXECUTIVE,
    TEXT,
    IMAGE,
    VIDEO,
    NEWS,
    ACADEMIC,
    SOCIAL,
    PRODUCT,
    TECHNICAL,
    GENERAL;

    @JsonValue
    public String toValue() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static AgentType fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("Agent type must be non-blank");
        }
        String normalized = value.trim().toUpperCase();
        for (AgentType t : values()) {
            if (t.name().equals(normalized)) return t;
        }
        throw new ConfigurationException("Unknown agent type: " + value + " (known: "
                + Arrays.stream(values()).map(AgentType::toValue).collect(Collectors.joining(", ")) + ")");
    }

    /** True for the nine swarm search domains. */
    public boolean isDomain() {
        return this != WORKER && this != SYNTHESIZER && this != EXECUTIVE;
    }
}
