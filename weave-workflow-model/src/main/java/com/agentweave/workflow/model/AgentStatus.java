package com.agentweave.workflow.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Outcome of one subtask execution. */
public enum AgentStatus {
    SUCCESS,
    FAILED,
    TIMEOUT;

    @JsonValue
    public String toValue() {
        return name().toLowerCase();
    }
}
