package com.agentweave.workflow.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle status of a workflow run. {@link #COMPLETED} does not mean every subtask
 * succeeded; inspect each agent result for that.
 */
public enum WorkflowStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    /** Completed, but a non-essential step (artifact generation, a dropped synthesis bucket) failed. */
    COMPLETED_WITH_WARNINGS,
    FAILED,
    CANCELLED;

    @JsonValue
    public String toValue() {
        return name().toLowerCase();
    }

    public boolean isTerminal() {
        return this != PENDING && this != RUNNING;
    }

    public boolean isCompleted() {
        return this == COMPLETED || this == COMPLETED_WITH_WARNINGS;
    }
}
