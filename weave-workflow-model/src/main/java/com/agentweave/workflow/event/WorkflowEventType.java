package com.agentweave.workflow.event;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle events pushed to a progress sink. Wire names are snake_case
 * (e.g. {@code agent_complete}).
 */
public enum WorkflowEventType {
    WORKFLOW_START,
    DECOMPOSITION_COMPLETE,
    AGENT_START,
    AGENT_COMPLETE,
    AGENT_FAILED,
    SYNTHESIS_START,
    SYNTHESIS_COMPLETE,
    WORKFLOW_COMPLETE,
    WORKFLOW_ERROR,
    /** Iterative pattern: a pass is starting. */
    ITERATION_START,
    /** Iterative pattern: a pass finished and its success predicate was evaluated. */
    ITERATION_COMPLETE,
    /** Conditional pattern: one branch was chosen. */
    BRANCH_SELECTED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    /** True for the two events that close a run. */
    public boolean isTerminal() {
        return this == WORKFLOW_COMPLETE || this == WORKFLOW_ERROR;
    }
}
