package com.agentweave.service;

/**
 * Thrown by {@link WorkflowService} when a submission would exceed the active-workflow limit.
 * Nothing has been started when this is thrown.
 */
public final class WorkflowRejectedException extends RuntimeException {

    private final int activeWorkflows;
    private final int limit;

    public WorkflowRejectedException(int activeWorkflows, int limit) {
        super(String.format("Workflow rejected: active=%d limit=%d", activeWorkflows, limit));
        this.activeWorkflows = activeWorkflows;
        this.limit = limit;
    }

    public int getActiveWorkflows() {
        return activeWorkflows;
    }

    public int getLimit() {
        return limit;
    }
}
