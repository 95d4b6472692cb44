package com.agentweave.service;

import com.agentweave.workflow.model.WorkflowStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Point-in-time view of a tracked workflow. For a running workflow the counts come from its
 * progress events; for a finished one from its result.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkflowStatusView(
        @JsonProperty("task_id") String taskId,
        @JsonProperty("pattern") String pattern,
        @JsonProperty("title") String title,
        @JsonProperty("status") WorkflowStatus status,
        @JsonProperty("subtasks_total") int subtasksTotal,
        @JsonProperty("subtasks_finished") int subtasksFinished,
        @JsonProperty("total_cost") BigDecimal totalCost,
        @JsonProperty("last_event") String lastEvent,
        @JsonProperty("started_at") Instant startedAt,
        @JsonProperty("completed_at") Instant completedAt) {

    public boolean isFinished() {
        return status.isTerminal();
    }
}
