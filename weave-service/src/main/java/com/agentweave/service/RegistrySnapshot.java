package com.agentweave.service;

import com.agentweave.workflow.WorkflowJson;
import com.agentweave.workflow.model.WorkflowResult;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Persistable copy of the finished workflows a {@link WorkflowRegistry} retains, oldest first.
 * Running workflows are not part of it: their threads do not survive a restart.
 */
public record RegistrySnapshot(
        @JsonProperty("completed_workflows") List<WorkflowResult> completedWorkflows,
        @JsonProperty("max_completed_retention") int retention,
        @JsonProperty("timestamp") Instant timestamp) {

    public RegistrySnapshot {
        completedWorkflows = completedWorkflows != null ? List.copyOf(completedWorkflows) : List.of();
    }

    public String toJson() {
        return WorkflowJson.toJson(this);
    }

    /** @throws java.io.UncheckedIOException when the text is not a snapshot */
    public static RegistrySnapshot fromJson(String json) {
        return WorkflowJson.fromJson(json, RegistrySnapshot.class);
    }
}
