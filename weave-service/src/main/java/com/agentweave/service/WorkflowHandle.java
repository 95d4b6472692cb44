package com.agentweave.service;

import com.agentweave.engine.CancellationToken;
import com.agentweave.workflow.model.WorkflowResult;

import java.util.concurrent.CompletableFuture;

/** Handle for an asynchronously submitted workflow: its task id, completion future and cancellation. */
public final class WorkflowHandle {

    private final String taskId;
    private final CompletableFuture<WorkflowResult> result;
    private final CancellationToken token;

    WorkflowHandle(String taskId, CompletableFuture<WorkflowResult> result, CancellationToken token) {
        this.taskId = taskId;
        this.result = result;
        this.token = token;
    }

    public String getTaskId() {
        return taskId;
    }

    /** Completes with the workflow result; never completes exceptionally for workflow-level failures. */
    public CompletableFuture<WorkflowResult> getResult() {
        return result;
    }

    /** Requests cancellation; returns false when already cancelled. */
    public boolean cancel() {
        return token.cancel("cancelled by caller");
    }
}
