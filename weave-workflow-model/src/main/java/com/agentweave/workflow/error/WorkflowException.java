package com.agentweave.workflow.error;

/**
 * Base of the workflow-level error taxonomy. Carries the stage in which the run failed
 * (decomposition, configuration, synthesis, execution) so callers and progress events can
 * report where the run stopped.
 */
public class WorkflowException extends RuntimeException {

    private final String stage;

    public WorkflowException(String stage, String message) {
        super(message);
        this.stage = stage;
    }

    public WorkflowException(String stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    public String getStage() {
        return stage;
    }
}
