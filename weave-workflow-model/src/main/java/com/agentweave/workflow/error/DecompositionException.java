package com.agentweave.workflow.error;

/**
 * Thrown when a task cannot be turned into a valid set of subtasks: the policy failed,
 * a dependency references an unknown subtask, or the dependencies form a cycle.
 * Always raised before any executor call, so a failed decomposition costs nothing.
 */
public class DecompositionException extends WorkflowException {

    public static final String STAGE = "decomposition";

    public DecompositionException(String message) {
        super(STAGE, message);
    }

    public DecompositionException(String message, Throwable cause) {
        super(STAGE, message, cause);
    }
}
