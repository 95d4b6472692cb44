package com.agentweave.workflow.error;

/**
 * Thrown by a synthesis policy. Fails the run, but the orchestrator still returns every
 * agent result gathered before synthesis started.
 */
public class SynthesisException extends WorkflowException {

    public static final String STAGE = "synthesis";

    public SynthesisException(String message) {
        super(STAGE, message);
    }

    public SynthesisException(String message, Throwable cause) {
        super(STAGE, message, cause);
    }
}
