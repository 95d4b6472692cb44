package com.agentweave.agent;

import com.agentweave.workflow.model.FailureKind;

/**
 * Classified executor failure. Thrown by {@link AgentExecutor} implementations; the engine
 * converts it into a FAILED (or TIMEOUT) agent result and never lets it escape a run.
 */
public class AgentExecutionException extends RuntimeException {

    private final FailureKind kind;

    public AgentExecutionException(FailureKind kind, String message) {
        super(message);
        this.kind = kind != null ? kind : FailureKind.UNKNOWN;
    }

    public AgentExecutionException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind != null ? kind : FailureKind.UNKNOWN;
    }

    public FailureKind getKind() {
        return kind;
    }

    public static AgentExecutionException rateLimited(String message) {
        return new AgentExecutionException(FailureKind.RATE_LIMIT, message);
    }

    public static AgentExecutionException network(String message, Throwable cause) {
        return new AgentExecutionException(FailureKind.NETWORK, message, cause);
    }
}
