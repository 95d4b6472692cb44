package com.agentweave.workflow.error;

/**
 * Invalid orchestrator configuration: bad branch reference, unknown agent type, no executor
 * for an agent type, or an out-of-range option. Rejected before execution starts.
 */
public class ConfigurationException extends WorkflowException {

    public static final String STAGE = "configuration";

    public ConfigurationException(String message) {
        super(STAGE, message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(STAGE, message, cause);
    }
}
