package com.agentweave.service;

import com.agentweave.engine.BaseOrchestrator;
import com.agentweave.engine.OrchestratorServices;
import com.agentweave.workflow.config.OrchestratorConfig;

/**
 * Creates a pattern orchestrator for one submission.
 * Throws {@link com.agentweave.workflow.error.ConfigurationException} when the configuration does not suit the pattern.
 */
@FunctionalInterface
public interface OrchestratorFactory {

    BaseOrchestrator create(OrchestratorConfig config, OrchestratorServices services);
}
