/**
 * Contracts the engine consumes: {@link com.agentweave.agent.AgentExecutor} (performs a
 * subtask), {@link com.agentweave.agent.ProgressSink} (receives events) and
 * {@link com.agentweave.agent.DocumentGenerator} (renders artifacts), plus the per-type
 * executor registry.
 */
package com.agentweave.agent;
