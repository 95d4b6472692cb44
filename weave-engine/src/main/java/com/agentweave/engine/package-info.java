/**
 * Pattern-independent run machinery: the {@link com.agentweave.engine.BaseOrchestrator}
 * template, run state, the dependency-aware scheduler and the executor invocation chain.
 */
package com.agentweave.engine;
