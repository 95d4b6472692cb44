/**
 * The five orchestration patterns built on {@link com.agentweave.engine.BaseOrchestrator}:
 * hierarchical, domain swarm, sequential, conditional and iterative, plus the callback
 * interfaces callers use to customise planning, branching, convergence and synthesis.
 */
package com.agentweave.patterns;
