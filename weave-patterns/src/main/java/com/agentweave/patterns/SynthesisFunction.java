package com.agentweave.patterns;

import com.agentweave.engine.RunContext;
import com.agentweave.workflow.model.AgentResult;

import java.util.List;

/**
 * Caller-supplied aggregation that replaces a pattern's built-in synthesis. Throw
 * {@link com.agentweave.workflow.error.SynthesisException} to fail the run.
 */
@FunctionalInterface
public interface SynthesisFunction {

    String synthesize(List<AgentResult> results, RunContext run);
}
