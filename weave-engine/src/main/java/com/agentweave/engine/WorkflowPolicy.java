package com.agentweave.engine;

import com.agentweave.workflow.model.AgentResult;
import com.agentweave.workflow.model.SubTask;

import java.util.List;

/**
 * The three decisions a pattern makes. {@link BaseOrchestrator} owns the run lifecycle
 * around them: validation, scheduling, events, accounting and result assembly.
 */
public interface WorkflowPolicy {

    /**
     * Splits the task into subtasks.
     *
     * @throws com.agentweave.workflow.error.DecompositionException when the task cannot be decomposed
     */
    List<SubTask> decompose(String task, RunContext run);

    /** Executes one subtask. Never throws: failures come back as FAILED or TIMEOUT results. */
    AgentResult executeOne(SubTask subtask, RunContext run);

    /**
     * Combines the results (declaration order) into the final text.
     *
     * @throws com.agentweave.workflow.error.SynthesisException when no usable synthesis can be produced
     */
    String synthesize(List<AgentResult> results, RunContext run);
}
