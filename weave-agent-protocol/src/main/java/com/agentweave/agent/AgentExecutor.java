package com.agentweave.agent;

import com.agentweave.workflow.model.SubTask;

/**
 * Contract for whatever actually performs a subtask (typically a call to an external
 * text-generation service). The engine never generates text itself.
 * <p>
 * <b>Threading:</b> the engine calls {@link #execute} from several worker threads at once
 * when a pattern runs subtasks in parallel. Implementations must be thread-safe.
 * The engine may stop waiting on a call that exceeds the per-subtask timeout; the call is
 * interrupted but implementations that ignore interruption simply finish unobserved.
 */
public interface AgentExecutor {

    /**
     * Executes one subtask.
     *
     * @param subtask the unit of work; never null
     * @param context run-level context and the results of the subtask's dependencies; never null
     * @return the execution outcome; never null
     * @throws AgentExecutionException for a classified failure (rate limit, auth, ...)
     * @throws Exception               on any other failure; recorded as {@code UNKNOWN}
     */
    AgentExecution execute(SubTask subtask, AgentContext context) throws Exception;
}
