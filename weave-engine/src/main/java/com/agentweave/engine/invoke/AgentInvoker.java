package com.agentweave.engine.invoke;

import com.agentweave.agent.AgentContext;
import com.agentweave.workflow.model.AgentResult;
import com.agentweave.workflow.model.SubTask;

/**
 * Turns one executor call into exactly one {@link AgentResult}. Implementations never throw:
 * executor exceptions, timeouts and interruptions all become FAILED or TIMEOUT results.
 */
@FunctionalInterface
public interface AgentInvoker {

    AgentResult invoke(SubTask subtask, AgentContext context);
}
