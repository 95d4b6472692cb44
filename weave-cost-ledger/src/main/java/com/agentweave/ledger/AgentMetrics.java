package com.agentweave.ledger;

import com.agentweave.workflow.model.AgentResult;
import com.agentweave.workflow.model.WorkflowStatus;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer instrumentation for executor calls and workflow runs:
 * <ul>
 *   <li>{@code weave.agent.execution} timer tagged {@code agentType}, {@code status}</li>
 *   <li>{@code weave.agent.tokens} counter tagged {@code agentType}</li>
 *   <li>{@code weave.workflow.runs} counter tagged {@code pattern}, {@code status}</li>
 * </ul>
 * Recording never fails the caller: meter errors are logged and dropped.
 */
public final class AgentMetrics {

    private static final Logger log = LoggerFactory.getLogger(AgentMetrics.class);

    public static final String AGENT_EXECUTION = "weave.agent.execution";
    public static final String AGENT_TOKENS = "weave.agent.tokens";
    public static final String WORKFLOW_RUNS = "weave.workflow.runs";

    private final MeterRegistry registry;

    public AgentMetrics(MeterRegistry registry) {
        this.registry = registry != null ? registry : new SimpleMeterRegistry();
    }

    /** Metrics backed by a private in-memory registry. */
    public static AgentMetrics inMemory() {
        return new AgentMetrics(new SimpleMeterRegistry());
    }

    public void recordAgent(AgentResult result) {
        if (result == null) return;
        try {
            String type = result.getAgentType() != null ? result.getAgentType().toValue() : "unknown";
            Timer.builder(AGENT_EXECUTION)
                    .tag("agentType", type)
                    .tag("status", result.getStatus().toValue())
                    .register(registry)
                    .record(result.getExecutionTimeMillis(), TimeUnit.MILLISECONDS);
            if (result.getTokensUsed() > 0) {
                registry.counter(AGENT_TOKENS, "agentType", type).increment(result.getTokensUsed());
            }
        } catch (RuntimeException e) {
            log.warn("Agent metrics recording failed | agentId={} | error={}", result.getAgentId(), e.getMessage(), e);
        }
    }

    public void recordWorkflow(String pattern, WorkflowStatus status) {
        try {
            registry.counter(WORKFLOW_RUNS,
                    "pattern", pattern != null ? pattern : "unknown",
                    "status", status != null ? status.toValue() : "unknown").increment();
        } catch (RuntimeException e) {
            log.warn("Workflow metrics recording failed | pattern={} | error={}", pattern, e.getMessage(), e);
        }
    }

    public MeterRegistry getRegistry() {
        return registry;
    }
}
