package com.agentweave.ledger;

import com.agentweave.workflow.model.AgentResult;
import com.agentweave.workflow.model.AgentType;
import com.agentweave.workflow.model.SubTask;
import com.agentweave.workflow.model.WorkflowStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.assertEquals;

class AgentMetricsTest {

    @Test
    void recordAgent_registersTimerAndTokenCounter() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        AgentMetrics metrics = new AgentMetrics(registry);
        SubTask t = SubTask.builder("a").description("a").agentType(AgentType.NEWS).build();

        metrics.recordAgent(AgentResult.success(t, "x", 42, BigDecimal.ONE, 15, null));
        metrics.recordAgent(AgentResult.success(t, "y", 8, BigDecimal.ONE, 5, null));

        assertEquals(2, registry.get(AgentMetrics.AGENT_EXECUTION).tags("agentType", "news", "status", "success").timer().count());
        assertEquals(50.0, registry.get(AgentMetrics.AGENT_TOKENS).tag("agentType", "news").counter().count());
    }

    @Test
    void recordWorkflow_countsByPatternAndStatus() {
        AgentMetrics metrics = AgentMetrics.inMemory();

        metrics.recordWorkflow("swarm", WorkflowStatus.COMPLETED);
        metrics.recordWorkflow("swarm", WorkflowStatus.COMPLETED);
        metrics.recordWorkflow("swarm", WorkflowStatus.FAILED);

        assertEquals(2.0, metrics.getRegistry().get(AgentMetrics.WORKFLOW_RUNS)
                .tags("pattern", "swarm", "status", "completed").counter().count());
    }
}
