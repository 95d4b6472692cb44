package com.agentweave.service;

import com.agentweave.workflow.model.AgentResult;
import com.agentweave.workflow.model.AgentStatus;
import com.agentweave.workflow.model.AgentType;
import com.agentweave.workflow.model.FailureKind;
import com.agentweave.workflow.model.WorkflowResult;
import com.agentweave.workflow.model.WorkflowStatus;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WorkflowRegistryTest {

    private static WorkflowResult done(String taskId) {
        return WorkflowResult.builder(taskId).pattern("swarm").status(WorkflowStatus.COMPLETED).build();
    }

    @Test
    void admit_rejectsBeyondActiveLimit() {
        WorkflowRegistry registry = new WorkflowRegistry(2, 10);
        registry.admit("a", "swarm", "A");
        registry.admit("b", "swarm", "B");

        WorkflowRejectedException e = assertThrows(WorkflowRejectedException.class, () -> registry.admit("c", "swarm", "C"));
        assertEquals(2, e.getLimit());

        registry.complete("a", done("a"));
        registry.admit("c", "swarm", "C");
        assertEquals(2, registry.activeCount());
    }

    @Test
    void completed_evictsOldestBeyondRetention() {
        WorkflowRegistry registry = new WorkflowRegistry(10, 2);
        for (String id : new String[]{"a", "b", "c"}) {
            registry.admit(id, "swarm", id);
            registry.complete(id, done(id));
        }

        assertTrue(registry.result("a").isEmpty());
        assertTrue(registry.result("b").isPresent());
        assertTrue(registry.result("c").isPresent());
        assertEquals(2, registry.completedCount());
    }

    @Test
    void status_coversRunningAndFinished() {
        WorkflowRegistry registry = new WorkflowRegistry(10, 10);
        registry.admit("a", "swarm", "Title");

        assertEquals(WorkflowStatus.RUNNING, registry.status("a").orElseThrow().status());

        registry.complete("a", done("a"));
        WorkflowStatusView view = registry.status("a").orElseThrow();
        assertEquals(WorkflowStatus.COMPLETED, view.status());
        assertTrue(view.isFinished());
        assertEquals("workflow_complete", view.lastEvent());
        assertTrue(registry.status("missing").isEmpty());
    }

    @Test
    void abandon_freesTheSlotWithoutAResult() {
        WorkflowRegistry registry = new WorkflowRegistry(1, 10);
        registry.admit("a", "swarm", "A");
        registry.abandon("a");

        assertEquals(0, registry.activeCount());
        assertTrue(registry.result("a").isEmpty());
    }

    @Test
    void snapshot_restoresFinishedWorkflowsIntoAFreshRegistry() {
        WorkflowRegistry registry = new WorkflowRegistry(10, 10);
        registry.admit("a", "swarm", "A");
        registry.complete("a", WorkflowResult.builder("a").title("A").pattern("swarm").status(WorkflowStatus.COMPLETED)
                .agentResults(List.of(
                        new AgentResult("w1", AgentType.WORKER, AgentStatus.SUCCESS, "found it", 12,
                                new BigDecimal("0.0030"), 40, null, null, 1, Map.of()),
                        new AgentResult("w2", AgentType.WORKER, AgentStatus.TIMEOUT, "", 0,
                                BigDecimal.ZERO, 900, "deadline", null, 2, Map.of())))
                .synthesis("found it").totalCost(new BigDecimal("0.0030")).totalTokens(12)
                .metadata("workflow_timed_out", true).startedAt(Instant.parse("2026-01-05T10:00:00Z"))
                .completedAt(Instant.parse("2026-01-05T10:00:02Z")).build());
        registry.admit("running", "swarm", "R");

        String json = registry.snapshot().toJson();
        WorkflowRegistry fresh = new WorkflowRegistry(10, 10);
        assertEquals(1, fresh.restore(RegistrySnapshot.fromJson(json)));

        WorkflowResult restored = fresh.result("a").orElseThrow();
        assertEquals(WorkflowStatus.COMPLETED, restored.getStatus());
        assertEquals("found it", restored.getSynthesis());
        assertEquals(0, new BigDecimal("0.003").compareTo(restored.getTotalCost()));
        assertEquals(true, restored.getMetadata().get("workflow_timed_out"));
        assertEquals(Instant.parse("2026-01-05T10:00:02Z"), restored.getCompletedAt());
        AgentResult timedOut = restored.getAgentResults().get(1);
        assertEquals(AgentStatus.TIMEOUT, timedOut.getStatus());
        assertEquals(FailureKind.TIMEOUT, timedOut.getFailureKind());
        assertEquals(2, timedOut.getAttempts());
        assertTrue(fresh.result("running").isEmpty());
        assertEquals(WorkflowStatus.COMPLETED, fresh.status("a").orElseThrow().status());
    }

    @Test
    void restore_skipsKnownIdsAndKeepsRetention() {
        WorkflowRegistry source = new WorkflowRegistry(10, 10);
        for (String id : new String[]{"a", "b", "c"}) {
            source.admit(id, "swarm", id);
            source.complete(id, done(id));
        }
        WorkflowRegistry target = new WorkflowRegistry(10, 1);
        target.admit("b", "swarm", "B");

        assertEquals(2, target.restore(source.snapshot()));

        assertTrue(target.result("a").isEmpty());
        assertTrue(target.result("b").isEmpty());
        assertTrue(target.result("c").isPresent());
        assertEquals(WorkflowStatus.RUNNING, target.status("b").orElseThrow().status());
    }
}
