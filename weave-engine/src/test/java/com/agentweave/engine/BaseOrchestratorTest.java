package com.agentweave.engine;

import com.agentweave.agent.AgentExecution;
import com.agentweave.agent.AgentExecutor;
import com.agentweave.agent.AgentExecutorRegistry;
import com.agentweave.workflow.config.OrchestratorConfig;
import com.agentweave.workflow.config.RetryPolicy;
import com.agentweave.workflow.event.WorkflowEvent;
import com.agentweave.workflow.event.WorkflowEventType;
import com.agentweave.workflow.model.AgentResult;
import com.agentweave.workflow.model.AgentStatus;
import com.agentweave.workflow.model.AgentType;
import com.agentweave.workflow.model.FailureKind;
import com.agentweave.workflow.model.SubTask;
import com.agentweave.workflow.model.WorkflowResult;
import com.agentweave.workflow.model.WorkflowStatus;
import com.agentweave.agent.AgentExecutionException;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BaseOrchestratorTest {

    private final AtomicInteger calls = new AtomicInteger();
    private final List<WorkflowEvent> events = new CopyOnWriteArrayList<>();

    private AgentExecutor echo() {
        return (t, c) -> {
            calls.incrementAndGet();
            return AgentExecution.completed(t.getId().toUpperCase(), 10, new BigDecimal("0.01"));
        };
    }

    private static SubTask task(String id, String... deps) {
        return SubTask.builder(id).description("do " + id).dependsOn(deps).build();
    }

    private List<WorkflowEventType> eventTypes() {
        return events.stream().map(WorkflowEvent::type).toList();
    }

    @Test
    void executeWorkflow_happyPathEmitsLifecycleAndTotals() {
        FixedPlanOrchestrator orchestrator = new FixedPlanOrchestrator(
                () -> List.of(task("a"), task("b"), task("c", "a", "b")),
                OrchestratorConfig.defaults(), OrchestratorServices.of(echo()));

        WorkflowResult result = orchestrator.executeWorkflow("task", "Title", Map.of(), events::add);

        assertEquals(WorkflowStatus.COMPLETED, result.getStatus());
        assertEquals("A|B|C", result.getSynthesis());
        assertEquals(List.of("a", "b", "c"), result.getAgentResults().stream().map(AgentResult::getAgentId).toList());
        assertEquals(30, result.getTotalTokens());
        assertEquals(0, new BigDecimal("0.03").compareTo(result.getTotalCost()));
        assertTrue(result.getTaskId().startsWith("fixed_"));
        assertEquals(WorkflowEventType.WORKFLOW_START, events.get(0).type());
        assertEquals(WorkflowEventType.DECOMPOSITION_COMPLETE, events.get(1).type());
        assertEquals(WorkflowEventType.WORKFLOW_COMPLETE, events.get(events.size() - 1).type());
        assertEquals(3, eventTypes().stream().filter(t -> t == WorkflowEventType.AGENT_START).count());
        assertTrue(eventTypes().indexOf(WorkflowEventType.SYNTHESIS_START)
                > eventTypes().lastIndexOf(WorkflowEventType.AGENT_COMPLETE));
        assertEquals(result.getTaskId(), events.get(0).taskId());
    }

    @Test
    void dependentReceivesDependencyResults() {
        List<String> seenDeps = new CopyOnWriteArrayList<>();
        AgentExecutor exec = (t, c) -> {
            c.getDependencyResults().forEach(r -> seenDeps.add(t.getId() + "<-" + r.getAgentId() + ":" + r.getOutput()));
            return AgentExecution.completed("out-" + t.getId(), 1, BigDecimal.ZERO);
        };
        FixedPlanOrchestrator orchestrator = new FixedPlanOrchestrator(() -> List.of(task("a"), task("b", "a")),
                OrchestratorConfig.defaults(), OrchestratorServices.of(exec));

        orchestrator.executeWorkflow("task", null, Map.of(), null);

        assertEquals(List.of("b<-a:out-a"), seenDeps);
    }

    @Test
    void cyclicDecomposition_failsWithZeroExecutorCalls() {
        FixedPlanOrchestrator orchestrator = new FixedPlanOrchestrator(() -> List.of(task("a", "c"), task("b", "a"), task("c", "b")),
                OrchestratorConfig.defaults(), OrchestratorServices.of(echo()));

        WorkflowResult result = orchestrator.executeWorkflow("task", "t", Map.of(), events::add);

        assertEquals(WorkflowStatus.FAILED, result.getStatus());
        assertEquals(0, calls.get());
        assertTrue(result.getAgentResults().isEmpty());
        assertTrue(result.getError().contains("Cyclic dependency"));
        assertEquals("decomposition", result.getMetadata().get("error_stage"));
        WorkflowEvent last = events.get(events.size() - 1);
        assertEquals(WorkflowEventType.WORKFLOW_ERROR, last.type());
        assertEquals("decomposition", last.payloadString("stage"));
    }

    @Test
    void unregisteredAgentType_isConfigurationFailureBeforeExecution() {
        AgentExecutorRegistry registry = new AgentExecutorRegistry().register(AgentType.WORKER, echo());
        FixedPlanOrchestrator orchestrator = new FixedPlanOrchestrator(
                () -> List.of(task("a"), SubTask.builder("img").description("draw").agentType(AgentType.IMAGE).build()),
                OrchestratorConfig.defaults(), OrchestratorServices.builder(registry).build());

        WorkflowResult result = orchestrator.executeWorkflow("task", "t", Map.of(), null);

        assertEquals(WorkflowStatus.FAILED, result.getStatus());
        assertEquals("configuration", result.getMetadata().get("error_stage"));
        assertEquals(0, calls.get());
    }

    @Test
    void oneSlowSubtaskTimesOutWhileOthersComplete() {
        AgentExecutor exec = (t, c) -> {
            if (t.getId().equals("slow")) Thread.sleep(4_000);
            return AgentExecution.completed(t.getId(), 1, BigDecimal.ZERO);
        };
        OrchestratorConfig config = OrchestratorConfig.builder()
                .maxConcurrentAgents(2).timeoutSeconds(1).workflowTimeoutSeconds(5).build();
        FixedPlanOrchestrator orchestrator = new FixedPlanOrchestrator(
                () -> List.of(task("one"), task("slow"), task("three"), task("four")),
                config, OrchestratorServices.of(exec));

        WorkflowResult result = orchestrator.executeWorkflow("task", "t", Map.of(), null);

        assertEquals(WorkflowStatus.COMPLETED, result.getStatus());
        assertEquals(4, result.getAgentResults().size());
        assertEquals(1, result.getAgentResults().stream().filter(r -> r.getStatus() == AgentStatus.TIMEOUT).count());
        assertEquals(AgentStatus.TIMEOUT, result.getAgentResults().get(1).getStatus());
        assertEquals("one|three|four", result.getSynthesis());
        assertEquals(4, orchestrator.synthesizedOver.size());
    }

    @Test
    void workflowDeadline_stopsDispatchAndSynthesizesWhatFinished() {
        AgentExecutor exec = (t, c) -> {
            calls.incrementAndGet();
            if (t.getId().equals("slow")) Thread.sleep(3_000);
            return AgentExecution.completed(t.getId(), 1, BigDecimal.ZERO);
        };
        OrchestratorConfig config = OrchestratorConfig.builder()
                .parallelExecution(false).workflowTimeoutSeconds(1).build();
        FixedPlanOrchestrator orchestrator = new FixedPlanOrchestrator(
                () -> List.of(task("one"), task("slow"), task("three"), task("four")),
                config, OrchestratorServices.of(exec));

        WorkflowResult result = orchestrator.executeWorkflow("task", "t", Map.of(), events::add);

        assertEquals(WorkflowStatus.COMPLETED, result.getStatus());
        assertEquals(true, result.getMetadata().get("workflow_timed_out"));
        assertEquals(List.of("three", "four"), result.getMetadata().get("undispatched"));
        assertEquals(List.of("one", "slow"), result.getAgentResults().stream().map(AgentResult::getAgentId).toList());
        assertEquals(AgentStatus.TIMEOUT, result.getAgentResults().get(1).getStatus());
        assertEquals("one", result.getSynthesis());
        assertEquals(2, calls.get());
        assertEquals(WorkflowEventType.WORKFLOW_COMPLETE, events.get(events.size() - 1).type());
    }

    @Test
    void cancellationAfterTwoCalls_stopsDispatchAndSkipsSynthesis() {
        CancellationToken token = new CancellationToken();
        AgentExecutor exec = (t, c) -> {
            if (calls.incrementAndGet() == 2) token.cancel("user request");
            return AgentExecution.completed(t.getId(), 1, BigDecimal.ZERO);
        };
        List<SubTask> plan = new ArrayList<>();
        for (int i = 0; i < 6; i++) plan.add(task("t" + i));
        FixedPlanOrchestrator orchestrator = new FixedPlanOrchestrator(() -> plan,
                OrchestratorConfig.builder().parallelExecution(false).build(), OrchestratorServices.of(exec));

        WorkflowResult result = orchestrator.executeWorkflow("fixed_cancel", "task", "t", Map.of(), events::add, token);

        assertEquals(WorkflowStatus.CANCELLED, result.getStatus());
        assertEquals(2, calls.get());
        assertTrue(result.getAgentResults().size() <= 2);
        assertNull(result.getSynthesis());
        assertNull(orchestrator.synthesizedOver);
        assertFalse(eventTypes().contains(WorkflowEventType.SYNTHESIS_START));
        assertEquals(List.of("t2", "t3", "t4", "t5"), result.getMetadata().get("undispatched"));
    }

    @Test
    void synthesisFailure_keepsAgentResults() {
        AgentExecutor exec = (t, c) -> {
            throw new AgentExecutionException(FailureKind.NETWORK, "connection reset");
        };
        FixedPlanOrchestrator orchestrator = new FixedPlanOrchestrator(() -> List.of(task("a"), task("b")),
                OrchestratorConfig.defaults(), OrchestratorServices.of(exec));

        WorkflowResult result = orchestrator.executeWorkflow("task", "t", Map.of(), null);

        assertEquals(WorkflowStatus.FAILED, result.getStatus());
        assertEquals(2, result.getAgentResults().size());
        assertEquals("synthesis", result.getMetadata().get("error_stage"));
        assertEquals(FailureKind.NETWORK, result.getAgentResults().get(0).getFailureKind());
    }

    @Test
    void failFast_failsRunWithoutSynthesis() {
        AgentExecutor exec = (t, c) -> t.getId().equals("a")
                ? AgentExecution.failed("bad", FailureKind.VALIDATION)
                : AgentExecution.completed("ok", 1, BigDecimal.ZERO);
        FixedPlanOrchestrator orchestrator = new FixedPlanOrchestrator(() -> List.of(task("a"), task("b"), task("c")),
                OrchestratorConfig.builder().parallelExecution(false).failFast(true).build(), OrchestratorServices.of(exec));

        WorkflowResult result = orchestrator.executeWorkflow("task", "t", Map.of(), null);

        assertEquals(WorkflowStatus.FAILED, result.getStatus());
        assertEquals(1, result.getAgentResults().size());
        assertNull(orchestrator.synthesizedOver);
        assertTrue(result.getError().contains("a"));
    }

    @Test
    void documentGeneration_failureDowngradesToWarning() {
        OrchestratorServices services = OrchestratorServices.builder(AgentExecutorRegistry.withDefault(echo()))
                .documentGenerator((text, formats) -> {
                    throw new IllegalStateException("renderer offline");
                })
                .build();
        FixedPlanOrchestrator orchestrator = new FixedPlanOrchestrator(() -> List.of(task("a")),
                OrchestratorConfig.builder().generateDocuments(true).build(), services);

        WorkflowResult result = orchestrator.executeWorkflow("task", "t", Map.of(), null);

        assertEquals(WorkflowStatus.COMPLETED_WITH_WARNINGS, result.getStatus());
        assertEquals("A", result.getSynthesis());
        assertTrue(result.getWarnings().get(0).contains("renderer offline"));
    }

    @Test
    void documentGeneration_attachesArtifacts() {
        List<List<String>> requested = new ArrayList<>();
        OrchestratorServices services = OrchestratorServices.builder(AgentExecutorRegistry.withDefault(echo()))
                .documentGenerator((text, formats) -> {
                    requested.add(formats);
                    return List.of("/tmp/report.md", "/tmp/report.pdf");
                })
                .build();
        FixedPlanOrchestrator orchestrator = new FixedPlanOrchestrator(() -> List.of(task("a")),
                OrchestratorConfig.builder().generateDocuments(true).documentFormats(List.of("markdown", "pdf")).build(), services);

        WorkflowResult result = orchestrator.executeWorkflow("task", "t", Map.of(), null);

        assertEquals(WorkflowStatus.COMPLETED, result.getStatus());
        assertEquals(List.of("/tmp/report.md", "/tmp/report.pdf"), result.getArtifacts());
        assertEquals(List.of(List.of("markdown", "pdf")), requested);
    }

    @Test
    void retryPolicy_retriesRateLimitedCalls() {
        AtomicInteger attempts = new AtomicInteger();
        AgentExecutor exec = (t, c) -> {
            if (attempts.incrementAndGet() < 3) throw AgentExecutionException.rateLimited("slow down");
            return AgentExecution.completed("done", 1, BigDecimal.ZERO);
        };
        OrchestratorServices services = OrchestratorServices.builder(AgentExecutorRegistry.withDefault(exec))
                .retrySleeper(d -> { })
                .build();
        FixedPlanOrchestrator orchestrator = new FixedPlanOrchestrator(() -> List.of(task("a")),
                OrchestratorConfig.builder().retryPolicy(RetryPolicy.of(3, 0.01, 2.0)).build(), services);

        WorkflowResult result = orchestrator.executeWorkflow("task", "t", Map.of(), events::add);

        assertEquals(WorkflowStatus.COMPLETED, result.getStatus());
        assertEquals(3, result.getAgentResults().get(0).getAttempts());
        WorkflowEvent complete = events.stream().filter(e -> e.type() == WorkflowEventType.AGENT_COMPLETE).findFirst().orElse(null);
        assertNotNull(complete);
        assertEquals(3, complete.payload().get("attempts"));
    }

    @Test
    void throwingProgressSink_doesNotAffectRun() {
        FixedPlanOrchestrator orchestrator = new FixedPlanOrchestrator(() -> List.of(task("a"), task("b")),
                OrchestratorConfig.defaults(), OrchestratorServices.of(echo()));

        WorkflowResult result = orchestrator.executeWorkflow("task", "t", Map.of(), e -> {
            throw new IllegalStateException("client disconnected");
        });

        assertEquals(WorkflowStatus.COMPLETED, result.getStatus());
        assertEquals("A|B", result.getSynthesis());
    }
}
