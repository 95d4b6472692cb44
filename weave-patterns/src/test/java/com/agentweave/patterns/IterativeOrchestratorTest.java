package com.agentweave.patterns;

import com.agentweave.agent.AgentExecution;
import com.agentweave.agent.AgentExecutor;
import com.agentweave.engine.OrchestratorServices;
import com.agentweave.workflow.config.OrchestratorConfig;
import com.agentweave.workflow.event.WorkflowEvent;
import com.agentweave.workflow.event.WorkflowEventType;
import com.agentweave.workflow.model.AgentResult;
import com.agentweave.workflow.model.AgentStatus;
import com.agentweave.workflow.model.AgentType;
import com.agentweave.workflow.model.SubTask;
import com.agentweave.workflow.model.WorkflowResult;
import com.agentweave.workflow.model.WorkflowStatus;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IterativeOrchestratorTest {

    private final ScriptedExecutor exec = new ScriptedExecutor();
    private final List<WorkflowEvent> events = new CopyOnWriteArrayList<>();

    private static final IterationPlanner TWO_WORKERS = (task, previous, pass, run) -> List.of(
            SubTask.builder("a").description("look again at " + task).build(),
            SubTask.builder("b").description("check").dependsOn("a").build());

    @Test
    void neverConverging_runsExactlyMaxIterationsAndCompletes() {
        IterativeOrchestrator orchestrator = new IterativeOrchestrator(OrchestratorConfig.builder().maxIterations(3).build(),
                OrchestratorServices.of(exec), TWO_WORKERS, IterationPredicate.never(), null);

        WorkflowResult result = orchestrator.executeWorkflow("task", "Loop", Map.of(), events::add);

        assertEquals(WorkflowStatus.COMPLETED, result.getStatus());
        assertEquals(3, result.getMetadata().get("iteration_count"));
        assertEquals(false, result.getMetadata().get("converged"));
        assertEquals(List.of("pass1_a", "pass1_b", "pass2_a", "pass2_b", "pass3_a", "pass3_b"),
                result.getAgentResults().stream().map(AgentResult::getAgentId).toList());
        assertEquals(3, exec.callsOf(AgentType.SYNTHESIZER).size());
        assertEquals("synthesizer:iteration_synthesis", result.getSynthesis());
        assertEquals(3, events.stream().filter(e -> e.type() == WorkflowEventType.ITERATION_START).count());
        assertEquals(3, events.stream().filter(e -> e.type() == WorkflowEventType.ITERATION_COMPLETE).count());
        assertEquals(3, ((List<?>) result.getMetadata().get("iteration_history")).size());
    }

    @Test
    void passDependencies_arePrefixedWithTheirPass() {
        new IterativeOrchestrator(OrchestratorConfig.builder().maxIterations(2).build(),
                OrchestratorServices.of(exec), TWO_WORKERS, IterationPredicate.never(), null)
                .executeWorkflow("task", null, Map.of(), null);

        SubTask secondPassB = exec.calls().stream().filter(t -> t.getId().equals("pass2_b")).findFirst().orElseThrow();
        assertEquals(List.of("pass2_a"), List.copyOf(secondPassB.getDependencies()));
        assertEquals(2, secondPassB.getContext().get("pass"));
    }

    @Test
    void convergence_stopsEarly() {
        IterationPredicate secondPass = (synthesis, results, pass) -> pass == 2;

        WorkflowResult result = new IterativeOrchestrator(OrchestratorConfig.builder().maxIterations(5).build(),
                OrchestratorServices.of(exec), TWO_WORKERS, secondPass, null)
                .executeWorkflow("task", null, Map.of(), events::add);

        assertEquals(WorkflowStatus.COMPLETED, result.getStatus());
        assertEquals(2, result.getMetadata().get("iteration_count"));
        assertEquals(true, result.getMetadata().get("converged"));
        WorkflowEvent last = events.stream().filter(e -> e.type() == WorkflowEventType.ITERATION_COMPLETE)
                .reduce((first, second) -> second).orElseThrow();
        assertEquals(true, last.payload().get("converged"));
    }

    @Test
    void plannerReceivesPreviousSynthesis() {
        List<String> seen = new ArrayList<>();
        IterationPlanner recording = (task, previous, pass, run) -> {
            seen.add(pass + ":" + previous);
            return List.of(SubTask.builder("w").description(task).build());
        };
        SynthesisFunction numbered = (results, run) -> "draft after " + results.get(0).getAgentId();

        new IterativeOrchestrator(OrchestratorConfig.builder().maxIterations(3).build(),
                OrchestratorServices.of(exec), recording, IterationPredicate.never(), numbered)
                .executeWorkflow("task", null, Map.of(), null);

        assertEquals(List.of("1:null", "2:draft after pass1_w", "3:draft after pass2_w"), seen);
        assertTrue(exec.callsOf(AgentType.SYNTHESIZER).isEmpty());
    }

    @Test
    void defaultPlanAndPredicate_convergeOnFirstCleanPass() {
        WorkflowResult result = new IterativeOrchestrator(OrchestratorConfig.defaults(), OrchestratorServices.of(exec))
                .executeWorkflow("Explain tides", null, Map.of(), null);

        assertEquals(1, result.getMetadata().get("iteration_count"));
        assertEquals(true, result.getMetadata().get("converged"));
        assertEquals(List.of("pass1_research"), result.getAgentResults().stream().map(AgentResult::getAgentId).toList());
    }

    @Test
    void defaultPlan_refinesAfterAFailedPass() {
        exec.failIds("pass1_research");

        WorkflowResult result = new IterativeOrchestrator(OrchestratorConfig.builder().maxIterations(2).build(),
                OrchestratorServices.of(exec), null, null,
                (results, run) -> results.stream().anyMatch(AgentResult::isSuccess) ? "ok" : "nothing yet")
                .executeWorkflow("Explain tides", null, Map.of(), null);

        assertEquals(List.of("pass1_research", "pass2_refine"), exec.callIds());
        assertTrue(exec.calls().get(1).getDescription().contains("Previous answer:\nnothing yet"));
        assertEquals(true, result.getMetadata().get("converged"));
    }

    @Test
    void synthesisFailureInAPass_failsRunWithResultsSoFar() {
        exec.failWhen(t -> t.getAgentType() == AgentType.WORKER);

        WorkflowResult result = new IterativeOrchestrator(OrchestratorConfig.builder().maxIterations(3).build(),
                OrchestratorServices.of(exec), TWO_WORKERS, IterationPredicate.never(), null)
                .executeWorkflow("task", null, Map.of(), null);

        assertEquals(WorkflowStatus.FAILED, result.getStatus());
        assertEquals("synthesis", result.getMetadata().get("error_stage"));
        assertEquals(2, result.getAgentResults().size());
        assertEquals(0, result.getMetadata().get("iteration_count"));
        assertNull(result.getSynthesis());
    }

    /** Workers named "slow" or every worker when {@code allWorkers} sleep for {@code millis}; synthesizers answer at once. */
    private static AgentExecutor sleepingWorkers(long millis, boolean allWorkers) {
        return (subtask, context) -> {
            if (subtask.getAgentType() == AgentType.WORKER && (allWorkers || subtask.getId().endsWith("slow"))) {
                Thread.sleep(millis);
            }
            return AgentExecution.completed("out:" + subtask.getId(), 3, new BigDecimal("0.001"));
        };
    }

    @Test
    void deadlineDuringALaterPass_keepsThePreviousSynthesis() {
        IterationPlanner oneWorker = (task, previous, pass, run) -> List.of(SubTask.builder("w").description(task).build());
        OrchestratorConfig config = OrchestratorConfig.builder().maxIterations(3).workflowTimeoutSeconds(1.2).build();

        WorkflowResult result = new IterativeOrchestrator(config, OrchestratorServices.of(sleepingWorkers(800, true)),
                oneWorker, IterationPredicate.never(), null)
                .executeWorkflow("task", null, Map.of(), events::add);

        assertEquals(WorkflowStatus.COMPLETED, result.getStatus());
        assertEquals("out:iteration_synthesis", result.getSynthesis());
        assertEquals(true, result.getMetadata().get("workflow_timed_out"));
        assertEquals(false, result.getMetadata().get("converged"));
        assertEquals(1, result.getMetadata().get("iteration_count"));
        assertEquals(List.of("pass1_w", "pass2_w"),
                result.getAgentResults().stream().map(AgentResult::getAgentId).toList());
        assertEquals(AgentStatus.TIMEOUT, result.getAgentResults().get(1).getStatus());
        assertEquals(2, events.stream().filter(e -> e.type() == WorkflowEventType.ITERATION_START).count());
    }

    @Test
    void deadlineInsideAPass_synthesizesWhatFinishedAndStops() {
        IterationPlanner fastAndSlow = (task, previous, pass, run) -> List.of(
                SubTask.builder("fast").description(task).build(),
                SubTask.builder("slow").description(task).build());
        SynthesisFunction ids = (results, run) -> String.join(",",
                OutputCombiner.successes(results).stream().map(AgentResult::getAgentId).toList());
        OrchestratorConfig config = OrchestratorConfig.builder()
                .maxIterations(3).maxConcurrentAgents(2).workflowTimeoutSeconds(1).build();

        WorkflowResult result = new IterativeOrchestrator(config, OrchestratorServices.of(sleepingWorkers(3000, false)),
                fastAndSlow, IterationPredicate.never(), ids)
                .executeWorkflow("task", null, Map.of(), null);

        assertEquals(WorkflowStatus.COMPLETED, result.getStatus());
        assertEquals("pass1_fast", result.getSynthesis());
        assertEquals(1, result.getMetadata().get("iteration_count"));
        assertEquals(true, result.getMetadata().get("workflow_timed_out"));
        assertEquals(AgentStatus.TIMEOUT, result.getAgentResults().get(1).getStatus());
        assertFalse(result.getAgentResults().stream().anyMatch(r -> r.getAgentId().startsWith("pass2_")));
    }
}
