package com.agentweave.patterns;

import com.agentweave.engine.OrchestratorServices;
import com.agentweave.workflow.config.OrchestratorConfig;
import com.agentweave.workflow.config.StepDefinition;
import com.agentweave.workflow.error.ConfigurationException;
import com.agentweave.workflow.event.WorkflowEvent;
import com.agentweave.workflow.event.WorkflowEventType;
import com.agentweave.workflow.model.WorkflowResult;
import com.agentweave.workflow.model.WorkflowStatus;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConditionalOrchestratorTest {

    private final ScriptedExecutor exec = new ScriptedExecutor();
    private final List<WorkflowEvent> events = new CopyOnWriteArrayList<>();

    private static OrchestratorConfig.Builder threeBranches() {
        return OrchestratorConfig.builder()
                .branch("a", List.of(StepDefinition.of("a1", "first of a")))
                .branch("b", List.of(StepDefinition.of("b1", "first of b"), StepDefinition.of("b2", "second of b")))
                .branch("c", List.of(StepDefinition.of("c1", "first of c")));
    }

    private WorkflowResult run(OrchestratorConfig config, Map<String, Object> context) {
        return new ConditionalOrchestrator(config, OrchestratorServices.of(exec))
                .executeWorkflow("route me", "Routing", context, events::add);
    }

    @Test
    void selectingB_executesExactlyBsSteps() {
        WorkflowResult result = run(threeBranches().build(), Map.of("condition", "b"));

        assertEquals(WorkflowStatus.COMPLETED, result.getStatus());
        assertEquals(List.of("b_step_1", "b_step_2"), exec.callIds());
        assertEquals("b", result.getMetadata().get("selected_branch"));
        assertEquals("## Step 1: b1\n\nworker:b_step_1\n\n## Step 2: b2\n\nworker:b_step_2", result.getSynthesis());
        WorkflowEvent selected = events.stream().filter(e -> e.type() == WorkflowEventType.BRANCH_SELECTED).findFirst().orElseThrow();
        assertEquals("b", selected.payloadString("branch"));
    }

    @Test
    void branchStepsAreChained() {
        run(threeBranches().build(), Map.of("condition", "b"));

        assertEquals("worker:b_step_1", exec.contexts().get(1).dependencyOutput("b_step_1"));
    }

    @Test
    void configuredCondition_andCustomKey() {
        run(threeBranches().condition("c").build(), Map.of("condition", "a"));
        assertEquals(List.of("c_step_1"), exec.callIds());

        ScriptedExecutor second = new ScriptedExecutor();
        new ConditionalOrchestrator(threeBranches().conditionKey("route").build(), OrchestratorServices.of(second))
                .executeWorkflow("t", null, Map.of("route", "a"), null);
        assertEquals(List.of("a_step_1"), second.callIds());
    }

    @Test
    void evaluator_choosesBranchFromContext() {
        ConditionEvaluator bySize = (context, task) -> ((Integer) context.get("size")) > 10 ? "c" : "a";

        new ConditionalOrchestrator(threeBranches().build(), OrchestratorServices.of(exec), bySize, null)
                .executeWorkflow("t", null, Map.of("size", 42), null);

        assertEquals(List.of("c_step_1"), exec.callIds());
    }

    @Test
    void unmatchedCondition_fallsBackToDefaultBranch() {
        WorkflowResult result = run(threeBranches().defaultBranch("a").build(), Map.of("condition", "zzz"));

        assertEquals(List.of("a_step_1"), exec.callIds());
        assertEquals("a", result.getMetadata().get("selected_branch"));
    }

    @Test
    void unmatchedCondition_withoutDefault_failsDecomposition() {
        WorkflowResult result = run(threeBranches().build(), Map.of());

        assertEquals(WorkflowStatus.FAILED, result.getStatus());
        assertEquals("decomposition", result.getMetadata().get("error_stage"));
        assertTrue(exec.calls().isEmpty());
    }

    @Test
    void invalidBranchConfigurations_rejectedAtConstruction() {
        OrchestratorServices services = OrchestratorServices.of(exec);
        assertThrows(ConfigurationException.class,
                () -> new ConditionalOrchestrator(OrchestratorConfig.defaults(), services));
        assertThrows(ConfigurationException.class,
                () -> new ConditionalOrchestrator(threeBranches().branch("empty", List.of()).build(), services));
        assertThrows(ConfigurationException.class,
                () -> new ConditionalOrchestrator(threeBranches().defaultBranch("missing").build(), services));
    }

    @Test
    void branchesFromJson_keepDeclarationOrder() {
        OrchestratorConfig config = OrchestratorConfig.fromJson("""
                {"branches": {
                   "simple":   [{"name": "answer", "description": "Answer directly"}],
                   "detailed": [{"name": "research", "description": "Research"},
                                {"name": "write", "description": "Write it up"}]
                 },
                 "default_branch": "simple"}
                """);

        WorkflowResult result = run(config, Map.of());

        assertEquals(List.of("simple", "detailed"), List.copyOf(config.getBranches().keySet()));
        assertEquals("simple", result.getMetadata().get("selected_branch"));
    }
}
