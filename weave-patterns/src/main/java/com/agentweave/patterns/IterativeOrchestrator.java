package com.agentweave.patterns;

import com.agentweave.engine.BaseOrchestrator;
import com.agentweave.engine.OrchestratorServices;
import com.agentweave.engine.RunContext;
import com.agentweave.engine.schedule.ScheduleOutcome;
import com.agentweave.workflow.config.OrchestratorConfig;
import com.agentweave.workflow.error.SynthesisException;
import com.agentweave.workflow.event.WorkflowEventType;
import com.agentweave.workflow.model.AgentResult;
import com.agentweave.workflow.model.AgentType;
import com.agentweave.workflow.model.SubTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Refinement loop: up to {@code maxIterations} decompose-execute-synthesize passes, each
 * planned with the previous pass's synthesis, until the {@link IterationPredicate} accepts a
 * synthesis. Reaching the ceiling without convergence still completes with the last
 * synthesis; {@code converged} in the result metadata tells the two apart.
 * <p>
 * The workflow deadline ends the loop: no pass starts after it, and a pass it interrupts is
 * synthesized over what finished. When that pass finished nothing, the previous pass's
 * synthesis is the result.
 * <p>
 * Subtask ids are prefixed with {@code pass<n>_} so they stay unique across the run.
 */
public final class IterativeOrchestrator extends BaseOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(IterativeOrchestrator.class);

    public static final String NAME = "iterative";

    private final IterationPlanner planner;
    private final IterationPredicate predicate;
    private final SynthesisFunction passSynthesis;

    public IterativeOrchestrator(OrchestratorConfig config, OrchestratorServices services) {
        this(config, services, null, null, null);
    }

    /**
     * @param planner       plans each pass; null plans one research subtask, then one refinement subtask per pass
     * @param predicate     convergence test; null means {@link IterationPredicate#allSucceeded()}
     * @param passSynthesis replaces the per-pass synthesizer call; may be null
     */
    public IterativeOrchestrator(OrchestratorConfig config, OrchestratorServices services, IterationPlanner planner,
                                 IterationPredicate predicate, SynthesisFunction passSynthesis) {
        super(NAME, config, services);
        this.planner = planner != null ? planner : IterativeOrchestrator::defaultPlan;
        this.predicate = predicate != null ? predicate : IterationPredicate.allSucceeded();
        this.passSynthesis = passSynthesis;
    }

    @Override
    protected String execute(RunContext run) {
        int max = config.getMaxIterations();
        List<String> history = new ArrayList<>();
        String previous = null;
        boolean converged = false;
        try {
            for (int pass = 1; pass <= max; pass++) {
                if (run.isCancelled()) return null;
                if (previous != null && run.getDeadline().isExpired()) {
                    run.markTimedOut();
                    log.warn("Iteration stopped at workflow deadline | taskId={} | passes={}", run.getTaskId(), history.size());
                    break;
                }
                run.emit(WorkflowEventType.ITERATION_START, payload("pass", pass, "max_iterations", max));
                ScheduleOutcome outcome = runPass(run, planPass(run.getTask(), previous, pass, run));
                if (outcome.isHalted()) return null;
                if (outcome.isTimedOut() && previous != null && OutputCombiner.successes(outcome.getResults()).isEmpty()) {
                    log.warn("Interrupted pass finished nothing, keeping previous synthesis | taskId={} | pass={}",
                            run.getTaskId(), pass);
                    break;
                }
                String synthesis = synthesizeStage(outcome.getResults(), run);
                if (synthesis == null) return null;
                history.add(synthesis);
                converged = predicate.test(synthesis, outcome.getResults(), pass);
                run.emit(WorkflowEventType.ITERATION_COMPLETE, payload("pass", pass, "converged", converged));
                log.info("Iteration complete | taskId={} | pass={} | max={} | converged={}",
                        run.getTaskId(), pass, max, converged);
                previous = synthesis;
                if (converged || outcome.isTimedOut()) break;
            }
            if (!converged && !run.isTimedOut()) {
                log.info("Iteration ceiling reached without convergence | taskId={} | passes={}", run.getTaskId(), max);
            }
            return previous;
        } finally {
            run.putMetadata("iteration_count", history.size());
            run.putMetadata("iteration_history", List.copyOf(history));
            run.putMetadata("converged", converged);
        }
    }

    @Override
    public List<SubTask> decompose(String task, RunContext run) {
        return planPass(task, null, 1, run);
    }

    private List<SubTask> planPass(String task, String previous, int pass, RunContext run) {
        List<SubTask> planned = planner.plan(task, previous, pass, run);
        if (planned == null) return List.of();
        String prefix = "pass" + pass + "_";
        List<SubTask> out = new ArrayList<>(planned.size());
        for (SubTask t : planned) {
            if (t == null) {
                out.add(null);
                continue;
            }
            Set<String> deps = new LinkedHashSet<>();
            for (String dep : t.getDependencies()) deps.add(prefix + dep);
            out.add(t.withId(prefix + t.getId()).toBuilder()
                    .dependencies(deps)
                    .contextValue("pass", pass)
                    .build());
        }
        return out;
    }

    @Override
    public String synthesize(List<AgentResult> results, RunContext run) {
        if (passSynthesis != null) return passSynthesis.synthesize(results, run);
        List<AgentResult> ok = OutputCombiner.successes(results);
        if (ok.isEmpty()) {
            throw new SynthesisException("No successful results in this pass (" + results.size() + " attempted)");
        }
        SubTask call = SubTask.builder("iteration_synthesis")
                .description("Synthesize the following findings into one answer for: " + run.getTitle() + "\n\n"
                        + OutputCombiner.combine(ok, AgentResult::getAgentId))
                .agentType(AgentType.SYNTHESIZER)
                .contextValue("source_count", ok.size())
                .build();
        AgentResult result = callAuxiliary(run, call);
        if (run.isCancelled()) return null;
        if (!result.isSuccess()) {
            throw new SynthesisException("Pass synthesis failed: " + result.getError());
        }
        return result.getOutput();
    }

    private static List<SubTask> defaultPlan(String task, String previous, int pass, RunContext run) {
        if (previous == null) {
            return List.of(SubTask.builder("research")
                    .description(task)
                    .agentType(AgentType.WORKER)
                    .build());
        }
        return List.of(SubTask.builder("refine")
                .description("Improve the previous answer to the task below. Fill gaps, correct errors and tighten it.\n\n"
                        + "Task:\n" + task + "\n\nPrevious answer:\n" + previous)
                .agentType(AgentType.WORKER)
                .build());
    }
}
