package com.agentweave.engine;

import com.agentweave.agent.AgentExecutorRegistry;
import com.agentweave.agent.DocumentGenerator;
import com.agentweave.agent.ProgressSink;
import com.agentweave.engine.invoke.AgentInvoker;
import com.agentweave.engine.invoke.RetryingAgentInvoker;
import com.agentweave.engine.invoke.TimedAgentInvoker;
import com.agentweave.engine.schedule.ScheduleOutcome;
import com.agentweave.engine.schedule.SchedulerListener;
import com.agentweave.engine.schedule.SubTaskScheduler;
import com.agentweave.ledger.AgentMetrics;
import com.agentweave.ledger.CostSummary;
import com.agentweave.ledger.CostTracker;
import com.agentweave.progress.EventEmitter;
import com.agentweave.workflow.config.OrchestratorConfig;
import com.agentweave.workflow.config.RetryPolicy;
import com.agentweave.workflow.error.ConfigurationException;
import com.agentweave.workflow.error.WorkflowException;
import com.agentweave.workflow.event.WorkflowEventType;
import com.agentweave.workflow.graph.WorkflowGraph;
import com.agentweave.workflow.model.AgentResult;
import com.agentweave.workflow.model.FailureKind;
import com.agentweave.workflow.model.SubTask;
import com.agentweave.workflow.model.WorkflowResult;
import com.agentweave.workflow.model.WorkflowStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Run lifecycle shared by every orchestration pattern.
 * <p>
 * {@link #executeWorkflow} drives: {@code workflow_start}, decomposition, graph and executor
 * validation, {@code decomposition_complete}, scheduled execution, synthesis, optional document
 * generation, result assembly and the terminal event. Patterns supply the three
 * {@link WorkflowPolicy} decisions and may override {@link #execute(RunContext)} to run several
 * passes (iterative) or extra synthesis tiers (hierarchical) using {@link #runPass},
 * {@link #runAuxiliary} and {@link #synthesizeStage}.
 * <p>
 * Outcome mapping:
 * <ul>
 *   <li>decomposition or configuration error: FAILED, no executor calls</li>
 *   <li>cancellation: CANCELLED, results gathered so far, no synthesis</li>
 *   <li>fail-fast stop: FAILED, results gathered so far, no synthesis</li>
 *   <li>synthesis error: FAILED, every agent result kept</li>
 *   <li>document generation error: COMPLETED_WITH_WARNINGS</li>
 * </ul>
 * An orchestrator holds no per-run state and may run several workflows concurrently.
 */
public abstract class BaseOrchestrator implements WorkflowPolicy {

    private static final Logger log = LoggerFactory.getLogger(BaseOrchestrator.class);

    /**
     * Payload key on agent events of supporting calls made by {@link #runAuxiliary}; absent on
     * events of the run's own subtasks.
     */
    public static final String TIER_KEY = "tier";
    public static final String SYNTHESIS_TIER = "synthesis";

    private final String patternName;
    protected final OrchestratorConfig config;
    protected final OrchestratorServices services;

    protected BaseOrchestrator(String patternName, OrchestratorConfig config, OrchestratorServices services) {
        if (patternName == null || patternName.isBlank()) {
            throw new IllegalArgumentException("patternName must be non-blank");
        }
        this.patternName = patternName;
        this.config = config != null ? config : OrchestratorConfig.defaults();
        this.services = Objects.requireNonNull(services, "services");
    }

    public final String getPatternName() {
        return patternName;
    }

    public final OrchestratorConfig getConfig() {
        return config;
    }

    /** Runs the workflow under a fresh task id without external cancellation. */
    public final WorkflowResult executeWorkflow(String task, String title, Map<String, Object> context, ProgressSink sink) {
        return executeWorkflow(TaskIds.newTaskId(patternName), task, title, context, sink, new CancellationToken());
    }

    /**
     * Runs the workflow. Never throws for workflow-level failures: they are reported through the
     * returned result's status and error.
     *
     * @param token checked before every dispatch; cancelling it stops the run at the next dispatch point
     */
    public final WorkflowResult executeWorkflow(String taskId, String task, String title, Map<String, Object> context,
                                                ProgressSink sink, CancellationToken token) {
        String id = taskId != null && !taskId.isBlank() ? taskId : TaskIds.newTaskId(patternName);
        CancellationToken cancel = token != null ? token : new CancellationToken();
        EventEmitter emitter = new EventEmitter(id, sink);
        CostTracker costs = new CostTracker(id);
        RunContext run = new RunContext(id, patternName, task, title, context, config, emitter, costs, cancel,
                Deadline.after(config.getWorkflowTimeout()));
        ExecutorService callPool = Executors.newCachedThreadPool(daemonThreads("weave-" + id + "-call-"));
        run.setInvoker(buildInvoker(callPool, cancel));

        log.info("Workflow started | taskId={} | pattern={} | title={}", id, patternName, run.getTitle());
        run.emit(WorkflowEventType.WORKFLOW_START, payload("title", run.getTitle(), "pattern", patternName, "task", run.getTask()));

        String synthesis = null;
        WorkflowStatus status;
        String error = null;
        String errorStage = null;
        try {
            synthesis = execute(run);
            if (synthesis == null && run.isCancelled()) {
                status = WorkflowStatus.CANCELLED;
            } else if (run.getFailFastSubtaskId() != null) {
                status = WorkflowStatus.FAILED;
                synthesis = null;
                errorStage = "execution";
                error = "Stopped after subtask " + run.getFailFastSubtaskId() + " failed (fail-fast)";
            } else {
                status = WorkflowStatus.COMPLETED;
                if (synthesis == null) synthesis = "";
            }
        } catch (WorkflowException e) {
            synthesis = null;
            if (run.isCancelled()) {
                status = WorkflowStatus.CANCELLED;
            } else {
                status = WorkflowStatus.FAILED;
                errorStage = e.getStage();
                error = e.getMessage();
                log.error("Workflow failed | taskId={} | pattern={} | stage={} | error={}", id, patternName, errorStage, error);
            }
        } catch (RuntimeException e) {
            synthesis = null;
            status = WorkflowStatus.FAILED;
            errorStage = "execution";
            error = e.getMessage() != null ? e.getMessage() : e.toString();
            log.error("Workflow failed unexpectedly | taskId={} | pattern={} | error={}", id, patternName, error, e);
        } finally {
            callPool.shutdownNow();
        }
        if (status == WorkflowStatus.CANCELLED) {
            log.info("Workflow cancelled | taskId={} | reason={} | results={}", id, cancel.getReason(), run.getAgentResults().size());
        }

        List<String> artifacts = List.of();
        if (status == WorkflowStatus.COMPLETED) {
            artifacts = generateArtifacts(run, synthesis);
            if (!run.getWarnings().isEmpty()) status = WorkflowStatus.COMPLETED_WITH_WARNINGS;
        }

        WorkflowResult result = assemble(run, status, synthesis, artifacts, error, errorStage);
        services.getMetrics().recordWorkflow(patternName, status);
        if (status == WorkflowStatus.FAILED) {
            run.emit(WorkflowEventType.WORKFLOW_ERROR, payload("stage", errorStage, "error", error,
                    "status", status.toValue(), "agent_results", result.getAgentResults().size()));
        } else {
            run.emit(WorkflowEventType.WORKFLOW_COMPLETE, payload("status", status.toValue(),
                    "total_cost", result.getTotalCost(), "total_tokens", result.getTotalTokens(),
                    "success_count", result.successCount(), "failure_count", result.failureCount()));
        }
        log.info("Workflow finished | taskId={} | pattern={} | status={} | results={} | cost={} | timeMs={}",
                id, patternName, status.toValue(), result.getAgentResults().size(), result.getTotalCost(),
                result.getTotalExecutionTimeMillis());
        return result;
    }

    /**
     * One decompose-execute-synthesize pass. Override to run several passes or extra synthesis
     * tiers.
     *
     * @return the synthesis, or null when the run halted (cancelled or fail-fast) before synthesis
     */
    protected String execute(RunContext run) {
        List<SubTask> subtasks = decompose(run.getTask(), run);
        ScheduleOutcome outcome = runPass(run, subtasks);
        if (outcome.isHalted()) return null;
        return synthesizeStage(outcome.getResults(), run);
    }

    /**
     * Validates the subtasks and executes them through the scheduler. Their results become part
     * of the run's agent results.
     *
     * @throws com.agentweave.workflow.error.DecompositionException on an invalid dependency graph
     * @throws ConfigurationException                               when an agent type has no executor
     */
    protected final ScheduleOutcome runPass(RunContext run, List<SubTask> subtasks) {
        WorkflowGraph graph = WorkflowGraph.of(subtasks);
        validateExecutors(graph.getSubtasks());
        run.emit(WorkflowEventType.DECOMPOSITION_COMPLETE, payload("count", graph.size(),
                "subtask_ids", graph.getSubtasks().stream().map(SubTask::getId).toList()));
        log.info("Decomposition complete | taskId={} | subtasks={} | concurrency={}",
                run.getTaskId(), graph.size(), concurrency(run));
        SubTaskScheduler scheduler = new SubTaskScheduler(run.getTaskId(), concurrency(run), run.getToken(),
                run.getDeadline(), config.isFailFast());
        ScheduleOutcome outcome = scheduler.run(graph, subtask -> executeOne(subtask, run), new RunListener(run, true));
        run.recordOutcome(outcome);
        return outcome;
    }

    /**
     * Executes supporting calls (synthesis tiers) through the same bounded scheduler. Costs and
     * events are recorded, but the results are not added to the run's agent results, and the
     * workflow deadline does not apply.
     */
    protected final List<AgentResult> runAuxiliary(RunContext run, List<SubTask> calls) {
        if (calls.isEmpty()) return List.of();
        WorkflowGraph graph = WorkflowGraph.of(calls);
        validateExecutors(graph.getSubtasks());
        SubTaskScheduler scheduler = new SubTaskScheduler(run.getTaskId(), concurrency(run), run.getToken(),
                Deadline.none(), false);
        return scheduler.run(graph, subtask -> executeOne(subtask, run), new RunListener(run, false)).getResults();
    }

    /** Single supporting call; a FAILED result when the run was cancelled before it could start. */
    protected final AgentResult callAuxiliary(RunContext run, SubTask call) {
        List<AgentResult> results = runAuxiliary(run, List.of(call));
        if (!results.isEmpty()) return results.get(0);
        return AgentResult.failed(call, "Run cancelled before the call was dispatched", FailureKind.UNKNOWN, 0);
    }

    /**
     * Wraps {@link #synthesize} with its events. Returns null without synthesizing when the run
     * is already cancelled.
     */
    protected final String synthesizeStage(List<AgentResult> results, RunContext run) {
        if (run.isCancelled()) return null;
        long successes = results.stream().filter(AgentResult::isSuccess).count();
        run.emit(WorkflowEventType.SYNTHESIS_START, payload("result_count", results.size(), "success_count", successes));
        String synthesis = synthesize(results, run);
        if (synthesis == null && run.isCancelled()) return null;
        String text = synthesis != null ? synthesis : "";
        run.emit(WorkflowEventType.SYNTHESIS_COMPLETE, payload("length", text.length()));
        return text;
    }

    /** Executes through the run's invoker chain (per-subtask timeout, then retry when configured). */
    @Override
    public AgentResult executeOne(SubTask subtask, RunContext run) {
        return run.getInvoker().invoke(subtask, run.agentContext(subtask));
    }

    /** Concurrency bound for this run's passes; 1 when parallel execution is off. */
    protected int concurrency(RunContext run) {
        return config.getEffectiveConcurrency();
    }

    private void validateExecutors(List<SubTask> subtasks) {
        AgentExecutorRegistry registry = services.getExecutors();
        for (SubTask t : subtasks) {
            if (!registry.supports(t.getAgentType())) {
                throw new ConfigurationException("No executor registered for agent type "
                        + t.getAgentType().toValue() + " (subtask " + t.getId() + ")");
            }
        }
    }

    private AgentInvoker buildInvoker(ExecutorService callPool, CancellationToken token) {
        AgentInvoker invoker = new TimedAgentInvoker(services.getExecutors(), callPool, config.getTimeout());
        RetryPolicy retry = config.getRetryPolicy();
        if (retry != null && retry.getMaxRetries() > 0) {
            invoker = new RetryingAgentInvoker(invoker, retry, services.getRetrySleeper(),
                    () -> ThreadLocalRandom.current().nextDouble(-1.0, 1.0), token::isCancelled);
        }
        return invoker;
    }

    private List<String> generateArtifacts(RunContext run, String synthesis) {
        DocumentGenerator generator = services.getDocumentGenerator();
        if (!config.isGenerateDocuments()) return List.of();
        if (generator == null) {
            log.debug("Document generation requested but no generator is wired | taskId={}", run.getTaskId());
            return List.of();
        }
        try {
            List<String> refs = generator.generate(synthesis, config.getDocumentFormats());
            return refs != null ? refs : List.of();
        } catch (Exception e) {
            log.warn("Document generation failed | taskId={} | formats={} | error={}",
                    run.getTaskId(), config.getDocumentFormats(), e.getMessage(), e);
            run.addWarning("Document generation failed: " + (e.getMessage() != null ? e.getMessage() : e.toString()));
            return List.of();
        }
    }

    private WorkflowResult assemble(RunContext run, WorkflowStatus status, String synthesis, List<String> artifacts,
                                    String error, String errorStage) {
        Instant completedAt = Instant.now();
        CostSummary costs = run.getCosts().snapshot();
        WorkflowResult.Builder b = WorkflowResult.builder(run.getTaskId())
                .title(run.getTitle())
                .pattern(patternName)
                .status(status)
                .agentResults(run.getAgentResults())
                .synthesis(synthesis)
                .totalCost(costs.totalCost())
                .totalTokens(costs.totalTokens())
                .totalExecutionTimeMillis(Duration.between(run.getStartedAt(), completedAt).toMillis())
                .artifacts(artifacts)
                .metadata(run.getMetadata())
                .error(error)
                .warnings(run.getWarnings())
                .startedAt(run.getStartedAt())
                .completedAt(completedAt);
        if (errorStage != null) b.metadata("error_stage", errorStage);
        if (run.isTimedOut()) {
            b.metadata("workflow_timed_out", true);
            b.metadata("undispatched", run.getUndispatched());
        }
        if (status == WorkflowStatus.CANCELLED) {
            b.metadata("cancelled", true);
            if (!run.getUndispatched().isEmpty()) b.metadata("undispatched", run.getUndispatched());
        }
        if (!costs.costByAgentType().isEmpty()) {
            Map<String, Object> byType = new LinkedHashMap<>();
            costs.costByAgentType().forEach((type, cost) -> byType.put(type.toValue(), cost));
            b.metadata("cost_by_agent_type", byType);
        }
        return b.build();
    }

    /** Insertion-ordered event payload from alternating keys and values; null values are skipped. */
    protected static Map<String, Object> payload(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            if (keyValues[i + 1] != null) map.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return map;
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    /** Turns scheduler callbacks into events, cost records and metrics for one run. */
    private final class RunListener implements SchedulerListener {

        private final RunContext run;
        private final boolean primary;

        RunListener(RunContext run, boolean primary) {
            this.run = run;
            this.primary = primary;
        }

        @Override
        public void onDispatch(SubTask subtask) {
            log.debug("Subtask dispatched | taskId={} | id={} | agentType={}",
                    run.getTaskId(), subtask.getId(), subtask.getAgentType().toValue());
            run.emit(WorkflowEventType.AGENT_START, payload("agent_id", subtask.getId(),
                    "agent_type", subtask.getAgentType().toValue(), "description", subtask.getDescription(),
                    TIER_KEY, tier()));
        }

        @Override
        public void onComplete(SubTask subtask, AgentResult result) {
            if (primary) run.recordResult(result);
            run.getCosts().record(result);
            AgentMetrics metrics = services.getMetrics();
            metrics.recordAgent(result);
            if (result.isSuccess()) {
                run.emit(WorkflowEventType.AGENT_COMPLETE, payload("agent_id", result.getAgentId(),
                        "agent_type", subtask.getAgentType().toValue(), "status", result.getStatus().toValue(),
                        "tokens_used", result.getTokensUsed(), "cost", result.getCost(),
                        "execution_time_ms", result.getExecutionTimeMillis(), "attempts", result.getAttempts(),
                        TIER_KEY, tier()));
            } else {
                log.warn("Subtask did not succeed | taskId={} | id={} | status={} | error={}",
                        run.getTaskId(), result.getAgentId(), result.getStatus().toValue(), result.getError());
                run.emit(WorkflowEventType.AGENT_FAILED, payload("agent_id", result.getAgentId(),
                        "agent_type", subtask.getAgentType().toValue(), "status", result.getStatus().toValue(),
                        "error", result.getError(), "failure_kind",
                        result.getFailureKind() != null ? result.getFailureKind().toValue() : null,
                        "attempts", result.getAttempts(), TIER_KEY, tier()));
            }
        }

        /** Null for the run's own subtasks, which leaves the key out of the payload. */
        private String tier() {
            return primary ? null : SYNTHESIS_TIER;
        }
    }
}
