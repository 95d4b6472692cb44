package com.agentweave.engine;

import com.agentweave.agent.AgentContext;
import com.agentweave.engine.invoke.AgentInvoker;
import com.agentweave.engine.schedule.ScheduleOutcome;
import com.agentweave.ledger.CostTracker;
import com.agentweave.progress.EventEmitter;
import com.agentweave.workflow.config.OrchestratorConfig;
import com.agentweave.workflow.event.WorkflowEventType;
import com.agentweave.workflow.model.AgentResult;
import com.agentweave.workflow.model.SubTask;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * State of one workflow run, shared between the template and the pattern. Created per
 * {@code executeWorkflow} call and discarded with it.
 * <p>
 * Agent results, warnings and metadata are appended from the dispatching thread and read by
 * the pattern between phases; all mutators are synchronized so pattern code may also call them
 * from its own threads.
 */
public final class RunContext {

    private final String taskId;
    private final String patternName;
    private final String task;
    private final String title;
    private final Map<String, Object> context;
    private final OrchestratorConfig config;
    private final EventEmitter emitter;
    private final CostTracker costs;
    private final CancellationToken token;
    private final Deadline deadline;
    private final Instant startedAt;
    private volatile AgentInvoker invoker;

    private final Map<String, AgentResult> resultsById = new ConcurrentHashMap<>();
    private final List<AgentResult> agentResults = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();
    private final Map<String, Object> metadata = new LinkedHashMap<>();
    private final List<String> undispatched = new ArrayList<>();
    private boolean timedOut;
    private String failFastSubtaskId;

    RunContext(String taskId, String patternName, String task, String title, Map<String, Object> context,
               OrchestratorConfig config, EventEmitter emitter, CostTracker costs, CancellationToken token,
               Deadline deadline) {
        this.taskId = taskId;
        this.patternName = patternName;
        this.task = task != null ? task : "";
        this.title = title != null && !title.isBlank() ? title : this.task;
        this.context = context != null ? Collections.unmodifiableMap(new LinkedHashMap<>(context)) : Map.of();
        this.config = config;
        this.emitter = emitter;
        this.costs = costs;
        this.token = token;
        this.deadline = deadline;
        this.startedAt = Instant.now();
    }

    void setInvoker(AgentInvoker invoker) {
        this.invoker = invoker;
    }

    public AgentInvoker getInvoker() {
        return invoker;
    }

    /** Executor-facing context for the subtask: run fields plus the results of its dependencies. */
    public AgentContext agentContext(SubTask subtask) {
        List<AgentResult> deps = new ArrayList<>(subtask.getDependencies().size());
        for (String id : subtask.getDependencies()) {
            AgentResult r = resultsById.get(id);
            if (r != null) deps.add(r);
        }
        return new AgentContext(taskId, task, title, context, deps);
    }

    public void emit(WorkflowEventType type, Map<String, Object> payload) {
        emitter.emit(type, payload);
    }

    void recordResult(AgentResult result) {
        resultsById.put(result.getAgentId(), result);
    }

    /** Appends a finished pass: its results in declaration order, plus its stop flags. */
    synchronized void recordOutcome(ScheduleOutcome outcome) {
        agentResults.addAll(outcome.getResults());
        if (outcome.isTimedOut()) timedOut = true;
        undispatched.addAll(outcome.getUndispatched());
        if (outcome.isFailFastTriggered() && failFastSubtaskId == null) {
            failFastSubtaskId = outcome.getFailFastSubtaskId();
        }
    }

    public AgentResult resultFor(String subtaskId) {
        return resultsById.get(subtaskId);
    }

    public synchronized void addWarning(String warning) {
        if (warning != null && !warning.isBlank()) warnings.add(warning);
    }

    public synchronized void putMetadata(String key, Object value) {
        metadata.put(key, value);
    }

    /** Agent results of every finished pass, in pass order then declaration order. */
    public synchronized List<AgentResult> getAgentResults() {
        return List.copyOf(agentResults);
    }

    public synchronized List<String> getWarnings() {
        return List.copyOf(warnings);
    }

    public synchronized Map<String, Object> getMetadata() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /** Records that the workflow deadline stopped the run outside a scheduled pass. */
    public synchronized void markTimedOut() {
        timedOut = true;
    }

    public synchronized boolean isTimedOut() {
        return timedOut;
    }

    public synchronized List<String> getUndispatched() {
        return List.copyOf(undispatched);
    }

    public synchronized String getFailFastSubtaskId() {
        return failFastSubtaskId;
    }

    public boolean isCancelled() {
        return token.isCancelled();
    }

    public String getTaskId() {
        return taskId;
    }

    public String getPatternName() {
        return patternName;
    }

    public String getTask() {
        return task;
    }

    public String getTitle() {
        return title;
    }

    public Map<String, Object> getContext() {
        return context;
    }

    public OrchestratorConfig getConfig() {
        return config;
    }

    public CostTracker getCosts() {
        return costs;
    }

    public CancellationToken getToken() {
        return token;
    }

    public Deadline getDeadline() {
        return deadline;
    }

    public Instant getStartedAt() {
        return startedAt;
    }
}
