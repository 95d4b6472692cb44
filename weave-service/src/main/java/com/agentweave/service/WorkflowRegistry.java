package com.agentweave.service;

import com.agentweave.workflow.event.WorkflowEventType;
import com.agentweave.workflow.model.WorkflowResult;
import com.agentweave.workflow.model.WorkflowStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Single responsibility: track admitted workflows until they finish, then keep their results
 * for later lookup.
 * <p>
 * At most {@code maxActive} workflows run at once; admission beyond that is rejected. Finished
 * results are retained in completion order and the oldest is evicted once more than
 * {@code retention} are held.
 */
public final class WorkflowRegistry {

    private static final Logger log = LoggerFactory.getLogger(WorkflowRegistry.class);

    private final int maxActive;
    private final int retention;
    private final Map<String, TrackedWorkflow> active = new LinkedHashMap<>();
    private final Map<String, WorkflowResult> completed = new LinkedHashMap<>();

    public WorkflowRegistry(int maxActive, int retention) {
        if (maxActive <= 0) throw new IllegalArgumentException("maxActive must be > 0");
        if (retention < 0) throw new IllegalArgumentException("retention must be >= 0");
        this.maxActive = maxActive;
        this.retention = retention;
    }

    /** @throws WorkflowRejectedException when {@code maxActive} workflows are already running */
    synchronized TrackedWorkflow admit(String taskId, String pattern, String title) {
        if (active.size() >= maxActive) {
            log.warn("Workflow rejected | pattern={} | active={} | limit={}", pattern, active.size(), maxActive);
            throw new WorkflowRejectedException(active.size(), maxActive);
        }
        TrackedWorkflow tracked = new TrackedWorkflow(taskId, pattern, title);
        active.put(taskId, tracked);
        return tracked;
    }

    synchronized void complete(String taskId, WorkflowResult result) {
        active.remove(taskId);
        retain(taskId, result);
    }

    /** Copies the retained results, oldest first. */
    public synchronized RegistrySnapshot snapshot() {
        return new RegistrySnapshot(new ArrayList<>(completed.values()), retention, Instant.now());
    }

    /**
     * Adds a snapshot's results to the retained ones as if they had just finished, in snapshot
     * order, so retention still evicts the oldest. A result whose task id is running here, or is
     * already retained, is skipped.
     *
     * @return the number of results added
     */
    public synchronized int restore(RegistrySnapshot snapshot) {
        int restored = 0;
        for (WorkflowResult result : snapshot.completedWorkflows()) {
            String taskId = result.getTaskId();
            if (active.containsKey(taskId) || completed.containsKey(taskId)) {
                log.debug("Snapshot entry skipped | taskId={}", taskId);
                continue;
            }
            retain(taskId, result);
            restored++;
        }
        log.info("Registry restored | restored={} | retained={} | snapshotAt={}",
                restored, completed.size(), snapshot.timestamp());
        return restored;
    }

    private void retain(String taskId, WorkflowResult result) {
        if (retention == 0) return;
        completed.put(taskId, result);
        Iterator<String> oldest = completed.keySet().iterator();
        while (completed.size() > retention && oldest.hasNext()) {
            String evicted = oldest.next();
            oldest.remove();
            log.debug("Completed workflow evicted | taskId={} | retention={}", evicted, retention);
        }
    }

    /** Drops an admitted workflow that never produced a result. */
    synchronized void abandon(String taskId) {
        active.remove(taskId);
    }

    synchronized Optional<TrackedWorkflow> findActive(String taskId) {
        return Optional.ofNullable(active.get(taskId));
    }

    public synchronized Optional<WorkflowResult> result(String taskId) {
        return Optional.ofNullable(completed.get(taskId));
    }

    public synchronized Optional<WorkflowStatusView> status(String taskId) {
        TrackedWorkflow running = active.get(taskId);
        if (running != null) return Optional.of(running.view());
        WorkflowResult done = completed.get(taskId);
        if (done == null) return Optional.empty();
        return Optional.of(new WorkflowStatusView(done.getTaskId(), done.getPattern(), done.getTitle(), done.getStatus(),
                done.getAgentResults().size(), done.getAgentResults().size(), done.getTotalCost(),
                (done.getStatus() == WorkflowStatus.FAILED
                        ? WorkflowEventType.WORKFLOW_ERROR : WorkflowEventType.WORKFLOW_COMPLETE).wireName(),
                done.getStartedAt(), done.getCompletedAt()));
    }

    public synchronized int activeCount() {
        return active.size();
    }

    public synchronized int completedCount() {
        return completed.size();
    }

    synchronized void cancelAll(String reason) {
        active.values().forEach(t -> t.getToken().cancel(reason));
    }
}
