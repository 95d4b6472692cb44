package com.agentweave.engine.schedule;

import com.agentweave.workflow.model.AgentResult;

import java.util.List;

/** What one scheduler run produced and why it stopped. */
public final class ScheduleOutcome {

    private final List<AgentResult> results;
    private final boolean cancelled;
    private final boolean timedOut;
    private final String failFastSubtaskId;
    private final List<String> undispatched;
    private final int peakConcurrency;

    ScheduleOutcome(List<AgentResult> results, boolean cancelled, boolean timedOut,
                    String failFastSubtaskId, List<String> undispatched, int peakConcurrency) {
        this.results = List.copyOf(results);
        this.cancelled = cancelled;
        this.timedOut = timedOut;
        this.failFastSubtaskId = failFastSubtaskId;
        this.undispatched = List.copyOf(undispatched);
        this.peakConcurrency = peakConcurrency;
    }

    /** Results in declaration order. Undispatched subtasks have none. */
    public List<AgentResult> getResults() {
        return results;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /** True when the workflow deadline stopped dispatch. */
    public boolean isTimedOut() {
        return timedOut;
    }

    public boolean isFailFastTriggered() {
        return failFastSubtaskId != null;
    }

    /** Id of the failure that stopped a fail-fast run; null otherwise. */
    public String getFailFastSubtaskId() {
        return failFastSubtaskId;
    }

    /** True when the run must not proceed to synthesis. */
    public boolean isHalted() {
        return cancelled || failFastSubtaskId != null;
    }

    /** Ids never dispatched, in declaration order. */
    public List<String> getUndispatched() {
        return undispatched;
    }

    /** Highest number of subtasks in flight at once. */
    public int getPeakConcurrency() {
        return peakConcurrency;
    }
}
