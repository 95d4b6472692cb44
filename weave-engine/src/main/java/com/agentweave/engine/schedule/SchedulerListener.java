package com.agentweave.engine.schedule;

import com.agentweave.workflow.model.AgentResult;
import com.agentweave.workflow.model.SubTask;

/**
 * Callbacks from {@link SubTaskScheduler}. Both are invoked on the dispatching thread, never
 * concurrently, and {@link #onComplete} for a subtask always happens before any of its
 * dependents is dispatched.
 */
public interface SchedulerListener {

    SchedulerListener NONE = new SchedulerListener() {
    };

    default void onDispatch(SubTask subtask) {
    }

    default void onComplete(SubTask subtask, AgentResult result) {
    }
}
