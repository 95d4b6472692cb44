package com.agentweave.agent;

import com.agentweave.workflow.event.WorkflowEvent;
import com.agentweave.workflow.event.WorkflowEventType;

import java.util.Map;

/**
 * Fire-and-forget receiver of progress events. The engine never waits on a sink for
 * anything but the call itself, and a sink that throws does not affect the run.
 */
@FunctionalInterface
public interface ProgressSink {

    /** Sink that discards every event. */
    ProgressSink NONE = event -> { };

    void emit(WorkflowEvent event);

    default void emit(WorkflowEventType type, String taskId, Map<String, Object> payload) {
        emit(WorkflowEvent.of(type, taskId, payload));
    }
}
