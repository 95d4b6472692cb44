package com.agentweave.progress;

import com.agentweave.agent.ProgressSink;
import com.agentweave.workflow.event.WorkflowEvent;
import com.agentweave.workflow.event.WorkflowEventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fail-safe facade over a {@link ProgressSink} for one run. Every emit delegates to the sink;
 * any exception from the sink is caught, logged and counted, never rethrown, so a broken
 * subscriber cannot fail or stall the run.
 */
public final class EventEmitter {

    private static final Logger log = LoggerFactory.getLogger(EventEmitter.class);

    private final String taskId;
    private final ProgressSink sink;
    private final AtomicLong emitted = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();

    public EventEmitter(String taskId, ProgressSink sink) {
        this.taskId = taskId;
        this.sink = sink != null ? sink : ProgressSink.NONE;
    }

    public void emit(WorkflowEventType type, Map<String, Object> payload) {
        emit(WorkflowEvent.of(type, taskId, payload));
    }

    public void emit(WorkflowEvent event) {
        try {
            sink.emit(event);
            emitted.incrementAndGet();
        } catch (Throwable t) {
            failures.incrementAndGet();
            log.warn("Progress sink failed | taskId={} | event={} | error={}",
                    taskId, event.type().wireName(), t.getMessage(), t);
        }
    }

    public String getTaskId() {
        return taskId;
    }

    public long getEmittedCount() {
        return emitted.get();
    }

    /** Number of events the sink rejected by throwing. */
    public long getFailureCount() {
        return failures.get();
    }
}
