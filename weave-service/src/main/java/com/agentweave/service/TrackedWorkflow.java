package com.agentweave.service;

import com.agentweave.agent.ProgressSink;
import com.agentweave.engine.BaseOrchestrator;
import com.agentweave.engine.CancellationToken;
import com.agentweave.workflow.event.WorkflowEvent;
import com.agentweave.workflow.model.WorkflowStatus;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A workflow the service has admitted and not yet finished. Observes the run's progress
 * events to answer status queries, and forwards every event to the caller's sink.
 */
final class TrackedWorkflow {

    private final String taskId;
    private final String pattern;
    private final String title;
    private final CancellationToken token = new CancellationToken();
    private final Instant startedAt = Instant.now();
    private final AtomicInteger subtasksTotal = new AtomicInteger();
    private final AtomicInteger subtasksFinished = new AtomicInteger();
    private volatile String lastEvent;

    TrackedWorkflow(String taskId, String pattern, String title) {
        this.taskId = taskId;
        this.pattern = pattern;
        this.title = title;
    }

    /** Sink that records progress and then passes the event on to {@code downstream}. */
    ProgressSink observing(ProgressSink downstream) {
        ProgressSink next = downstream != null ? downstream : ProgressSink.NONE;
        return event -> {
            observe(event);
            next.emit(event);
        };
    }

    private void observe(WorkflowEvent event) {
        lastEvent = event.type().wireName();
        switch (event.type()) {
            case DECOMPOSITION_COMPLETE -> {
                Object count = event.payload().get("count");
                if (count instanceof Number n) subtasksTotal.addAndGet(n.intValue());
            }
            case AGENT_COMPLETE, AGENT_FAILED -> {
                if (!BaseOrchestrator.SYNTHESIS_TIER.equals(event.payload().get(BaseOrchestrator.TIER_KEY))) {
                    subtasksFinished.incrementAndGet();
                }
            }
            default -> {
            }
        }
    }

    WorkflowStatusView view() {
        WorkflowStatus status = token.isCancelled() ? WorkflowStatus.CANCELLED : WorkflowStatus.RUNNING;
        return new WorkflowStatusView(taskId, pattern, title, status, subtasksTotal.get(), subtasksFinished.get(),
                null, lastEvent, startedAt, null);
    }

    String getTaskId() {
        return taskId;
    }

    CancellationToken getToken() {
        return token;
    }
}
