package com.agentweave.service;

import com.agentweave.agent.ProgressSink;
import com.agentweave.engine.BaseOrchestrator;
import com.agentweave.engine.OrchestratorServices;
import com.agentweave.engine.TaskIds;
import com.agentweave.progress.LoggingProgressSink;
import com.agentweave.progress.ProgressChannel;
import com.agentweave.workflow.config.OrchestratorConfig;
import com.agentweave.workflow.model.WorkflowResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point for callers: submits workflows by pattern name, tracks them while they run and
 * keeps their results afterwards.
 * <p>
 * Submission resolves the pattern, builds its orchestrator (configuration errors are thrown to
 * the caller at this point) and admits the run against the active-workflow limit. Asynchronous
 * runs deliver progress to the subscriber through a bounded {@link ProgressChannel}, so a slow
 * subscriber never blocks the run beyond the configured backpressure policy.
 */
public final class WorkflowService implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkflowService.class);

    private final PatternRegistry patterns;
    private final OrchestratorServices services;
    private final WeaveConfig config;
    private final WorkflowRegistry registry;
    private final ExecutorService runner;

    public WorkflowService(OrchestratorServices services) {
        this(PatternRegistry.withBuiltIns(), services, WeaveConfig.defaults());
    }

    public WorkflowService(PatternRegistry patterns, OrchestratorServices services, WeaveConfig config) {
        this.patterns = Objects.requireNonNull(patterns, "patterns");
        this.services = Objects.requireNonNull(services, "services");
        this.config = config != null ? config : WeaveConfig.defaults();
        this.registry = new WorkflowRegistry(this.config.getMaxActiveWorkflows(), this.config.getCompletedRetention());
        this.runner = Executors.newCachedThreadPool(daemonThreads());
    }

    /**
     * Runs a workflow on the calling thread.
     *
     * @param workflowConfig null uses the pattern's default configuration
     * @throws com.agentweave.workflow.error.ConfigurationException for an unknown pattern or a configuration the pattern rejects
     * @throws WorkflowRejectedException                            when the active-workflow limit is reached
     */
    public WorkflowResult submit(String pattern, String task, String title, Map<String, Object> context,
                                 OrchestratorConfig workflowConfig) {
        return submit(pattern, task, title, context, workflowConfig, null);
    }

    /** As {@link #submit(String, String, String, Map, OrchestratorConfig)}, emitting progress to {@code sink} synchronously. */
    public WorkflowResult submit(String pattern, String task, String title, Map<String, Object> context,
                                 OrchestratorConfig workflowConfig, ProgressSink sink) {
        Admission admission = admit(pattern, task, title, workflowConfig);
        return run(admission, task, title, context, sink);
    }

    /**
     * Starts a workflow in the background.
     *
     * @param subscriber receives progress events through a bounded channel; may be null
     * @throws com.agentweave.workflow.error.ConfigurationException for an unknown pattern or a configuration the pattern rejects
     * @throws WorkflowRejectedException                            when the active-workflow limit is reached
     */
    public WorkflowHandle submitAsync(String pattern, String task, String title, Map<String, Object> context,
                                      OrchestratorConfig workflowConfig, ProgressSink subscriber) {
        Admission admission = admit(pattern, task, title, workflowConfig);
        String taskId = admission.tracked().getTaskId();
        ProgressChannel channel = subscriber != null
                ? new ProgressChannel(taskId, subscriber, config.getEventBufferSize(), config.getEventBackpressure(),
                config.getEventOfferTimeout())
                : null;
        CompletableFuture<WorkflowResult> future;
        try {
            future = CompletableFuture.supplyAsync(() -> {
                try {
                    return run(admission, task, title, context, channel);
                } finally {
                    if (channel != null) closeChannel(taskId, channel);
                }
            }, runner);
        } catch (RejectedExecutionException e) {
            registry.abandon(taskId);
            if (channel != null) channel.close();
            throw new IllegalStateException("Workflow service is shut down", e);
        }
        return new WorkflowHandle(taskId, future, admission.tracked().getToken());
    }

    /** Requests cancellation of a running workflow; false when it is unknown, finished or already cancelled. */
    public boolean cancel(String taskId) {
        Optional<TrackedWorkflow> tracked = registry.findActive(taskId);
        if (tracked.isEmpty()) {
            log.debug("Cancel ignored, workflow not running | taskId={}", taskId);
            return false;
        }
        boolean cancelled = tracked.get().getToken().cancel("cancelled by caller");
        if (cancelled) log.info("Workflow cancellation requested | taskId={}", taskId);
        return cancelled;
    }

    public Optional<WorkflowStatusView> status(String taskId) {
        return registry.status(taskId);
    }

    /** Result of a finished workflow still within the retention window. */
    public Optional<WorkflowResult> result(String taskId) {
        return registry.result(taskId);
    }

    public List<PatternDescriptor> listPatterns() {
        return patterns.descriptors();
    }

    public WorkflowRegistry getRegistry() {
        return registry;
    }

    /** Cancels every running workflow and stops accepting asynchronous submissions. */
    @Override
    public void close() {
        registry.cancelAll("service shutting down");
        runner.shutdown();
        try {
            if (!runner.awaitTermination(config.getEventCloseTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Workflows still running after shutdown wait | active={}", registry.activeCount());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private record Admission(BaseOrchestrator orchestrator, TrackedWorkflow tracked) {
    }

    private Admission admit(String pattern, String task, String title, OrchestratorConfig workflowConfig) {
        OrchestratorConfig effective = workflowConfig != null ? workflowConfig : patterns.descriptor(pattern).defaultConfig();
        BaseOrchestrator orchestrator = patterns.factory(pattern).create(effective, services);
        String taskId = TaskIds.newTaskId(pattern);
        TrackedWorkflow tracked = registry.admit(taskId, pattern, title != null && !title.isBlank() ? title : task);
        log.info("Workflow admitted | taskId={} | pattern={} | active={}", taskId, pattern, registry.activeCount());
        return new Admission(orchestrator, tracked);
    }

    private WorkflowResult run(Admission admission, String task, String title, Map<String, Object> context, ProgressSink sink) {
        TrackedWorkflow tracked = admission.tracked();
        ProgressSink downstream = config.isLogEvents() ? withEventLog(new LoggingProgressSink(), sink) : sink;
        WorkflowResult result = null;
        try {
            result = admission.orchestrator().executeWorkflow(tracked.getTaskId(), task, title, context,
                    tracked.observing(downstream), tracked.getToken());
            return result;
        } finally {
            if (result != null) {
                registry.complete(tracked.getTaskId(), result);
            } else {
                registry.abandon(tracked.getTaskId());
            }
        }
    }

    /** Tees events into {@code eventLog}; a failing log never keeps an event from {@code sink}. */
    static ProgressSink withEventLog(ProgressSink eventLog, ProgressSink sink) {
        if (sink == null) return eventLog;
        return event -> {
            try {
                eventLog.emit(event);
            } catch (RuntimeException e) {
                log.warn("Event log failed | taskId={} | event={} | error={}",
                        event.taskId(), event.type().wireName(), e.toString());
            }
            sink.emit(event);
        };
    }

    private void closeChannel(String taskId, ProgressChannel channel) {
        channel.close(config.getEventCloseTimeout());
        if (channel.getDroppedCount() > 0) {
            log.warn("Progress events dropped | taskId={} | dropped={} | policy={}",
                    taskId, channel.getDroppedCount(), config.getEventBackpressure());
        }
    }

    private static ThreadFactory daemonThreads() {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "weave-workflow-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
