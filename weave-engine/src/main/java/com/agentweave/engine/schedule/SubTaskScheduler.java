package com.agentweave.engine.schedule;

import com.agentweave.engine.CancellationToken;
import com.agentweave.engine.Deadline;
import com.agentweave.workflow.graph.WorkflowGraph;
import com.agentweave.workflow.model.AgentResult;
import com.agentweave.workflow.model.FailureKind;
import com.agentweave.workflow.model.SubTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Dispatches the subtasks of a validated graph with bounded concurrency.
 * <p>
 * Single responsibility: decide what runs when. The dispatch loop runs on the calling thread;
 * subtasks run on a fixed pool of {@code concurrency} threads and report back through a
 * completion queue. A subtask is dispatched once every dependency has a result (success or
 * not) and a slot is free; among ready subtasks the highest priority goes first, then the
 * earliest declared.
 * <p>
 * Stop conditions, checked before every dispatch:
 * <ul>
 *   <li>cancellation: nothing new is dispatched, in-flight subtasks finish and are kept</li>
 *   <li>deadline: nothing new is dispatched, in-flight subtasks are recorded as TIMEOUT</li>
 *   <li>fail-fast: after the first non-success nothing new is dispatched, in-flight finish</li>
 * </ul>
 */
public final class SubTaskScheduler {

    private static final Logger log = LoggerFactory.getLogger(SubTaskScheduler.class);
    private static final long CANCEL_POLL_MILLIS = 25;

    private final String name;
    private final int concurrency;
    private final CancellationToken token;
    private final Deadline deadline;
    private final boolean failFast;

    public SubTaskScheduler(String name, int concurrency, CancellationToken token, Deadline deadline, boolean failFast) {
        if (concurrency <= 0) throw new IllegalArgumentException("concurrency must be > 0");
        this.name = name != null ? name : "run";
        this.concurrency = concurrency;
        this.token = token != null ? token : new CancellationToken();
        this.deadline = deadline != null ? deadline : Deadline.none();
        this.failFast = failFast;
    }

    private record Completion(int index, AgentResult result) {
    }

    /**
     * Runs every subtask of the graph (subject to the stop conditions).
     *
     * @param execute  runs one subtask; must not throw, but a thrown exception is recorded as FAILED
     * @param listener dispatch and completion callbacks; may be null
     */
    public ScheduleOutcome run(WorkflowGraph graph, Function<SubTask, AgentResult> execute, SchedulerListener listener) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(execute, "execute");
        SchedulerListener events = listener != null ? listener : SchedulerListener.NONE;
        List<SubTask> subtasks = graph.getSubtasks();
        int[][] depIndexes = dependencyIndexes(graph);
        ResultCollector collector = new ResultCollector(subtasks.size());
        TreeSet<Integer> pending = new TreeSet<>();
        for (int i = 0; i < subtasks.size(); i++) pending.add(i);
        Map<Integer, Future<?>> inFlight = new HashMap<>();
        Map<Integer, Long> dispatchedAt = new HashMap<>();
        BlockingQueue<Completion> completions = new LinkedBlockingQueue<>();

        boolean cancelled = false;
        boolean timedOut = false;
        String failFastId = null;
        int peak = 0;

        ExecutorService pool = Executors.newFixedThreadPool(Math.min(concurrency, subtasks.size()), threadFactory(name));
        try {
            while (true) {
                boolean stop = cancelled || timedOut || failFastId != null;
                while (!stop && inFlight.size() < concurrency && !pending.isEmpty()) {
                    if (token.isCancelled()) {
                        cancelled = true;
                        log.info("Dispatch stopped by cancellation | run={} | inFlight={} | pending={}",
                                name, inFlight.size(), pending.size());
                        break;
                    }
                    if (deadline.isExpired()) {
                        timedOut = true;
                        log.warn("Dispatch stopped at workflow deadline | run={} | inFlight={} | pending={}",
                                name, inFlight.size(), pending.size());
                        break;
                    }
                    Integer next = pickReady(pending, subtasks, depIndexes, collector);
                    if (next == null) break;
                    pending.remove(next);
                    SubTask subtask = subtasks.get(next);
                    events.onDispatch(subtask);
                    int index = next;
                    dispatchedAt.put(index, System.nanoTime());
                    inFlight.put(index, pool.submit(() -> completions.add(new Completion(index, runGuarded(execute, subtask)))));
                    peak = Math.max(peak, inFlight.size());
                }
                if (inFlight.isEmpty()) {
                    if (!pending.isEmpty() && !(cancelled || timedOut || failFastId != null)) {
                        if (token.isCancelled()) {
                            cancelled = true;
                        } else if (deadline.isExpired()) {
                            timedOut = true;
                        } else {
                            log.error("Scheduler stalled with no ready subtask | run={} | pending={}", name, pending.size());
                        }
                    }
                    break;
                }
                Completion done = awaitCompletion(completions);
                if (done == null) {
                    if (deadline.isExpired() && !timedOut) {
                        timedOut = true;
                        log.warn("Workflow deadline reached with subtasks in flight | run={} | inFlight={}", name, inFlight.size());
                    }
                    if (timedOut) {
                        expireInFlight(inFlight, dispatchedAt, subtasks, collector, events);
                        break;
                    }
                    continue;
                }
                if (!collector.set(done.index(), done.result())) continue;
                inFlight.remove(done.index());
                events.onComplete(subtasks.get(done.index()), done.result());
                if (failFast && !done.result().isSuccess() && failFastId == null) {
                    failFastId = done.result().getAgentId();
                    log.warn("Fail-fast triggered | run={} | subtask={} | status={}",
                            name, failFastId, done.result().getStatus().toValue());
                }
            }
        } finally {
            if (timedOut) {
                pool.shutdownNow();
            } else {
                pool.shutdown();
            }
        }

        List<String> undispatched = new ArrayList<>();
        for (Integer i : pending) undispatched.add(subtasks.get(i).getId());
        return new ScheduleOutcome(collector.inOrder(), cancelled, timedOut, failFastId, undispatched, peak);
    }

    private Completion awaitCompletion(BlockingQueue<Completion> completions) {
        long waitNanos = TimeUnit.MILLISECONDS.toNanos(CANCEL_POLL_MILLIS);
        if (deadline.isBounded()) waitNanos = Math.min(waitNanos, Math.max(1, deadline.remainingNanos()));
        try {
            return completions.poll(waitNanos, TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            token.cancel("dispatch thread interrupted");
            return null;
        }
    }

    private static void expireInFlight(Map<Integer, Future<?>> inFlight, Map<Integer, Long> dispatchedAt,
                                       List<SubTask> subtasks, ResultCollector collector, SchedulerListener events) {
        for (Iterator<Map.Entry<Integer, Future<?>>> it = inFlight.entrySet().iterator(); it.hasNext(); ) {
            Map.Entry<Integer, Future<?>> e = it.next();
            int index = e.getKey();
            e.getValue().cancel(true);
            long ms = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - dispatchedAt.getOrDefault(index, System.nanoTime()));
            AgentResult timeout = AgentResult.timeout(subtasks.get(index), "Workflow deadline reached before completion", ms);
            if (collector.set(index, timeout)) {
                events.onComplete(subtasks.get(index), timeout);
            }
            it.remove();
        }
    }

    private static AgentResult runGuarded(Function<SubTask, AgentResult> execute, SubTask subtask) {
        try {
            AgentResult r = execute.apply(subtask);
            if (r != null) return r;
            return AgentResult.failed(subtask, "No result produced", FailureKind.UNKNOWN, 0);
        } catch (RuntimeException e) {
            log.warn("Subtask execution threw | id={} | error={}", subtask.getId(), e.toString(), e);
            return AgentResult.failed(subtask, e.getMessage() != null ? e.getMessage() : e.toString(), FailureKind.UNKNOWN, 0);
        }
    }

    private static Integer pickReady(TreeSet<Integer> pending, List<SubTask> subtasks, int[][] depIndexes,
                                     ResultCollector collector) {
        Integer best = null;
        for (Integer i : pending) {
            if (!dependenciesSatisfied(depIndexes[i], collector)) continue;
            if (best == null || subtasks.get(i).getPriority() > subtasks.get(best).getPriority()) {
                best = i;
            }
        }
        return best;
    }

    private static boolean dependenciesSatisfied(int[] deps, ResultCollector collector) {
        for (int d : deps) {
            if (!collector.has(d)) return false;
        }
        return true;
    }

    private static int[][] dependencyIndexes(WorkflowGraph graph) {
        List<SubTask> subtasks = graph.getSubtasks();
        int[][] out = new int[subtasks.size()][];
        for (int i = 0; i < subtasks.size(); i++) {
            out[i] = subtasks.get(i).getDependencies().stream().mapToInt(graph::indexOf).toArray();
        }
        return out;
    }

    private static ThreadFactory threadFactory(String name) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "weave-" + name + "-agent-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
