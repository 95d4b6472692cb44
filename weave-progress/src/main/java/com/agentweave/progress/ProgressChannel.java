package com.agentweave.progress;

import com.agentweave.agent.ProgressSink;
import com.agentweave.workflow.event.WorkflowEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded hand-off between a running workflow (producer) and a slow subscriber.
 * <p>
 * Events are queued (capacity {@link #DEFAULT_CAPACITY} unless configured) and delivered to
 * the downstream sink by one daemon thread, in emit order. When the queue is full the
 * {@link BackpressurePolicy} decides: evict the oldest event, or block the producer for at
 * most the offer timeout and then drop the new event. Every dropped event is counted.
 * <p>
 * {@link #close()} stops accepting events, delivers what is still queued and stops the
 * delivery thread. Events emitted after close are counted as dropped.
 */
public final class ProgressChannel implements ProgressSink, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProgressChannel.class);

    public static final int DEFAULT_CAPACITY = 1000;
    public static final Duration DEFAULT_OFFER_TIMEOUT = Duration.ofMillis(500);
    private static final long POLL_MILLIS = 50;

    private final String name;
    private final BlockingQueue<WorkflowEvent> queue;
    private final ProgressSink downstream;
    private final BackpressurePolicy policy;
    private final Duration offerTimeout;
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicLong delivered = new AtomicLong();
    private final Thread consumer;
    private volatile boolean closed;

    public ProgressChannel(String name, ProgressSink downstream) {
        this(name, downstream, DEFAULT_CAPACITY, BackpressurePolicy.DROP_OLDEST, DEFAULT_OFFER_TIMEOUT);
    }

    public ProgressChannel(String name, ProgressSink downstream, int capacity,
                           BackpressurePolicy policy, Duration offerTimeout) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be > 0");
        this.name = name != null ? name : "progress";
        this.downstream = Objects.requireNonNull(downstream, "downstream");
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.policy = policy != null ? policy : BackpressurePolicy.DROP_OLDEST;
        this.offerTimeout = offerTimeout != null ? offerTimeout : DEFAULT_OFFER_TIMEOUT;
        this.consumer = new Thread(this::deliverLoop, "weave-progress-" + this.name);
        this.consumer.setDaemon(true);
        this.consumer.start();
    }

    @Override
    public void emit(WorkflowEvent event) {
        if (event == null) return;
        if (closed) {
            dropped.incrementAndGet();
            log.debug("Progress event after close dropped | channel={} | event={}", name, event.type().wireName());
            return;
        }
        switch (policy) {
            case DROP_OLDEST -> offerDroppingOldest(event);
            case BLOCK_WITH_TIMEOUT -> offerBlocking(event);
        }
    }

    private void offerDroppingOldest(WorkflowEvent event) {
        while (!queue.offer(event)) {
            WorkflowEvent evicted = queue.poll();
            if (evicted != null) {
                long n = dropped.incrementAndGet();
                log.debug("Progress queue full, oldest dropped | channel={} | event={} | dropped={}",
                        name, evicted.type().wireName(), n);
            }
        }
    }

    private void offerBlocking(WorkflowEvent event) {
        try {
            if (!queue.offer(event, offerTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                long n = dropped.incrementAndGet();
                log.warn("Progress queue full after {} ms, event dropped | channel={} | event={} | dropped={}",
                        offerTimeout.toMillis(), name, event.type().wireName(), n);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            dropped.incrementAndGet();
            log.warn("Interrupted while offering progress event | channel={} | event={}", name, event.type().wireName());
        }
    }

    private void deliverLoop() {
        while (true) {
            WorkflowEvent event;
            try {
                event = queue.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (event == null) {
                if (closed) break;
                continue;
            }
            try {
                downstream.emit(event);
                delivered.incrementAndGet();
            } catch (Throwable t) {
                log.warn("Progress subscriber failed | channel={} | event={} | error={}",
                        name, event.type().wireName(), t.getMessage(), t);
            }
        }
        log.debug("Progress channel stopped | channel={} | delivered={} | dropped={}", name, delivered.get(), dropped.get());
    }

    /**
     * Stops accepting events and waits up to {@code timeout} for queued events to be delivered.
     *
     * @return true when the delivery thread finished within the timeout
     */
    public boolean close(Duration timeout) {
        closed = true;
        try {
            consumer.join(Math.max(1, timeout.toMillis()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        boolean finished = !consumer.isAlive();
        if (!finished) {
            log.warn("Progress channel did not drain in time | channel={} | pending={}", name, queue.size());
        }
        return finished;
    }

    @Override
    public void close() {
        close(Duration.ofSeconds(5));
    }

    public long getDroppedCount() {
        return dropped.get();
    }

    public long getDeliveredCount() {
        return delivered.get();
    }

    public int getPendingCount() {
        return queue.size();
    }

    public BackpressurePolicy getPolicy() {
        return policy;
    }

    public boolean isClosed() {
        return closed;
    }
}
