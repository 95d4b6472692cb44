package com.agentweave.engine;

import java.time.Duration;

/** Monotonic point in time after which no new subtask may be dispatched. */
public final class Deadline {

    private static final Deadline NONE = new Deadline(Long.MAX_VALUE, false);

    private final long atNanos;
    private final boolean bounded;

    private Deadline(long atNanos, boolean bounded) {
        this.atNanos = atNanos;
        this.bounded = bounded;
    }

    public static Deadline none() {
        return NONE;
    }

    /** Deadline {@code timeout} from now, or {@link #none()} when the timeout is null or not positive. */
    public static Deadline after(Duration timeout) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) return NONE;
        return new Deadline(System.nanoTime() + timeout.toNanos(), true);
    }

    public boolean isBounded() {
        return bounded;
    }

    public boolean isExpired() {
        return bounded && System.nanoTime() - atNanos >= 0;
    }

    /** Nanoseconds left; 0 when expired, {@link Long#MAX_VALUE} when unbounded. */
    public long remainingNanos() {
        if (!bounded) return Long.MAX_VALUE;
        return Math.max(0, atNanos - System.nanoTime());
    }
}
