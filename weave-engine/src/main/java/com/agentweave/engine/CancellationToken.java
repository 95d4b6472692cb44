package com.agentweave.engine;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag for one run. The scheduler checks it before every dispatch;
 * subtasks already running are allowed to finish.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private volatile String reason;

    /**
     * Requests cancellation.
     *
     * @return true if this call cancelled the token, false if it was already cancelled
     */
    public boolean cancel(String reason) {
        if (cancelled.compareAndSet(false, true)) {
            this.reason = reason != null ? reason : "cancelled";
            return true;
        }
        return false;
    }

    public boolean cancel() {
        return cancel("cancelled by caller");
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public String getReason() {
        return reason;
    }
}
