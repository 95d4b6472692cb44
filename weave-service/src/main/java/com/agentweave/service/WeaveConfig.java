package com.agentweave.service;

import com.agentweave.progress.BackpressurePolicy;
import com.agentweave.progress.ProgressChannel;

import java.time.Duration;
import java.util.Map;

/**
 * Service limits and progress-channel settings, loaded from environment variables.
 * <p>
 * WEAVE_MAX_ACTIVE_WORKFLOWS (default 50), WEAVE_COMPLETED_RETENTION (default 100),
 * WEAVE_EVENT_BUFFER_SIZE (default 1000), WEAVE_EVENT_BACKPRESSURE ({@code drop_oldest} or
 * {@code block_with_timeout}, default drop_oldest), WEAVE_EVENT_OFFER_TIMEOUT_MS (default 500),
 * WEAVE_EVENT_CLOSE_TIMEOUT_MS (default 5000), WEAVE_LOG_EVENTS ({@code true} logs every progress
 * event, default false). Unparseable numbers fall back to the default.
 */
public final class WeaveConfig {

    static final String ENV_MAX_ACTIVE_WORKFLOWS = "WEAVE_MAX_ACTIVE_WORKFLOWS";
    static final String ENV_COMPLETED_RETENTION = "WEAVE_COMPLETED_RETENTION";
    static final String ENV_EVENT_BUFFER_SIZE = "WEAVE_EVENT_BUFFER_SIZE";
    static final String ENV_EVENT_BACKPRESSURE = "WEAVE_EVENT_BACKPRESSURE";
    static final String ENV_EVENT_OFFER_TIMEOUT_MS = "WEAVE_EVENT_OFFER_TIMEOUT_MS";
    static final String ENV_EVENT_CLOSE_TIMEOUT_MS = "WEAVE_EVENT_CLOSE_TIMEOUT_MS";
    static final String ENV_LOG_EVENTS = "WEAVE_LOG_EVENTS";

    public static final int DEFAULT_MAX_ACTIVE_WORKFLOWS = 50;
    public static final int DEFAULT_COMPLETED_RETENTION = 100;
    private static final long DEFAULT_CLOSE_TIMEOUT_MS = 5_000;

    private final int maxActiveWorkflows;
    private final int completedRetention;
    private final int eventBufferSize;
    private final BackpressurePolicy eventBackpressure;
    private final Duration eventOfferTimeout;
    private final Duration eventCloseTimeout;
    private final boolean logEvents;

    private WeaveConfig(Builder b) {
        if (b.maxActiveWorkflows <= 0) throw new IllegalArgumentException("maxActiveWorkflows must be > 0");
        if (b.completedRetention < 0) throw new IllegalArgumentException("completedRetention must be >= 0");
        if (b.eventBufferSize <= 0) throw new IllegalArgumentException("eventBufferSize must be > 0");
        this.maxActiveWorkflows = b.maxActiveWorkflows;
        this.completedRetention = b.completedRetention;
        this.eventBufferSize = b.eventBufferSize;
        this.eventBackpressure = b.eventBackpressure != null ? b.eventBackpressure : BackpressurePolicy.DROP_OLDEST;
        this.eventOfferTimeout = b.eventOfferTimeout != null ? b.eventOfferTimeout : ProgressChannel.DEFAULT_OFFER_TIMEOUT;
        this.eventCloseTimeout = b.eventCloseTimeout != null ? b.eventCloseTimeout : Duration.ofMillis(DEFAULT_CLOSE_TIMEOUT_MS);
        this.logEvents = b.logEvents;
    }

    public static WeaveConfig defaults() {
        return builder().build();
    }

    public static WeaveConfig fromEnvironment() {
        return fromEnv(System.getenv());
    }

    /**
     * Reads the WEAVE_* keys from the given map.
     *
     * @throws com.agentweave.workflow.error.ConfigurationException on an unknown backpressure policy
     */
    public static WeaveConfig fromEnv(Map<String, String> env) {
        Map<String, String> e = env != null ? env : Map.of();
        String policy = e.get(ENV_EVENT_BACKPRESSURE);
        return builder()
                .maxActiveWorkflows(parseInt(e.get(ENV_MAX_ACTIVE_WORKFLOWS), DEFAULT_MAX_ACTIVE_WORKFLOWS))
                .completedRetention(parseInt(e.get(ENV_COMPLETED_RETENTION), DEFAULT_COMPLETED_RETENTION))
                .eventBufferSize(parseInt(e.get(ENV_EVENT_BUFFER_SIZE), ProgressChannel.DEFAULT_CAPACITY))
                .eventBackpressure(policy != null && !policy.isBlank() ? BackpressurePolicy.fromValue(policy) : null)
                .eventOfferTimeout(Duration.ofMillis(parseLong(e.get(ENV_EVENT_OFFER_TIMEOUT_MS),
                        ProgressChannel.DEFAULT_OFFER_TIMEOUT.toMillis())))
                .eventCloseTimeout(Duration.ofMillis(parseLong(e.get(ENV_EVENT_CLOSE_TIMEOUT_MS), DEFAULT_CLOSE_TIMEOUT_MS)))
                .logEvents(Boolean.parseBoolean(e.get(ENV_LOG_EVENTS) != null ? e.get(ENV_LOG_EVENTS).trim() : null))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static int parseInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) return defaultValue;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException ex) {
            return defaultValue;
        }
    }

    private static long parseLong(String value, long defaultValue) {
        if (value == null || value.isBlank()) return defaultValue;
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException ex) {
            return defaultValue;
        }
    }

    /** Running workflows allowed at once; further submissions are rejected. */
    public int getMaxActiveWorkflows() {
        return maxActiveWorkflows;
    }

    /** Finished workflows kept for status and result lookups, oldest evicted first. */
    public int getCompletedRetention() {
        return completedRetention;
    }

    public int getEventBufferSize() {
        return eventBufferSize;
    }

    public BackpressurePolicy getEventBackpressure() {
        return eventBackpressure;
    }

    public Duration getEventOfferTimeout() {
        return eventOfferTimeout;
    }

    /** How long closing a subscriber channel waits for queued events to be delivered. */
    public Duration getEventCloseTimeout() {
        return eventCloseTimeout;
    }

    /** When true every progress event is also written to the log as JSON. */
    public boolean isLogEvents() {
        return logEvents;
    }

    public static final class Builder {
        private int maxActiveWorkflows = DEFAULT_MAX_ACTIVE_WORKFLOWS;
        private int completedRetention = DEFAULT_COMPLETED_RETENTION;
        private int eventBufferSize = ProgressChannel.DEFAULT_CAPACITY;
        private BackpressurePolicy eventBackpressure = BackpressurePolicy.DROP_OLDEST;
        private Duration eventOfferTimeout = ProgressChannel.DEFAULT_OFFER_TIMEOUT;
        private Duration eventCloseTimeout = Duration.ofMillis(DEFAULT_CLOSE_TIMEOUT_MS);
        private boolean logEvents;

        public Builder maxActiveWorkflows(int maxActiveWorkflows) {
            this.maxActiveWorkflows = maxActiveWorkflows;
            return this;
        }

        public Builder completedRetention(int completedRetention) {
            this.completedRetention = completedRetention;
            return this;
        }

        public Builder eventBufferSize(int eventBufferSize) {
            this.eventBufferSize = eventBufferSize;
            return this;
        }

        public Builder eventBackpressure(BackpressurePolicy policy) {
            this.eventBackpressure = policy;
            return this;
        }

        public Builder eventOfferTimeout(Duration timeout) {
            this.eventOfferTimeout = timeout;
            return this;
        }

        public Builder eventCloseTimeout(Duration timeout) {
            this.eventCloseTimeout = timeout;
            return this;
        }

        public Builder logEvents(boolean logEvents) {
            this.logEvents = logEvents;
            return this;
        }

        public WeaveConfig build() {
            return new WeaveConfig(this);
        }
    }
}
