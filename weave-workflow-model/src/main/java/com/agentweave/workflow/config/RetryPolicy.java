package com.agentweave.workflow.config;

import com.agentweave.workflow.error.ConfigurationException;
import com.agentweave.workflow.model.FailureKind;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Opt-in retry for subtask executions. Delay before retry {@code n} (0-based) is
 * {@code backoffBaseSeconds * backoffMultiplier^n}, capped at {@code maxBackoffSeconds},
 * then spread by up to {@code ± jitter} of itself.
 * Only {@link #getRetryableKinds()} are retried; VALIDATION, AUTH and UNKNOWN never are.
 */
public final class RetryPolicy {

    private static final Set<FailureKind> NEVER_RETRIED =
            EnumSet.of(FailureKind.VALIDATION, FailureKind.AUTH, FailureKind.UNKNOWN);

    private final int maxRetries;
    private final double backoffBaseSeconds;
    private final double backoffMultiplier;
    private final double maxBackoffSeconds;
    private final double jitter;
    private final Set<FailureKind> retryableKinds;

    @JsonCreator
    public RetryPolicy(
            @JsonProperty("maxRetries") Integer maxRetries,
            @JsonProperty("backoffBaseSeconds") Double backoffBaseSeconds,
            @JsonProperty("backoffMultiplier") Double backoffMultiplier,
            @JsonProperty("maxBackoffSeconds") Double maxBackoffSeconds,
            @JsonProperty("jitter") Double jitter,
            @JsonProperty("retryableKinds") Set<FailureKind> retryableKinds) {
        this.maxRetries = maxRetries != null ? maxRetries : 3;
        this.backoffBaseSeconds = backoffBaseSeconds != null ? backoffBaseSeconds : 1.0;
        this.backoffMultiplier = backoffMultiplier != null ? backoffMultiplier : 2.0;
        this.maxBackoffSeconds = maxBackoffSeconds != null ? maxBackoffSeconds : 60.0;
        this.jitter = jitter != null ? jitter : 0.2;
        EnumSet<FailureKind> kinds = retryableKinds == null || retryableKinds.isEmpty()
                ? EnumSet.of(FailureKind.TIMEOUT, FailureKind.RATE_LIMIT)
                : EnumSet.copyOf(retryableKinds);
        kinds.removeAll(NEVER_RETRIED);
        this.retryableKinds = Set.copyOf(kinds);

        if (this.maxRetries < 0) throw new ConfigurationException("maxRetries must be >= 0, got " + this.maxRetries);
        if (this.backoffBaseSeconds < 0) throw new ConfigurationException("backoffBaseSeconds must be >= 0");
        if (this.backoffMultiplier < 1.0) throw new ConfigurationException("backoffMultiplier must be >= 1.0");
        if (this.maxBackoffSeconds < this.backoffBaseSeconds) {
            throw new ConfigurationException("maxBackoffSeconds must be >= backoffBaseSeconds");
        }
        if (this.jitter < 0 || this.jitter >= 1.0) throw new ConfigurationException("jitter must be in [0, 1)");
    }

    /** Defaults: 3 retries, 1 s base, x2, 60 s cap, 20% jitter, TIMEOUT and RATE_LIMIT. */
    public static RetryPolicy defaults() {
        return new RetryPolicy(null, null, null, null, null, null);
    }

    public static RetryPolicy of(int maxRetries, double backoffBaseSeconds, double backoffMultiplier) {
        return new RetryPolicy(maxRetries, backoffBaseSeconds, backoffMultiplier,
                Math.max(60.0, backoffBaseSeconds), 0.0, null);
    }

    public boolean isRetryable(FailureKind kind) {
        return kind != null && retryableKinds.contains(kind);
    }

    /**
     * Delay before retry {@code attempt} (0 = first retry).
     *
     * @param jitterSample uniform sample in [-1, 1]; scaled by {@link #getJitter()}
     */
    public Duration backoff(int attempt, double jitterSample) {
        double seconds = backoffBaseSeconds * Math.pow(backoffMultiplier, Math.max(0, attempt));
        seconds = Math.min(seconds, maxBackoffSeconds);
        double clamped = Math.max(-1.0, Math.min(1.0, jitterSample));
        seconds = Math.max(0.0, seconds * (1.0 + jitter * clamped));
        return Duration.ofNanos((long) (seconds * 1_000_000_000L));
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public double getBackoffBaseSeconds() {
        return backoffBaseSeconds;
    }

    public double getBackoffMultiplier() {
        return backoffMultiplier;
    }

    public double getMaxBackoffSeconds() {
        return maxBackoffSeconds;
    }

    public double getJitter() {
        return jitter;
    }

    public Set<FailureKind> getRetryableKinds() {
        return retryableKinds;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RetryPolicy that = (RetryPolicy) o;
        return maxRetries == that.maxRetries
                && Double.compare(backoffBaseSeconds, that.backoffBaseSeconds) == 0
                && Double.compare(backoffMultiplier, that.backoffMultiplier) == 0
                && Double.compare(maxBackoffSeconds, that.maxBackoffSeconds) == 0
                && Double.compare(jitter, that.jitter) == 0
                && retryableKinds.equals(that.retryableKinds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(maxRetries, backoffBaseSeconds, backoffMultiplier, maxBackoffSeconds, jitter, retryableKinds);
    }
}
