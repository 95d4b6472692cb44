package com.agentweave.workflow.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Result of executing one subtask. Produced exactly once per subtask and never mutated;
 * {@link #getAgentId()} equals the subtask id.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class AgentResult {

    private final String agentId;
    private final AgentType agentType;
    private final AgentStatus status;
    private final String output;
    private final long tokensUsed;
    private final BigDecimal cost;
    private final long executionTimeMillis;
    private final String error;
    private final FailureKind failureKind;
    private final int attempts;
    private final Map<String, Object> metadata;

    @JsonCreator
    public AgentResult(@JsonProperty("agentId") String agentId,
                       @JsonProperty("agentType") AgentType agentType,
                       @JsonProperty("status") AgentStatus status,
                       @JsonProperty("output") String output,
                       @JsonProperty("tokensUsed") long tokensUsed,
                       @JsonProperty("cost") BigDecimal cost,
                       @JsonProperty("executionTimeMillis") long executionTimeMillis,
                       @JsonProperty("error") String error,
                       @JsonProperty("failureKind") FailureKind failureKind,
                       @JsonProperty("attempts") int attempts,
                       @JsonProperty("metadata") Map<String, Object> metadata) {
        this.agentId = Objects.requireNonNull(agentId, "agentId");
        this.agentType = agentType;
        this.status = Objects.requireNonNull(status, "status");
        this.output = output != null ? output : "";
        this.tokensUsed = Math.max(0, tokensUsed);
        this.cost = cost != null ? cost : BigDecimal.ZERO;
        this.executionTimeMillis = Math.max(0, executionTimeMillis);
        this.error = error;
        this.failureKind = status == AgentStatus.SUCCESS ? null
                : (failureKind != null ? failureKind : (status == AgentStatus.TIMEOUT ? FailureKind.TIMEOUT : FailureKind.UNKNOWN));
        this.attempts = Math.max(1, attempts);
        this.metadata = metadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
                : Map.of();
    }

    public static AgentResult success(SubTask subtask, String output, long tokensUsed, BigDecimal cost,
                                      long executionTimeMillis, Map<String, Object> metadata) {
        return new AgentResult(subtask.getId(), subtask.getAgentType(), AgentStatus.SUCCESS, output,
                tokensUsed, cost, executionTimeMillis, null, null, 1, metadata);
    }

    public static AgentResult failed(SubTask subtask, String error, FailureKind kind, long executionTimeMillis) {
        return new AgentResult(subtask.getId(), subtask.getAgentType(), AgentStatus.FAILED, "",
                0, BigDecimal.ZERO, executionTimeMillis, error, kind, 1, null);
    }

    public static AgentResult timeout(SubTask subtask, String error, long executionTimeMillis) {
        return new AgentResult(subtask.getId(), subtask.getAgentType(), AgentStatus.TIMEOUT, "",
                0, BigDecimal.ZERO, executionTimeMillis, error, FailureKind.TIMEOUT, 1, null);
    }

    /** Returns a copy recording the number of attempts it took (retry wrapper). */
    public AgentResult withAttempts(int attemptCount) {
        return new AgentResult(agentId, agentType, status, output, tokensUsed, cost, executionTimeMillis,
                error, failureKind, attemptCount, metadata);
    }

    public String getAgentId() {
        return agentId;
    }

    public AgentType getAgentType() {
        return agentType;
    }

    public AgentStatus getStatus() {
        return status;
    }

    public boolean isSuccess() {
        return status == AgentStatus.SUCCESS;
    }

    /** Output text; empty (never null) when the subtask failed. */
    public String getOutput() {
        return output;
    }

    public long getTokensUsed() {
        return tokensUsed;
    }

    public BigDecimal getCost() {
        return cost;
    }

    public long getExecutionTimeMillis() {
        return executionTimeMillis;
    }

    public String getError() {
        return error;
    }

    /** Failure classification; null on success. */
    public FailureKind getFailureKind() {
        return failureKind;
    }

    public int getAttempts() {
        return attempts;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    @Override
    public String toString() {
        return "AgentResult{agentId=" + agentId + ", status=" + status.toValue() + ", tokens=" + tokensUsed
                + ", cost=" + cost + ", timeMs=" + executionTimeMillis
                + (error != null ? ", error=" + error : "") + "}";
    }
}
