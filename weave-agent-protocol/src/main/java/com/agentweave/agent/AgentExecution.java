package com.agentweave.agent;

import com.agentweave.workflow.model.AgentStatus;
import com.agentweave.workflow.model.FailureKind;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Raw outcome reported by an {@link AgentExecutor}. Execution time is not part of it: the
 * engine measures that itself. An executor may report a failure by returning a FAILED
 * execution instead of throwing.
 */
public final class AgentExecution {

    private final AgentStatus status;
    private final String output;
    private final long tokensUsed;
    private final BigDecimal cost;
    private final String error;
    private final FailureKind failureKind;
    private final Map<String, Object> metadata;

    public AgentExecution(AgentStatus status, String output, long tokensUsed, BigDecimal cost,
                          String error, FailureKind failureKind, Map<String, Object> metadata) {
        this.status = status != null ? status : AgentStatus.FAILED;
        this.output = output != null ? output : "";
        this.tokensUsed = Math.max(0, tokensUsed);
        this.cost = cost != null ? cost : BigDecimal.ZERO;
        this.error = error;
        this.failureKind = failureKind;
        this.metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
    }

    public static AgentExecution completed(String output, long tokensUsed, BigDecimal cost) {
        return new AgentExecution(AgentStatus.SUCCESS, output, tokensUsed, cost, null, null, null);
    }

    public static AgentExecution completed(String output, long tokensUsed, BigDecimal cost, Map<String, Object> metadata) {
        return new AgentExecution(AgentStatus.SUCCESS, output, tokensUsed, cost, null, null, metadata);
    }

    public static AgentExecution failed(String error, FailureKind kind) {
        return new AgentExecution(AgentStatus.FAILED, "", 0, BigDecimal.ZERO, error, kind, null);
    }

    public AgentStatus getStatus() {
        return status;
    }

    public boolean isSuccess() {
        return status == AgentStatus.SUCCESS;
    }

    public String getOutput() {
        return output;
    }

    public long getTokensUsed() {
        return tokensUsed;
    }

    public BigDecimal getCost() {
        return cost;
    }

    public String getError() {
        return error;
    }

    public FailureKind getFailureKind() {
        return failureKind;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }
}
