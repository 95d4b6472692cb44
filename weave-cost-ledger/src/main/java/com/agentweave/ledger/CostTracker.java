package com.agentweave.ledger;

import com.agentweave.workflow.model.AgentResult;
import com.agentweave.workflow.model.AgentType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.Map;

/**
 * Accumulates cost and token usage for one workflow run.
 * <p>
 * Single responsibility: running totals. Worker threads record concurrently; all mutation
 * and snapshotting happens under one lock so a snapshot never mixes a half-applied update.
 * Synthesis-tier calls that are not part of the run's agent results are recorded here too,
 * so totals cover every executor call the run made.
 */
public final class CostTracker {

    private static final Logger log = LoggerFactory.getLogger(CostTracker.class);

    private final String taskId;
    private final Object lock = new Object();
    private BigDecimal totalCost = BigDecimal.ZERO;
    private long totalTokens;
    private int calls;
    private int failedCalls;
    private final Map<AgentType, BigDecimal> costByType = new EnumMap<>(AgentType.class);
    private final Map<AgentType, Long> tokensByType = new EnumMap<>(AgentType.class);

    public CostTracker(String taskId) {
        this.taskId = taskId;
    }

    /** Records one executor call. Null results are ignored. */
    public void record(AgentResult result) {
        if (result == null) return;
        AgentType type = result.getAgentType() != null ? result.getAgentType() : AgentType.WORKER;
        synchronized (lock) {
            totalCost = totalCost.add(result.getCost());
            totalTokens += result.getTokensUsed();
            calls++;
            if (!result.isSuccess()) failedCalls++;
            costByType.merge(type, result.getCost(), BigDecimal::add);
            tokensByType.merge(type, result.getTokensUsed(), Long::sum);
        }
        log.debug("Cost recorded | taskId={} | agentId={} | tokens={} | cost={}",
                taskId, result.getAgentId(), result.getTokensUsed(), result.getCost());
    }

    public BigDecimal getTotalCost() {
        synchronized (lock) {
            return totalCost;
        }
    }

    public long getTotalTokens() {
        synchronized (lock) {
            return totalTokens;
        }
    }

    public CostSummary snapshot() {
        synchronized (lock) {
            return new CostSummary(totalCost, totalTokens, calls, failedCalls, costByType, tokensByType);
        }
    }

    public String getTaskId() {
        return taskId;
    }
}
