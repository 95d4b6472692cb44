package com.agentweave.ledger;

import com.agentweave.workflow.model.AgentType;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Point-in-time totals for one run: cost, tokens, call counts and the per-agent-type
 * breakdown.
 */
public record CostSummary(
        BigDecimal totalCost,
        long totalTokens,
        int calls,
        int failedCalls,
        Map<AgentType, BigDecimal> costByAgentType,
        Map<AgentType, Long> tokensByAgentType
) {
    public CostSummary {
        totalCost = totalCost != null ? totalCost : BigDecimal.ZERO;
        costByAgentType = costByAgentType != null && !costByAgentType.isEmpty()
                ? Collections.unmodifiableMap(new EnumMap<>(costByAgentType))
                : Map.of();
        tokensByAgentType = tokensByAgentType != null && !tokensByAgentType.isEmpty()
                ? Collections.unmodifiableMap(new EnumMap<>(tokensByAgentType))
                : Map.of();
    }

    public static CostSummary empty() {
        return new CostSummary(BigDecimal.ZERO, 0, 0, 0, Map.of(), Map.of());
    }
}
