package com.agentweave.engine.invoke;

import com.agentweave.agent.AgentContext;
import com.agentweave.agent.AgentExecution;
import com.agentweave.agent.AgentExecutionException;
import com.agentweave.agent.AgentExecutorRegistry;
import com.agentweave.workflow.model.AgentResult;
import com.agentweave.workflow.model.AgentStatus;
import com.agentweave.workflow.model.AgentType;
import com.agentweave.workflow.model.FailureKind;
import com.agentweave.workflow.model.SubTask;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TimedAgentInvokerTest {

    private final ExecutorService pool = Executors.newCachedThreadPool();
    private final SubTask subtask = SubTask.builder("s1").description("summarize").agentType(AgentType.TEXT).build();
    private final AgentContext context = new AgentContext("t", "task", "title", Map.of(), List.of());

    @AfterEach
    void shutdown() {
        pool.shutdownNow();
    }

    @Test
    void invoke_successCarriesTokensCostAndMeasuredTime() {
        AgentExecutorRegistry registry = AgentExecutorRegistry.withDefault((t, c) -> {
            Thread.sleep(20);
            return AgentExecution.completed("summary", 120, new BigDecimal("0.004"), Map.of("model", "m1"));
        });

        AgentResult r = new TimedAgentInvoker(registry, pool, Duration.ofSeconds(5)).invoke(subtask, context);

        assertEquals(AgentStatus.SUCCESS, r.getStatus());
        assertEquals("summary", r.getOutput());
        assertEquals(120, r.getTokensUsed());
        assertEquals(new BigDecimal("0.004"), r.getCost());
        assertTrue(r.getExecutionTimeMillis() >= 15, "time " + r.getExecutionTimeMillis());
        assertEquals("m1", r.getMetadata().get("model"));
        assertNull(r.getFailureKind());
    }

    @Test
    void invoke_slowCallBecomesTimeout() {
        AgentExecutorRegistry registry = AgentExecutorRegistry.withDefault((t, c) -> {
            Thread.sleep(5_000);
            return AgentExecution.completed("late", 1, BigDecimal.ZERO);
        });

        long start = System.nanoTime();
        AgentResult r = new TimedAgentInvoker(registry, pool, Duration.ofMillis(100)).invoke(subtask, context);
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        assertEquals(AgentStatus.TIMEOUT, r.getStatus());
        assertEquals(FailureKind.TIMEOUT, r.getFailureKind());
        assertTrue(elapsedMs < 2_000, "waited " + elapsedMs + " ms");
    }

    @Test
    void invoke_classifiedExceptionKeepsKind() {
        AgentExecutorRegistry registry = AgentExecutorRegistry.withDefault((t, c) -> {
            throw AgentExecutionException.rateLimited("429 from provider");
        });

        AgentResult r = new TimedAgentInvoker(registry, pool, Duration.ofSeconds(5)).invoke(subtask, context);

        assertEquals(AgentStatus.FAILED, r.getStatus());
        assertEquals(FailureKind.RATE_LIMIT, r.getFailureKind());
        assertEquals("429 from provider", r.getError());
    }

    @Test
    void invoke_unexpectedExceptionIsUnknownFailure() {
        AgentExecutorRegistry registry = AgentExecutorRegistry.withDefault((t, c) -> {
            throw new IllegalStateException("parser blew up");
        });

        AgentResult r = new TimedAgentInvoker(registry, pool, Duration.ofSeconds(5)).invoke(subtask, context);

        assertEquals(FailureKind.UNKNOWN, r.getFailureKind());
        assertEquals("parser blew up", r.getError());
    }

    @Test
    void invoke_reportedFailureIsNotTreatedAsSuccess() {
        AgentExecutorRegistry registry = AgentExecutorRegistry.withDefault(
                (t, c) -> AgentExecution.failed("invalid api key", FailureKind.AUTH));

        AgentResult r = new TimedAgentInvoker(registry, pool, Duration.ofSeconds(5)).invoke(subtask, context);

        assertEquals(AgentStatus.FAILED, r.getStatus());
        assertEquals(FailureKind.AUTH, r.getFailureKind());
        assertEquals("", r.getOutput());
    }

    @Test
    void invoke_missingExecutorIsValidationFailure() {
        AgentResult r = new TimedAgentInvoker(new AgentExecutorRegistry(), pool, Duration.ofSeconds(1)).invoke(subtask, context);

        assertEquals(FailureKind.VALIDATION, r.getFailureKind());
    }
}
