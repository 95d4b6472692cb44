package com.agentweave.engine.invoke;

import com.agentweave.agent.AgentContext;
import com.agentweave.agent.AgentExecution;
import com.agentweave.agent.AgentExecutionException;
import com.agentweave.agent.AgentExecutor;
import com.agentweave.agent.AgentExecutorRegistry;
import com.agentweave.workflow.error.ConfigurationException;
import com.agentweave.workflow.model.AgentResult;
import com.agentweave.workflow.model.AgentStatus;
import com.agentweave.workflow.model.FailureKind;
import com.agentweave.workflow.model.SubTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Single responsibility: call the executor registered for the subtask's agent type and bound
 * the call by the per-subtask timeout.
 * <p>
 * The call runs on {@code callExecutor}; the invoking thread waits at most {@code timeout}.
 * On timeout the call is interrupted and the subtask is recorded as TIMEOUT. Execution time is
 * measured here, at the call boundary.
 */
public final class TimedAgentInvoker implements AgentInvoker {

    private static final Logger log = LoggerFactory.getLogger(TimedAgentInvoker.class);

    private final AgentExecutorRegistry registry;
    private final ExecutorService callExecutor;
    private final Duration timeout;

    public TimedAgentInvoker(AgentExecutorRegistry registry, ExecutorService callExecutor, Duration timeout) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.callExecutor = Objects.requireNonNull(callExecutor, "callExecutor");
        this.timeout = timeout != null && !timeout.isNegative() && !timeout.isZero() ? timeout : Duration.ofSeconds(120);
    }

    @Override
    public AgentResult invoke(SubTask subtask, AgentContext context) {
        long start = System.nanoTime();
        AgentExecutor executor;
        try {
            executor = registry.resolve(subtask.getAgentType());
        } catch (ConfigurationException e) {
            log.warn("No executor for subtask | id={} | agentType={}", subtask.getId(), subtask.getAgentType().toValue());
            return AgentResult.failed(subtask, e.getMessage(), FailureKind.VALIDATION, 0);
        }
        Future<AgentExecution> future;
        try {
            future = callExecutor.submit(() -> executor.execute(subtask, context));
        } catch (RuntimeException e) {
            log.warn("Executor call rejected | id={} | error={}", subtask.getId(), e.getMessage());
            return AgentResult.failed(subtask, "Executor call rejected: " + e.getMessage(), FailureKind.UNKNOWN, 0);
        }
        try {
            AgentExecution execution = future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
            return toResult(subtask, execution, elapsedMillis(start));
        } catch (TimeoutException e) {
            future.cancel(true);
            long ms = elapsedMillis(start);
            log.warn("Subtask timed out | id={} | timeoutMs={} | elapsedMs={}", subtask.getId(), timeout.toMillis(), ms);
            return AgentResult.timeout(subtask, "Subtask exceeded timeout of " + timeout.toMillis() + " ms", ms);
        } catch (ExecutionException e) {
            return fromThrowable(subtask, e.getCause() != null ? e.getCause() : e, elapsedMillis(start));
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for subtask | id={}", subtask.getId());
            return AgentResult.failed(subtask, "Interrupted while waiting for executor", FailureKind.UNKNOWN, elapsedMillis(start));
        }
    }

    private static AgentResult toResult(SubTask subtask, AgentExecution execution, long ms) {
        if (execution == null) {
            return AgentResult.failed(subtask, "Executor returned no result", FailureKind.VALIDATION, ms);
        }
        if (execution.getStatus() == AgentStatus.SUCCESS) {
            return new AgentResult(subtask.getId(), subtask.getAgentType(), AgentStatus.SUCCESS, execution.getOutput(),
                    execution.getTokensUsed(), execution.getCost(), ms, null, null, 1, execution.getMetadata());
        }
        FailureKind kind = execution.getStatus() == AgentStatus.TIMEOUT ? FailureKind.TIMEOUT : execution.getFailureKind();
        log.warn("Subtask reported failure | id={} | status={} | kind={} | error={}", subtask.getId(),
                execution.getStatus().toValue(), kind != null ? kind.toValue() : null, execution.getError());
        return new AgentResult(subtask.getId(), subtask.getAgentType(), execution.getStatus(), "",
                execution.getTokensUsed(), execution.getCost(), ms, execution.getError(), kind, 1, execution.getMetadata());
    }

    private static AgentResult fromThrowable(SubTask subtask, Throwable cause, long ms) {
        if (cause instanceof AgentExecutionException ae) {
            log.warn("Subtask failed | id={} | kind={} | error={}", subtask.getId(), ae.getKind().toValue(), ae.getMessage());
            if (ae.getKind() == FailureKind.TIMEOUT) {
                return AgentResult.timeout(subtask, ae.getMessage(), ms);
            }
            return AgentResult.failed(subtask, ae.getMessage(), ae.getKind(), ms);
        }
        log.warn("Subtask failed | id={} | kind=unknown | error={}", subtask.getId(), cause.toString(), cause);
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return AgentResult.failed(subtask, message, FailureKind.UNKNOWN, ms);
    }

    private static long elapsedMillis(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    public Duration getTimeout() {
        return timeout;
    }
}
