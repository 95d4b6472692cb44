package com.agentweave.engine.invoke;

import com.agentweave.agent.AgentContext;
import com.agentweave.workflow.config.RetryPolicy;
import com.agentweave.workflow.model.AgentResult;
import com.agentweave.workflow.model.SubTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.BooleanSupplier;
import java.util.function.DoubleSupplier;

/**
 * Retries a delegate invoker according to a {@link RetryPolicy}. Only failures whose kind the
 * policy marks retryable are retried; the returned result is the last attempt's, with
 * {@link AgentResult#getAttempts()} set to the number of attempts made.
 * <p>
 * Retrying stops early when {@code abort} reports true (run cancelled) or the waiting thread
 * is interrupted.
 */
public final class RetryingAgentInvoker implements AgentInvoker {

    private static final Logger log = LoggerFactory.getLogger(RetryingAgentInvoker.class);

    private final AgentInvoker delegate;
    private final RetryPolicy policy;
    private final Sleeper sleeper;
    private final DoubleSupplier jitterSource;
    private final BooleanSupplier abort;

    public RetryingAgentInvoker(AgentInvoker delegate, RetryPolicy policy) {
        this(delegate, policy, Sleeper.SYSTEM, () -> ThreadLocalRandom.current().nextDouble(-1.0, 1.0), () -> false);
    }

    /**
     * @param jitterSource uniform samples in [-1, 1] for backoff jitter
     * @param abort        checked before each retry; true stops retrying
     */
    public RetryingAgentInvoker(AgentInvoker delegate, RetryPolicy policy, Sleeper sleeper,
                                DoubleSupplier jitterSource, BooleanSupplier abort) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.policy = policy != null ? policy : RetryPolicy.defaults();
        this.sleeper = sleeper != null ? sleeper : Sleeper.SYSTEM;
        this.jitterSource = jitterSource != null ? jitterSource : () -> 0.0;
        this.abort = abort != null ? abort : () -> false;
    }

    @Override
    public AgentResult invoke(SubTask subtask, AgentContext context) {
        AgentResult result = delegate.invoke(subtask, context);
        int attempts = 1;
        while (!result.isSuccess()
                && policy.isRetryable(result.getFailureKind())
                && attempts <= policy.getMaxRetries()
                && !abort.getAsBoolean()) {
            Duration delay = policy.backoff(attempts - 1, jitterSource.getAsDouble());
            log.info("Retrying subtask | id={} | attempt={} | kind={} | delayMs={}",
                    subtask.getId(), attempts + 1, result.getFailureKind().toValue(), delay.toMillis());
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Retry wait interrupted | id={} | attempts={}", subtask.getId(), attempts);
                break;
            }
            result = delegate.invoke(subtask, context);
            attempts++;
        }
        if (attempts > 1) {
            log.info("Subtask finished after retries | id={} | attempts={} | status={}",
                    subtask.getId(), attempts, result.getStatus().toValue());
        }
        return result.withAttempts(attempts);
    }

    public RetryPolicy getPolicy() {
        return policy;
    }
}
