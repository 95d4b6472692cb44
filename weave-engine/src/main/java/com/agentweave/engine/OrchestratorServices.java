package com.agentweave.engine;

import com.agentweave.agent.AgentExecutor;
import com.agentweave.agent.AgentExecutorRegistry;
import com.agentweave.agent.DocumentGenerator;
import com.agentweave.engine.invoke.Sleeper;
import com.agentweave.ledger.AgentMetrics;

import java.util.Objects;

/**
 * Collaborators an orchestrator needs besides its configuration: the executor registry,
 * an optional document generator, metrics and the retry sleeper. Shared across runs.
 */
public final class OrchestratorServices {

    private final AgentExecutorRegistry executors;
    private final DocumentGenerator documentGenerator;
    private final AgentMetrics metrics;
    private final Sleeper retrySleeper;

    private OrchestratorServices(Builder b) {
        this.executors = Objects.requireNonNull(b.executors, "executors");
        this.documentGenerator = b.documentGenerator;
        this.metrics = b.metrics != null ? b.metrics : AgentMetrics.inMemory();
        this.retrySleeper = b.retrySleeper != null ? b.retrySleeper : Sleeper.SYSTEM;
    }

    public static Builder builder(AgentExecutorRegistry executors) {
        return new Builder(executors);
    }

    /** Services routing every agent type to one executor. */
    public static OrchestratorServices of(AgentExecutor executor) {
        return builder(AgentExecutorRegistry.withDefault(executor)).build();
    }

    public AgentExecutorRegistry getExecutors() {
        return executors;
    }

    /** Null when no generator is wired; artifact generation is then skipped. */
    public DocumentGenerator getDocumentGenerator() {
        return documentGenerator;
    }

    public AgentMetrics getMetrics() {
        return metrics;
    }

    public Sleeper getRetrySleeper() {
        return retrySleeper;
    }

    public static final class Builder {
        private final AgentExecutorRegistry executors;
        private DocumentGenerator documentGenerator;
        private AgentMetrics metrics;
        private Sleeper retrySleeper;

        private Builder(AgentExecutorRegistry executors) {
            this.executors = executors;
        }

        public Builder documentGenerator(DocumentGenerator generator) {
            this.documentGenerator = generator;
            return this;
        }

        public Builder metrics(AgentMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder retrySleeper(Sleeper sleeper) {
            this.retrySleeper = sleeper;
            return this;
        }

        public OrchestratorServices build() {
            return new OrchestratorServices(this);
        }
    }
}
