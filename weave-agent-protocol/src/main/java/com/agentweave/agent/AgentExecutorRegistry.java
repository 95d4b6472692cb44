package com.agentweave.agent;

import com.agentweave.workflow.error.ConfigurationException;
import com.agentweave.workflow.model.AgentType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Executors registered per {@link AgentType}, with an optional default used for any type
 * without its own registration. Constructed and passed in by the caller; there is no global
 * instance.
 */
public final class AgentExecutorRegistry {

    private final Map<AgentType, AgentExecutor> byType = new ConcurrentHashMap<>();
    private volatile AgentExecutor defaultExecutor;

    public AgentExecutorRegistry() {
    }

    /** Registry that resolves every agent type to the same executor. */
    public static AgentExecutorRegistry withDefault(AgentExecutor executor) {
        AgentExecutorRegistry registry = new AgentExecutorRegistry();
        registry.registerDefault(executor);
        return registry;
    }

    /**
     * Registers the executor for one agent type.
     *
     * @throws IllegalArgumentException if the type already has an executor
     */
    public AgentExecutorRegistry register(AgentType type, AgentExecutor executor) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(executor, "executor");
        if (byType.putIfAbsent(type, executor) != null) {
            throw new IllegalArgumentException("Executor already registered for agent type: " + type.toValue());
        }
        return this;
    }

    public AgentExecutorRegistry registerDefault(AgentExecutor executor) {
        this.defaultExecutor = Objects.requireNonNull(executor, "executor");
        return this;
    }

    public Optional<AgentExecutor> find(AgentType type) {
        if (type == null) return Optional.empty();
        AgentExecutor exec = byType.get(type);
        return Optional.ofNullable(exec != null ? exec : defaultExecutor);
    }

    /**
     * Resolves the executor for the given type, falling back to the default.
     *
     * @throws ConfigurationException when neither is registered
     */
    public AgentExecutor resolve(AgentType type) {
        return find(type).orElseThrow(() -> new ConfigurationException(
                "No executor registered for agent type: " + (type != null ? type.toValue() : "null")));
    }

    public boolean supports(AgentType type) {
        return find(type).isPresent();
    }

    /** Explicit registrations (the default executor is not included). */
    public Map<AgentType, AgentExecutor> getRegistered() {
        Map<AgentType, AgentExecutor> copy = new EnumMap<>(AgentType.class);
        copy.putAll(byType);
        return Collections.unmodifiableMap(copy);
    }
}
