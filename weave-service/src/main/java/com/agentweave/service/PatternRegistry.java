package com.agentweave.service;

import com.agentweave.patterns.ConditionalOrchestrator;
import com.agentweave.patterns.DomainSwarmOrchestrator;
import com.agentweave.patterns.HierarchicalOrchestrator;
import com.agentweave.patterns.IterativeOrchestrator;
import com.agentweave.patterns.SequentialOrchestrator;
import com.agentweave.workflow.config.OrchestratorConfig;
import com.agentweave.workflow.error.ConfigurationException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Patterns available to {@link WorkflowService}, by name, in registration order. Patterns are
 * registered at startup; lookup never falls back to reflection. Not shared globally: each
 * service owns the registry it was built with.
 */
public final class PatternRegistry {

    private record Entry(PatternDescriptor descriptor, OrchestratorFactory factory) {
    }

    private final Map<String, Entry> entries = new LinkedHashMap<>();

    /** Registry with the five built-in patterns. */
    public static PatternRegistry withBuiltIns() {
        return new PatternRegistry()
                .register(new PatternDescriptor(HierarchicalOrchestrator.NAME, "Hierarchical research",
                                "Parallel tier-1 researchers, grouped tier-2 synthesis and one executive synthesis",
                                OrchestratorConfig.builder().numAgents(HierarchicalOrchestrator.DEFAULT_AGENTS).build()),
                        HierarchicalOrchestrator::new)
                .register(new PatternDescriptor(DomainSwarmOrchestrator.NAME, "Domain swarm",
                                "One agent per search domain in parallel, then a combined summary",
                                OrchestratorConfig.builder().numAgents(DomainSwarmOrchestrator.DEFAULT_AGENTS).build()),
                        DomainSwarmOrchestrator::new)
                .register(new PatternDescriptor(SequentialOrchestrator.NAME, "Sequential pipeline",
                                "Caller-defined steps run one after another, each seeing the previous result",
                                OrchestratorConfig.defaults()),
                        SequentialOrchestrator::new)
                .register(new PatternDescriptor(ConditionalOrchestrator.NAME, "Conditional branch",
                                "Runs the steps of exactly one named branch, chosen from the run context",
                                OrchestratorConfig.defaults()),
                        ConditionalOrchestrator::new)
                .register(new PatternDescriptor(IterativeOrchestrator.NAME, "Iterative refinement",
                                "Repeats plan, execute and synthesize until the result converges or the pass limit is hit",
                                OrchestratorConfig.defaults()),
                        IterativeOrchestrator::new);
    }

    /**
     * Registers a pattern.
     *
     * @throws IllegalArgumentException if the name is already registered
     */
    public synchronized PatternRegistry register(PatternDescriptor descriptor, OrchestratorFactory factory) {
        Objects.requireNonNull(descriptor, "descriptor");
        Objects.requireNonNull(factory, "factory");
        if (entries.putIfAbsent(descriptor.name(), new Entry(descriptor, factory)) != null) {
            throw new IllegalArgumentException("Pattern already registered: " + descriptor.name());
        }
        return this;
    }

    /** @throws ConfigurationException for an unknown pattern name */
    public synchronized OrchestratorFactory factory(String pattern) {
        return entry(pattern).factory();
    }

    /** @throws ConfigurationException for an unknown pattern name */
    public synchronized PatternDescriptor descriptor(String pattern) {
        return entry(pattern).descriptor();
    }

    public synchronized boolean contains(String pattern) {
        return pattern != null && entries.containsKey(pattern);
    }

    public synchronized List<PatternDescriptor> descriptors() {
        List<PatternDescriptor> out = new ArrayList<>(entries.size());
        entries.values().forEach(e -> out.add(e.descriptor()));
        return List.copyOf(out);
    }

    private Entry entry(String pattern) {
        Entry e = pattern != null ? entries.get(pattern) : null;
        if (e == null) {
            throw new ConfigurationException("Unknown pattern: " + pattern + " (registered: " + entries.keySet() + ")");
        }
        return e;
    }
}
