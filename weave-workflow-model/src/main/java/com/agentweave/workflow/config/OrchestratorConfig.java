package com.agentweave.workflow.config;

import com.agentweave.workflow.WorkflowJson;
import com.agentweave.workflow.error.ConfigurationException;
import com.agentweave.workflow.error.WorkflowException;
import com.agentweave.workflow.model.AgentType;
import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Options shared by every orchestration pattern. Each pattern reads the subset it needs;
 * the rest are ignored. Immutable; use {@link #builder()} or {@link #fromJson(String)}.
 * <p>
 * JSON keys are camelCase; snake_case spellings
 * ({@code num_agents}, {@code enable_drummer}, ...) are read as aliases.
 * Out-of-range values are rejected with {@link ConfigurationException}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class OrchestratorConfig {

    public static final int DEFAULT_MAX_CONCURRENT_AGENTS = 4;
    public static final double DEFAULT_TIMEOUT_SECONDS = 120.0;
    public static final int DEFAULT_MAX_ITERATIONS = 3;
    public static final int DEFAULT_GROUP_SIZE = 3;
    public static final String DEFAULT_CONDITION_KEY = "condition";

    private final Integer numAgents;
    private final boolean parallelExecution;
    private final int maxConcurrentAgents;
    private final double timeoutSeconds;
    private final double workflowTimeoutSeconds;
    private final boolean failFast;
    private final int maxIterations;
    private final int groupSize;
    private final boolean enableTier2Synthesis;
    private final boolean enableTier3Synthesis;
    private final List<AgentType> domains;
    private final Set<AgentType> allowedAgentTypes;
    private final boolean summarize;
    private final List<StepDefinition> steps;
    private final Map<String, List<StepDefinition>> branches;
    private final String condition;
    private final String conditionKey;
    private final String defaultBranch;
    private final List<String> perspectives;
    private final boolean generateDocuments;
    private final List<String> documentFormats;
    private final RetryPolicy retryPolicy;

    @JsonCreator
    public OrchestratorConfig(
            @JsonProperty("numAgents") @JsonAlias("num_agents") Integer numAgents,
            @JsonProperty("parallelExecution") @JsonAlias("parallel_execution") Boolean parallelExecution,
            @JsonProperty("maxConcurrentAgents") @JsonAlias("max_concurrent_agents") Integer maxConcurrentAgents,
            @JsonProperty("timeoutSeconds") @JsonAlias("timeout_seconds") Double timeoutSeconds,
            @JsonProperty("workflowTimeoutSeconds") @JsonAlias("workflow_timeout_seconds") Double workflowTimeoutSeconds,
            @JsonProperty("failFast") @JsonAlias("fail_fast") Boolean failFast,
            @JsonProperty("maxIterations") @JsonAlias("max_iterations") Integer maxIterations,
            @JsonProperty("groupSize") @JsonAlias("group_size") Integer groupSize,
            @JsonProperty("enableTier2Synthesis") @JsonAlias({"enable_tier2_synthesis", "enable_drummer"}) Boolean enableTier2Synthesis,
            @JsonProperty("enableTier3Synthesis") @JsonAlias({"enable_tier3_synthesis", "enable_camina"}) Boolean enableTier3Synthesis,
            @JsonProperty("domains") List<AgentType> domains,
            @JsonProperty("allowedAgentTypes") @JsonAlias("allowed_agent_types") Set<AgentType> allowedAgentTypes,
            @JsonProperty("summarize") Boolean summarize,
            @JsonProperty("steps") List<StepDefinition> steps,
            @JsonProperty("branches") Map<String, List<StepDefinition>> branches,
            @JsonProperty("condition") String condition,
            @JsonProperty("conditionKey") @JsonAlias("condition_key") String conditionKey,
            @JsonProperty("defaultBranch") @JsonAlias("default_branch") String defaultBranch,
            @JsonProperty("perspectives") List<String> perspectives,
            @JsonProperty("generateDocuments") @JsonAlias("generate_documents") Boolean generateDocuments,
            @JsonProperty("documentFormats") @JsonAlias("document_formats") List<String> documentFormats,
            @JsonProperty("retryPolicy") @JsonAlias("retry_policy") RetryPolicy retryPolicy) {
        this.numAgents = numAgents;
        this.parallelExecution = parallelExecution == null || parallelExecution;
        this.maxConcurrentAgents = maxConcurrentAgents != null ? maxConcurrentAgents : DEFAULT_MAX_CONCURRENT_AGENTS;
        this.timeoutSeconds = timeoutSeconds != null ? timeoutSeconds : DEFAULT_TIMEOUT_SECONDS;
        this.workflowTimeoutSeconds = workflowTimeoutSeconds != null ? workflowTimeoutSeconds : 0.0;
        this.failFast = failFast != null && failFast;
        this.maxIterations = maxIterations != null ? maxIterations : DEFAULT_MAX_ITERATIONS;
        this.groupSize = groupSize != null ? groupSize : DEFAULT_GROUP_SIZE;
        this.enableTier2Synthesis = enableTier2Synthesis == null || enableTier2Synthesis;
        this.enableTier3Synthesis = enableTier3Synthesis == null || enableTier3Synthesis;
        this.domains = domains != null ? List.copyOf(domains) : List.of();
        this.allowedAgentTypes = allowedAgentTypes != null
                ? Collections.unmodifiableSet(new LinkedHashSet<>(allowedAgentTypes))
                : Set.of();
        this.summarize = summarize == null || summarize;
        this.steps = steps != null ? List.copyOf(steps) : List.of();
        this.branches = copyBranches(branches);
        this.condition = condition;
        this.conditionKey = conditionKey != null && !conditionKey.isBlank() ? conditionKey : DEFAULT_CONDITION_KEY;
        this.defaultBranch = defaultBranch != null && !defaultBranch.isBlank() ? defaultBranch : null;
        this.perspectives = perspectives != null ? List.copyOf(perspectives) : List.of();
        this.generateDocuments = generateDocuments != null && generateDocuments;
        this.documentFormats = documentFormats != null && !documentFormats.isEmpty()
                ? List.copyOf(documentFormats)
                : List.of("markdown");
        this.retryPolicy = retryPolicy;
        validate();
    }

    private static Map<String, List<StepDefinition>> copyBranches(Map<String, List<StepDefinition>> branches) {
        if (branches == null) return Map.of();
        Map<String, List<StepDefinition>> copy = new LinkedHashMap<>();
        branches.forEach((name, steps) -> copy.put(name, steps != null ? List.copyOf(steps) : List.of()));
        return Collections.unmodifiableMap(copy);
    }

    private void validate() {
        if (numAgents != null && numAgents <= 0) {
            throw new ConfigurationException("numAgents must be > 0, got " + numAgents);
        }
        if (maxConcurrentAgents <= 0) {
            throw new ConfigurationException("maxConcurrentAgents must be > 0, got " + maxConcurrentAgents);
        }
        if (timeoutSeconds <= 0) {
            throw new ConfigurationException("timeoutSeconds must be > 0, got " + timeoutSeconds);
        }
        if (workflowTimeoutSeconds < 0) {
            throw new ConfigurationException("workflowTimeoutSeconds must be >= 0, got " + workflowTimeoutSeconds);
        }
        if (maxIterations <= 0) {
            throw new ConfigurationException("maxIterations must be > 0, got " + maxIterations);
        }
        if (groupSize <= 0) {
            throw new ConfigurationException("groupSize must be > 0, got " + groupSize);
        }
    }

    public static OrchestratorConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .numAgents(numAgents)
                .parallelExecution(parallelExecution)
                .maxConcurrentAgents(maxConcurrentAgents)
                .timeoutSeconds(timeoutSeconds)
                .workflowTimeoutSeconds(workflowTimeoutSeconds)
                .failFast(failFast)
                .maxIterations(maxIterations)
                .groupSize(groupSize)
                .enableTier2Synthesis(enableTier2Synthesis)
                .enableTier3Synthesis(enableTier3Synthesis)
                .domains(domains)
                .allowedAgentTypes(allowedAgentTypes)
                .summarize(summarize)
                .steps(steps)
                .branches(branches)
                .condition(condition)
                .conditionKey(conditionKey)
                .defaultBranch(defaultBranch)
                .perspectives(perspectives)
                .generateDocuments(generateDocuments)
                .documentFormats(documentFormats)
                .retryPolicy(retryPolicy);
    }

    /**
     * Parses a configuration from JSON.
     *
     * @throws ConfigurationException when a value is out of range or an agent type is unknown
     * @throws UncheckedIOException on malformed JSON
     */
    public static OrchestratorConfig fromJson(String json) {
        if (json == null || json.isBlank()) return defaults();
        try {
            return WorkflowJson.fromJson(json, OrchestratorConfig.class);
        } catch (UncheckedIOException e) {
            for (Throwable t = e.getCause(); t != null; t = t.getCause()) {
                if (t instanceof WorkflowException we) throw we;
            }
            throw e;
        }
    }

    public String toJson() {
        return WorkflowJson.toJson(this);
    }

    /** Number of agents for patterns that size their decomposition, or {@code fallback} when unset. */
    public int numAgentsOr(int fallback) {
        return numAgents != null ? numAgents : fallback;
    }

    /** Concurrency bound actually applied by the scheduler: 1 when parallel execution is off. */
    @JsonIgnore
    public int getEffectiveConcurrency() {
        return parallelExecution ? maxConcurrentAgents : 1;
    }

    @JsonIgnore
    public Duration getTimeout() {
        return Duration.ofMillis(Math.round(timeoutSeconds * 1000));
    }

    /** Overall run deadline, or null when none is configured. */
    @JsonIgnore
    public Duration getWorkflowTimeout() {
        return workflowTimeoutSeconds > 0 ? Duration.ofMillis(Math.round(workflowTimeoutSeconds * 1000)) : null;
    }

    public Integer getNumAgents() {
        return numAgents;
    }

    public boolean isParallelExecution() {
        return parallelExecution;
    }

    public int getMaxConcurrentAgents() {
        return maxConcurrentAgents;
    }

    public double getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public double getWorkflowTimeoutSeconds() {
        return workflowTimeoutSeconds;
    }

    public boolean isFailFast() {
        return failFast;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public int getGroupSize() {
        return groupSize;
    }

    public boolean isEnableTier2Synthesis() {
        return enableTier2Synthesis;
    }

    public boolean isEnableTier3Synthesis() {
        return enableTier3Synthesis;
    }

    public List<AgentType> getDomains() {
        return domains;
    }

    /** Domain types the swarm may use; empty means every domain type. */
    public Set<AgentType> getAllowedAgentTypes() {
        return allowedAgentTypes;
    }

    public boolean isSummarize() {
        return summarize;
    }

    public List<StepDefinition> getSteps() {
        return steps;
    }

    public Map<String, List<StepDefinition>> getBranches() {
        return branches;
    }

    public String getCondition() {
        return condition;
    }

    public String getConditionKey() {
        return conditionKey;
    }

    public String getDefaultBranch() {
        return defaultBranch;
    }

    public List<String> getPerspectives() {
        return perspectives;
    }

    public boolean isGenerateDocuments() {
        return generateDocuments;
    }

    public List<String> getDocumentFormats() {
        return documentFormats;
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    public static final class Builder {
        private Integer numAgents;
        private Boolean parallelExecution;
        private Integer maxConcurrentAgents;
        private Double timeoutSeconds;
        private Double workflowTimeoutSeconds;
        private Boolean failFast;
        private Integer maxIterations;
        private Integer groupSize;
        private Boolean enableTier2Synthesis;
        private Boolean enableTier3Synthesis;
        private List<AgentType> domains;
        private Set<AgentType> allowedAgentTypes;
        private Boolean summarize;
        private List<StepDefinition> steps;
        private Map<String, List<StepDefinition>> branches;
        private String condition;
        private String conditionKey;
        private String defaultBranch;
        private List<String> perspectives;
        private Boolean generateDocuments;
        private List<String> documentFormats;
        private RetryPolicy retryPolicy;

        private Builder() {
        }

        public Builder numAgents(Integer numAgents) {
            this.numAgents = numAgents;
            return this;
        }

        public Builder parallelExecution(boolean parallelExecution) {
            this.parallelExecution = parallelExecution;
            return this;
        }

        public Builder maxConcurrentAgents(int maxConcurrentAgents) {
            this.maxConcurrentAgents = maxConcurrentAgents;
            return this;
        }

        public Builder timeoutSeconds(double timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
            return this;
        }

        public Builder workflowTimeoutSeconds(double workflowTimeoutSeconds) {
            this.workflowTimeoutSeconds = workflowTimeoutSeconds;
            return this;
        }

        public Builder failFast(boolean failFast) {
            this.failFast = failFast;
            return this;
        }

        public Builder maxIterations(int maxIterations) {
            this.maxIterations = maxIterations;
            return this;
        }

        public Builder groupSize(int groupSize) {
            this.groupSize = groupSize;
            return this;
        }

        public Builder enableTier2Synthesis(boolean enable) {
            this.enableTier2Synthesis = enable;
            return this;
        }

        public Builder enableTier3Synthesis(boolean enable) {
            this.enableTier3Synthesis = enable;
            return this;
        }

        public Builder domains(List<AgentType> domains) {
            this.domains = domains != null ? new ArrayList<>(domains) : null;
            return this;
        }

        public Builder allowedAgentTypes(Set<AgentType> allowed) {
            this.allowedAgentTypes = allowed != null ? new LinkedHashSet<>(allowed) : null;
            return this;
        }

        public Builder summarize(boolean summarize) {
            this.summarize = summarize;
            return this;
        }

        public Builder steps(List<StepDefinition> steps) {
            this.steps = steps != null ? new ArrayList<>(steps) : null;
            return this;
        }

        public Builder branches(Map<String, List<StepDefinition>> branches) {
            this.branches = branches != null ? new LinkedHashMap<>(branches) : null;
            return this;
        }

        public Builder branch(String name, List<StepDefinition> steps) {
            if (branches == null) branches = new LinkedHashMap<>();
            branches.put(name, steps);
            return this;
        }

        public Builder condition(String condition) {
            this.condition = condition;
            return this;
        }

        public Builder conditionKey(String conditionKey) {
            this.conditionKey = conditionKey;
            return this;
        }

        public Builder defaultBranch(String defaultBranch) {
            this.defaultBranch = defaultBranch;
            return this;
        }

        public Builder perspectives(List<String> perspectives) {
            this.perspectives = perspectives != null ? new ArrayList<>(perspectives) : null;
            return this;
        }

        public Builder generateDocuments(boolean generateDocuments) {
            this.generateDocuments = generateDocuments;
            return this;
        }

        public Builder documentFormats(List<String> formats) {
            this.documentFormats = formats != null ? new ArrayList<>(formats) : null;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public OrchestratorConfig build() {
            return new OrchestratorConfig(numAgents, parallelExecution, maxConcurrentAgents, timeoutSeconds,
                    workflowTimeoutSeconds, failFast, maxIterations, groupSize, enableTier2Synthesis,
                    enableTier3Synthesis, domains, allowedAgentTypes, summarize, steps, branches, condition,
                    conditionKey, defaultBranch, perspectives, generateDocuments, documentFormats, retryPolicy);
        }
    }
}
