package com.agentweave.workflow.model;

import com.agentweave.workflow.WorkflowJson;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one workflow run. Assembled once at the end of the run and immutable thereafter.
 * Agent results keep subtask declaration order, not completion order.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class WorkflowResult {

    private final String taskId;
    private final String title;
    private final String pattern;
    private final WorkflowStatus status;
    private final List<AgentResult> agentResults;
    private final String synthesis;
    private final BigDecimal totalCost;
    private final long totalTokens;
    private final long totalExecutionTimeMillis;
    private final List<String> artifacts;
    private final Map<String, Object> metadata;
    private final String error;
    private final List<String> warnings;
    private final Instant startedAt;
    private final Instant completedAt;

    private WorkflowResult(Builder b) {
        this.taskId = Objects.requireNonNull(b.taskId, "taskId");
        this.title = b.title;
        this.pattern = b.pattern;
        this.status = Objects.requireNonNull(b.status, "status");
        this.agentResults = List.copyOf(b.agentResults);
        this.synthesis = b.synthesis;
        this.totalCost = b.totalCost != null ? b.totalCost : BigDecimal.ZERO;
        this.totalTokens = b.totalTokens;
        this.totalExecutionTimeMillis = b.totalExecutionTimeMillis;
        this.artifacts = List.copyOf(b.artifacts);
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(b.metadata));
        this.error = b.error;
        this.warnings = List.copyOf(b.warnings);
        this.startedAt = b.startedAt;
        this.completedAt = b.completedAt;
    }

    public static Builder builder(String taskId) {
        return new Builder(taskId);
    }

    /** Rebuilds a result from its JSON form, as written by {@link #toJson()}. */
    @JsonCreator
    static WorkflowResult fromJson(@JsonProperty("taskId") String taskId,
                                   @JsonProperty("title") String title,
                                   @JsonProperty("pattern") String pattern,
                                   @JsonProperty("status") WorkflowStatus status,
                                   @JsonProperty("agentResults") List<AgentResult> agentResults,
                                   @JsonProperty("synthesis") String synthesis,
                                   @JsonProperty("totalCost") BigDecimal totalCost,
                                   @JsonProperty("totalTokens") long totalTokens,
                                   @JsonProperty("totalExecutionTimeMillis") long totalExecutionTimeMillis,
                                   @JsonProperty("artifacts") List<String> artifacts,
                                   @JsonProperty("metadata") Map<String, Object> metadata,
                                   @JsonProperty("error") String error,
                                   @JsonProperty("warnings") List<String> warnings,
                                   @JsonProperty("startedAt") Instant startedAt,
                                   @JsonProperty("completedAt") Instant completedAt) {
        return builder(taskId).title(title).pattern(pattern).status(status).agentResults(agentResults)
                .synthesis(synthesis).totalCost(totalCost).totalTokens(totalTokens)
                .totalExecutionTimeMillis(totalExecutionTimeMillis).artifacts(artifacts).metadata(metadata)
                .error(error).warnings(warnings).startedAt(startedAt).completedAt(completedAt).build();
    }

    public String getTaskId() {
        return taskId;
    }

    public String getTitle() {
        return title;
    }

    /** Name of the pattern that produced this result (e.g. hierarchical, swarm). */
    public String getPattern() {
        return pattern;
    }

    public WorkflowStatus getStatus() {
        return status;
    }

    public List<AgentResult> getAgentResults() {
        return agentResults;
    }

    /** Final synthesis text; null when the run failed or was cancelled before synthesis. */
    public String getSynthesis() {
        return synthesis;
    }

    public BigDecimal getTotalCost() {
        return totalCost;
    }

    public long getTotalTokens() {
        return totalTokens;
    }

    public long getTotalExecutionTimeMillis() {
        return totalExecutionTimeMillis;
    }

    /** References returned by the document generator (paths, URLs); empty when none were produced. */
    public List<String> getArtifacts() {
        return artifacts;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public String getError() {
        return error;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public long successCount() {
        return agentResults.stream().filter(AgentResult::isSuccess).count();
    }

    public long failureCount() {
        return agentResults.size() - successCount();
    }

    public String toJson() {
        return WorkflowJson.toJson(this);
    }

    @Override
    public String toString() {
        return "WorkflowResult{taskId=" + taskId + ", status=" + status.toValue() + ", agentResults="
                + agentResults.size() + ", totalCost=" + totalCost + (error != null ? ", error=" + error : "") + "}";
    }

    public static final class Builder {
        private final String taskId;
        private String title;
        private String pattern;
        private WorkflowStatus status = WorkflowStatus.PENDING;
        private final List<AgentResult> agentResults = new ArrayList<>();
        private String synthesis;
        private BigDecimal totalCost;
        private long totalTokens;
        private long totalExecutionTimeMillis;
        private final List<String> artifacts = new ArrayList<>();
        private final Map<String, Object> metadata = new LinkedHashMap<>();
        private String error;
        private final List<String> warnings = new ArrayList<>();
        private Instant startedAt;
        private Instant completedAt;

        private Builder(String taskId) {
            this.taskId = taskId;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder pattern(String pattern) {
            this.pattern = pattern;
            return this;
        }

        public Builder status(WorkflowStatus status) {
            this.status = status;
            return this;
        }

        public Builder agentResults(List<AgentResult> results) {
            agentResults.clear();
            if (results != null) agentResults.addAll(results);
            return this;
        }

        public Builder synthesis(String synthesis) {
            this.synthesis = synthesis;
            return this;
        }

        public Builder totalCost(BigDecimal totalCost) {
            this.totalCost = totalCost;
            return this;
        }

        public Builder totalTokens(long totalTokens) {
            this.totalTokens = totalTokens;
            return this;
        }

        public Builder totalExecutionTimeMillis(long millis) {
            this.totalExecutionTimeMillis = millis;
            return this;
        }

        public Builder artifacts(List<String> refs) {
            artifacts.clear();
            if (refs != null) artifacts.addAll(refs);
            return this;
        }

        public Builder metadata(Map<String, Object> values) {
            if (values != null) metadata.putAll(values);
            return this;
        }

        public Builder metadata(String key, Object value) {
            metadata.put(key, value);
            return this;
        }

        public Builder error(String error) {
            this.error = error;
            return this;
        }

        public Builder warning(String warning) {
            if (warning != null && !warning.isBlank()) warnings.add(warning);
            return this;
        }

        public Builder warnings(List<String> values) {
            if (values != null) values.forEach(this::warning);
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public WorkflowResult build() {
            return new WorkflowResult(this);
        }
    }
}
