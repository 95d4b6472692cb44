package com.agentweave.workflow.config;

import com.agentweave.workflow.error.ConfigurationException;
import com.agentweave.workflow.model.AgentType;
import com.agentweave.workflow.model.SubTask;
import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** One caller-declared step of a sequential pipeline or conditional branch. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class StepDefinition {

    private final String name;
    private final String description;
    private final AgentType agentType;
    private final String specialization;
    private final Map<String, Object> context;

    @JsonCreator
    public StepDefinition(
            @JsonProperty("name") String name,
            @JsonProperty("description") String description,
            @JsonProperty("agentType") @JsonAlias("agent_type") AgentType agentType,
            @JsonProperty("specialization") String specialization,
            @JsonProperty("context") Map<String, Object> context) {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Step name must be non-blank");
        }
        this.name = name;
        this.description = description != null && !description.isBlank() ? description : name;
        this.agentType = agentType != null ? agentType : AgentType.WORKER;
        this.specialization = specialization;
        this.context = context != null ? Collections.unmodifiableMap(new LinkedHashMap<>(context)) : Map.of();
    }

    public static StepDefinition of(String name, String description) {
        return new StepDefinition(name, description, null, null, null);
    }

    public static StepDefinition of(String name, String description, AgentType agentType) {
        return new StepDefinition(name, description, agentType, null, null);
    }

    /** Builds the subtask for this step under the given id; the step name is kept in the context. */
    public SubTask toSubTask(String id) {
        return SubTask.builder(id)
                .description(description)
                .agentType(agentType)
                .specialization(specialization)
                .context(context)
                .contextValue("step_name", name)
                .build();
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public AgentType getAgentType() {
        return agentType;
    }

    public String getSpecialization() {
        return specialization;
    }

    public Map<String, Object> getContext() {
        return context;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StepDefinition that = (StepDefinition) o;
        return name.equals(that.name)
                && description.equals(that.description)
                && agentType == that.agentType
                && Objects.equals(specialization, that.specialization)
                && context.equals(that.context);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, description, agentType, specialization, context);
    }

    @Override
    public String toString() {
        return "StepDefinition{name=" + name + ", agentType=" + agentType.toValue() + "}";
    }
}
