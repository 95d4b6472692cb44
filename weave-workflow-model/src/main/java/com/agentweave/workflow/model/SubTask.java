package com.agentweave.workflow.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One unit of decomposed work, assigned to a single executor call. Immutable once built;
 * the orchestrator owns it for the duration of the run.
 * <p>
 * {@link #getDependencies()} lists ids of subtasks in the same run that must have a result
 * before this one may start. {@link #getPriority()} orders ready subtasks (higher first);
 * ties fall back to declaration order.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class SubTask {

    private final String id;
    private final String description;
    private final AgentType agentType;
    private final String specialization;
    private final int priority;
    private final Set<String> dependencies;
    private final Map<String, Object> context;

    private SubTask(Builder b) {
        this.id = requireText(b.id, "id");
        this.description = requireText(b.description, "description");
        this.agentType = Objects.requireNonNull(b.agentType, "agentType");
        this.specialization = b.specialization != null && !b.specialization.isBlank() ? b.specialization : null;
        this.priority = b.priority;
        this.dependencies = Collections.unmodifiableSet(new LinkedHashSet<>(b.dependencies));
        this.context = Collections.unmodifiableMap(new LinkedHashMap<>(b.context));
    }

    private static String requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("SubTask " + name + " must be non-blank");
        }
        return value;
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    /** Copy of this subtask with the given extra dependency ids (used to chain sequential steps). */
    public SubTask withAdditionalDependencies(Set<String> extra) {
        Builder b = toBuilder();
        if (extra != null) b.dependencies.addAll(extra);
        return b.build();
    }

    /** Copy of this subtask under a new id (dependencies are left untouched). */
    public SubTask withId(String newId) {
        Builder b = toBuilder();
        b.id = newId;
        return b.build();
    }

    public Builder toBuilder() {
        Builder b = new Builder(id)
                .description(description)
                .agentType(agentType)
                .specialization(specialization)
                .priority(priority)
                .context(context);
        b.dependencies.addAll(dependencies);
        return b;
    }

    public String getId() {
        return id;
    }

    public String getDescription() {
        return description;
    }

    public AgentType getAgentType() {
        return agentType;
    }

    /** Optional specialization (e.g. "climate policy"); null when not set. */
    public String getSpecialization() {
        return specialization;
    }

    public int getPriority() {
        return priority;
    }

    /** Ids of subtasks that must complete first. Unmodifiable, in declaration order. */
    public Set<String> getDependencies() {
        return dependencies;
    }

    /** Opaque key/value bag passed through to the executor. Unmodifiable. */
    public Map<String, Object> getContext() {
        return context;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SubTask that = (SubTask) o;
        return priority == that.priority
                && id.equals(that.id)
                && description.equals(that.description)
                && agentType == that.agentType
                && Objects.equals(specialization, that.specialization)
                && dependencies.equals(that.dependencies)
                && context.equals(that.context);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, description, agentType, specialization, priority, dependencies, context);
    }

    @Override
    public String toString() {
        return "SubTask{id=" + id + ", agentType=" + agentType.toValue() + ", priority=" + priority
                + ", dependencies=" + dependencies + "}";
    }

    public static final class Builder {
        private String id;
        private String description;
        private AgentType agentType = AgentType.WORKER;
        private String specialization;
        private int priority;
        private final Set<String> dependencies = new LinkedHashSet<>();
        private final Map<String, Object> context = new LinkedHashMap<>();

        private Builder(String id) {
            this.id = id;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder agentType(AgentType agentType) {
            this.agentType = agentType;
            return this;
        }

        public Builder specialization(String specialization) {
            this.specialization = specialization;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder dependsOn(String... ids) {
            if (ids != null) {
                for (String dep : ids) {
                    if (dep != null && !dep.isBlank()) dependencies.add(dep);
                }
            }
            return this;
        }

        public Builder dependencies(Set<String> ids) {
            dependencies.clear();
            if (ids != null) dependencies.addAll(ids);
            return this;
        }

        public Builder context(Map<String, Object> values) {
            context.clear();
            if (values != null) context.putAll(values);
            return this;
        }

        public Builder contextValue(String key, Object value) {
            context.put(key, value);
            return this;
        }

        public SubTask build() {
            return new SubTask(this);
        }
    }
}
