package com.agentweave.workflow.event;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One progress event. Transient: pushed to a sink, never persisted by the engine.
 */
public record WorkflowEvent(
        @JsonProperty("event_type") WorkflowEventType type,
        @JsonProperty("task_id") String taskId,
        @JsonProperty("payload") Map<String, Object> payload,
        @JsonProperty("timestamp") Instant timestamp
) {
    public WorkflowEvent {
        Objects.requireNonNull(type, "type");
        payload = payload != null ? Collections.unmodifiableMap(new LinkedHashMap<>(payload)) : Map.of();
        timestamp = timestamp != null ? timestamp : Instant.now();
    }

    public static WorkflowEvent of(WorkflowEventType type, String taskId, Map<String, Object> payload) {
        return new WorkflowEvent(type, taskId, payload, Instant.now());
    }

    /** Payload value as a string, or null when absent. */
    public String payloadString(String key) {
        Object v = payload.get(key);
        return v != null ? v.toString() : null;
    }
}
