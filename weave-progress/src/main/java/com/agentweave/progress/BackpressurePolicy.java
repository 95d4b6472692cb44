package com.agentweave.progress;

import com.agentweave.workflow.error.ConfigurationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** What a full {@link ProgressChannel} does with a new event. */
public enum BackpressurePolicy {
    /** Evict the oldest queued event to make room. The producer never blocks. */
    DROP_OLDEST,
    /** Block the producer up to the offer timeout, then drop the new event. */
    BLOCK_WITH_TIMEOUT;

    @JsonValue
    public String toValue() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static BackpressurePolicy fromValue(String value) {
        if (value == null || value.isBlank()) return DROP_OLDEST;
        String normalized = value.trim().toUpperCase().replace('-', '_');
        for (BackpressurePolicy p : values()) {
            if (p.name().equals(normalized)) return p;
        }
        throw new ConfigurationException("Unknown backpressure policy: " + value);
    }
}
