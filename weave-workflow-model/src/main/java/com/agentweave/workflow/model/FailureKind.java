package com.agentweave.workflow.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Classification of an executor failure. Retry policies decide on this value:
 * {@link #TIMEOUT} and {@link #RATE_LIMIT} are retryable by default, {@link #VALIDATION}
 * and {@link #AUTH} never are.
 */
public enum FailureKind {
    TIMEOUT,
    RATE_LIMIT,
    NETWORK,
    VALIDATION,
    AUTH,
    UNKNOWN;

    @JsonValue
    public String toValue() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static FailureKind fromValue(String value) {
        if (value == null || value.isBlank()) return UNKNOWN;
        String normalized = value.trim().toUpperCase().replace('-', '_');
        for (FailureKind k : values()) {
            if (k.name().equals(normalized)) return k;
        }
        return UNKNOWN;
    }
}
