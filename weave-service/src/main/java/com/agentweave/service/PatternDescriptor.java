package com.agentweave.service;

import com.agentweave.workflow.config.OrchestratorConfig;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/** Listing entry for a registered pattern: its name, display name, description and default configuration. */
public record PatternDescriptor(
        @JsonProperty("name") String name,
        @JsonProperty("display_name") String displayName,
        @JsonProperty("description") String description,
        @JsonProperty("default_config") OrchestratorConfig defaultConfig) {

    public PatternDescriptor {
        Objects.requireNonNull(name, "name");
        displayName = displayName != null ? displayName : name;
        description = description != null ? description : "";
        defaultConfig = defaultConfig != null ? defaultConfig : OrchestratorConfig.defaults();
    }
}
