package com.agentweave.service;

import com.agentweave.agent.AgentExecution;
import com.agentweave.engine.OrchestratorServices;
import com.agentweave.patterns.HierarchicalOrchestrator;
import com.agentweave.workflow.WorkflowJson;
import com.agentweave.workflow.config.OrchestratorConfig;
import com.agentweave.workflow.error.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PatternRegistryTest {

    private final OrchestratorServices services = OrchestratorServices.of((t, c) -> AgentExecution.completed("x", 1, BigDecimal.ZERO));

    @Test
    void builtIns_listedInRegistrationOrder() {
        List<String> names = PatternRegistry.withBuiltIns().descriptors().stream().map(PatternDescriptor::name).toList();

        assertEquals(List.of("hierarchical", "swarm", "sequential", "conditional", "iterative"), names);
    }

    @Test
    void factory_buildsThePattern() {
        PatternRegistry registry = PatternRegistry.withBuiltIns();

        assertInstanceOf(HierarchicalOrchestrator.class,
                registry.factory("hierarchical").create(OrchestratorConfig.defaults(), services));
        assertEquals(8, registry.descriptor("hierarchical").defaultConfig().getNumAgents());
    }

    @Test
    void unknownPattern_isConfigurationError() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> PatternRegistry.withBuiltIns().factory("round-robin"));
        assertTrue(e.getMessage().contains("round-robin"));
    }

    @Test
    void duplicateName_isRejected() {
        PatternRegistry registry = PatternRegistry.withBuiltIns();

        assertThrows(IllegalArgumentException.class, () -> registry.register(
                new PatternDescriptor("swarm", null, null, null), HierarchicalOrchestrator::new));
    }

    @Test
    void descriptor_serializesWithSnakeCaseKeys() {
        String json = WorkflowJson.toJson(PatternRegistry.withBuiltIns().descriptor("swarm"));

        assertTrue(json.contains("\"display_name\":\"Domain swarm\""));
        assertTrue(json.contains("\"default_config\":{"));
    }
}
