package com.agentweave.service;

import com.agentweave.progress.BackpressurePolicy;
import com.agentweave.workflow.error.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WeaveConfigTest {

    @Test
    void fromEnv_emptyUsesDefaults() {
        WeaveConfig config = WeaveConfig.fromEnv(Map.of());

        assertEquals(50, config.getMaxActiveWorkflows());
        assertEquals(100, config.getCompletedRetention());
        assertEquals(1000, config.getEventBufferSize());
        assertEquals(BackpressurePolicy.DROP_OLDEST, config.getEventBackpressure());
        assertEquals(Duration.ofMillis(500), config.getEventOfferTimeout());
        assertFalse(config.isLogEvents());
    }

    @Test
    void fromEnv_readsEveryKey() {
        WeaveConfig config = WeaveConfig.fromEnv(Map.of(
                "WEAVE_MAX_ACTIVE_WORKFLOWS", "7",
                "WEAVE_COMPLETED_RETENTION", " 12 ",
                "WEAVE_EVENT_BUFFER_SIZE", "64",
                "WEAVE_EVENT_BACKPRESSURE", "block-with-timeout",
                "WEAVE_EVENT_OFFER_TIMEOUT_MS", "250",
                "WEAVE_EVENT_CLOSE_TIMEOUT_MS", "900",
                "WEAVE_LOG_EVENTS", "TRUE"));

        assertEquals(7, config.getMaxActiveWorkflows());
        assertEquals(12, config.getCompletedRetention());
        assertEquals(64, config.getEventBufferSize());
        assertEquals(BackpressurePolicy.BLOCK_WITH_TIMEOUT, config.getEventBackpressure());
        assertEquals(Duration.ofMillis(250), config.getEventOfferTimeout());
        assertEquals(Duration.ofMillis(900), config.getEventCloseTimeout());
        assertTrue(config.isLogEvents());
    }

    @Test
    void fromEnv_unparseableNumbersFallBack() {
        WeaveConfig config = WeaveConfig.fromEnv(Map.of("WEAVE_MAX_ACTIVE_WORKFLOWS", "lots"));

        assertEquals(WeaveConfig.DEFAULT_MAX_ACTIVE_WORKFLOWS, config.getMaxActiveWorkflows());
    }

    @Test
    void fromEnv_unknownBackpressureIsRejected() {
        assertThrows(ConfigurationException.class,
                () -> WeaveConfig.fromEnv(Map.of("WEAVE_EVENT_BACKPRESSURE", "drop_newest")));
    }

    @Test
    void builder_rejectsNonPositiveLimits() {
        assertThrows(IllegalArgumentException.class, () -> WeaveConfig.builder().maxActiveWorkflows(0).build());
        assertThrows(IllegalArgumentException.class, () -> WeaveConfig.builder().eventBufferSize(0).build());
    }
}
