package com.agentweave.engine.schedule;

import com.agentweave.workflow.model.AgentResult;
import com.agentweave.workflow.model.FailureKind;
import com.agentweave.workflow.model.SubTask;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResultCollectorTest {

    @Test
    void set_isWriteOnceAndOrdered() {
        SubTask a = SubTask.builder("a").description("a").build();
        SubTask b = SubTask.builder("b").description("b").build();
        ResultCollector collector = new ResultCollector(3);

        assertTrue(collector.set(1, AgentResult.success(b, "b", 0, BigDecimal.ZERO, 0, null)));
        assertTrue(collector.set(0, AgentResult.success(a, "a", 0, BigDecimal.ZERO, 0, null)));
        assertFalse(collector.set(0, AgentResult.failed(a, "late", FailureKind.UNKNOWN, 0)));

        assertEquals(2, collector.filledCount());
        assertEquals("a", collector.inOrder().get(0).getOutput());
        assertEquals("b", collector.inOrder().get(1).getAgentId());
        assertFalse(collector.has(2));
    }
}
