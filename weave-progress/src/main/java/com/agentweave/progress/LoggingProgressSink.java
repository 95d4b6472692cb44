package com.agentweave.progress;

import com.agentweave.agent.ProgressSink;
import com.agentweave.workflow.WorkflowJson;
import com.agentweave.workflow.event.WorkflowEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Writes every event as one JSON line to the log at INFO. */
public final class LoggingProgressSink implements ProgressSink {

    private static final Logger log = LoggerFactory.getLogger(LoggingProgressSink.class);

    @Override
    public void emit(WorkflowEvent event) {
        if (log.isInfoEnabled()) {
            log.info("Workflow event | {}", WorkflowJson.toJson(event));
        }
    }
}
