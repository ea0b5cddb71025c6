package com.workflow.engine.event;

import com.workflow.core.model.WorkflowEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default sink: writes every event to the log.
 */
public class LoggingEventSink implements EventSink {

    private static final Logger log = LoggerFactory.getLogger(LoggingEventSink.class);

    @Override
    public void publish(WorkflowEvent event) {
        log.info("Event {} execution={} workflow={} step={} payload={}",
            event.type(), event.executionId(), event.workflowId(), event.stepId(), event.payload());
    }
}
