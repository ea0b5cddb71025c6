package com.workflow.engine.event;

import com.workflow.core.model.WorkflowEvent;
import com.workflow.core.model.WorkflowEventType;
import com.workflow.core.model.WorkflowExecution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Builds events and fans them out to the configured sinks.
 * A failing sink is logged and skipped; publishing never throws.
 */
public class EventPublisher {

    private static final Logger log = LoggerFactory.getLogger(EventPublisher.class);

    private final List<EventSink> sinks;
    private final Clock clock;

    public EventPublisher(List<EventSink> sinks, Clock clock) {
        this.sinks = List.copyOf(sinks);
        this.clock = clock;
    }

    public void publish(WorkflowEventType type, WorkflowExecution execution, String stepId) {
        publish(type, execution, stepId, Map.of());
    }

    public void publish(WorkflowEventType type, WorkflowExecution execution, String stepId, Map<String, Object> payload) {
        WorkflowEvent event = WorkflowEvent.of(type, execution, stepId, payload, clock.instant());
        for (EventSink sink : sinks) {
            try {
                sink.publish(event);
            } catch (Exception e) {
                log.warn("Event sink {} failed to publish {} for execution {}: {}",
                    sink.getClass().getSimpleName(), type, execution.id(), e.getMessage());
            }
        }
    }
}
