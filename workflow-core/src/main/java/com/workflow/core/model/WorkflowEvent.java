package com.workflow.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Immutable record of something that happened to an execution.
 * Published to external subscribers (audit, dashboards, approver notification).
 */
public record WorkflowEvent(
    String eventId,
    WorkflowEventType type,
    String executionId,
    String workflowId,
    String stepId,
    Map<String, Object> payload,
    Instant timestamp
) {
    public WorkflowEvent {
        payload = payload != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(payload)) : Map.of();
    }

    /**
     * Create a new event about an execution.
     */
    public static WorkflowEvent of(
            WorkflowEventType type,
            WorkflowExecution execution,
            String stepId,
            Map<String, Object> payload,
            Instant timestamp) {
        return new WorkflowEvent(
            UUID.randomUUID().toString(),
            type,
            execution.id(),
            execution.workflowId(),
            stepId,
            payload,
            timestamp
        );
    }
}
