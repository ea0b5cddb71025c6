package com.workflow.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Trigger declaration of a workflow definition.
 * The engine stores it; firing triggers belongs to the host application.
 *
 * @param kind       trigger kind
 * @param parameters kind-specific parameters (event name, cron expression, ...)
 */
public record WorkflowTrigger(
    TriggerKind kind,
    Map<String, Object> parameters
) {
    public WorkflowTrigger {
        parameters = parameters != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(parameters)) : Map.of();
    }

    public static WorkflowTrigger manual() {
        return new WorkflowTrigger(TriggerKind.MANUAL, Map.of());
    }

    public static WorkflowTrigger event(String eventName) {
        return new WorkflowTrigger(TriggerKind.EVENT, Map.of("event", eventName));
    }

    public static WorkflowTrigger schedule(String cronExpression) {
        return new WorkflowTrigger(TriggerKind.SCHEDULE, Map.of("schedule", cronExpression));
    }
}
