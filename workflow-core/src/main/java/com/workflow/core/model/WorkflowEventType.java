package com.workflow.core.model;

/**
 * Types of events published to the event sink.
 */
public enum WorkflowEventType {
    // Execution lifecycle events
    EXECUTION_STARTED,
    EXECUTION_PAUSED,
    EXECUTION_RESUMED,
    EXECUTION_COMPLETED,
    EXECUTION_FAILED,
    EXECUTION_CANCELLED,

    // Step events
    STEP_COMPLETED,
    STEP_FAILED,
    RETRY_SCHEDULED,
    DELAY_SCHEDULED,

    // Approval events
    APPROVAL_REQUESTED,
    APPROVAL_RESOLVED;

    /**
     * Check if this is an execution lifecycle event.
     */
    public boolean isLifecycleEvent() {
        return name().startsWith("EXECUTION_");
    }
}
