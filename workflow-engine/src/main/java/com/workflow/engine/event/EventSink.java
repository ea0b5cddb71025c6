package com.workflow.engine.event;

import com.workflow.core.model.WorkflowEvent;

/**
 * Publish-style outlet for execution events: approver notification,
 * audit trails, dashboards. Implementations may be slow or fail;
 * the engine never lets that affect execution state.
 */
@FunctionalInterface
public interface EventSink {
    void publish(WorkflowEvent event);
}
