package com.workflow.core.model;

/**
 * How a workflow is meant to be started by the host application.
 */
public enum TriggerKind {
    EVENT,
    SCHEDULE,
    MANUAL,
    WEBHOOK
}
