package com.workflow.core.model;

/**
 * Status of a workflow definition. Only ACTIVE definitions can be started.
 */
public enum DefinitionStatus {
    DRAFT,
    ACTIVE,
    INACTIVE
}
