package com.workflow.core.exception;

/**
 * Thrown when a definition, execution or approval request is not found.
 */
public class NotFoundException extends WorkflowException {

    public static final String ERROR_CODE = "NOT_FOUND";

    private final String entityId;

    public NotFoundException(String entityType, String entityId) {
        this(ERROR_CODE, entityType, entityId);
    }

    protected NotFoundException(String errorCode, String entityType, String entityId) {
        super(errorCode, String.format("%s not found: %s", entityType, entityId));
        this.entityId = entityId;
    }

    public String getEntityId() {
        return entityId;
    }
}
