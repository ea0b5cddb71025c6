package com.workflow.core.exception;

/**
 * Thrown when a compare-and-set update loses against a concurrent writer.
 */
public class OptimisticLockException extends WorkflowException {

    public static final String ERROR_CODE = "OPTIMISTIC_LOCK_CONFLICT";

    public OptimisticLockException(String entityType, String entityId, long expectedVersion, long actualVersion) {
        super(ERROR_CODE, String.format(
            "Optimistic lock conflict on %s[%s]: expected version %d, actual version %d",
            entityType, entityId, expectedVersion, actualVersion
        ));
    }

    public OptimisticLockException(String entityType, String entityId) {
        super(ERROR_CODE, String.format(
            "Optimistic lock conflict on %s[%s]",
            entityType, entityId
        ));
    }
}
