package com.workflow.core.exception;

import com.workflow.core.model.ExecutionStatus;

/**
 * Thrown when an invalid state transition is attempted.
 */
public class InvalidStateTransitionException extends WorkflowException {

    public static final String ERROR_CODE = "INVALID_STATE_TRANSITION";

    public InvalidStateTransitionException(String executionId, ExecutionStatus currentStatus, ExecutionStatus targetStatus) {
        super(ERROR_CODE, String.format(
            "Cannot transition execution %s from %s to %s",
            executionId, currentStatus, targetStatus
        ));
    }

    public InvalidStateTransitionException(String entity, String currentState, String targetState) {
        super(ERROR_CODE, String.format(
            "Cannot transition %s from %s to %s",
            entity, currentState, targetState
        ));
    }

    public InvalidStateTransitionException(String message) {
        super(ERROR_CODE, message);
    }
}
