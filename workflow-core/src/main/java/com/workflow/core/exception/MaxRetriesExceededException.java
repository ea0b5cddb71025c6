package com.workflow.core.exception;

/**
 * Terminal failure of a step after its retry bound was reached.
 * Recorded in the execution's error field rather than thrown to callers.
 */
public class MaxRetriesExceededException extends WorkflowException {

    public static final String ERROR_CODE = "MAX_RETRIES_EXCEEDED";

    public MaxRetriesExceededException(String stepId, int attempts, String lastError) {
        super(ERROR_CODE, String.format(
            "Step %s failed after %d attempt(s): %s",
            stepId, attempts, lastError
        ));
    }
}
