package com.workflow.core.exception;

/**
 * A recoverable failure of a single step dispatch.
 * Handled by the retry controller; never propagates past the step loop.
 */
public class StepExecutionException extends WorkflowException {

    public static final String ERROR_CODE = "STEP_EXECUTION_FAILED";

    private final String stepId;
    private final boolean retryable;

    public StepExecutionException(String stepId, String message) {
        this(stepId, ERROR_CODE, message, true, null);
    }

    public StepExecutionException(String stepId, String errorCode, String message, boolean retryable, Throwable cause) {
        super(errorCode != null ? errorCode : ERROR_CODE, message, cause);
        this.stepId = stepId;
        this.retryable = retryable;
    }

    /**
     * Create a failure that must not be retried (bad configuration, unknown handler).
     */
    public static StepExecutionException permanent(String stepId, String message) {
        return new StepExecutionException(stepId, ERROR_CODE, message, false, null);
    }

    public String getStepId() {
        return stepId;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
