package com.workflow.handler;

/**
 * Exception thrown by step handlers on failure.
 */
public class StepHandlerException extends Exception {

    private final String errorCode;
    private final boolean retryable;

    public StepHandlerException(String errorCode, String message) {
        this(errorCode, message, true);
    }

    public StepHandlerException(String errorCode, String message, boolean retryable) {
        super(message);
        this.errorCode = errorCode;
        this.retryable = retryable;
    }

    public StepHandlerException(String errorCode, String message, Throwable cause) {
        this(errorCode, message, cause, true);
    }

    public StepHandlerException(String errorCode, String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.errorCode = errorCode;
        this.retryable = retryable;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /**
     * A failure that will not go away on retry (bad input, missing record).
     */
    public static StepHandlerException permanent(String errorCode, String message) {
        return new StepHandlerException(errorCode, message, false);
    }

    /**
     * A failure worth retrying (timeout, unavailable dependency).
     */
    public static StepHandlerException transientFailure(String errorCode, String message) {
        return new StepHandlerException(errorCode, message, true);
    }
}
