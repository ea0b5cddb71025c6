package com.workflow.core.exception;

/**
 * Base exception for all workflow engine errors.
 */
public class WorkflowException extends RuntimeException {

    private final String errorCode;

    public WorkflowException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public WorkflowException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
