package com.workflow.core.exception;

public class ExecutionNotFoundException extends NotFoundException {

    public static final String ERROR_CODE = "EXECUTION_NOT_FOUND";

    public ExecutionNotFoundException(String executionId) {
        super(ERROR_CODE, "WorkflowExecution", executionId);
    }
}
