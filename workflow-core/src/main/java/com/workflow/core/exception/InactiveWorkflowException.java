package com.workflow.core.exception;

import com.workflow.core.model.DefinitionStatus;

/**
 * Thrown when starting a workflow whose definition is not ACTIVE.
 */
public class InactiveWorkflowException extends WorkflowException {

    public static final String ERROR_CODE = "INACTIVE_WORKFLOW";

    public InactiveWorkflowException(String workflowId, DefinitionStatus status) {
        super(ERROR_CODE, String.format(
            "Workflow %s is not active (status %s)",
            workflowId, status
        ));
    }
}
