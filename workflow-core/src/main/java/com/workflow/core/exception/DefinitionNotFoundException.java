package com.workflow.core.exception;

public class DefinitionNotFoundException extends NotFoundException {

    public static final String ERROR_CODE = "DEFINITION_NOT_FOUND";

    public DefinitionNotFoundException(String workflowId) {
        super(ERROR_CODE, "WorkflowDefinition", workflowId);
    }

    public DefinitionNotFoundException(String workflowId, int version) {
        super(ERROR_CODE, "WorkflowDefinition", workflowId + " v" + version);
    }
}
