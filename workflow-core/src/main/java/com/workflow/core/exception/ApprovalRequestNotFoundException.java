package com.workflow.core.exception;

public class ApprovalRequestNotFoundException extends NotFoundException {

    public static final String ERROR_CODE = "APPROVAL_REQUEST_NOT_FOUND";

    public ApprovalRequestNotFoundException(String requestId) {
        super(ERROR_CODE, "ApprovalRequest", requestId);
    }
}
