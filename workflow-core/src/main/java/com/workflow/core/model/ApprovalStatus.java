package com.workflow.core.model;

/**
 * Resolution state of an approval request. Resolved exactly once.
 */
public enum ApprovalStatus {
    PENDING,
    APPROVED,
    REJECTED;

    public boolean isResolved() {
        return this != PENDING;
    }
}
