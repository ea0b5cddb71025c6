package com.workflow.core.model;

import com.workflow.core.exception.InvalidStateTransitionException;

import java.time.Instant;
import java.util.UUID;

/**
 * A human decision requested by an approval step.
 *
 * Invariants:
 * - at most one PENDING request per (executionId, stepId)
 * - PENDING -> APPROVED | REJECTED, exactly once
 */
public record ApprovalRequest(
    String id,
    String executionId,
    String stepId,
    String approverId,
    ApprovalStatus status,
    Instant requestedAt,
    Instant respondedAt,
    String comments
) {
    /**
     * Create a new pending request.
     */
    public static ApprovalRequest create(String executionId, String stepId, String approverId, Instant now) {
        return new ApprovalRequest(
            UUID.randomUUID().toString(),
            executionId,
            stepId,
            approverId,
            ApprovalStatus.PENDING,
            now,
            null,
            null
        );
    }

    public boolean isPending() {
        return status == ApprovalStatus.PENDING;
    }

    /**
     * Record the approver's decision.
     *
     * @throws IllegalArgumentException        if decision is PENDING
     * @throws InvalidStateTransitionException if the request is already resolved
     */
    public ApprovalRequest resolve(ApprovalStatus decision, String responseComments, Instant now) {
        if (decision == null || decision == ApprovalStatus.PENDING) {
            throw new IllegalArgumentException("Decision must be APPROVED or REJECTED");
        }
        if (!isPending()) {
            throw new InvalidStateTransitionException("ApprovalRequest " + id, status.name(), decision.name());
        }
        return new ApprovalRequest(
            id, executionId, stepId, approverId, decision, requestedAt, now, responseComments);
    }
}
