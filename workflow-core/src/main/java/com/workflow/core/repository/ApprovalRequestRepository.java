package com.workflow.core.repository;

import com.workflow.core.model.ApprovalRequest;

import java.util.List;
import java.util.Optional;

/**
 * Repository for ApprovalRequest persistence.
 */
public interface ApprovalRequestRepository {

    /**
     * Insert a new request.
     *
     * @param request The request to save
     */
    void save(ApprovalRequest request);

    /**
     * Store a resolution, only if the stored request is still PENDING.
     *
     * @param resolved The resolved request
     * @return true if the resolution was stored, false if another response won
     */
    boolean resolve(ApprovalRequest resolved);

    /**
     * Find a request by id.
     *
     * @param requestId The request id
     * @return The request if found
     */
    Optional<ApprovalRequest> findById(String requestId);

    /**
     * Find the pending request for an execution parked on a step.
     *
     * @param executionId The execution id
     * @param stepId      The approval step id
     * @return The pending request if one exists
     */
    Optional<ApprovalRequest> findPending(String executionId, String stepId);

    /**
     * Find the most recent request for an execution and step, whatever its status.
     *
     * @param executionId The execution id
     * @param stepId      The approval step id
     * @return The latest request if any
     */
    Optional<ApprovalRequest> findLatest(String executionId, String stepId);

    /**
     * List all requests of an execution, oldest first.
     *
     * @param executionId The execution id
     * @return The requests
     */
    List<ApprovalRequest> findByExecution(String executionId);

    /**
     * List pending requests awaiting a given approver, oldest first.
     *
     * @param approverId The approver
     * @return Pending requests
     */
    List<ApprovalRequest> findPendingByApprover(String approverId);
}
