package com.workflow.engine.persistence;

import com.workflow.core.model.ApprovalRequest;
import com.workflow.core.model.ApprovalStatus;
import com.workflow.core.repository.ApprovalRequestRepository;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of ApprovalRequestRepository.
 * For demonstration and testing purposes.
 */
public class InMemoryApprovalRequestRepository implements ApprovalRequestRepository {

    private final Map<String, ApprovalRequest> requests = new ConcurrentHashMap<>();

    @Override
    public void save(ApprovalRequest request) {
        requests.put(request.id(), request);
    }

    @Override
    public boolean resolve(ApprovalRequest resolved) {
        boolean[] stored = {false};
        requests.computeIfPresent(resolved.id(), (id, existing) -> {
            if (existing.status() != ApprovalStatus.PENDING) {
                return existing;
            }
            stored[0] = true;
            return resolved;
        });
        return stored[0];
    }

    @Override
    public Optional<ApprovalRequest> findById(String requestId) {
        return Optional.ofNullable(requests.get(requestId));
    }

    @Override
    public Optional<ApprovalRequest> findPending(String executionId, String stepId) {
        return requests.values().stream()
            .filter(r -> r.executionId().equals(executionId) && r.stepId().equals(stepId))
            .filter(ApprovalRequest::isPending)
            .findFirst();
    }

    @Override
    public Optional<ApprovalRequest> findLatest(String executionId, String stepId) {
        return requests.values().stream()
            .filter(r -> r.executionId().equals(executionId) && r.stepId().equals(stepId))
            .max(Comparator.comparing(ApprovalRequest::requestedAt));
    }

    @Override
    public List<ApprovalRequest> findByExecution(String executionId) {
        return requests.values().stream()
            .filter(r -> r.executionId().equals(executionId))
            .sorted(Comparator.comparing(ApprovalRequest::requestedAt))
            .collect(Collectors.toList());
    }

    @Override
    public List<ApprovalRequest> findPendingByApprover(String approverId) {
        return requests.values().stream()
            .filter(r -> r.approverId().equals(approverId))
            .filter(ApprovalRequest::isPending)
            .sorted(Comparator.comparing(ApprovalRequest::requestedAt))
            .collect(Collectors.toList());
    }
}
