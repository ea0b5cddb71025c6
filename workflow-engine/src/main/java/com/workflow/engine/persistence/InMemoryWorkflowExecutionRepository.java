package com.workflow.engine.persistence;

import com.workflow.core.exception.OptimisticLockException;
import com.workflow.core.model.ExecutionStatistics;
import com.workflow.core.model.ExecutionStatus;
import com.workflow.core.model.WorkflowExecution;
import com.workflow.core.repository.ExecutionQuery;
import com.workflow.core.repository.WorkflowExecutionRepository;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of WorkflowExecutionRepository.
 * Compare-and-set updates are atomic per execution through {@link ConcurrentHashMap#compute}.
 */
public class InMemoryWorkflowExecutionRepository implements WorkflowExecutionRepository {

    private final Map<String, WorkflowExecution> executions = new ConcurrentHashMap<>();

    @Override
    public void save(WorkflowExecution execution) {
        executions.putIfAbsent(execution.id(), execution);
    }

    @Override
    public WorkflowExecution update(WorkflowExecution execution) {
        WorkflowExecution next = execution.toBuilder().incrementSequence().build();
        WorkflowExecution stored = executions.compute(execution.id(), (id, existing) -> {
            if (existing == null) {
                throw new OptimisticLockException("WorkflowExecution", id);
            }
            if (existing.sequenceNumber() != execution.sequenceNumber()) {
                throw new OptimisticLockException(
                    "WorkflowExecution", id, execution.sequenceNumber(), existing.sequenceNumber());
            }
            return next;
        });
        return stored;
    }

    @Override
    public Optional<WorkflowExecution> findById(String executionId) {
        return Optional.ofNullable(executions.get(executionId));
    }

    @Override
    public List<WorkflowExecution> find(ExecutionQuery query) {
        return executions.values().stream()
            .filter(e -> query.workflowId() == null || query.workflowId().equals(e.workflowId()))
            .filter(e -> query.status() == null || query.status() == e.status())
            .sorted(Comparator.comparing(WorkflowExecution::startedAt).reversed())
            .limit(query.limit())
            .collect(Collectors.toList());
    }

    @Override
    public List<WorkflowExecution> findByStatus(ExecutionStatus status, int limit) {
        return executions.values().stream()
            .filter(e -> e.status() == status)
            .sorted(Comparator.comparing(WorkflowExecution::updatedAt))
            .limit(limit)
            .collect(Collectors.toList());
    }

    @Override
    public long countActive(String workflowId) {
        return executions.values().stream()
            .filter(e -> e.workflowId().equals(workflowId))
            .filter(e -> !e.isTerminal())
            .count();
    }

    @Override
    public ExecutionStatistics statistics(String workflowId) {
        List<WorkflowExecution> matching = executions.values().stream()
            .filter(e -> workflowId == null || workflowId.equals(e.workflowId()))
            .collect(Collectors.toList());

        long successful = matching.stream().filter(e -> e.status() == ExecutionStatus.COMPLETED).count();
        long failed = matching.stream().filter(e -> e.status() == ExecutionStatus.FAILED).count();
        double averageSeconds = matching.stream()
            .filter(e -> e.completedAt() != null)
            .mapToDouble(e -> Duration.between(e.startedAt(), e.completedAt()).toMillis() / 1000.0)
            .average()
            .orElse(0.0);

        return ExecutionStatistics.of(matching.size(), successful, failed, averageSeconds);
    }
}
