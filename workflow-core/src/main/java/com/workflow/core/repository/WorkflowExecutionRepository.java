package com.workflow.core.repository;

import com.workflow.core.exception.OptimisticLockException;
import com.workflow.core.model.ExecutionStatistics;
import com.workflow.core.model.ExecutionStatus;
import com.workflow.core.model.WorkflowExecution;

import java.util.List;
import java.util.Optional;

/**
 * Repository for WorkflowExecution persistence.
 * Updates are compare-and-set on {@link WorkflowExecution#sequenceNumber()}.
 */
public interface WorkflowExecutionRepository {

    /**
     * Insert a new execution.
     *
     * @param execution The execution to save
     */
    void save(WorkflowExecution execution);

    /**
     * Compare-and-set update. Succeeds only if the stored sequence number equals
     * the one carried by {@code execution}.
     *
     * @param execution The modified execution, carrying the sequence number it was read at
     * @return The stored execution with its sequence number incremented
     * @throws OptimisticLockException if another writer updated the execution first
     */
    WorkflowExecution update(WorkflowExecution execution);

    /**
     * Find an execution by id.
     *
     * @param executionId The execution id
     * @return The execution if found
     */
    Optional<WorkflowExecution> findById(String executionId);

    /**
     * Find executions matching a query, newest start time first.
     *
     * @param query The filter
     * @return Matching executions
     */
    List<WorkflowExecution> find(ExecutionQuery query);

    /**
     * Find executions in a given status.
     *
     * @param status The status
     * @param limit  Maximum number of results
     * @return Matching executions, oldest update first
     */
    List<WorkflowExecution> findByStatus(ExecutionStatus status, int limit);

    /**
     * Count executions of a workflow that are still RUNNING or PAUSED.
     *
     * @param workflowId The workflow id
     * @return Number of non-terminal executions
     */
    long countActive(String workflowId);

    /**
     * Aggregate statistics over persisted executions.
     *
     * @param workflowId Optional workflow filter, null for all
     * @return Counts, average duration and success rate
     */
    ExecutionStatistics statistics(String workflowId);
}
