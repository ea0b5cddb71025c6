package com.workflow.engine.service;

import com.workflow.core.model.WorkflowDefinition;
import com.workflow.core.model.WorkflowExecution;
import com.workflow.core.repository.ExecutionQuery;
import com.workflow.engine.approval.ExecutionControl;

import java.util.List;
import java.util.Map;

/**
 * Core service for workflow execution.
 * Manages execution lifecycle and state transitions.
 */
public interface WorkflowExecutionService extends ExecutionControl {

    /**
     * Start an execution of a definition version.
     *
     * The stored copy of the definition's (id, version) is bound, not the argument itself.
     *
     * @param definition     The definition to bind; must be stored, ACTIVE and the workflow not deactivated since
     * @param initialContext The initial context
     * @return The execution as created, positioned at the entry step
     * @throws com.workflow.core.exception.DefinitionNotFoundException if that version is not stored
     * @throws com.workflow.core.exception.InactiveWorkflowException if the workflow is not active
     */
    WorkflowExecution start(WorkflowDefinition definition, Map<String, Object> initialContext);

    /**
     * Start an execution of the latest version of a workflow.
     *
     * @param workflowId     The workflow id
     * @param initialContext The initial context
     * @return The execution as created
     */
    WorkflowExecution start(String workflowId, Map<String, Object> initialContext);

    /**
     * Pause a running execution on behalf of an operator.
     *
     * @param executionId The execution id
     * @return The paused execution
     */
    WorkflowExecution pause(String executionId);

    /**
     * Resume a paused execution. After an operator pause the current step is
     * dispatched again; after an approved approval the execution moves past it.
     *
     * @param executionId The execution id
     * @return The execution as resumed
     */
    @Override
    WorkflowExecution resume(String executionId);

    /**
     * Cancel an execution. Cancelling a terminal execution is a no-op.
     *
     * @param executionId The execution id
     * @return The execution after cancellation
     */
    @Override
    WorkflowExecution cancel(String executionId);

    /**
     * Get an execution by id.
     *
     * @param executionId The execution id
     * @return The execution
     */
    WorkflowExecution getExecution(String executionId);

    /**
     * List executions, newest start time first.
     *
     * @param query The filter
     * @return Matching executions
     */
    List<WorkflowExecution> listExecutions(ExecutionQuery query);
}
