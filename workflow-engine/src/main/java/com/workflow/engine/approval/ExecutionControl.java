package com.workflow.engine.approval;

import com.workflow.core.model.WorkflowExecution;

/**
 * The execution operations an approval decision triggers.
 */
public interface ExecutionControl {

    /**
     * Resume a paused execution.
     */
    WorkflowExecution resume(String executionId);

    /**
     * Cancel an execution. A no-op on terminal executions.
     */
    WorkflowExecution cancel(String executionId);
}
