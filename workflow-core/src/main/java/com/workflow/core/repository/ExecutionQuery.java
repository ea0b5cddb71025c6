package com.workflow.core.repository;

import com.workflow.core.model.ExecutionStatus;

/**
 * Filter for listing executions. Null fields match everything.
 */
public record ExecutionQuery(
    String workflowId,
    ExecutionStatus status,
    int limit
) {
    public static final int DEFAULT_LIMIT = 100;

    public ExecutionQuery {
        if (limit <= 0) {
            limit = DEFAULT_LIMIT;
        }
    }

    public static ExecutionQuery all() {
        return new ExecutionQuery(null, null, DEFAULT_LIMIT);
    }

    public static ExecutionQuery forWorkflow(String workflowId) {
        return new ExecutionQuery(workflowId, null, DEFAULT_LIMIT);
    }
}
