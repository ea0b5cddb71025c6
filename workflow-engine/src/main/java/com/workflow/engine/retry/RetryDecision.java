package com.workflow.engine.retry;

import com.workflow.core.model.WorkflowExecution;

import java.time.Duration;

/**
 * What happened to an execution after a step failure.
 *
 * @param action     retry scheduled, execution failed, or advance past the step
 * @param execution  the execution as persisted
 * @param nextStepId step to advance to (ADVANCE only), null to complete
 * @param retryDelay wait before the retry (RETRY only)
 */
public record RetryDecision(
    Action action,
    WorkflowExecution execution,
    String nextStepId,
    Duration retryDelay
) {
    public enum Action {
        RETRY,   // Same step re-dispatched after retryDelay
        FAIL,    // Execution is FAILED
        ADVANCE  // onError=continue|skip: move past the failed step
    }

    public static RetryDecision retry(WorkflowExecution execution, Duration delay) {
        return new RetryDecision(Action.RETRY, execution, null, delay);
    }

    public static RetryDecision fail(WorkflowExecution execution) {
        return new RetryDecision(Action.FAIL, execution, null, null);
    }

    public static RetryDecision advance(WorkflowExecution execution, String nextStepId) {
        return new RetryDecision(Action.ADVANCE, execution, nextStepId, null);
    }

    /**
     * Check if the step loop should keep going.
     */
    public boolean continuesLoop() {
        return action == Action.ADVANCE;
    }
}
