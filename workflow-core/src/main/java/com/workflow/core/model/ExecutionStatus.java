package com.workflow.core.model;

/**
 * Lifecycle states for a workflow execution.
 * Transitions are monotone toward the terminal set {COMPLETED, FAILED, CANCELLED}.
 */
public enum ExecutionStatus {
    /**
     * Step loop is active, or waiting on a delay/retry continuation.
     * Transitions: -> PAUSED, COMPLETED, FAILED, CANCELLED
     */
    RUNNING,

    /**
     * Halted by an operator or by an approval step.
     * Transitions: -> RUNNING, CANCELLED
     */
    PAUSED,

    /**
     * Graph exhausted. Terminal state.
     */
    COMPLETED,

    /**
     * Retry bound reached on a step with onError=stop. Terminal state.
     */
    FAILED,

    /**
     * Cancelled by an operator or by a rejected approval. Terminal state.
     */
    CANCELLED;

    /**
     * Check if this status is terminal (no further transitions possible).
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * Check if this status can transition to the target status.
     */
    public boolean canTransitionTo(ExecutionStatus target) {
        return switch (this) {
            case RUNNING -> target == PAUSED || target == COMPLETED ||
                            target == FAILED || target == CANCELLED;
            case PAUSED -> target == RUNNING || target == CANCELLED;
            case COMPLETED, FAILED, CANCELLED -> false;
        };
    }
}
