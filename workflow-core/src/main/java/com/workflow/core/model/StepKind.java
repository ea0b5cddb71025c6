package com.workflow.core.model;

/**
 * The five kinds of workflow steps.
 */
public enum StepKind {
    /** Invokes a registered action handler. */
    ACTION,
    /** Evaluates a condition against the context and picks a branch. */
    CONDITION,
    /** Suspends the execution for a fixed number of seconds. */
    DELAY,
    /** Suspends the execution until a human approves or rejects. */
    APPROVAL,
    /** Invokes a notification handler, best-effort unless onError=stop. */
    NOTIFICATION
}
