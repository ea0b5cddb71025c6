package com.workflow.core.model;

/**
 * Why a paused execution is paused.
 * Decides whether resume re-dispatches the current step or advances past it.
 */
public enum PauseReason {
    /**
     * Paused by an operator. Resume re-dispatches currentStepId.
     */
    OPERATOR,

    /**
     * Parked on an approval step. Resume advances past the approval step.
     */
    APPROVAL
}
