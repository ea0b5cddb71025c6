package com.workflow.core.model;

/**
 * What happens to the execution once a step has failed for good.
 */
public enum OnError {
    /** Fail the execution once retries are exhausted. */
    STOP,
    /** Retry, then advance past the step with the error recorded. */
    CONTINUE,
    /** Do not retry; advance past the step with the error recorded. */
    SKIP
}
