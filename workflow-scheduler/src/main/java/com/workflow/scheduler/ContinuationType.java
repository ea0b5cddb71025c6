package com.workflow.scheduler;

/**
 * Why an execution is waiting to be re-entered.
 */
public enum ContinuationType {
    DELAY,  // Delay step elapsed
    RETRY   // Backoff before the next attempt of a failed step
}
