package com.workflow.scheduler;

/**
 * Receives continuations once they are due.
 */
@FunctionalInterface
public interface ContinuationCallback {
    void onContinuationDue(ScheduledContinuation continuation);
}
