package com.workflow.scheduler;

import java.time.Instant;
import java.util.List;

/**
 * Repository for scheduled continuations.
 */
public interface ContinuationRepository {

    void save(ScheduledContinuation continuation);

    /**
     * Pending continuations whose wakeAt is not after now, earliest first.
     */
    List<ScheduledContinuation> findDue(Instant now, int limit);

    List<ScheduledContinuation> findPendingByExecution(String executionId);

    /**
     * Mark as fired if still pending.
     *
     * @return true if this caller won the right to fire it
     */
    boolean markFired(String continuationId, Instant firedAt);

    /**
     * Cancel every pending continuation of an execution.
     *
     * @return number of continuations cancelled
     */
    int cancelByExecution(String executionId);
}
