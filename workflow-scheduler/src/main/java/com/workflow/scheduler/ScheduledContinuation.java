package com.workflow.scheduler;

import java.time.Instant;
import java.util.UUID;

/**
 * A durable note to re-enter an execution at a given step once wakeAt has passed.
 *
 * Invariants:
 * - fires at most once (fired flips false -> true via compare-and-set)
 * - a cancelled continuation never fires
 * - executionSequence is the execution's sequence number when it was scheduled;
 *   a continuation whose execution has moved on since is stale
 */
public record ScheduledContinuation(
    String id,
    String executionId,
    long executionSequence,
    String stepId,
    ContinuationType type,
    Instant wakeAt,
    boolean fired,
    Instant firedAt,
    boolean cancelled,
    Instant createdAt
) {
    public static ScheduledContinuation create(
            String executionId, long executionSequence, String stepId,
            ContinuationType type, Instant wakeAt, Instant now) {
        return new ScheduledContinuation(
            UUID.randomUUID().toString(),
            executionId,
            executionSequence,
            stepId,
            type,
            wakeAt,
            false,
            null,
            false,
            now
        );
    }

    public boolean isPending() {
        return !fired && !cancelled;
    }

    public boolean isDue(Instant now) {
        return isPending() && !wakeAt.isAfter(now);
    }
}
