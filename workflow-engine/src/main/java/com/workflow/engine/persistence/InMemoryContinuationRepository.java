package com.workflow.engine.persistence;

import com.workflow.scheduler.ContinuationRepository;
import com.workflow.scheduler.ScheduledContinuation;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of ContinuationRepository.
 * Continuations do not survive a restart; use the JDBC store for that.
 * A continuation is removed once it fires or is cancelled.
 */
public class InMemoryContinuationRepository implements ContinuationRepository {

    private final Map<String, ScheduledContinuation> continuations = new ConcurrentHashMap<>();

    @Override
    public void save(ScheduledContinuation continuation) {
        continuations.put(continuation.id(), continuation);
    }

    @Override
    public List<ScheduledContinuation> findDue(Instant now, int limit) {
        return continuations.values().stream()
            .filter(c -> c.isDue(now))
            .sorted(Comparator.comparing(ScheduledContinuation::wakeAt))
            .limit(limit)
            .collect(Collectors.toList());
    }

    @Override
    public List<ScheduledContinuation> findPendingByExecution(String executionId) {
        return continuations.values().stream()
            .filter(c -> c.executionId().equals(executionId))
            .filter(ScheduledContinuation::isPending)
            .sorted(Comparator.comparing(ScheduledContinuation::wakeAt))
            .collect(Collectors.toList());
    }

    @Override
    public boolean markFired(String continuationId, Instant firedAt) {
        boolean[] won = {false};
        continuations.computeIfPresent(continuationId, (id, c) -> {
            if (!c.isPending()) {
                return c;
            }
            won[0] = true;
            return null;
        });
        return won[0];
    }

    @Override
    public int cancelByExecution(String executionId) {
        int cancelled = 0;
        for (ScheduledContinuation c : findPendingByExecution(executionId)) {
            if (continuations.remove(c.id(), c)) {
                cancelled++;
            }
        }
        return cancelled;
    }

    /**
     * Number of continuations held. Fired and cancelled ones are dropped, so this is the pending count.
     */
    public int size() {
        return continuations.size();
    }
}
