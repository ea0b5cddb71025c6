package com.workflow.engine.coordinator;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One lock per execution id, so that at most one dispatch per execution is in flight.
 * Locks are reference counted and dropped once nobody holds or waits for them.
 * Re-entrant: a dispatch may re-enter the lock it already holds.
 */
public class ExecutionLockManager {

    private final Map<String, LockEntry> locks = new ConcurrentHashMap<>();

    public void runLocked(String executionId, Runnable action) {
        LockEntry entry = acquire(executionId);
        try {
            action.run();
        } finally {
            release(executionId, entry);
        }
    }

    public <T> T callLocked(String executionId, Supplier<T> action) {
        LockEntry entry = acquire(executionId);
        try {
            return action.get();
        } finally {
            release(executionId, entry);
        }
    }

    /**
     * Number of executions with a held or awaited lock.
     */
    public int activeLocks() {
        return locks.size();
    }

    private LockEntry acquire(String executionId) {
        LockEntry entry = locks.compute(executionId, (id, existing) -> {
            LockEntry e = existing != null ? existing : new LockEntry();
            e.references++;
            return e;
        });
        entry.lock.lock();
        return entry;
    }

    private void release(String executionId, LockEntry entry) {
        entry.lock.unlock();
        locks.computeIfPresent(executionId, (id, existing) -> --existing.references == 0 ? null : existing);
    }

    private static final class LockEntry {
        private final ReentrantLock lock = new ReentrantLock();
        private int references;
    }
}
