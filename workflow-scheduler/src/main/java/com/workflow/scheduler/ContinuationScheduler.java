package com.workflow.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Time-based scheduler for delay steps and retry backoff.
 *
 * Continuations are persisted before anything else happens, so a restart
 * loses no wake-ups. While running, each new continuation also gets an
 * in-process wake at its exact due time; the periodic poll picks up
 * everything else (continuations from before a restart, missed wakes).
 *
 * Responsibilities:
 * - Persist continuations
 * - Fire each due continuation exactly once
 * - Cancel the continuations of paused or cancelled executions
 */
public class ContinuationScheduler {

    private static final Logger log = LoggerFactory.getLogger(ContinuationScheduler.class);

    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(1);
    public static final int DEFAULT_BATCH_SIZE = 100;

    private final ContinuationRepository repository;
    private final Clock clock;
    private final Duration pollInterval;
    private final int batchSize;
    private final ScheduledExecutorService scheduler;

    private volatile ContinuationCallback callback;
    private volatile boolean running = false;

    public ContinuationScheduler(ContinuationRepository repository, Clock clock) {
        this(repository, clock, DEFAULT_POLL_INTERVAL, DEFAULT_BATCH_SIZE, 2);
    }

    public ContinuationScheduler(
            ContinuationRepository repository,
            Clock clock,
            Duration pollInterval,
            int batchSize,
            int threads) {
        this.repository = repository;
        this.clock = clock;
        this.pollInterval = pollInterval;
        this.batchSize = batchSize;
        this.scheduler = Executors.newScheduledThreadPool(threads);
    }

    /**
     * Set the receiver of due continuations. Must be called before {@link #start()}.
     */
    public void setCallback(ContinuationCallback callback) {
        this.callback = callback;
    }

    /**
     * Start the scheduler.
     */
    public void start() {
        if (running) {
            log.warn("Continuation scheduler already running");
            return;
        }
        if (callback == null) {
            throw new IllegalStateException("No continuation callback configured");
        }

        running = true;
        log.info("Starting continuation scheduler (poll interval {})", pollInterval);

        scheduler.scheduleWithFixedDelay(
            this::pollSafely,
            pollInterval.toMillis(),
            pollInterval.toMillis(),
            TimeUnit.MILLISECONDS
        );

        log.info("Continuation scheduler started");
    }

    /**
     * Stop the scheduler.
     */
    public void stop() {
        running = false;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(30, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Continuation scheduler stopped");
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Schedule a continuation to fire after a delay.
     *
     * @param executionId the execution to re-enter
     * @param executionSequence the execution's sequence number after the scheduling write
     * @param stepId      the step to re-enter at
     * @param type        delay elapsed or retry backoff
     * @param delay       how long to wait
     * @return the persisted continuation
     */
    public ScheduledContinuation schedule(
            String executionId, long executionSequence, String stepId, ContinuationType type, Duration delay) {
        Instant now = clock.instant();
        ScheduledContinuation continuation = ScheduledContinuation.create(
            executionId, executionSequence, stepId, type, now.plus(delay), now);

        repository.save(continuation);

        log.info("Scheduled {} continuation {} for execution {} step {} at {}",
            type, continuation.id(), executionId, stepId, continuation.wakeAt());

        if (running) {
            scheduler.schedule(this::pollSafely, Math.max(0, delay.toMillis()), TimeUnit.MILLISECONDS);
        }
        return continuation;
    }

    /**
     * Cancel all pending continuations of an execution.
     *
     * @return number cancelled
     */
    public int cancelAll(String executionId) {
        int cancelled = repository.cancelByExecution(executionId);
        if (cancelled > 0) {
            log.info("Cancelled {} pending continuation(s) for execution {}", cancelled, executionId);
        }
        return cancelled;
    }

    /**
     * Check if an execution has a continuation waiting to fire.
     */
    public boolean hasPending(String executionId) {
        return !repository.findPendingByExecution(executionId).isEmpty();
    }

    /**
     * Fire every continuation that is due now.
     * Safe to call concurrently: each continuation is claimed via compare-and-set.
     *
     * @return number of continuations fired
     */
    public int runDueContinuations() {
        Instant now = clock.instant();
        List<ScheduledContinuation> due = repository.findDue(now, batchSize);

        int fired = 0;
        for (ScheduledContinuation continuation : due) {
            try {
                if (fire(continuation)) {
                    fired++;
                }
            } catch (Exception e) {
                log.error("Failed to fire continuation: {}", continuation.id(), e);
            }
        }
        return fired;
    }

    // ========== Internal Methods ==========

    private void pollSafely() {
        if (!running) return;

        try {
            runDueContinuations();
        } catch (Exception e) {
            log.error("Error polling continuations", e);
        }
    }

    private boolean fire(ScheduledContinuation continuation) {
        if (!repository.markFired(continuation.id(), clock.instant())) {
            log.debug("Continuation {} already fired or cancelled", continuation.id());
            return false;
        }

        log.info("Firing {} continuation {} for execution {}",
            continuation.type(), continuation.id(), continuation.executionId());

        ContinuationCallback target = callback;
        if (target == null) {
            throw new IllegalStateException("No continuation callback configured");
        }
        target.onContinuationDue(continuation);
        return true;
    }
}
