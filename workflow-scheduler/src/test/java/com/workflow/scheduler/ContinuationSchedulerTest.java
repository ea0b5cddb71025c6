package com.workflow.scheduler;

import com.workflow.core.test.TimeController;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;

class ContinuationSchedulerTest {

    private TimeController time;
    private MapContinuationRepository repository;
    private List<ScheduledContinuation> firedContinuations;
    private ContinuationScheduler scheduler;

    @BeforeEach
    void setUp() {
        time = TimeController.frozen();
        repository = new MapContinuationRepository();
        firedContinuations = new CopyOnWriteArrayList<>();
        scheduler = new ContinuationScheduler(repository, time);
        scheduler.setCallback(firedContinuations::add);
    }

    @AfterEach
    void tearDown() {
        scheduler.stop();
    }

    @Test
    void runDueContinuations_shouldFireOnlyOnceWakeTimeHasPassed() {
        scheduler.schedule("exec-1", 1L, "wait", ContinuationType.DELAY, Duration.ofSeconds(30));

        assertThat(scheduler.runDueContinuations()).isZero();

        time.advanceSeconds(30);
        assertThat(scheduler.runDueContinuations()).isEqualTo(1);

        assertThat(firedContinuations).hasSize(1);
        assertThat(firedContinuations.get(0).stepId()).isEqualTo("wait");
        assertThat(firedContinuations.get(0).type()).isEqualTo(ContinuationType.DELAY);
    }

    @Test
    void runDueContinuations_shouldNeverFireTwice() {
        scheduler.schedule("exec-1", 1L, "charge", ContinuationType.RETRY, Duration.ZERO);

        scheduler.runDueContinuations();
        scheduler.runDueContinuations();

        assertThat(firedContinuations).hasSize(1);
        assertThat(scheduler.hasPending("exec-1")).isFalse();
    }

    @Test
    void cancelAll_shouldPreventFiring() {
        scheduler.schedule("exec-1", 1L, "wait", ContinuationType.DELAY, Duration.ofSeconds(5));
        scheduler.schedule("exec-2", 1L, "wait", ContinuationType.DELAY, Duration.ofSeconds(5));

        assertThat(scheduler.cancelAll("exec-1")).isEqualTo(1);
        time.advanceSeconds(5);
        scheduler.runDueContinuations();

        assertThat(firedContinuations)
            .extracting(ScheduledContinuation::executionId)
            .containsExactly("exec-2");
    }

    @Test
    void runDueContinuations_callbackFailure_shouldNotStopOtherContinuations() {
        scheduler.setCallback(c -> {
            if (c.executionId().equals("exec-bad")) {
                throw new IllegalStateException("boom");
            }
            firedContinuations.add(c);
        });
        scheduler.schedule("exec-bad", 1L, "a", ContinuationType.RETRY, Duration.ZERO);
        time.advanceSeconds(1);
        scheduler.schedule("exec-good", 1L, "a", ContinuationType.RETRY, Duration.ZERO);
        time.advanceSeconds(1);

        scheduler.runDueContinuations();

        assertThat(firedContinuations)
            .extracting(ScheduledContinuation::executionId)
            .containsExactly("exec-good");
    }

    @Test
    void start_withoutCallback_shouldFail() {
        ContinuationScheduler unwired = new ContinuationScheduler(repository, time);
        try {
            assertThatThrownBy(unwired::start).isInstanceOf(IllegalStateException.class);
        } finally {
            unwired.stop();
        }
    }

    @Test
    void hasPending_shouldReflectScheduledContinuations() {
        assertThat(scheduler.hasPending("exec-1")).isFalse();

        scheduler.schedule("exec-1", 1L, "wait", ContinuationType.DELAY, Duration.ofMinutes(1));

        assertThat(scheduler.hasPending("exec-1")).isTrue();
    }

    /**
     * Minimal map-backed repository for exercising the scheduler in isolation.
     */
    static class MapContinuationRepository implements ContinuationRepository {

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
                .filter(c -> c.executionId().equals(executionId) && c.isPending())
                .collect(Collectors.toList());
        }

        @Override
        public synchronized boolean markFired(String continuationId, Instant firedAt) {
            ScheduledContinuation c = continuations.get(continuationId);
            if (c == null || !c.isPending()) {
                return false;
            }
            continuations.put(c.id(), new ScheduledContinuation(
                c.id(), c.executionId(), c.executionSequence(), c.stepId(), c.type(), c.wakeAt(), true, firedAt, false, c.createdAt()));
            return true;
        }

        @Override
        public synchronized int cancelByExecution(String executionId) {
            List<ScheduledContinuation> pending = new ArrayList<>(findPendingByExecution(executionId));
            for (ScheduledContinuation c : pending) {
                continuations.put(c.id(), new ScheduledContinuation(
                    c.id(), c.executionId(), c.executionSequence(), c.stepId(), c.type(), c.wakeAt(), false, null, true, c.createdAt()));
            }
            return pending.size();
        }
    }
}
