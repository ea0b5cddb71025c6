package com.workflow.recovery;

import com.workflow.core.model.ExecutionStatus;
import com.workflow.core.model.WorkflowExecution;
import com.workflow.core.repository.WorkflowExecutionRepository;
import com.workflow.engine.coordinator.ExecutionCoordinator;
import com.workflow.engine.metrics.WorkflowMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Re-enters executions that are RUNNING but have nothing driving them.
 *
 * An execution is orphaned when the process died between persisting its state and
 * scheduling its next continuation, or when its dispatch was rejected. Paused
 * executions are left alone: they wait for an approval decision or an operator.
 */
public class RecoveryEngine {

    private static final Logger log = LoggerFactory.getLogger(RecoveryEngine.class);

    private final WorkflowExecutionRepository executionRepository;
    private final ExecutionCoordinator coordinator;
    private final WorkflowMetrics metrics;
    private final Duration scanInterval;
    private final int batchSize;

    private final ScheduledExecutorService scheduler;
    private volatile boolean running = false;

    public RecoveryEngine(
            WorkflowExecutionRepository executionRepository,
            ExecutionCoordinator coordinator,
            WorkflowMetrics metrics,
            Duration scanInterval,
            int batchSize) {
        this.executionRepository = executionRepository;
        this.coordinator = coordinator;
        this.metrics = metrics;
        this.scanInterval = scanInterval;
        this.batchSize = batchSize;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "workflow-recovery");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Run a first scan right away, then keep scanning at the configured interval.
     */
    public void start() {
        if (running) {
            log.warn("Recovery engine already running");
            return;
        }

        running = true;
        log.info("Starting recovery engine, scanning every {}", scanInterval);

        scheduler.execute(this::startupScan);
        scheduler.scheduleWithFixedDelay(
            this::periodicScan,
            scanInterval.toMillis(),
            scanInterval.toMillis(),
            TimeUnit.MILLISECONDS
        );
    }

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
        log.info("Recovery engine stopped");
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * One pass over the oldest RUNNING executions.
     *
     * @return number of executions handed back to the coordinator
     */
    public int recoverAll() {
        List<WorkflowExecution> candidates = executionRepository.findByStatus(ExecutionStatus.RUNNING, batchSize);
        if (candidates.isEmpty()) {
            return 0;
        }

        int recovered = 0;
        for (WorkflowExecution execution : candidates) {
            try {
                if (coordinator.recover(execution.id())) {
                    metrics.recoveryAttempted(true);
                    recovered++;
                }
            } catch (Exception e) {
                metrics.recoveryAttempted(false);
                log.error("Failed to recover execution: {}", execution.id(), e);
            }
        }

        if (recovered > 0) {
            log.info("Recovered {} of {} running executions", recovered, candidates.size());
        }
        return recovered;
    }

    private void startupScan() {
        if (!running) return;

        try {
            // Gauges start at zero in a fresh process
            int runningCount = executionRepository.findByStatus(ExecutionStatus.RUNNING, Integer.MAX_VALUE).size();
            int pausedCount = executionRepository.findByStatus(ExecutionStatus.PAUSED, Integer.MAX_VALUE).size();
            metrics.syncActiveGauges(runningCount, pausedCount);
            log.info("Found {} running and {} paused executions at startup", runningCount, pausedCount);

            recoverAll();
        } catch (Exception e) {
            log.error("Error in startup recovery scan", e);
        }
    }

    private void periodicScan() {
        if (!running) return;

        try {
            recoverAll();
        } catch (Exception e) {
            log.error("Error in recovery scan", e);
        }
    }
}
