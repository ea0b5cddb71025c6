package com.workflow.engine.metrics;

import com.workflow.core.model.ApprovalStatus;
import com.workflow.core.model.PauseReason;
import com.workflow.core.model.StepKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer metrics for the workflow engine.
 *
 * Metrics exposed:
 * - Execution counts by outcome, durations
 * - Active (running / paused) execution gauges
 * - Step latency and failures by step kind
 * - Retry, approval and recovery counts
 *
 * Tags are limited to bounded values (step kind, outcome, error code);
 * execution and workflow ids go to the logs instead.
 */
public class WorkflowMetrics {

    // Metric names
    public static final String EXECUTIONS_STARTED = "workflow.executions.started";
    public static final String EXECUTIONS_COMPLETED = "workflow.executions.completed";
    public static final String EXECUTIONS_FAILED = "workflow.executions.failed";
    public static final String EXECUTIONS_CANCELLED = "workflow.executions.cancelled";
    public static final String EXECUTIONS_PAUSED = "workflow.executions.paused";
    public static final String EXECUTIONS_RESUMED = "workflow.executions.resumed";
    public static final String EXECUTIONS_ACTIVE = "workflow.executions.active";
    public static final String EXECUTION_DURATION = "workflow.execution.duration";

    public static final String STEP_DURATION = "workflow.step.duration";
    public static final String STEP_FAILURES = "workflow.step.failures";
    public static final String STEP_RETRIES = "workflow.step.retries";

    public static final String APPROVALS_REQUESTED = "workflow.approvals.requested";
    public static final String APPROVALS_RESOLVED = "workflow.approvals.resolved";
    public static final String RECOVERY_ATTEMPTS = "workflow.recovery.attempts";

    private final MeterRegistry registry;

    private final AtomicInteger running = new AtomicInteger(0);
    private final AtomicInteger paused = new AtomicInteger(0);

    public WorkflowMetrics(MeterRegistry registry) {
        this.registry = registry;

        Gauge.builder(EXECUTIONS_ACTIVE, running, AtomicInteger::get)
            .tag("status", "RUNNING")
            .description("Executions currently running in this process")
            .register(registry);
        Gauge.builder(EXECUTIONS_ACTIVE, paused, AtomicInteger::get)
            .tag("status", "PAUSED")
            .description("Executions paused by this process")
            .register(registry);
    }

    // ========== Execution Metrics ==========

    public void executionStarted() {
        Counter.builder(EXECUTIONS_STARTED)
            .description("Total executions started")
            .register(registry)
            .increment();
        running.incrementAndGet();
    }

    public void executionCompleted(Duration duration) {
        Counter.builder(EXECUTIONS_COMPLETED)
            .description("Total executions completed successfully")
            .register(registry)
            .increment();

        Timer.builder(EXECUTION_DURATION)
            .tag("outcome", "success")
            .description("Execution duration from start to completion")
            .register(registry)
            .record(duration);

        decrement(running);
    }

    public void executionFailed(String errorCode) {
        Counter.builder(EXECUTIONS_FAILED)
            .tag("error_code", sanitize(errorCode))
            .description("Total executions failed")
            .register(registry)
            .increment();
        decrement(running);
    }

    public void executionCancelled(boolean wasPaused) {
        Counter.builder(EXECUTIONS_CANCELLED)
            .description("Total executions cancelled")
            .register(registry)
            .increment();
        decrement(wasPaused ? paused : running);
    }

    public void executionPaused(PauseReason reason) {
        Counter.builder(EXECUTIONS_PAUSED)
            .tag("reason", reason.name())
            .description("Total executions paused")
            .register(registry)
            .increment();
        decrement(running);
        paused.incrementAndGet();
    }

    public void executionResumed() {
        Counter.builder(EXECUTIONS_RESUMED)
            .description("Total executions resumed")
            .register(registry)
            .increment();
        decrement(paused);
        running.incrementAndGet();
    }

    // ========== Step Metrics ==========

    public void stepCompleted(StepKind kind, long durationMs) {
        Timer.builder(STEP_DURATION)
            .tag("kind", kind.name())
            .tag("outcome", "success")
            .description("Step dispatch duration")
            .register(registry)
            .record(Duration.ofMillis(durationMs));
    }

    public void stepFailed(StepKind kind, String errorCode, boolean willRetry) {
        Counter.builder(STEP_FAILURES)
            .tag("kind", kind.name())
            .tag("error_code", sanitize(errorCode))
            .tag("will_retry", String.valueOf(willRetry))
            .description("Total step failures")
            .register(registry)
            .increment();
    }

    public void stepRetried(StepKind kind) {
        Counter.builder(STEP_RETRIES)
            .tag("kind", kind.name())
            .description("Total step retries scheduled")
            .register(registry)
            .increment();
    }

    // ========== Approval and Recovery Metrics ==========

    public void approvalRequested() {
        Counter.builder(APPROVALS_REQUESTED)
            .description("Total approval requests created")
            .register(registry)
            .increment();
    }

    public void approvalResolved(ApprovalStatus decision) {
        Counter.builder(APPROVALS_RESOLVED)
            .tag("decision", decision.name())
            .description("Total approval requests resolved")
            .register(registry)
            .increment();
    }

    public void recoveryAttempted(boolean success) {
        Counter.builder(RECOVERY_ATTEMPTS)
            .tag("success", String.valueOf(success))
            .description("Execution recovery attempts")
            .register(registry)
            .increment();
    }

    /**
     * Update gauge values from store state (for accuracy after restart).
     */
    public void syncActiveGauges(int runningCount, int pausedCount) {
        running.set(runningCount);
        paused.set(pausedCount);
    }

    // ========== Helper Methods ==========

    private static void decrement(AtomicInteger gauge) {
        gauge.updateAndGet(v -> Math.max(0, v - 1));
    }

    /**
     * Sanitize an error code for use as a metric tag.
     */
    private static String sanitize(String value) {
        if (value == null || value.isBlank()) {
            return "unspecified";
        }
        String sanitized = value.toLowerCase()
            .replaceAll("[^a-z0-9_]", "_")
            .replaceAll("_+", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
