package com.workflow.engine.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * MDC (Mapped Diagnostic Context) helper for structured logging.
 * Ensures all logs include relevant correlation IDs for tracing.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forStep(executionId, workflowId, stepId, attempt)) {
 *     log.info("Dispatching step"); // Automatically includes executionId, workflowId, stepId
 * }
 * </pre>
 *
 * Contexts nest: closing one removes only the keys it added, so a step context
 * inside an execution context leaves the execution keys in place.
 *
 * Log output with MDC:
 * 2024-01-15 10:30:45.123 [workflow-dispatch-1] INFO  c.w.e.e.StepExecutor - Dispatching step
 *   executionId=5f1c... workflowId=purchase-order stepId=manager_approval attempt=1
 */
public final class LoggingContext implements AutoCloseable {

    public static final String EXECUTION_ID = "executionId";
    public static final String WORKFLOW_ID = "workflowId";
    public static final String STEP_ID = "stepId";
    public static final String ATTEMPT = "attempt";
    public static final String TRACE_ID = "traceId";

    private final List<String> addedKeys = new ArrayList<>();

    private LoggingContext() {
        // Private constructor - use static factory methods
    }

    /**
     * Create a logging context for execution-level operations.
     */
    public static LoggingContext forExecution(String executionId, String workflowId) {
        LoggingContext ctx = new LoggingContext();
        ctx.putIfAbsent(EXECUTION_ID, executionId);
        ctx.putIfAbsent(WORKFLOW_ID, workflowId);
        ctx.putIfAbsent(TRACE_ID, UUID.randomUUID().toString().substring(0, 8));
        return ctx;
    }

    /**
     * Create a logging context for step-level operations.
     */
    public static LoggingContext forStep(String executionId, String workflowId, String stepId, int attempt) {
        LoggingContext ctx = forExecution(executionId, workflowId);
        ctx.putIfAbsent(STEP_ID, stepId);
        ctx.putIfAbsent(ATTEMPT, String.valueOf(attempt));
        return ctx;
    }

    /**
     * Get current execution ID from context.
     */
    public static String getExecutionId() {
        return MDC.get(EXECUTION_ID);
    }

    public static String getStepId() {
        return MDC.get(STEP_ID);
    }

    private void putIfAbsent(String key, String value) {
        if (value != null && MDC.get(key) == null) {
            MDC.put(key, value);
            addedKeys.add(key);
        }
    }

    @Override
    public void close() {
        for (String key : addedKeys) {
            MDC.remove(key);
        }
        addedKeys.clear();
    }
}
