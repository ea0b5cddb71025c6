package com.workflow.core.model;

/**
 * Aggregate view over persisted executions.
 *
 * @param totalExecutions         all executions
 * @param successfulExecutions    executions with status COMPLETED
 * @param failedExecutions        executions with status FAILED
 * @param averageExecutionSeconds mean of (completedAt - startedAt) over executions that have a completedAt
 * @param successRate             successful / total as a percentage, 0 when there are no executions
 */
public record ExecutionStatistics(
    long totalExecutions,
    long successfulExecutions,
    long failedExecutions,
    double averageExecutionSeconds,
    double successRate
) {
    public static ExecutionStatistics empty() {
        return new ExecutionStatistics(0, 0, 0, 0.0, 0.0);
    }

    /**
     * Build statistics from raw counts, deriving the success rate.
     */
    public static ExecutionStatistics of(long total, long successful, long failed, double averageSeconds) {
        double rate = total > 0 ? (successful * 100.0) / total : 0.0;
        return new ExecutionStatistics(total, successful, failed, averageSeconds, rate);
    }
}
