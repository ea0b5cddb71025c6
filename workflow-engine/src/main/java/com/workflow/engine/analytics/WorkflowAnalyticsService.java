package com.workflow.engine.analytics;

import com.workflow.core.model.ExecutionStatistics;
import com.workflow.core.repository.WorkflowExecutionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Read-only aggregates over persisted executions.
 */
public class WorkflowAnalyticsService {

    private static final Logger log = LoggerFactory.getLogger(WorkflowAnalyticsService.class);

    private final WorkflowExecutionRepository executionRepository;

    public WorkflowAnalyticsService(WorkflowExecutionRepository executionRepository) {
        this.executionRepository = executionRepository;
    }

    /**
     * Execution counts, average duration and success rate.
     *
     * @param workflowId optional workflow filter, null for every workflow
     */
    public ExecutionStatistics analytics(String workflowId) {
        ExecutionStatistics statistics = executionRepository.statistics(workflowId);
        log.debug("Analytics for {}: {} executions, {}% successful",
            workflowId != null ? workflowId : "all workflows",
            statistics.totalExecutions(), statistics.successRate());
        return statistics;
    }
}
