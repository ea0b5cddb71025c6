package com.workflow.handler;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Map;

/**
 * Context provided to step handlers during execution.
 */
public class StepHandlerContext {

    private final String executionId;
    private final String workflowId;
    private final String stepId;
    private final int attemptNumber;
    private final Map<String, Object> parameters;
    private final Map<String, Object> executionContext;
    private final ObjectMapper objectMapper;

    public StepHandlerContext(
            String executionId,
            String workflowId,
            String stepId,
            int attemptNumber,
            Map<String, Object> parameters,
            Map<String, Object> executionContext,
            ObjectMapper objectMapper) {
        this.executionId = executionId;
        this.workflowId = workflowId;
        this.stepId = stepId;
        this.attemptNumber = attemptNumber;
        this.parameters = parameters != null ? parameters : Map.of();
        this.executionContext = executionContext != null ? executionContext : Map.of();
        this.objectMapper = objectMapper;
    }

    public String getExecutionId() {
        return executionId;
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public String getStepId() {
        return stepId;
    }

    /**
     * Get the attempt number, starting at 1.
     */
    public int getAttemptNumber() {
        return attemptNumber;
    }

    /**
     * Get the step parameters from its configuration.
     */
    public Map<String, Object> getParameters() {
        return parameters;
    }

    /**
     * Get the step parameters bound to a specific type.
     */
    public <T> T getParameters(Class<T> type) {
        return objectMapper.convertValue(parameters, type);
    }

    /**
     * Get a read-only view of the execution context.
     */
    public Map<String, Object> getExecutionContext() {
        return executionContext;
    }

    /**
     * Get the idempotency key for this step of this execution.
     * Stable across retries; use it when making external calls.
     */
    public String getIdempotencyKey() {
        return executionId + ":" + stepId;
    }
}
