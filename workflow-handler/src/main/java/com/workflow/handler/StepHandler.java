package com.workflow.handler;

/**
 * Implementation of a named action or notification.
 * Applications register handlers under the name referenced by step configurations.
 */
@FunctionalInterface
public interface StepHandler {

    /**
     * Execute the step.
     *
     * @param context parameters, execution context and utilities
     * @return the outcome, with any context updates to merge
     * @throws StepHandlerException if the step fails
     */
    StepResult handle(StepHandlerContext context) throws StepHandlerException;
}
