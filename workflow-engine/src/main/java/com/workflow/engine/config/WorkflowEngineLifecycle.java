package com.workflow.engine.config;

import com.workflow.scheduler.ContinuationScheduler;
import org.springframework.context.SmartLifecycle;

/**
 * Starts the continuation scheduler once the context is refreshed, that is after
 * the coordinator has been registered as its callback.
 */
public class WorkflowEngineLifecycle implements SmartLifecycle {

    private final ContinuationScheduler scheduler;

    public WorkflowEngineLifecycle(ContinuationScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    public void start() {
        scheduler.start();
    }

    @Override
    public void stop() {
        scheduler.stop();
    }

    @Override
    public boolean isRunning() {
        return scheduler.isRunning();
    }
}
