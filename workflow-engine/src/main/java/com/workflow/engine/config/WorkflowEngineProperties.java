package com.workflow.engine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Settings bound from {@code workflow.engine.*}.
 */
@ConfigurationProperties(prefix = "workflow.engine")
public class WorkflowEngineProperties {

    public enum Store {
        MEMORY,
        JDBC
    }

    /**
     * Where definitions, executions, approvals and continuations are kept.
     */
    private Store store = Store.MEMORY;

    /**
     * Size of the step-loop worker pool.
     */
    private int dispatchThreads = 4;

    private final Scheduler scheduler = new Scheduler();

    private final Recovery recovery = new Recovery();

    public Store getStore() {
        return store;
    }

    public void setStore(Store store) {
        this.store = store;
    }

    public int getDispatchThreads() {
        return dispatchThreads;
    }

    public void setDispatchThreads(int dispatchThreads) {
        this.dispatchThreads = dispatchThreads;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public Recovery getRecovery() {
        return recovery;
    }

    public static class Scheduler {

        private Duration pollInterval = Duration.ofSeconds(1);
        private int batchSize = 100;
        private int threads = 2;

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public int getThreads() {
            return threads;
        }

        public void setThreads(int threads) {
            this.threads = threads;
        }
    }

    /**
     * Re-entry of executions left RUNNING with nothing scheduled, e.g. after a crash.
     */
    public static class Recovery {

        private boolean enabled = true;
        private Duration scanInterval = Duration.ofSeconds(30);
        private int batchSize = 100;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getScanInterval() {
            return scanInterval;
        }

        public void setScanInterval(Duration scanInterval) {
            this.scanInterval = scanInterval;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }
    }
}
