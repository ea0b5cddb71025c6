package com.workflow.recovery;

import org.springframework.context.SmartLifecycle;

/**
 * Starts recovery after every singleton exists, so handlers registered during
 * context startup are in place before orphaned executions are re-entered.
 */
public class RecoveryLifecycle implements SmartLifecycle {

    private final RecoveryEngine recoveryEngine;

    public RecoveryLifecycle(RecoveryEngine recoveryEngine) {
        this.recoveryEngine = recoveryEngine;
    }

    @Override
    public void start() {
        recoveryEngine.start();
    }

    @Override
    public void stop() {
        recoveryEngine.stop();
    }

    @Override
    public boolean isRunning() {
        return recoveryEngine.isRunning();
    }
}
