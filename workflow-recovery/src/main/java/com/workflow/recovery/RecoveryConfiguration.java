package com.workflow.recovery;

import com.workflow.core.repository.WorkflowExecutionRepository;
import com.workflow.engine.config.WorkflowEngineProperties;
import com.workflow.engine.coordinator.ExecutionCoordinator;
import com.workflow.engine.metrics.WorkflowMetrics;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Recovery wiring, on unless {@code workflow.engine.recovery.enabled=false}.
 */
@Configuration
@ConditionalOnProperty(prefix = "workflow.engine.recovery", name = "enabled", matchIfMissing = true)
public class RecoveryConfiguration {

    @Bean
    public RecoveryEngine recoveryEngine(
            WorkflowExecutionRepository executionRepository,
            ExecutionCoordinator coordinator,
            WorkflowMetrics metrics,
            WorkflowEngineProperties properties) {
        WorkflowEngineProperties.Recovery settings = properties.getRecovery();
        return new RecoveryEngine(
            executionRepository,
            coordinator,
            metrics,
            settings.getScanInterval(),
            settings.getBatchSize());
    }

    @Bean
    public RecoveryLifecycle recoveryLifecycle(RecoveryEngine recoveryEngine) {
        return new RecoveryLifecycle(recoveryEngine);
    }
}
