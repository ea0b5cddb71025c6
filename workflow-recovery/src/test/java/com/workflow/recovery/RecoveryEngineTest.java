package com.workflow.recovery;

import com.workflow.core.model.ExecutionStatus;
import com.workflow.core.model.PauseReason;
import com.workflow.core.model.WorkflowDefinition;
import com.workflow.core.model.WorkflowExecution;
import com.workflow.core.model.WorkflowStep;
import com.workflow.engine.metrics.WorkflowMetrics;
import com.workflow.engine.test.EngineFixture;
import com.workflow.engine.test.ScriptedHandler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Recovery engine")
class RecoveryEngineTest {

    private EngineFixture engine;
    private ScriptedHandler work;
    private RecoveryEngine recovery;

    @BeforeEach
    void setUp() {
        engine = new EngineFixture();
        work = ScriptedHandler.succeeding();
        engine.handlers.register("work", work);
        recovery = new RecoveryEngine(
            engine.executions, engine.coordinator, engine.metrics, Duration.ofMinutes(10), 100);
    }

    @AfterEach
    void tearDown() {
        recovery.stop();
    }

    private WorkflowExecution orphan(WorkflowDefinition definition) {
        WorkflowExecution execution = WorkflowExecution.start(definition, Map.of(), engine.time.instant());
        engine.executions.save(execution);
        return execution;
    }

    private ExecutionStatus statusOf(WorkflowExecution execution) {
        return engine.coordinator.getExecution(execution.id()).status();
    }

    private double recoveryAttempts(boolean success) {
        return engine.meterRegistry.get(WorkflowMetrics.RECOVERY_ATTEMPTS)
            .tag("success", String.valueOf(success))
            .counter()
            .count();
    }

    @Test
    void recoverAll_shouldDriveOrphanedExecutionsToCompletion() {
        WorkflowDefinition definition = engine.activeWorkflow(
            WorkflowStep.action("a", "work", "b"),
            WorkflowStep.action("b", "work"));
        WorkflowExecution first = orphan(definition);
        WorkflowExecution second = orphan(definition);

        int recovered = recovery.recoverAll();

        assertThat(recovered).isEqualTo(2);
        assertThat(statusOf(first)).isEqualTo(ExecutionStatus.COMPLETED);
        assertThat(statusOf(second)).isEqualTo(ExecutionStatus.COMPLETED);
        assertThat(work.invocations()).isEqualTo(4);
        assertThat(recoveryAttempts(true)).isEqualTo(2.0);
    }

    @Test
    void recoverAll_shouldSkipExecutionsWaitingOnContinuation() {
        WorkflowDefinition definition = engine.activeWorkflow(
            WorkflowStep.delay("wait", 60, "b"),
            WorkflowStep.action("b", "work"));
        WorkflowExecution waiting = engine.coordinator.start(definition, Map.of());

        assertThat(recovery.recoverAll()).isZero();
        assertThat(engine.coordinator.getExecution(waiting.id()).currentStepId()).isEqualTo("wait");
        assertThat(work.invocations()).isZero();
    }

    @Test
    void recoverAll_shouldLeavePausedExecutionsAlone() {
        WorkflowDefinition definition = engine.activeWorkflow(WorkflowStep.action("a", "work"));
        WorkflowExecution execution = orphan(definition);
        engine.executions.update(execution.paused(PauseReason.OPERATOR, engine.time.instant()));

        assertThat(recovery.recoverAll()).isZero();
        assertThat(statusOf(execution)).isEqualTo(ExecutionStatus.PAUSED);
    }

    @Test
    void recoverAll_withNothingRunning_shouldDoNothing() {
        assertThat(recovery.recoverAll()).isZero();
    }

    @Test
    void start_shouldRecoverOrphansOnStartupScan() throws InterruptedException {
        WorkflowDefinition definition = engine.activeWorkflow(WorkflowStep.action("a", "work"));
        WorkflowExecution execution = orphan(definition);

        recovery.start();

        Instant deadline = Instant.now().plusSeconds(5);
        while (statusOf(execution) != ExecutionStatus.COMPLETED && Instant.now().isBefore(deadline)) {
            Thread.sleep(20);
        }
        assertThat(statusOf(execution)).isEqualTo(ExecutionStatus.COMPLETED);
        assertThat(recovery.isRunning()).isTrue();
    }

    @Test
    void stop_shouldMarkEngineStopped() {
        recovery.start();
        recovery.stop();

        assertThat(recovery.isRunning()).isFalse();
    }
}
