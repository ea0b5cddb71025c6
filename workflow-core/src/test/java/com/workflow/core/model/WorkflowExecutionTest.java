package com.workflow.core.model;

import com.workflow.core.exception.InvalidStateTransitionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class WorkflowExecutionTest {

    private static final Instant NOW = Instant.parse("2024-01-15T10:00:00Z");

    private WorkflowDefinition definition;

    @BeforeEach
    void setUp() {
        definition = WorkflowDefinition.builder()
            .id("wf-1")
            .name("Test")
            .version(2)
            .status(DefinitionStatus.ACTIVE)
            .steps(
                WorkflowStep.action("A", "create_record", "B"),
                WorkflowStep.action("B", "send_email"))
            .build();
    }

    @Test
    void start_shouldPositionAtEntryStep() {
        WorkflowExecution execution = WorkflowExecution.start(definition, Map.of("orderId", "o-1"), NOW);

        assertThat(execution.id()).isNotBlank();
        assertThat(execution.workflowId()).isEqualTo("wf-1");
        assertThat(execution.definitionVersion()).isEqualTo(2);
        assertThat(execution.status()).isEqualTo(ExecutionStatus.RUNNING);
        assertThat(execution.currentStepId()).isEqualTo("A");
        assertThat(execution.context()).containsEntry("orderId", "o-1");
        assertThat(execution.retryCount()).isZero();
        assertThat(execution.startedAt()).isEqualTo(NOW);
        assertThat(execution.completedAt()).isNull();
    }

    @Test
    void context_shouldBeDefensivelyCopiedAndAllowNulls() {
        Map<String, Object> input = new HashMap<>();
        input.put("note", null);

        WorkflowExecution execution = WorkflowExecution.start(definition, input, NOW);
        input.put("late", "value");

        assertThat(execution.context()).containsKey("note").doesNotContainKey("late");
        assertThatThrownBy(() -> execution.context().put("x", 1))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void paused_shouldRecordReason_andResumeShouldClearIt() {
        WorkflowExecution paused = WorkflowExecution.start(definition, Map.of(), NOW)
            .paused(PauseReason.APPROVAL, NOW);

        assertThat(paused.isAwaitingApproval()).isTrue();

        WorkflowExecution resumed = paused.withStatus(ExecutionStatus.RUNNING, NOW);
        assertThat(resumed.pauseReason()).isNull();
        assertThat(resumed.isRunning()).isTrue();
    }

    @Test
    void withStatus_invalidTransition_shouldThrow() {
        WorkflowExecution completed = WorkflowExecution.start(definition, Map.of(), NOW).completed(NOW);

        assertThatThrownBy(() -> completed.withStatus(ExecutionStatus.RUNNING, NOW))
            .isInstanceOf(InvalidStateTransitionException.class);
    }

    @Test
    void completed_shouldClearCursorAndStampCompletion() {
        WorkflowExecution completed = WorkflowExecution.start(definition, Map.of(), NOW)
            .completed(NOW.plusSeconds(5));

        assertThat(completed.currentStepId()).isNull();
        assertThat(completed.completedAt()).isEqualTo(NOW.plusSeconds(5));
        assertThat(completed.isTerminal()).isTrue();
    }

    @Test
    void advancedTo_shouldResetRetryCount() {
        WorkflowExecution failedOnce = WorkflowExecution.start(definition, Map.of(), NOW)
            .withStepFailure("timeout", NOW);
        assertThat(failedOnce.retryCount()).isEqualTo(1);
        assertThat(failedOnce.error()).isEqualTo("timeout");

        WorkflowExecution advanced = failedOnce.advancedTo("B", NOW);

        assertThat(advanced.currentStepId()).isEqualTo("B");
        assertThat(advanced.retryCount()).isZero();
    }

    @Test
    void withContextUpdates_shouldMergeOverExistingKeys() {
        WorkflowExecution execution = WorkflowExecution.start(definition, Map.of("a", 1, "b", 2), NOW)
            .withContextUpdates(Map.of("b", 3, "c", 4));

        assertThat(execution.context()).containsEntry("a", 1).containsEntry("b", 3).containsEntry("c", 4);
    }

    @Test
    void withers_shouldNotChangeSequenceNumber() {
        WorkflowExecution execution = WorkflowExecution.start(definition, Map.of(), NOW);

        assertThat(execution.advancedTo("B", NOW).sequenceNumber()).isEqualTo(execution.sequenceNumber());
        assertThat(execution.toBuilder().incrementSequence().build().sequenceNumber())
            .isEqualTo(execution.sequenceNumber() + 1);
    }
}
