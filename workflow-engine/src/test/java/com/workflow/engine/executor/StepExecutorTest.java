package com.workflow.engine.executor;

import com.workflow.core.exception.StepExecutionException;
import com.workflow.core.model.ActionConfig;
import com.workflow.core.model.ApprovalStatus;
import com.workflow.core.model.Condition;
import com.workflow.core.model.ConditionOperator;
import com.workflow.core.model.ErrorHandlingPolicy;
import com.workflow.core.model.NotificationConfig;
import com.workflow.core.model.OnError;
import com.workflow.core.model.WorkflowDefinition;
import com.workflow.core.model.WorkflowExecution;
import com.workflow.core.model.WorkflowStep;
import com.workflow.engine.test.EngineFixture;
import com.workflow.engine.test.ScriptedHandler;
import com.workflow.handler.StepHandlerContext;
import com.workflow.handler.StepResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class StepExecutorTest {

    private EngineFixture engine;
    private StepExecutor executor;

    @BeforeEach
    void setUp() {
        engine = new EngineFixture();
        executor = engine.stepExecutor;
    }

    /**
     * Persist an execution positioned at the first of the given steps.
     */
    private WorkflowExecution executionAt(Map<String, Object> context, WorkflowStep... steps) {
        WorkflowDefinition definition = engine.activeWorkflow(steps);
        WorkflowExecution execution = WorkflowExecution.start(definition, context, engine.time.instant());
        engine.executions.save(execution);
        return execution;
    }

    // ========== Action ==========

    @Test
    void action_shouldInvokeHandlerWithParametersAndContext() {
        ScriptedHandler handler = ScriptedHandler.succeedingWith(Map.of("charged", true));
        engine.handlers.register("charge", handler);
        WorkflowStep step = WorkflowStep.builder()
            .id("pay")
            .config(new ActionConfig("charge", Map.of("currency", "EUR")))
            .nextSteps("ship")
            .build();
        WorkflowExecution execution = executionAt(Map.of("amount", 20),
            step, WorkflowStep.action("ship", "charge"));

        StepOutcome outcome = executor.execute(execution, step);

        assertThat(outcome.type()).isEqualTo(StepOutcome.Type.ADVANCE);
        assertThat(outcome.nextStepId()).isEqualTo("ship");
        assertThat(outcome.contextUpdates()).containsEntry("charged", true);

        StepHandlerContext context = handler.contexts().get(0);
        assertThat(context.getExecutionId()).isEqualTo(execution.id());
        assertThat(context.getStepId()).isEqualTo("pay");
        assertThat(context.getAttemptNumber()).isEqualTo(1);
        assertThat(context.getParameters()).containsEntry("currency", "EUR");
        assertThat(context.getExecutionContext()).containsEntry("amount", 20);
        assertThat(context.getIdempotencyKey()).isEqualTo(execution.id() + ":pay");
    }

    @Test
    void action_lastStep_shouldAdvanceToNothing() {
        engine.handlers.register("work", ScriptedHandler.succeeding());
        WorkflowStep step = WorkflowStep.action("only", "work");
        WorkflowExecution execution = executionAt(Map.of(), step);

        StepOutcome outcome = executor.execute(execution, step);

        assertThat(outcome.type()).isEqualTo(StepOutcome.Type.ADVANCE);
        assertThat(outcome.nextStepId()).isNull();
        assertThat(outcome.suspends()).isFalse();
    }

    @Test
    void action_withUnknownHandler_shouldFailPermanently() {
        WorkflowStep step = WorkflowStep.action("a", "missing");
        WorkflowExecution execution = executionAt(Map.of(), step);

        assertThatThrownBy(() -> executor.execute(execution, step))
            .isInstanceOf(StepExecutionException.class)
            .hasMessageContaining("missing")
            .satisfies(e -> {
                StepExecutionException failure = (StepExecutionException) e;
                assertThat(failure.isRetryable()).isFalse();
                assertThat(failure.getErrorCode()).isEqualTo(StepExecutor.HANDLER_NOT_FOUND);
                assertThat(failure.getStepId()).isEqualTo("a");
            });
    }

    @Test
    void action_handlerThrowingRuntimeException_shouldFailRetryably() {
        engine.handlers.register("flaky", context -> {
            throw new IllegalStateException("connection reset");
        });
        WorkflowStep step = WorkflowStep.action("a", "flaky");
        WorkflowExecution execution = executionAt(Map.of(), step);

        assertThatThrownBy(() -> executor.execute(execution, step))
            .isInstanceOf(StepExecutionException.class)
            .hasMessageContaining("connection reset")
            .satisfies(e -> {
                StepExecutionException failure = (StepExecutionException) e;
                assertThat(failure.isRetryable()).isTrue();
                assertThat(failure.getErrorCode()).isEqualTo(StepExecutor.HANDLER_ERROR);
            });
    }

    @Test
    void action_reportedFailure_shouldKeepRetryability() {
        engine.handlers.register("soft", context -> StepResult.failure("try later"));
        engine.handlers.register("hard", context -> StepResult.permanentFailure("bad input"));
        WorkflowStep soft = WorkflowStep.action("soft", "soft");
        WorkflowStep hard = WorkflowStep.action("hard", "hard");
        WorkflowExecution execution = executionAt(Map.of(), soft, hard);

        assertThatThrownBy(() -> executor.execute(execution, soft))
            .isInstanceOf(StepExecutionException.class)
            .hasMessage("try later")
            .matches(e -> ((StepExecutionException) e).isRetryable());
        assertThatThrownBy(() -> executor.execute(execution, hard))
            .isInstanceOf(StepExecutionException.class)
            .hasMessage("bad input")
            .matches(e -> !((StepExecutionException) e).isRetryable());
    }

    @Test
    void action_attemptNumber_shouldFollowRetryCount() {
        ScriptedHandler handler = ScriptedHandler.succeeding();
        engine.handlers.register("work", handler);
        WorkflowStep step = WorkflowStep.action("a", "work");
        WorkflowExecution execution = executionAt(Map.of(), step).toBuilder().retryCount(2).build();

        executor.execute(execution, step);

        assertThat(handler.contexts().get(0).getAttemptNumber()).isEqualTo(3);
    }

    // ========== Condition ==========

    @Test
    void condition_shouldSelectBranchByResult() {
        WorkflowStep step = WorkflowStep.condition("check",
            Condition.of("amount", ConditionOperator.GREATER_THAN, 100), "big", "small");
        WorkflowStep big = WorkflowStep.delay("big", 0);
        WorkflowStep small = WorkflowStep.delay("small", 0);

        WorkflowExecution large = executionAt(Map.of("amount", 500), step, big, small);
        WorkflowExecution little = executionAt(Map.of("amount", 5), step, big, small);

        assertThat(executor.execute(large, step).nextStepId()).isEqualTo("big");
        assertThat(executor.execute(little, step).nextStepId()).isEqualTo("small");
    }

    @Test
    void condition_withSingleNextStep_shouldUseItForBothResults() {
        WorkflowStep step = WorkflowStep.condition("check",
            Condition.of("flag", ConditionOperator.EQUALS, true), "after");
        WorkflowStep after = WorkflowStep.delay("after", 0);
        WorkflowExecution execution = executionAt(Map.of("flag", false), step, after);

        assertThat(executor.execute(execution, step).nextStepId()).isEqualTo("after");
    }

    // ========== Delay ==========

    @Test
    void delay_shouldSuspendForConfiguredSeconds() {
        WorkflowStep step = WorkflowStep.delay("wait", 90, "after");
        WorkflowExecution execution = executionAt(Map.of(), step, WorkflowStep.delay("after", 0));

        StepOutcome outcome = executor.execute(execution, step);

        assertThat(outcome.type()).isEqualTo(StepOutcome.Type.DELAY);
        assertThat(outcome.delay()).isEqualTo(Duration.ofSeconds(90));
        assertThat(outcome.suspends()).isTrue();
    }

    @Test
    void delay_ofZero_shouldAdvanceImmediately() {
        WorkflowStep step = WorkflowStep.delay("wait", 0, "after");
        WorkflowExecution execution = executionAt(Map.of(), step, WorkflowStep.delay("after", 0));

        StepOutcome outcome = executor.execute(execution, step);

        assertThat(outcome.type()).isEqualTo(StepOutcome.Type.ADVANCE);
        assertThat(outcome.nextStepId()).isEqualTo("after");
    }

    @Test
    void delay_negative_shouldFailPermanently() {
        WorkflowStep valid = WorkflowStep.delay("wait", 1);
        WorkflowExecution execution = executionAt(Map.of(), valid);
        WorkflowStep negative = WorkflowStep.delay("wait", -5);

        assertThatThrownBy(() -> executor.execute(execution, negative))
            .isInstanceOf(StepExecutionException.class)
            .matches(e -> !((StepExecutionException) e).isRetryable());
    }

    // ========== Approval ==========

    @Test
    void approval_shouldCreateOnePendingRequest() {
        WorkflowStep step = WorkflowStep.approval("sign-off", "manager-7");
        WorkflowExecution execution = executionAt(Map.of(), step);

        StepOutcome first = executor.execute(execution, step);
        StepOutcome second = executor.execute(execution, step);

        assertThat(first.type()).isEqualTo(StepOutcome.Type.AWAIT_APPROVAL);
        assertThat(first.approvalRequest().status()).isEqualTo(ApprovalStatus.PENDING);
        assertThat(first.approvalRequest().approverId()).isEqualTo("manager-7");
        assertThat(second.approvalRequest().id()).isEqualTo(first.approvalRequest().id());
        assertThat(engine.approvals.findByExecution(execution.id())).hasSize(1);
    }

    // ========== Notification ==========

    @Test
    void notification_shouldPassParametersToHandler() {
        ScriptedHandler handler = ScriptedHandler.succeeding();
        engine.handlers.register(NotificationConfig.DEFAULT_HANDLER, handler);
        WorkflowStep step = WorkflowStep.notification("notify", Map.of("message", "hello"));
        WorkflowExecution execution = executionAt(Map.of(), step);

        StepOutcome outcome = executor.execute(execution, step);

        assertThat(outcome.type()).isEqualTo(StepOutcome.Type.ADVANCE);
        assertThat(handler.contexts().get(0).getParameters()).containsEntry("message", "hello");
    }

    @Test
    @DisplayName("Notification failures are swallowed unless the step must succeed")
    void notification_failure_shouldBeBestEffort() {
        engine.handlers.register(NotificationConfig.DEFAULT_HANDLER, ScriptedHandler.alwaysFailing());
        WorkflowStep lenient = WorkflowStep.builder()
            .id("notify")
            .config(NotificationConfig.of(Map.of()))
            .nextSteps("after")
            .errorHandling(ErrorHandlingPolicy.of(0, 0, OnError.CONTINUE))
            .build();
        WorkflowStep strict = lenient.toBuilder()
            .id("notify-strict")
            .errorHandling(ErrorHandlingPolicy.of(0, 0, OnError.STOP))
            .build();
        WorkflowExecution execution = executionAt(Map.of(), lenient, strict, WorkflowStep.delay("after", 0));

        assertThat(executor.execute(execution, lenient).nextStepId()).isEqualTo("after");
        assertThatThrownBy(() -> executor.execute(execution, strict))
            .isInstanceOf(StepExecutionException.class);
    }

    @Test
    void notification_withoutHandler_shouldBeSkippedUnlessStrict() {
        WorkflowStep lenient = WorkflowStep.builder()
            .id("notify")
            .config(new NotificationConfig("sms", Map.of()))
            .errorHandling(ErrorHandlingPolicy.of(0, 0, OnError.SKIP))
            .build();
        WorkflowStep strict = lenient.toBuilder().id("strict")
            .errorHandling(ErrorHandlingPolicy.defaultPolicy())
            .build();
        WorkflowExecution execution = executionAt(Map.of(), lenient, strict);

        assertThat(executor.execute(execution, lenient).type()).isEqualTo(StepOutcome.Type.ADVANCE);
        assertThatThrownBy(() -> executor.execute(execution, strict))
            .isInstanceOf(StepExecutionException.class)
            .hasMessageContaining("sms");
    }
}
