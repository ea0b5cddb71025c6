package com.workflow.engine.executor;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.workflow.core.exception.StepExecutionException;
import com.workflow.core.model.ActionConfig;
import com.workflow.core.model.ApprovalConfig;
import com.workflow.core.model.ApprovalRequest;
import com.workflow.core.model.ConditionConfig;
import com.workflow.core.model.DelayConfig;
import com.workflow.core.model.NotificationConfig;
import com.workflow.core.model.OnError;
import com.workflow.core.model.StepConfig;
import com.workflow.core.model.WorkflowExecution;
import com.workflow.core.model.WorkflowStep;
import com.workflow.engine.approval.ApprovalGateManager;
import com.workflow.engine.condition.ConditionEvaluator;
import com.workflow.engine.metrics.WorkflowMetrics;
import com.workflow.handler.StepHandler;
import com.workflow.handler.StepHandlerContext;
import com.workflow.handler.StepHandlerException;
import com.workflow.handler.StepHandlerRegistry;
import com.workflow.handler.StepResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;

/**
 * Dispatches a single step according to its kind.
 *
 * Every failure leaves here as a {@link StepExecutionException}; deciding
 * whether to retry is the caller's job. Dispatch never changes persisted
 * state except through the approval gate, which records the request.
 */
public class StepExecutor {

    private static final Logger log = LoggerFactory.getLogger(StepExecutor.class);

    public static final String HANDLER_NOT_FOUND = "HANDLER_NOT_FOUND";
    public static final String HANDLER_ERROR = "HANDLER_ERROR";
    public static final String INVALID_CONFIGURATION = "INVALID_STEP_CONFIGURATION";

    private final StepHandlerRegistry handlers;
    private final ConditionEvaluator conditionEvaluator;
    private final ApprovalGateManager approvalGate;
    private final WorkflowMetrics metrics;
    private final ObjectMapper objectMapper;

    public StepExecutor(
            StepHandlerRegistry handlers,
            ConditionEvaluator conditionEvaluator,
            ApprovalGateManager approvalGate,
            WorkflowMetrics metrics,
            ObjectMapper objectMapper) {
        this.handlers = handlers;
        this.conditionEvaluator = conditionEvaluator;
        this.approvalGate = approvalGate;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
    }

    /**
     * Dispatch a step of an execution.
     *
     * @param execution the execution, positioned at {@code step}
     * @param step      the step to dispatch
     * @return what the step loop should do next
     * @throws StepExecutionException if the step failed
     */
    public StepOutcome execute(WorkflowExecution execution, WorkflowStep step) {
        long startNanos = System.nanoTime();
        log.debug("Dispatching {} step {} (attempt {})", step.kind(), step.id(), execution.retryCount() + 1);

        StepOutcome outcome = switch (step.kind()) {
            case ACTION -> executeAction(execution, step);
            case CONDITION -> executeCondition(execution, step);
            case DELAY -> executeDelay(step);
            case APPROVAL -> executeApproval(execution, step);
            case NOTIFICATION -> executeNotification(execution, step);
        };

        metrics.stepCompleted(step.kind(), (System.nanoTime() - startNanos) / 1_000_000);
        return outcome;
    }

    // ========== Step Kinds ==========

    private StepOutcome executeAction(WorkflowExecution execution, WorkflowStep step) {
        ActionConfig config = config(step, ActionConfig.class);
        StepHandler handler = handlers.find(config.action())
            .orElseThrow(() -> new StepExecutionException(step.id(), HANDLER_NOT_FOUND,
                "No handler registered for action: " + config.action(), false, null));

        StepResult result = invoke(handler, execution, step, config.parameters());
        return StepOutcome.advance(step.nextStep().orElse(null), result.contextUpdates());
    }

    private StepOutcome executeCondition(WorkflowExecution execution, WorkflowStep step) {
        ConditionConfig config = config(step, ConditionConfig.class);
        boolean result = conditionEvaluator.evaluate(config.condition(), execution.context());
        String next = step.branch(result).orElse(null);

        log.debug("Condition {} {} {} evaluated to {}, next step {}",
            config.condition().field(), config.condition().operator().wireName(),
            config.condition().value(), result, next);

        return StepOutcome.advance(next);
    }

    private StepOutcome executeDelay(WorkflowStep step) {
        DelayConfig config = config(step, DelayConfig.class);
        if (config.delaySeconds() < 0) {
            throw new StepExecutionException(step.id(), INVALID_CONFIGURATION,
                "Delay must not be negative: " + config.delaySeconds(), false, null);
        }
        if (config.delaySeconds() == 0) {
            return StepOutcome.advance(step.nextStep().orElse(null));
        }
        return StepOutcome.delay(Duration.ofSeconds(config.delaySeconds()));
    }

    private StepOutcome executeApproval(WorkflowExecution execution, WorkflowStep step) {
        ApprovalConfig config = config(step, ApprovalConfig.class);
        ApprovalRequest request = approvalGate.request(execution.id(), step.id(), config.approverId());
        return StepOutcome.awaitApproval(request);
    }

    /**
     * Notifications are best-effort: a failure is logged and the execution moves on,
     * unless the step's policy says STOP.
     */
    private StepOutcome executeNotification(WorkflowExecution execution, WorkflowStep step) {
        NotificationConfig config = config(step, NotificationConfig.class);
        String next = step.nextStep().orElse(null);
        boolean mustSucceed = step.errorHandling().onError() == OnError.STOP;

        StepHandler handler = handlers.find(config.handler()).orElse(null);
        if (handler == null) {
            if (mustSucceed) {
                throw new StepExecutionException(step.id(), HANDLER_NOT_FOUND,
                    "No notification handler registered: " + config.handler(), false, null);
            }
            log.warn("No notification handler registered: {}, skipping step {}", config.handler(), step.id());
            return StepOutcome.advance(next);
        }

        try {
            StepResult result = invoke(handler, execution, step, config.parameters());
            return StepOutcome.advance(next, result.contextUpdates());
        } catch (StepExecutionException e) {
            if (mustSucceed) {
                throw e;
            }
            log.warn("Notification step {} failed, continuing: {}", step.id(), e.getMessage());
            return StepOutcome.advance(next);
        }
    }

    // ========== Internal Methods ==========

    private StepResult invoke(
            StepHandler handler,
            WorkflowExecution execution,
            WorkflowStep step,
            Map<String, Object> parameters) {
        StepHandlerContext context = new StepHandlerContext(
            execution.id(),
            execution.workflowId(),
            step.id(),
            execution.retryCount() + 1,
            parameters,
            execution.context(),
            objectMapper
        );

        StepResult result;
        try {
            result = handler.handle(context);
        } catch (StepHandlerException e) {
            throw new StepExecutionException(step.id(), e.getErrorCode(), e.getMessage(), e.isRetryable(), e);
        } catch (RuntimeException e) {
            throw new StepExecutionException(step.id(), HANDLER_ERROR,
                "Handler threw " + e.getClass().getSimpleName() + ": " + e.getMessage(), true, e);
        }

        if (result == null) {
            return StepResult.success();
        }
        if (!result.succeeded()) {
            String error = result.error() != null ? result.error() : "Step " + step.id() + " reported failure";
            throw new StepExecutionException(step.id(), StepExecutionException.ERROR_CODE, error, result.retryable(), null);
        }
        return result;
    }

    private static <T extends StepConfig> T config(WorkflowStep step, Class<T> type) {
        try {
            return step.configAs(type);
        } catch (IllegalStateException e) {
            throw new StepExecutionException(step.id(), INVALID_CONFIGURATION, e.getMessage(), false, e);
        }
    }
}
