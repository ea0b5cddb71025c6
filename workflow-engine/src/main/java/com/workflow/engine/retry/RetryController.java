package com.workflow.engine.retry;

import com.workflow.core.exception.MaxRetriesExceededException;
import com.workflow.core.exception.OptimisticLockException;
import com.workflow.core.exception.StepExecutionException;
import com.workflow.core.model.ErrorHandlingPolicy;
import com.workflow.core.model.WorkflowEventType;
import com.workflow.core.model.WorkflowExecution;
import com.workflow.core.model.WorkflowStep;
import com.workflow.core.repository.WorkflowExecutionRepository;
import com.workflow.engine.event.EventPublisher;
import com.workflow.engine.metrics.WorkflowMetrics;
import com.workflow.scheduler.ContinuationScheduler;
import com.workflow.scheduler.ContinuationType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Failure accounting and bounded retry for step dispatches.
 *
 * On each failure the execution's retryCount is incremented and the error recorded.
 * While the step's policy allows another attempt, a RETRY continuation re-dispatches
 * the same step after the backoff delay; otherwise onError decides:
 * STOP fails the execution, CONTINUE and SKIP move past the step.
 * Non-retryable failures go straight to onError.
 */
public class RetryController {

    private static final Logger log = LoggerFactory.getLogger(RetryController.class);

    private final WorkflowExecutionRepository executionRepository;
    private final ContinuationScheduler scheduler;
    private final EventPublisher events;
    private final WorkflowMetrics metrics;
    private final Clock clock;

    public RetryController(
            WorkflowExecutionRepository executionRepository,
            ContinuationScheduler scheduler,
            EventPublisher events,
            WorkflowMetrics metrics,
            Clock clock) {
        this.executionRepository = executionRepository;
        this.scheduler = scheduler;
        this.events = events;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Handle a failed dispatch of the execution's current step.
     *
     * @param execution the execution as read before the dispatch
     * @param step      the step that failed
     * @param failure   the failure
     * @return the decision, with the execution as persisted
     * @throws OptimisticLockException if the execution was changed concurrently (paused, cancelled)
     */
    public RetryDecision handleFailure(WorkflowExecution execution, WorkflowStep step, StepExecutionException failure) {
        Instant now = clock.instant();
        ErrorHandlingPolicy policy = step.errorHandling();

        WorkflowExecution failed = execution.withStepFailure(failure.getMessage(), now);
        int failures = failed.retryCount();
        boolean willRetry = failure.isRetryable() && policy.hasMoreAttempts(failures);

        metrics.stepFailed(step.kind(), failure.getErrorCode(), willRetry);

        if (willRetry) {
            return scheduleRetry(failed, step, failure, policy.computeRetryDelay(failures));
        }

        events.publish(WorkflowEventType.STEP_FAILED, failed, step.id(), failurePayload(failure, failures));

        return switch (policy.onError()) {
            case STOP -> failExecution(failed, step, failure, failures, now);
            case CONTINUE, SKIP -> {
                WorkflowExecution saved = executionRepository.update(failed);
                log.warn("Step {} failed after {} attempt(s), continuing past it ({}): {}",
                    step.id(), failures, policy.onError(), failure.getMessage());
                yield RetryDecision.advance(saved, step.nextStep().orElse(null));
            }
        };
    }

    // ========== Internal Methods ==========

    private RetryDecision scheduleRetry(
            WorkflowExecution failed,
            WorkflowStep step,
            StepExecutionException failure,
            Duration delay) {
        WorkflowExecution saved = executionRepository.update(failed);
        scheduler.schedule(saved.id(), saved.sequenceNumber(), step.id(), ContinuationType.RETRY, delay);

        metrics.stepRetried(step.kind());

        Map<String, Object> payload = failurePayload(failure, saved.retryCount());
        payload.put("delayMillis", delay.toMillis());
        events.publish(WorkflowEventType.RETRY_SCHEDULED, saved, step.id(), payload);

        log.warn("Step {} failed (attempt {}/{}), retrying in {}: {}",
            step.id(), saved.retryCount(), step.errorHandling().maxRetries(), delay, failure.getMessage());
        return RetryDecision.retry(saved, delay);
    }

    private RetryDecision failExecution(
            WorkflowExecution failed,
            WorkflowStep step,
            StepExecutionException failure,
            int failures,
            Instant now) {
        String error = failure.isRetryable()
            ? new MaxRetriesExceededException(step.id(), failures, failure.getMessage()).getMessage()
            : failure.getMessage();

        WorkflowExecution saved = executionRepository.update(failed.failed(error, now));

        metrics.executionFailed(failure.isRetryable() ? MaxRetriesExceededException.ERROR_CODE : failure.getErrorCode());
        events.publish(WorkflowEventType.EXECUTION_FAILED, saved, step.id(), Map.of("error", error));

        log.info("Execution {} failed at step {}: {}", saved.id(), step.id(), error);
        return RetryDecision.fail(saved);
    }

    private static Map<String, Object> failurePayload(StepExecutionException failure, int attempt) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("errorCode", failure.getErrorCode());
        payload.put("error", failure.getMessage());
        payload.put("attempt", attempt);
        payload.put("retryable", failure.isRetryable());
        return payload;
    }
}
