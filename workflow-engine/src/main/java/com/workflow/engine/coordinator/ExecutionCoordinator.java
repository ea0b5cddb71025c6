package com.workflow.engine.coordinator;

import com.workflow.core.exception.DefinitionNotFoundException;
import com.workflow.core.exception.ExecutionNotFoundException;
import com.workflow.core.exception.InactiveWorkflowException;
import com.workflow.core.exception.InvalidStateTransitionException;
import com.workflow.core.exception.OptimisticLockException;
import com.workflow.core.exception.StepExecutionException;
import com.workflow.core.exception.WorkflowValidationException;
import com.workflow.core.model.ApprovalRequest;
import com.workflow.core.model.ApprovalStatus;
import com.workflow.core.model.ExecutionStatus;
import com.workflow.core.model.PauseReason;
import com.workflow.core.model.WorkflowDefinition;
import com.workflow.core.model.WorkflowEventType;
import com.workflow.core.model.WorkflowExecution;
import com.workflow.core.model.WorkflowStep;
import com.workflow.core.repository.ApprovalRequestRepository;
import com.workflow.core.repository.ExecutionQuery;
import com.workflow.core.repository.WorkflowDefinitionRepository;
import com.workflow.core.repository.WorkflowExecutionRepository;
import com.workflow.engine.event.EventPublisher;
import com.workflow.engine.executor.StepExecutor;
import com.workflow.engine.executor.StepOutcome;
import com.workflow.engine.logging.LoggingContext;
import com.workflow.engine.metrics.WorkflowMetrics;
import com.workflow.engine.retry.RetryController;
import com.workflow.engine.retry.RetryDecision;
import com.workflow.engine.service.WorkflowExecutionService;
import com.workflow.scheduler.ContinuationCallback;
import com.workflow.scheduler.ContinuationScheduler;
import com.workflow.scheduler.ContinuationType;
import com.workflow.scheduler.ScheduledContinuation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Drives executions through their step graph.
 * This is the central control plane component.
 *
 * The step loop runs on the dispatch executor under the execution's lock, so at most
 * one dispatch per execution is in flight. Every transition is persisted with a
 * compare-and-set on the execution's sequence number; pause and cancel write without
 * taking the lock, and a running loop that loses the race simply stops.
 *
 * Suspensions:
 * - delay: the execution stays RUNNING at the delay step; a DELAY continuation moves it on
 * - approval: PAUSED (APPROVAL) until the gate resumes or cancels it
 * - retry backoff: a RETRY continuation re-dispatches the same step
 */
public class ExecutionCoordinator implements WorkflowExecutionService, ContinuationCallback {

    private static final Logger log = LoggerFactory.getLogger(ExecutionCoordinator.class);

    public static final String UNEXPECTED_ERROR = "UNEXPECTED_STEP_ERROR";

    private static final int MAX_UPDATE_ATTEMPTS = 5;

    private final WorkflowDefinitionRepository definitionRepository;
    private final WorkflowExecutionRepository executionRepository;
    private final ApprovalRequestRepository approvalRepository;
    private final StepExecutor stepExecutor;
    private final RetryController retryController;
    private final ContinuationScheduler scheduler;
    private final ExecutionLockManager locks;
    private final EventPublisher events;
    private final WorkflowMetrics metrics;
    private final Executor dispatchExecutor;
    private final Clock clock;

    public ExecutionCoordinator(
            WorkflowDefinitionRepository definitionRepository,
            WorkflowExecutionRepository executionRepository,
            ApprovalRequestRepository approvalRepository,
            StepExecutor stepExecutor,
            RetryController retryController,
            ContinuationScheduler scheduler,
            ExecutionLockManager locks,
            EventPublisher events,
            WorkflowMetrics metrics,
            Executor dispatchExecutor,
            Clock clock) {
        this.definitionRepository = definitionRepository;
        this.executionRepository = executionRepository;
        this.approvalRepository = approvalRepository;
        this.stepExecutor = stepExecutor;
        this.retryController = retryController;
        this.scheduler = scheduler;
        this.locks = locks;
        this.events = events;
        this.metrics = metrics;
        this.dispatchExecutor = dispatchExecutor;
        this.clock = clock;
    }

    @Override
    public WorkflowExecution start(WorkflowDefinition requested, Map<String, Object> initialContext) {
        // Run what is stored, not what the caller holds
        WorkflowDefinition definition = definitionRepository.find(requested.id(), requested.version())
            .orElseThrow(() -> new DefinitionNotFoundException(requested.id(), requested.version()));
        WorkflowDefinition latest = definitionRepository.findLatest(definition.id()).orElse(definition);
        if (!latest.isActive()) {
            throw new InactiveWorkflowException(latest.id(), latest.status());
        }
        if (!definition.isActive()) {
            throw new InactiveWorkflowException(definition.id(), definition.status());
        }
        if (definition.steps().isEmpty()) {
            throw new WorkflowValidationException("steps", "cannot be empty");
        }

        WorkflowExecution execution = WorkflowExecution.start(definition, initialContext, clock.instant());
        executionRepository.save(execution);

        metrics.executionStarted();
        events.publish(WorkflowEventType.EXECUTION_STARTED, execution, execution.currentStepId());
        log.info("Started execution {} of workflow {} v{}",
            execution.id(), definition.id(), definition.version());

        submit(execution.id(), execution.sequenceNumber());
        return execution;
    }

    @Override
    public WorkflowExecution start(String workflowId, Map<String, Object> initialContext) {
        WorkflowDefinition definition = definitionRepository.findLatest(workflowId)
            .orElseThrow(() -> new DefinitionNotFoundException(workflowId));
        return start(definition, initialContext);
    }

    @Override
    public WorkflowExecution pause(String executionId) {
        WorkflowExecution paused = updateWithRetry(executionId, current -> {
            if (current.status() != ExecutionStatus.RUNNING) {
                throw new InvalidStateTransitionException(executionId, current.status(), ExecutionStatus.PAUSED);
            }
            return current.paused(PauseReason.OPERATOR, clock.instant());
        });

        scheduler.cancelAll(executionId);

        metrics.executionPaused(PauseReason.OPERATOR);
        events.publish(WorkflowEventType.EXECUTION_PAUSED, paused, paused.currentStepId(),
            Map.of("reason", PauseReason.OPERATOR.name()));
        log.info("Paused execution {} at step {}", executionId, paused.currentStepId());
        return paused;
    }

    @Override
    public WorkflowExecution resume(String executionId) {
        WorkflowExecution resumed = locks.callLocked(executionId, () ->
            updateWithRetry(executionId, current -> {
                if (current.status() != ExecutionStatus.PAUSED) {
                    throw new InvalidStateTransitionException(executionId, current.status(), ExecutionStatus.RUNNING);
                }
                return current.pauseReason() == PauseReason.APPROVAL
                    ? pastApproval(current)
                    : current.withStatus(ExecutionStatus.RUNNING, clock.instant());
            })
        );

        metrics.executionResumed();
        events.publish(WorkflowEventType.EXECUTION_RESUMED, resumed, resumed.currentStepId());
        log.info("Resumed execution {} at step {}", executionId, resumed.currentStepId());

        if (resumed.status() == ExecutionStatus.COMPLETED) {
            onCompleted(resumed);
        } else {
            submit(executionId, resumed.sequenceNumber());
        }
        return resumed;
    }

    @Override
    public WorkflowExecution cancel(String executionId) {
        AtomicReference<ExecutionStatus> previous = new AtomicReference<>();
        WorkflowExecution result = updateWithRetry(executionId, current -> {
            previous.set(current.status());
            return current.isTerminal()
                ? current
                : current.withStatus(ExecutionStatus.CANCELLED, clock.instant());
        });

        if (previous.get().isTerminal()) {
            log.debug("Execution {} already {}, cancel is a no-op", executionId, previous.get());
            return result;
        }

        scheduler.cancelAll(executionId);

        metrics.executionCancelled(previous.get() == ExecutionStatus.PAUSED);
        events.publish(WorkflowEventType.EXECUTION_CANCELLED, result, result.currentStepId(),
            Map.of("previousStatus", previous.get().name()));
        log.info("Cancelled execution {} (was {})", executionId, previous.get());
        return result;
    }

    @Override
    public WorkflowExecution getExecution(String executionId) {
        return load(executionId);
    }

    @Override
    public List<WorkflowExecution> listExecutions(ExecutionQuery query) {
        return executionRepository.find(query != null ? query : ExecutionQuery.all());
    }

    /**
     * Re-enter a RUNNING execution at its current step, e.g. after a restart.
     * Executions waiting on a continuation are left to the scheduler.
     *
     * @return true if a dispatch was submitted
     */
    public boolean recover(String executionId) {
        WorkflowExecution execution = load(executionId);
        if (!execution.isRunning()) {
            return false;
        }
        if (scheduler.hasPending(executionId)) {
            log.debug("Execution {} has a pending continuation, not recovering", executionId);
            return false;
        }

        log.info("Recovering execution {} at step {}", executionId, execution.currentStepId());
        long expectedSequence = execution.sequenceNumber();
        dispatch(executionId, () -> {
            WorkflowExecution current = executionRepository.findById(executionId).orElse(null);
            // A dispatch already in flight may have parked it on a delay or retry meanwhile
            if (current == null
                    || current.sequenceNumber() != expectedSequence
                    || !current.isRunning()
                    || scheduler.hasPending(executionId)) {
                log.debug("Skipping stale recovery of execution {}", executionId);
                return;
            }
            drive(current);
        });
        return true;
    }

    @Override
    public void onContinuationDue(ScheduledContinuation continuation) {
        dispatch(continuation.executionId(), () -> handleContinuation(continuation));
    }

    // ========== Step Loop ==========

    private void submit(String executionId, long expectedSequence) {
        dispatch(executionId, () -> {
            WorkflowExecution execution = executionRepository.findById(executionId).orElse(null);
            if (execution == null || execution.sequenceNumber() != expectedSequence) {
                log.debug("Skipping stale dispatch of execution {}", executionId);
                return;
            }
            drive(execution);
        });
    }

    /**
     * Run a task on the dispatch executor under the execution's lock.
     * Nothing thrown by the task escapes.
     */
    private void dispatch(String executionId, Runnable task) {
        try {
            dispatchExecutor.execute(() -> {
                try {
                    locks.runLocked(executionId, task);
                } catch (OptimisticLockException e) {
                    log.debug("Execution {} changed concurrently, stopping dispatch: {}", executionId, e.getMessage());
                } catch (Exception e) {
                    log.error("Dispatch of execution {} failed", executionId, e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Dispatch of execution {} rejected, leaving it for recovery: {}", executionId, e.getMessage());
        }
    }

    private void handleContinuation(ScheduledContinuation continuation) {
        WorkflowExecution execution = executionRepository.findById(continuation.executionId()).orElse(null);
        if (execution == null
                || !execution.isRunning()
                || execution.sequenceNumber() != continuation.executionSequence()
                || !continuation.stepId().equals(execution.currentStepId())) {
            log.debug("Ignoring stale {} continuation {} for execution {}",
                continuation.type(), continuation.id(), continuation.executionId());
            return;
        }

        if (continuation.type() == ContinuationType.DELAY) {
            WorkflowDefinition definition = loadDefinition(execution);
            String next = definition.getStep(continuation.stepId())
                .flatMap(WorkflowStep::nextStep)
                .orElse(null);
            log.debug("Delay at step {} elapsed for execution {}", continuation.stepId(), execution.id());

            WorkflowExecution advanced = advance(execution, next);
            if (advanced != null) {
                drive(advanced);
            }
        } else {
            drive(execution);
        }
    }

    /**
     * The step loop: dispatch the current step until the execution suspends or finishes.
     */
    private void drive(WorkflowExecution start) {
        WorkflowDefinition definition = loadDefinition(start);

        try (LoggingContext ignored = LoggingContext.forExecution(start.id(), start.workflowId())) {
            WorkflowExecution current = start;
            while (current != null && current.isRunning()) {
                Optional<WorkflowStep> step = definition.getStep(current.currentStepId());
                if (step.isEmpty()) {
                    complete(current);
                    return;
                }
                current = dispatchStep(current, step.get());
            }
        }
    }

    /**
     * Dispatch one step and apply the result.
     *
     * @return the execution to continue with, or null if the loop must stop
     */
    private WorkflowExecution dispatchStep(WorkflowExecution execution, WorkflowStep step) {
        try (LoggingContext ignored = LoggingContext.forStep(
                execution.id(), execution.workflowId(), step.id(), execution.retryCount() + 1)) {
            StepOutcome outcome;
            try {
                outcome = stepExecutor.execute(execution, step);
            } catch (StepExecutionException e) {
                return onFailure(execution, step, e);
            } catch (OptimisticLockException e) {
                throw e;
            } catch (RuntimeException e) {
                log.error("Unexpected error dispatching step {} of execution {}", step.id(), execution.id(), e);
                return onFailure(execution, step, new StepExecutionException(
                    step.id(), UNEXPECTED_ERROR, String.valueOf(e.getMessage()), true, e));
            }
            return applyOutcome(execution, step, outcome);
        }
    }

    private WorkflowExecution applyOutcome(WorkflowExecution execution, WorkflowStep step, StepOutcome outcome) {
        WorkflowExecution updated = execution.withContextUpdates(outcome.contextUpdates());

        return switch (outcome.type()) {
            case ADVANCE -> {
                events.publish(WorkflowEventType.STEP_COMPLETED, updated, step.id(),
                    payload("kind", step.kind().name(), "nextStepId", outcome.nextStepId()));
                yield advance(updated, outcome.nextStepId());
            }
            case DELAY -> {
                WorkflowExecution saved = updated == execution ? execution : executionRepository.update(updated);
                scheduler.schedule(saved.id(), saved.sequenceNumber(), step.id(), ContinuationType.DELAY, outcome.delay());
                events.publish(WorkflowEventType.DELAY_SCHEDULED, saved, step.id(),
                    Map.of("delayMillis", outcome.delay().toMillis()));
                log.info("Execution {} waiting {} at step {}", saved.id(), outcome.delay(), step.id());
                yield null;
            }
            case AWAIT_APPROVAL -> {
                WorkflowExecution paused = pauseForApproval(updated, step);
                metrics.executionPaused(PauseReason.APPROVAL);
                events.publish(WorkflowEventType.EXECUTION_PAUSED, paused, step.id(), Map.of(
                    "reason", PauseReason.APPROVAL.name(),
                    "requestId", outcome.approvalRequest().id()
                ));
                log.info("Execution {} paused for approval {} at step {}",
                    paused.id(), outcome.approvalRequest().id(), step.id());
                yield null;
            }
        };
    }

    private WorkflowExecution onFailure(WorkflowExecution execution, WorkflowStep step, StepExecutionException failure) {
        RetryDecision decision = retryController.handleFailure(execution, step, failure);
        if (!decision.continuesLoop()) {
            return null;
        }
        return advance(decision.execution(), decision.nextStepId());
    }

    // ========== Transitions ==========

    /**
     * Move to the next step, or complete if there is none.
     *
     * @return the persisted execution, or null if it completed
     */
    private WorkflowExecution advance(WorkflowExecution execution, String nextStepId) {
        if (nextStepId == null) {
            complete(execution);
            return null;
        }
        return executionRepository.update(execution.advancedTo(nextStepId, clock.instant()));
    }

    private void complete(WorkflowExecution execution) {
        WorkflowExecution saved = executionRepository.update(execution.completed(clock.instant()));
        onCompleted(saved);
    }

    private void onCompleted(WorkflowExecution completed) {
        metrics.executionCompleted(Duration.between(completed.startedAt(), completed.completedAt()));
        events.publish(WorkflowEventType.EXECUTION_COMPLETED, completed, null);
        log.info("Execution {} completed", completed.id());
    }

    /**
     * Park the execution on its approval request.
     *
     * An operator pause can land between the request being created and this write.
     * The request is then the only way forward, so the pause is taken over as an
     * approval pause; otherwise the approval would be dispatched again on resume.
     */
    private WorkflowExecution pauseForApproval(WorkflowExecution execution, WorkflowStep step) {
        try {
            return executionRepository.update(execution.paused(PauseReason.APPROVAL, clock.instant()));
        } catch (OptimisticLockException e) {
            WorkflowExecution current = load(execution.id());
            if (current.status() != ExecutionStatus.PAUSED
                    || current.pauseReason() != PauseReason.OPERATOR
                    || !step.id().equals(current.currentStepId())) {
                throw e;
            }
            log.info("Execution {} was paused by an operator while requesting approval at step {}, awaiting approval",
                current.id(), step.id());
            return executionRepository.update(current.toBuilder()
                .pauseReason(PauseReason.APPROVAL)
                .updatedAt(clock.instant())
                .build());
        }
    }

    /**
     * Resume an approval pause: allowed once the approval is granted, and moves past the step.
     */
    private WorkflowExecution pastApproval(WorkflowExecution current) {
        String stepId = current.currentStepId();
        Optional<ApprovalRequest> latest = approvalRepository.findLatest(current.id(), stepId);
        if (latest.isEmpty() || latest.get().status() != ApprovalStatus.APPROVED) {
            throw new InvalidStateTransitionException(String.format(
                "Execution %s is awaiting approval at step %s", current.id(), stepId));
        }

        String next = loadDefinition(current).getStep(stepId)
            .flatMap(WorkflowStep::nextStep)
            .orElse(null);

        WorkflowExecution running = current.withStatus(ExecutionStatus.RUNNING, clock.instant());
        return next != null
            ? running.advancedTo(next, clock.instant())
            : running.completed(clock.instant());
    }

    /**
     * Read-modify-write with compare-and-set, re-reading on conflict.
     * Returning the input unchanged from {@code change} skips the write.
     */
    private WorkflowExecution updateWithRetry(String executionId, UnaryOperator<WorkflowExecution> change) {
        OptimisticLockException lastConflict = null;
        for (int attempt = 1; attempt <= MAX_UPDATE_ATTEMPTS; attempt++) {
            WorkflowExecution current = load(executionId);
            WorkflowExecution changed = change.apply(current);
            if (changed == current) {
                return current;
            }
            try {
                return executionRepository.update(changed);
            } catch (OptimisticLockException e) {
                lastConflict = e;
                log.debug("Conflict updating execution {} (attempt {}), re-reading", executionId, attempt);
            }
        }
        throw lastConflict;
    }

    private WorkflowExecution load(String executionId) {
        return executionRepository.findById(executionId)
            .orElseThrow(() -> new ExecutionNotFoundException(executionId));
    }

    private WorkflowDefinition loadDefinition(WorkflowExecution execution) {
        return definitionRepository.find(execution.workflowId(), execution.definitionVersion())
            .orElseThrow(() -> new DefinitionNotFoundException(execution.workflowId(), execution.definitionVersion()));
    }

    private static Map<String, Object> payload(String k1, Object v1, String k2, Object v2) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(k1, v1);
        payload.put(k2, v2);
        return payload;
    }
}
