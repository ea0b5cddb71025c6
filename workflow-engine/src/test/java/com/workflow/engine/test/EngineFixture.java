package com.workflow.engine.test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.workflow.core.model.WorkflowDefinition;
import com.workflow.core.model.WorkflowStep;
import com.workflow.core.test.TimeController;
import com.workflow.engine.analytics.WorkflowAnalyticsService;
import com.workflow.engine.approval.ApprovalGateManager;
import com.workflow.engine.condition.ConditionEvaluator;
import com.workflow.engine.coordinator.ExecutionCoordinator;
import com.workflow.engine.coordinator.ExecutionLockManager;
import com.workflow.engine.definition.WorkflowDefinitionService;
import com.workflow.engine.event.EventPublisher;
import com.workflow.engine.executor.StepExecutor;
import com.workflow.engine.metrics.WorkflowMetrics;
import com.workflow.engine.persistence.InMemoryApprovalRequestRepository;
import com.workflow.engine.persistence.InMemoryContinuationRepository;
import com.workflow.engine.persistence.InMemoryWorkflowDefinitionRepository;
import com.workflow.engine.persistence.InMemoryWorkflowExecutionRepository;
import com.workflow.engine.retry.RetryController;
import com.workflow.handler.StepHandlerRegistry;
import com.workflow.scheduler.ContinuationScheduler;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * A fully wired engine over in-memory stores, for tests.
 *
 * Steps run on the calling thread and time only moves through {@link #time},
 * so a test drives delays and retries explicitly with {@link #advanceAndFire(Duration)}.
 * The scheduler is never started.
 */
public class EngineFixture {

    public final TimeController time = TimeController.frozen();
    public final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    public final WorkflowMetrics metrics = new WorkflowMetrics(meterRegistry);
    public final RecordingEventSink events = new RecordingEventSink();
    public final EventPublisher publisher = new EventPublisher(List.of(events), time);

    public final InMemoryWorkflowDefinitionRepository definitions = new InMemoryWorkflowDefinitionRepository();
    public final InMemoryWorkflowExecutionRepository executions = new InMemoryWorkflowExecutionRepository();
    public final InMemoryApprovalRequestRepository approvals = new InMemoryApprovalRequestRepository();
    public final InMemoryContinuationRepository continuations = new InMemoryContinuationRepository();

    public final StepHandlerRegistry handlers = new StepHandlerRegistry();
    public final ContinuationScheduler scheduler = new ContinuationScheduler(continuations, time);
    public final ConditionEvaluator conditionEvaluator = new ConditionEvaluator();
    public final ApprovalGateManager approvalGate =
        new ApprovalGateManager(approvals, executions, publisher, metrics, time);
    public final StepExecutor stepExecutor =
        new StepExecutor(handlers, conditionEvaluator, approvalGate, metrics, objectMapper);
    public final RetryController retryController =
        new RetryController(executions, scheduler, publisher, metrics, time);
    public final ExecutionLockManager locks = new ExecutionLockManager();
    public final ExecutionCoordinator coordinator = new ExecutionCoordinator(
        definitions, executions, approvals, stepExecutor, retryController,
        scheduler, locks, publisher, metrics, Runnable::run, time);

    public final WorkflowDefinitionService definitionService =
        new WorkflowDefinitionService(definitions, executions, time);
    public final WorkflowAnalyticsService analytics = new WorkflowAnalyticsService(executions);

    public EngineFixture() {
        approvalGate.setExecutionControl(coordinator);
        scheduler.setCallback(coordinator);
    }

    /**
     * Register and activate a workflow made of the given steps, first step first.
     */
    public WorkflowDefinition activeWorkflow(WorkflowStep... steps) {
        WorkflowDefinition created = definitionService.create(WorkflowDefinition.builder()
            .id("wf-" + UUID.randomUUID())
            .name("test workflow")
            .steps(steps)
            .build());
        return definitionService.activate(created.id());
    }

    /**
     * Move the clock forward and fire whatever became due.
     *
     * @return number of continuations fired
     */
    public int advanceAndFire(Duration duration) {
        time.advance(duration);
        return scheduler.runDueContinuations();
    }
}
