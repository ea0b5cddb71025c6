package com.workflow.engine.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.workflow.core.repository.ApprovalRequestRepository;
import com.workflow.core.repository.WorkflowDefinitionRepository;
import com.workflow.core.repository.WorkflowExecutionRepository;
import com.workflow.engine.analytics.WorkflowAnalyticsService;
import com.workflow.engine.approval.ApprovalGateManager;
import com.workflow.engine.condition.ConditionEvaluator;
import com.workflow.engine.coordinator.ExecutionCoordinator;
import com.workflow.engine.coordinator.ExecutionLockManager;
import com.workflow.engine.definition.WorkflowDefinitionService;
import com.workflow.engine.event.EventPublisher;
import com.workflow.engine.event.EventSink;
import com.workflow.engine.event.LoggingEventSink;
import com.workflow.engine.executor.StepExecutor;
import com.workflow.engine.metrics.WorkflowMetrics;
import com.workflow.engine.persistence.InMemoryApprovalRequestRepository;
import com.workflow.engine.persistence.InMemoryContinuationRepository;
import com.workflow.engine.persistence.InMemoryWorkflowDefinitionRepository;
import com.workflow.engine.persistence.InMemoryWorkflowExecutionRepository;
import com.workflow.engine.persistence.jdbc.JdbcApprovalRequestRepository;
import com.workflow.engine.persistence.jdbc.JdbcContinuationRepository;
import com.workflow.engine.persistence.jdbc.JdbcWorkflowDefinitionRepository;
import com.workflow.engine.persistence.jdbc.JdbcWorkflowExecutionRepository;
import com.workflow.engine.retry.RetryController;
import com.workflow.handler.StepHandlerRegistry;
import com.workflow.scheduler.ContinuationRepository;
import com.workflow.scheduler.ContinuationScheduler;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Spring wiring of the workflow engine.
 *
 * The coordinator is registered as the approval gate's execution control and as the
 * scheduler's callback here; both depend on it and it depends on both.
 */
@Configuration
@EnableConfigurationProperties(WorkflowEngineProperties.class)
public class WorkflowEngineConfiguration {

    // ========== Infrastructure ==========

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    public WorkflowMetrics workflowMetrics(MeterRegistry meterRegistry) {
        return new WorkflowMetrics(meterRegistry);
    }

    @Bean
    @ConditionalOnMissingBean
    public StepHandlerRegistry stepHandlerRegistry() {
        return new StepHandlerRegistry();
    }

    @Bean
    public LoggingEventSink loggingEventSink() {
        return new LoggingEventSink();
    }

    @Bean
    public EventPublisher eventPublisher(ObjectProvider<EventSink> sinks, Clock clock) {
        List<EventSink> ordered = sinks.orderedStream().collect(Collectors.toList());
        return new EventPublisher(ordered, clock);
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService workflowDispatchExecutor(WorkflowEngineProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(properties.getDispatchThreads(), runnable -> {
            Thread thread = new Thread(runnable, "workflow-dispatch-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    // ========== Engine Components ==========

    @Bean
    public ContinuationScheduler continuationScheduler(
            ContinuationRepository continuationRepository,
            Clock clock,
            WorkflowEngineProperties properties) {
        WorkflowEngineProperties.Scheduler settings = properties.getScheduler();
        return new ContinuationScheduler(
            continuationRepository,
            clock,
            settings.getPollInterval(),
            settings.getBatchSize(),
            settings.getThreads());
    }

    @Bean
    public WorkflowEngineLifecycle workflowEngineLifecycle(ContinuationScheduler continuationScheduler) {
        return new WorkflowEngineLifecycle(continuationScheduler);
    }

    @Bean
    public ConditionEvaluator conditionEvaluator() {
        return new ConditionEvaluator();
    }

    @Bean
    public ApprovalGateManager approvalGateManager(
            ApprovalRequestRepository approvalRepository,
            WorkflowExecutionRepository executionRepository,
            EventPublisher eventPublisher,
            WorkflowMetrics metrics,
            Clock clock) {
        return new ApprovalGateManager(approvalRepository, executionRepository, eventPublisher, metrics, clock);
    }

    @Bean
    public StepExecutor stepExecutor(
            StepHandlerRegistry handlers,
            ConditionEvaluator conditionEvaluator,
            ApprovalGateManager approvalGateManager,
            WorkflowMetrics metrics,
            ObjectMapper objectMapper) {
        return new StepExecutor(handlers, conditionEvaluator, approvalGateManager, metrics, objectMapper);
    }

    @Bean
    public RetryController retryController(
            WorkflowExecutionRepository executionRepository,
            ContinuationScheduler continuationScheduler,
            EventPublisher eventPublisher,
            WorkflowMetrics metrics,
            Clock clock) {
        return new RetryController(executionRepository, continuationScheduler, eventPublisher, metrics, clock);
    }

    @Bean
    public ExecutionLockManager executionLockManager() {
        return new ExecutionLockManager();
    }

    @Bean
    public ExecutionCoordinator executionCoordinator(
            WorkflowDefinitionRepository definitionRepository,
            WorkflowExecutionRepository executionRepository,
            ApprovalRequestRepository approvalRepository,
            StepExecutor stepExecutor,
            RetryController retryController,
            ContinuationScheduler continuationScheduler,
            ExecutionLockManager executionLockManager,
            EventPublisher eventPublisher,
            WorkflowMetrics metrics,
            ExecutorService workflowDispatchExecutor,
            ApprovalGateManager approvalGateManager,
            Clock clock) {
        ExecutionCoordinator coordinator = new ExecutionCoordinator(
            definitionRepository,
            executionRepository,
            approvalRepository,
            stepExecutor,
            retryController,
            continuationScheduler,
            executionLockManager,
            eventPublisher,
            metrics,
            workflowDispatchExecutor,
            clock);

        approvalGateManager.setExecutionControl(coordinator);
        continuationScheduler.setCallback(coordinator);
        return coordinator;
    }

    @Bean
    public WorkflowDefinitionService workflowDefinitionService(
            WorkflowDefinitionRepository definitionRepository,
            WorkflowExecutionRepository executionRepository,
            Clock clock) {
        return new WorkflowDefinitionService(definitionRepository, executionRepository, clock);
    }

    @Bean
    public WorkflowAnalyticsService workflowAnalyticsService(WorkflowExecutionRepository executionRepository) {
        return new WorkflowAnalyticsService(executionRepository);
    }

    // ========== Stores ==========

    @Configuration
    @ConditionalOnProperty(prefix = "workflow.engine", name = "store", havingValue = "memory", matchIfMissing = true)
    static class InMemoryStores {

        @Bean
        public WorkflowDefinitionRepository workflowDefinitionRepository() {
            return new InMemoryWorkflowDefinitionRepository();
        }

        @Bean
        public WorkflowExecutionRepository workflowExecutionRepository() {
            return new InMemoryWorkflowExecutionRepository();
        }

        @Bean
        public ApprovalRequestRepository approvalRequestRepository() {
            return new InMemoryApprovalRequestRepository();
        }

        @Bean
        public ContinuationRepository continuationRepository() {
            return new InMemoryContinuationRepository();
        }
    }

    @Configuration
    @ConditionalOnProperty(prefix = "workflow.engine", name = "store", havingValue = "jdbc")
    static class JdbcStores {

        @Bean
        public WorkflowDefinitionRepository workflowDefinitionRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
            return new JdbcWorkflowDefinitionRepository(jdbcTemplate, objectMapper);
        }

        @Bean
        public WorkflowExecutionRepository workflowExecutionRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
            return new JdbcWorkflowExecutionRepository(jdbcTemplate, objectMapper);
        }

        @Bean
        public ApprovalRequestRepository approvalRequestRepository(JdbcTemplate jdbcTemplate) {
            return new JdbcApprovalRequestRepository(jdbcTemplate);
        }

        @Bean
        public ContinuationRepository continuationRepository(JdbcTemplate jdbcTemplate) {
            return new JdbcContinuationRepository(jdbcTemplate);
        }
    }
}
