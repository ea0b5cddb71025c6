package com.workflow.engine.persistence.jdbc;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.workflow.core.exception.OptimisticLockException;
import com.workflow.core.model.ActionConfig;
import com.workflow.core.model.ApprovalRequest;
import com.workflow.core.model.ApprovalStatus;
import com.workflow.core.model.Condition;
import com.workflow.core.model.ConditionOperator;
import com.workflow.core.model.DefinitionStatus;
import com.workflow.core.model.ErrorHandlingPolicy;
import com.workflow.core.model.ExecutionStatistics;
import com.workflow.core.model.ExecutionStatus;
import com.workflow.core.model.OnError;
import com.workflow.core.model.PauseReason;
import com.workflow.core.model.WorkflowDefinition;
import com.workflow.core.model.WorkflowExecution;
import com.workflow.core.model.WorkflowStep;
import com.workflow.core.model.WorkflowTrigger;
import com.workflow.core.repository.ExecutionQuery;
import com.workflow.core.test.TimeController;
import com.workflow.scheduler.ContinuationType;
import com.workflow.scheduler.ScheduledContinuation;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Runs the PostgreSQL stores against a real database.
 * Skipped when no Docker daemon is available.
 */
@Testcontainers(disabledWithoutDocker = true)
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class JdbcRepositoriesTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15")
        .withDatabaseName("workflow_test")
        .withUsername("test")
        .withPassword("test");

    private final TimeController time = TimeController.frozen();

    private JdbcTemplate jdbcTemplate;
    private JdbcWorkflowDefinitionRepository definitions;
    private JdbcWorkflowExecutionRepository executions;
    private JdbcApprovalRequestRepository approvals;
    private JdbcContinuationRepository continuations;

    @BeforeAll
    void createSchema() {
        DriverManagerDataSource dataSource = new DriverManagerDataSource(
            postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword());
        new ResourceDatabasePopulator(new ClassPathResource("schema.sql")).execute(dataSource);

        ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
        jdbcTemplate = new JdbcTemplate(dataSource);
        definitions = new JdbcWorkflowDefinitionRepository(jdbcTemplate, objectMapper);
        executions = new JdbcWorkflowExecutionRepository(jdbcTemplate, objectMapper);
        approvals = new JdbcApprovalRequestRepository(jdbcTemplate);
        continuations = new JdbcContinuationRepository(jdbcTemplate);
    }

    @BeforeEach
    void cleanTables() {
        jdbcTemplate.update("""
            TRUNCATE workflow_definitions, workflow_executions,
                     approval_requests, scheduled_continuations
            """);
    }

    private WorkflowDefinition definition(String id, int version, DefinitionStatus status) {
        return WorkflowDefinition.builder()
            .id(id)
            .name("purchase order")
            .description("approve large orders")
            .version(version)
            .trigger(WorkflowTrigger.event("order.created"))
            .status(status)
            .steps(
                WorkflowStep.builder()
                    .id("validate")
                    .name("Validate order")
                    .config(new ActionConfig("validate", Map.of("strict", true)))
                    .nextSteps("check")
                    .errorHandling(ErrorHandlingPolicy.builder()
                        .maxRetries(4)
                        .retryDelaySeconds(2)
                        .backoffMultiplier(2.0)
                        .maxRetryDelaySeconds(30)
                        .onError(OnError.CONTINUE)
                        .build())
                    .build(),
                WorkflowStep.condition("check",
                    Condition.of("amount", ConditionOperator.GREATER_THAN, 1000), "approve", "notify"),
                WorkflowStep.approval("approve", "manager", "wait"),
                WorkflowStep.delay("wait", 3600, "notify"),
                WorkflowStep.notification("notify", Map.of("channel", "email")))
            .createdAt(time.instant())
            .updatedAt(time.instant())
            .build();
    }

    private WorkflowExecution started(String workflowId) {
        WorkflowExecution execution = WorkflowExecution.start(
            definition(workflowId, 1, DefinitionStatus.ACTIVE), Map.of("amount", 1500), time.instant());
        executions.save(execution);
        return execution;
    }

    // ========== Definitions ==========

    @Test
    @DisplayName("Definitions round-trip with every step kind and policy intact")
    void definition_shouldRoundTrip() {
        WorkflowDefinition original = definition("po", 1, DefinitionStatus.DRAFT);
        definitions.save(original);

        WorkflowDefinition loaded = definitions.find("po", 1).orElseThrow();

        assertThat(loaded).isEqualTo(original);
        assertThat(loaded.getStep("check").orElseThrow().branch(false)).contains("notify");
    }

    @Test
    void definition_versionsAndLatest() {
        definitions.save(definition("po", 1, DefinitionStatus.DRAFT));
        definitions.save(definition("po", 2, DefinitionStatus.ACTIVE));
        time.advanceSeconds(5);
        definitions.save(definition("other", 1, DefinitionStatus.DRAFT));

        assertThat(definitions.findLatest("po")).get()
            .extracting(WorkflowDefinition::version).isEqualTo(2);
        assertThat(definitions.findAllLatest(null))
            .extracting(WorkflowDefinition::id)
            .containsExactly("other", "po");
        assertThat(definitions.findAllLatest(DefinitionStatus.ACTIVE))
            .extracting(WorkflowDefinition::id)
            .containsExactly("po");

        assertThat(definitions.delete("po")).isEqualTo(2);
        assertThat(definitions.findLatest("po")).isEmpty();
    }

    // ========== Executions ==========

    @Test
    void execution_updateShouldCompareAndSet() {
        WorkflowExecution execution = started("po");

        WorkflowExecution paused = executions.update(execution.paused(PauseReason.APPROVAL, time.instant()));

        assertThat(paused.sequenceNumber()).isEqualTo(1);
        WorkflowExecution loaded = executions.findById(execution.id()).orElseThrow();
        assertThat(loaded).isEqualTo(paused);
        assertThat(loaded.context()).containsEntry("amount", 1500);

        assertThatThrownBy(() -> executions.update(execution.withStatus(ExecutionStatus.CANCELLED, time.instant())))
            .isInstanceOf(OptimisticLockException.class);
    }

    @Test
    void execution_queriesAndStatistics() {
        WorkflowExecution first = started("po");
        time.advanceSeconds(1);
        started("po");
        started("other");
        time.advanceSeconds(9);
        executions.update(first.completed(time.instant()));

        assertThat(executions.find(ExecutionQuery.forWorkflow("po"))).hasSize(2);
        assertThat(executions.find(new ExecutionQuery(null, ExecutionStatus.COMPLETED, 10)))
            .extracting(WorkflowExecution::id)
            .containsExactly(first.id());
        assertThat(executions.findByStatus(ExecutionStatus.RUNNING, 10)).hasSize(2);
        assertThat(executions.countActive("po")).isEqualTo(1);

        ExecutionStatistics statistics = executions.statistics("po");
        assertThat(statistics.totalExecutions()).isEqualTo(2);
        assertThat(statistics.successfulExecutions()).isEqualTo(1);
        assertThat(statistics.averageExecutionSeconds()).isEqualTo(10.0);
        assertThat(statistics.successRate()).isEqualTo(50.0);
        assertThat(executions.statistics(null).totalExecutions()).isEqualTo(3);
    }

    // ========== Approvals ==========

    @Test
    void approval_resolveShouldSucceedOnce() {
        ApprovalRequest request = ApprovalRequest.create("e1", "approve", "manager", time.instant());
        approvals.save(request);

        assertThat(approvals.findPending("e1", "approve")).contains(request);
        assertThat(approvals.findPendingByApprover("manager")).containsExactly(request);

        ApprovalRequest approved = request.resolve(ApprovalStatus.APPROVED, "ok", time.instant());
        assertThat(approvals.resolve(approved)).isTrue();
        assertThat(approvals.resolve(request.resolve(ApprovalStatus.REJECTED, null, time.instant()))).isFalse();

        assertThat(approvals.findById(request.id())).contains(approved);
        assertThat(approvals.findLatest("e1", "approve")).contains(approved);
        assertThat(approvals.findPending("e1", "approve")).isEmpty();
        assertThat(approvals.findByExecution("e1")).hasSize(1);
    }

    // ========== Continuations ==========

    @Test
    void continuation_dueFireAndCancel() {
        Instant now = time.instant();
        ScheduledContinuation soon = ScheduledContinuation.create(
            "e1", 1L, "wait", ContinuationType.DELAY, now.plusSeconds(10), now);
        ScheduledContinuation later = ScheduledContinuation.create(
            "e1", 1L, "charge", ContinuationType.RETRY, now.plusSeconds(60), now);
        continuations.save(soon);
        continuations.save(later);

        List<ScheduledContinuation> due = continuations.findDue(now.plus(Duration.ofSeconds(30)), 10);
        assertThat(due).extracting(ScheduledContinuation::id).containsExactly(soon.id());

        assertThat(continuations.markFired(soon.id(), now)).isTrue();
        assertThat(continuations.markFired(soon.id(), now)).isFalse();

        assertThat(continuations.cancelByExecution("e1")).isEqualTo(1);
        assertThat(continuations.findPendingByExecution("e1")).isEmpty();
        assertThat(continuations.markFired(later.id(), now)).isFalse();
    }
}
