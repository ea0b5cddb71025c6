package com.workflow.examples.purchase;

import com.workflow.core.model.ApprovalRequest;
import com.workflow.core.model.ApprovalStatus;
import com.workflow.core.model.ExecutionStatistics;
import com.workflow.core.model.WorkflowDefinition;
import com.workflow.core.model.WorkflowExecution;
import com.workflow.engine.analytics.WorkflowAnalyticsService;
import com.workflow.engine.approval.ApprovalGateManager;
import com.workflow.engine.coordinator.ExecutionCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Runs two orders through the workflow on startup: a small one that is approved
 * automatically and a large one that waits for the finance manager.
 */
public class PurchaseOrderDemo implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(PurchaseOrderDemo.class);

    private static final Duration COMPLETION_TIMEOUT = Duration.ofSeconds(60);

    private final ExecutionCoordinator coordinator;
    private final ApprovalGateManager approvalGate;
    private final WorkflowAnalyticsService analytics;
    private final WorkflowDefinition definition;

    public PurchaseOrderDemo(
            ExecutionCoordinator coordinator,
            ApprovalGateManager approvalGate,
            WorkflowAnalyticsService analytics,
            WorkflowDefinition definition) {
        this.coordinator = coordinator;
        this.approvalGate = approvalGate;
        this.analytics = analytics;
        this.definition = definition;
    }

    @Override
    public void run(ApplicationArguments args) throws InterruptedException {
        log.info("=== Purchase order demo ===");

        WorkflowExecution small = coordinator.start(definition, Map.of(
            "orderId", "PO-1001", "requester", "alice", "amount", 250));
        WorkflowExecution large = coordinator.start(definition, Map.of(
            "orderId", "PO-1002", "requester", "bob", "amount", 4800));
        log.info("Started small order {} and large order {}", small.id(), large.id());

        approvePendingOrders(large.id());

        report(awaitTerminal(small.id()));
        report(awaitTerminal(large.id()));

        ExecutionStatistics stats = analytics.analytics(definition.id());
        log.info("Executions: {} total, {} successful, {} failed, {}% success, {}s average",
            stats.totalExecutions(), stats.successfulExecutions(), stats.failedExecutions(),
            stats.successRate(), stats.averageExecutionSeconds());
    }

    private void approvePendingOrders(String executionId) throws InterruptedException {
        Instant deadline = Instant.now().plus(COMPLETION_TIMEOUT);
        while (Instant.now().isBefore(deadline)) {
            List<ApprovalRequest> pending = approvalGate.listPending(PurchaseOrderWorkflow.APPROVER);
            for (ApprovalRequest request : pending) {
                if (request.executionId().equals(executionId)) {
                    log.info("Finance manager approving request {} for execution {}", request.id(), executionId);
                    approvalGate.respond(request.id(), ApprovalStatus.APPROVED, "Within quarterly budget");
                    return;
                }
            }
            Thread.sleep(100);
        }
        log.warn("No approval request appeared for execution {}", executionId);
    }

    private WorkflowExecution awaitTerminal(String executionId) throws InterruptedException {
        Instant deadline = Instant.now().plus(COMPLETION_TIMEOUT);
        WorkflowExecution execution = coordinator.getExecution(executionId);
        while (!execution.isTerminal() && Instant.now().isBefore(deadline)) {
            Thread.sleep(100);
            execution = coordinator.getExecution(executionId);
        }
        return execution;
    }

    private void report(WorkflowExecution execution) {
        log.info("Order {} finished {} with budget {}",
            execution.context().get("orderId"), execution.status(), execution.context().get("budgetReference"));
    }
}
