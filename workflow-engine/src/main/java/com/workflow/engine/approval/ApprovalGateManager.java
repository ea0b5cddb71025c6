package com.workflow.engine.approval;

import com.workflow.core.exception.ApprovalRequestNotFoundException;
import com.workflow.core.exception.ExecutionNotFoundException;
import com.workflow.core.exception.InvalidStateTransitionException;
import com.workflow.core.model.ApprovalRequest;
import com.workflow.core.model.ApprovalStatus;
import com.workflow.core.model.WorkflowEventType;
import com.workflow.core.model.WorkflowExecution;
import com.workflow.core.repository.ApprovalRequestRepository;
import com.workflow.core.repository.WorkflowExecutionRepository;
import com.workflow.engine.event.EventPublisher;
import com.workflow.engine.metrics.WorkflowMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Creates and resolves approval requests, and turns decisions back into
 * execution control: approved resumes, rejected cancels.
 *
 * Invariants:
 * - at most one PENDING request per (executionId, stepId)
 * - a request is resolved exactly once; later responses are rejected
 */
public class ApprovalGateManager {

    private static final Logger log = LoggerFactory.getLogger(ApprovalGateManager.class);

    private final ApprovalRequestRepository approvalRepository;
    private final WorkflowExecutionRepository executionRepository;
    private final EventPublisher events;
    private final WorkflowMetrics metrics;
    private final Clock clock;

    private volatile ExecutionControl executionControl;

    public ApprovalGateManager(
            ApprovalRequestRepository approvalRepository,
            WorkflowExecutionRepository executionRepository,
            EventPublisher events,
            WorkflowMetrics metrics,
            Clock clock) {
        this.approvalRepository = approvalRepository;
        this.executionRepository = executionRepository;
        this.events = events;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Wire the component that resumes and cancels executions.
     * Set once during assembly; the coordinator depends on this manager too.
     */
    public void setExecutionControl(ExecutionControl executionControl) {
        this.executionControl = executionControl;
    }

    /**
     * Request approval for an execution parked on a step, notifying the approver.
     * Returns the existing request if one is already pending for the same step.
     *
     * @throws ExecutionNotFoundException if the execution does not exist
     */
    public ApprovalRequest request(String executionId, String stepId, String approverId) {
        Optional<ApprovalRequest> pending = approvalRepository.findPending(executionId, stepId);
        if (pending.isPresent()) {
            log.debug("Approval already pending for execution {} step {}: {}",
                executionId, stepId, pending.get().id());
            return pending.get();
        }

        WorkflowExecution execution = executionRepository.findById(executionId)
            .orElseThrow(() -> new ExecutionNotFoundException(executionId));

        ApprovalRequest request = ApprovalRequest.create(executionId, stepId, approverId, clock.instant());
        approvalRepository.save(request);

        metrics.approvalRequested();
        events.publish(WorkflowEventType.APPROVAL_REQUESTED, execution, stepId, Map.of(
            "requestId", request.id(),
            "approverId", approverId
        ));

        log.info("Requested approval {} from {} for execution {} step {}",
            request.id(), approverId, executionId, stepId);
        return request;
    }

    /**
     * Record a decision and drive the execution accordingly.
     *
     * @param requestId the request
     * @param decision  APPROVED or REJECTED
     * @param comments  optional approver comments
     * @return the resolved request
     * @throws ApprovalRequestNotFoundException if no such request exists
     * @throws InvalidStateTransitionException  if the request was already resolved
     */
    public ApprovalRequest respond(String requestId, ApprovalStatus decision, String comments) {
        ApprovalRequest request = approvalRepository.findById(requestId)
            .orElseThrow(() -> new ApprovalRequestNotFoundException(requestId));

        ApprovalRequest resolved = request.resolve(decision, comments, clock.instant());
        if (!approvalRepository.resolve(resolved)) {
            throw new InvalidStateTransitionException("ApprovalRequest " + requestId, "RESOLVED", decision.name());
        }

        metrics.approvalResolved(decision);
        log.info("Approval {} for execution {} step {} {}",
            requestId, request.executionId(), request.stepId(), decision);

        Optional<WorkflowExecution> execution = executionRepository.findById(request.executionId());
        if (execution.isEmpty()) {
            log.warn("Approval {} resolved for missing execution {}", requestId, request.executionId());
            return resolved;
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("requestId", requestId);
        payload.put("decision", decision.name());
        payload.put("comments", comments);
        events.publish(WorkflowEventType.APPROVAL_RESOLVED, execution.get(), request.stepId(), payload);

        if (execution.get().isTerminal()) {
            log.warn("Execution {} is already {}, approval {} recorded without effect",
                request.executionId(), execution.get().status(), requestId);
            return resolved;
        }

        ExecutionControl control = requireExecutionControl();
        try {
            if (decision == ApprovalStatus.APPROVED) {
                control.resume(request.executionId());
            } else {
                control.cancel(request.executionId());
            }
        } catch (InvalidStateTransitionException e) {
            // The execution may have finished between the check above and the transition
            WorkflowExecution current = executionRepository.findById(request.executionId()).orElse(null);
            if (current == null || !current.isTerminal()) {
                throw e;
            }
            log.warn("Execution {} became {} while approval {} was applied, recorded without effect",
                request.executionId(), current.status(), requestId);
        }
        return resolved;
    }

    public ApprovalRequest getRequest(String requestId) {
        return approvalRepository.findById(requestId)
            .orElseThrow(() -> new ApprovalRequestNotFoundException(requestId));
    }

    public List<ApprovalRequest> listPending(String approverId) {
        return approvalRepository.findPendingByApprover(approverId);
    }

    public List<ApprovalRequest> listForExecution(String executionId) {
        return approvalRepository.findByExecution(executionId);
    }

    private ExecutionControl requireExecutionControl() {
        ExecutionControl control = executionControl;
        if (control == null) {
            throw new IllegalStateException("ApprovalGateManager has no ExecutionControl configured");
        }
        return control;
    }
}
