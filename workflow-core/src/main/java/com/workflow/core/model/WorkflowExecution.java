package com.workflow.core.model;

import com.workflow.core.exception.InvalidStateTransitionException;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * One running instance of a workflow definition.
 * Primary source of truth for execution state.
 *
 * Primary Key: id
 *
 * Invariants:
 * - status transitions follow {@link ExecutionStatus#canTransitionTo}
 * - currentStepId is null exactly when status == COMPLETED
 * - retryCount resets to 0 whenever currentStepId changes
 * - pauseReason is set exactly when status == PAUSED
 * - sequenceNumber increases by one on every persisted update (compare-and-set token)
 */
public record WorkflowExecution(
    // Primary key
    String id,

    // Bound definition
    String workflowId,
    int definitionVersion,

    // State
    ExecutionStatus status,
    PauseReason pauseReason,
    String currentStepId,
    Map<String, Object> context,

    // Error tracking
    String error,
    int retryCount,

    // Timing
    Instant startedAt,
    Instant completedAt,
    Instant updatedAt,

    // Versioning (optimistic locking)
    long sequenceNumber
) {
    public WorkflowExecution {
        context = context != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(context)) : Map.of();
    }

    /**
     * Create a new execution positioned at the entry step.
     *
     * @param definition   the definition version to bind
     * @param context      initial context
     * @param now          start time
     */
    public static WorkflowExecution start(WorkflowDefinition definition, Map<String, Object> context, Instant now) {
        String firstStepId = definition.firstStep().map(WorkflowStep::id).orElse(null);
        return new WorkflowExecution(
            UUID.randomUUID().toString(),
            definition.id(),
            definition.version(),
            ExecutionStatus.RUNNING,
            null,
            firstStepId,
            context,
            null,
            0,
            now,
            null,
            now,
            0L
        );
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public boolean isRunning() {
        return status == ExecutionStatus.RUNNING;
    }

    public boolean isAwaitingApproval() {
        return status == ExecutionStatus.PAUSED && pauseReason == PauseReason.APPROVAL;
    }

    /**
     * Move to a new status.
     *
     * @throws InvalidStateTransitionException if the state machine forbids it
     */
    public WorkflowExecution withStatus(ExecutionStatus newStatus, Instant now) {
        if (!status.canTransitionTo(newStatus)) {
            throw new InvalidStateTransitionException(id, status, newStatus);
        }
        return toBuilder()
            .status(newStatus)
            .pauseReason(null)
            .completedAt(newStatus.isTerminal() ? now : completedAt)
            .updatedAt(now)
            .build();
    }

    /**
     * Pause for the given reason.
     */
    public WorkflowExecution paused(PauseReason reason, Instant now) {
        return withStatus(ExecutionStatus.PAUSED, now).toBuilder()
            .pauseReason(reason)
            .build();
    }

    /**
     * Advance the cursor to another step. Resets the retry count.
     */
    public WorkflowExecution advancedTo(String stepId, Instant now) {
        return toBuilder()
            .currentStepId(stepId)
            .retryCount(0)
            .updatedAt(now)
            .build();
    }

    /**
     * Record a failure of the current step.
     */
    public WorkflowExecution withStepFailure(String errorMessage, Instant now) {
        return toBuilder()
            .error(errorMessage)
            .retryCount(retryCount + 1)
            .updatedAt(now)
            .build();
    }

    /**
     * Graph exhausted: COMPLETED with the cursor cleared.
     */
    public WorkflowExecution completed(Instant now) {
        return withStatus(ExecutionStatus.COMPLETED, now).toBuilder()
            .currentStepId(null)
            .build();
    }

    /**
     * Terminal failure with the last error recorded.
     */
    public WorkflowExecution failed(String errorMessage, Instant now) {
        return withStatus(ExecutionStatus.FAILED, now).toBuilder()
            .error(errorMessage)
            .build();
    }

    /**
     * Merge context updates produced by a step.
     */
    public WorkflowExecution withContextUpdates(Map<String, Object> updates) {
        if (updates == null || updates.isEmpty()) {
            return this;
        }
        Map<String, Object> merged = new LinkedHashMap<>(context);
        merged.putAll(updates);
        return toBuilder().context(merged).build();
    }

    /**
     * Builder for creating modified copies.
     */
    public Builder toBuilder() {
        return new Builder(this);
    }

    public static class Builder {
        private String id;
        private String workflowId;
        private int definitionVersion;
        private ExecutionStatus status;
        private PauseReason pauseReason;
        private String currentStepId;
        private Map<String, Object> context;
        private String error;
        private int retryCount;
        private Instant startedAt;
        private Instant completedAt;
        private Instant updatedAt;
        private long sequenceNumber;

        public Builder(WorkflowExecution execution) {
            this.id = execution.id();
            this.workflowId = execution.workflowId();
            this.definitionVersion = execution.definitionVersion();
            this.status = execution.status();
            this.pauseReason = execution.pauseReason();
            this.currentStepId = execution.currentStepId();
            this.context = execution.context();
            this.error = execution.error();
            this.retryCount = execution.retryCount();
            this.startedAt = execution.startedAt();
            this.completedAt = execution.completedAt();
            this.updatedAt = execution.updatedAt();
            this.sequenceNumber = execution.sequenceNumber();
        }

        public Builder status(ExecutionStatus status) {
            this.status = status;
            return this;
        }

        public Builder pauseReason(PauseReason pauseReason) {
            this.pauseReason = pauseReason;
            return this;
        }

        public Builder currentStepId(String currentStepId) {
            this.currentStepId = currentStepId;
            return this;
        }

        public Builder context(Map<String, Object> context) {
            this.context = context;
            return this;
        }

        public Builder error(String error) {
            this.error = error;
            return this;
        }

        public Builder retryCount(int retryCount) {
            this.retryCount = retryCount;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder sequenceNumber(long sequenceNumber) {
            this.sequenceNumber = sequenceNumber;
            return this;
        }

        public Builder incrementSequence() {
            this.sequenceNumber++;
            return this;
        }

        public WorkflowExecution build() {
            return new WorkflowExecution(
                id, workflowId, definitionVersion, status, pauseReason,
                currentStepId, context, error, retryCount,
                startedAt, completedAt, updatedAt, sequenceNumber
            );
        }
    }
}
