package com.workflow.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * A named, versioned graph of steps with a trigger.
 * Every update produces a new version; a version bound by an execution is never modified.
 *
 * Primary Key: (id, version)
 *
 * Invariants:
 * - step ids are unique
 * - all next-step ids reference steps of this definition
 * - the first step in {@link #steps()} is the entry step
 */
public record WorkflowDefinition(
    // Identity
    String id,
    String name,
    String description,
    int version,

    // Graph
    WorkflowTrigger trigger,
    List<WorkflowStep> steps,

    // Lifecycle
    DefinitionStatus status,

    // Metadata
    Instant createdAt,
    Instant updatedAt
) {
    public WorkflowDefinition {
        steps = steps != null ? List.copyOf(steps) : List.of();
        trigger = trigger != null ? trigger : WorkflowTrigger.manual();
        status = status != null ? status : DefinitionStatus.DRAFT;
    }

    /**
     * Get a step by id.
     */
    public Optional<WorkflowStep> getStep(String stepId) {
        if (stepId == null) {
            return Optional.empty();
        }
        return steps.stream()
            .filter(s -> s.id().equals(stepId))
            .findFirst();
    }

    /**
     * The entry step, if the definition has any steps.
     */
    public Optional<WorkflowStep> firstStep() {
        return steps.isEmpty() ? Optional.empty() : Optional.of(steps.get(0));
    }

    public boolean isActive() {
        return status == DefinitionStatus.ACTIVE;
    }

    public WorkflowDefinition withStatus(DefinitionStatus newStatus, Instant now) {
        return new WorkflowDefinition(
            id, name, description, version + 1, trigger, steps, newStatus, createdAt, now);
    }

    /**
     * Builder for WorkflowDefinition.
     */
    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .id(id)
            .name(name)
            .description(description)
            .version(version)
            .trigger(trigger)
            .steps(steps)
            .status(status)
            .createdAt(createdAt)
            .updatedAt(updatedAt);
    }

    public static class Builder {
        private String id;
        private String name;
        private String description;
        private int version = 1;
        private WorkflowTrigger trigger = WorkflowTrigger.manual();
        private List<WorkflowStep> steps = List.of();
        private DefinitionStatus status = DefinitionStatus.DRAFT;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder version(int version) {
            this.version = version;
            return this;
        }

        public Builder trigger(WorkflowTrigger trigger) {
            this.trigger = trigger;
            return this;
        }

        public Builder steps(List<WorkflowStep> steps) {
            this.steps = steps;
            return this;
        }

        public Builder steps(WorkflowStep... steps) {
            this.steps = List.of(steps);
            return this;
        }

        public Builder status(DefinitionStatus status) {
            this.status = status;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public WorkflowDefinition build() {
            return new WorkflowDefinition(
                id, name, description, version, trigger, steps, status, createdAt, updatedAt);
        }
    }
}
