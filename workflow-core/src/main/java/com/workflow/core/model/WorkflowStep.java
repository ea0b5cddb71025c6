package com.workflow.core.model;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A single node in a workflow graph.
 *
 * Invariants:
 * - id is non-empty and unique within its definition
 * - config.kind() == kind
 * - CONDITION steps declare one or two next steps (true branch, false branch)
 * - other kinds declare zero or one next step
 */
public record WorkflowStep(
    String id,
    String name,
    StepKind kind,
    StepConfig config,
    List<String> nextSteps,
    ErrorHandlingPolicy errorHandling
) {
    public WorkflowStep {
        nextSteps = nextSteps != null ? List.copyOf(nextSteps) : List.of();
        errorHandling = errorHandling != null ? errorHandling : ErrorHandlingPolicy.defaultFor(kind);
        if (config != null && kind != null && config.kind() != kind) {
            throw new IllegalArgumentException(
                "Step " + id + " is " + kind + " but carries " + config.kind() + " configuration");
        }
    }

    /**
     * The step that follows a non-branching step, if any.
     */
    public Optional<String> nextStep() {
        return nextSteps.isEmpty() ? Optional.empty() : Optional.of(nextSteps.get(0));
    }

    /**
     * The step selected by a condition result.
     * A condition that declares a single next step uses it for both branches.
     */
    public Optional<String> branch(boolean conditionResult) {
        if (nextSteps.isEmpty()) {
            return Optional.empty();
        }
        if (conditionResult || nextSteps.size() < 2) {
            return Optional.of(nextSteps.get(0));
        }
        return Optional.of(nextSteps.get(1));
    }

    /**
     * Typed view of the configuration.
     *
     * @throws IllegalStateException if the configuration is of another kind
     */
    public <T extends StepConfig> T configAs(Class<T> type) {
        if (!type.isInstance(config)) {
            throw new IllegalStateException("Step " + id + " has no " + type.getSimpleName());
        }
        return type.cast(config);
    }

    /**
     * Get the display name, falling back to the id.
     */
    public String displayName() {
        return name != null && !name.isBlank() ? name : id;
    }

    public static WorkflowStep action(String id, String action, String... next) {
        return builder().id(id).kind(StepKind.ACTION).config(ActionConfig.of(action)).nextSteps(next).build();
    }

    public static WorkflowStep condition(String id, Condition condition, String... next) {
        return builder().id(id).kind(StepKind.CONDITION).config(new ConditionConfig(condition)).nextSteps(next).build();
    }

    public static WorkflowStep delay(String id, long delaySeconds, String... next) {
        return builder().id(id).kind(StepKind.DELAY).config(DelayConfig.ofSeconds(delaySeconds)).nextSteps(next).build();
    }

    public static WorkflowStep approval(String id, String approverId, String... next) {
        return builder().id(id).kind(StepKind.APPROVAL).config(ApprovalConfig.of(approverId)).nextSteps(next).build();
    }

    public static WorkflowStep notification(String id, Map<String, Object> parameters, String... next) {
        return builder().id(id).kind(StepKind.NOTIFICATION).config(NotificationConfig.of(parameters)).nextSteps(next).build();
    }

    /**
     * Builder for WorkflowStep.
     */
    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .id(id)
            .name(name)
            .kind(kind)
            .config(config)
            .nextSteps(nextSteps)
            .errorHandling(errorHandling);
    }

    public static class Builder {
        private String id;
        private String name;
        private StepKind kind;
        private StepConfig config;
        private List<String> nextSteps = List.of();
        private ErrorHandlingPolicy errorHandling;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder kind(StepKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder config(StepConfig config) {
            this.config = config;
            return this;
        }

        public Builder nextSteps(List<String> nextSteps) {
            this.nextSteps = nextSteps;
            return this;
        }

        public Builder nextSteps(String... nextSteps) {
            this.nextSteps = List.of(nextSteps);
            return this;
        }

        public Builder errorHandling(ErrorHandlingPolicy errorHandling) {
            this.errorHandling = errorHandling;
            return this;
        }

        public WorkflowStep build() {
            StepKind effectiveKind = kind != null ? kind : (config != null ? config.kind() : null);
            return new WorkflowStep(id, name, effectiveKind, config, nextSteps, errorHandling);
        }
    }
}
