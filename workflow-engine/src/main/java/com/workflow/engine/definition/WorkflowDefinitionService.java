package com.workflow.engine.definition;

import com.workflow.core.exception.DefinitionNotFoundException;
import com.workflow.core.exception.InvalidStateTransitionException;
import com.workflow.core.exception.WorkflowValidationException;
import com.workflow.core.model.ActionConfig;
import com.workflow.core.model.ApprovalConfig;
import com.workflow.core.model.ConditionConfig;
import com.workflow.core.model.DefinitionStatus;
import com.workflow.core.model.DelayConfig;
import com.workflow.core.model.StepKind;
import com.workflow.core.model.WorkflowDefinition;
import com.workflow.core.model.WorkflowStep;
import com.workflow.core.repository.WorkflowDefinitionRepository;
import com.workflow.core.repository.WorkflowExecutionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Creates, versions and retires workflow definitions.
 *
 * Every change is stored as a new version; earlier versions stay readable so
 * executions bound to them keep their graph.
 */
public class WorkflowDefinitionService {

    private static final Logger log = LoggerFactory.getLogger(WorkflowDefinitionService.class);

    private final WorkflowDefinitionRepository definitionRepository;
    private final WorkflowExecutionRepository executionRepository;
    private final Clock clock;

    public WorkflowDefinitionService(
            WorkflowDefinitionRepository definitionRepository,
            WorkflowExecutionRepository executionRepository,
            Clock clock) {
        this.definitionRepository = definitionRepository;
        this.executionRepository = executionRepository;
        this.clock = clock;
    }

    /**
     * Register a new workflow at version 1.
     * An id is generated when the definition carries none.
     *
     * @throws WorkflowValidationException if the graph is malformed
     */
    public WorkflowDefinition create(WorkflowDefinition definition) {
        validate(definition);

        Instant now = clock.instant();
        WorkflowDefinition created = definition.toBuilder()
            .id(definition.id() != null ? definition.id() : UUID.randomUUID().toString())
            .version(1)
            .createdAt(now)
            .updatedAt(now)
            .build();

        if (definitionRepository.findLatest(created.id()).isPresent()) {
            throw new WorkflowValidationException("id", "workflow " + created.id() + " already exists");
        }

        definitionRepository.save(created);
        log.info("Created workflow {} ({}) with {} steps", created.id(), created.name(), created.steps().size());
        return created;
    }

    /**
     * Store a new version with the name, description, trigger and steps of {@code changes}.
     * The status is kept; use {@link #activate} and {@link #deactivate} to change it.
     *
     * @throws DefinitionNotFoundException if the workflow does not exist
     */
    public WorkflowDefinition update(String workflowId, WorkflowDefinition changes) {
        WorkflowDefinition current = get(workflowId);
        validate(changes);

        WorkflowDefinition updated = current.toBuilder()
            .name(changes.name())
            .description(changes.description())
            .trigger(changes.trigger())
            .steps(changes.steps())
            .version(current.version() + 1)
            .updatedAt(clock.instant())
            .build();

        definitionRepository.save(updated);
        log.info("Updated workflow {} to version {}", workflowId, updated.version());
        return updated;
    }

    public WorkflowDefinition activate(String workflowId) {
        return changeStatus(workflowId, DefinitionStatus.ACTIVE);
    }

    public WorkflowDefinition deactivate(String workflowId) {
        return changeStatus(workflowId, DefinitionStatus.INACTIVE);
    }

    /**
     * Latest version of a workflow.
     *
     * @throws DefinitionNotFoundException if the workflow does not exist
     */
    public WorkflowDefinition get(String workflowId) {
        return definitionRepository.findLatest(workflowId)
            .orElseThrow(() -> new DefinitionNotFoundException(workflowId));
    }

    /**
     * Latest version of every workflow, newest first.
     *
     * @param status optional filter, null for all
     */
    public List<WorkflowDefinition> list(DefinitionStatus status) {
        return definitionRepository.findAllLatest(status);
    }

    /**
     * Delete every version of a workflow.
     *
     * @throws DefinitionNotFoundException     if the workflow does not exist
     * @throws InvalidStateTransitionException if executions of it are still running or paused
     */
    public void delete(String workflowId) {
        get(workflowId);

        long active = executionRepository.countActive(workflowId);
        if (active > 0) {
            throw new InvalidStateTransitionException(String.format(
                "Workflow %s has %d active execution(s) and cannot be deleted", workflowId, active));
        }

        int versions = definitionRepository.delete(workflowId);
        log.info("Deleted workflow {} ({} versions)", workflowId, versions);
    }

    // ========== Validation ==========

    /**
     * Check the structural rules of a definition graph.
     *
     * @throws WorkflowValidationException on the first violation found
     */
    public void validate(WorkflowDefinition definition) {
        if (definition.name() == null || definition.name().isBlank()) {
            throw new WorkflowValidationException("name", "cannot be empty");
        }
        if (definition.steps().isEmpty()) {
            throw new WorkflowValidationException("steps", "cannot be empty");
        }

        Set<String> ids = new HashSet<>();
        for (WorkflowStep step : definition.steps()) {
            if (step.id() == null || step.id().isBlank()) {
                throw new WorkflowValidationException("steps.id", "cannot be empty");
            }
            if (!ids.add(step.id())) {
                throw new WorkflowValidationException("steps.id", "duplicate step id " + step.id());
            }
        }

        for (WorkflowStep step : definition.steps()) {
            validateStep(step, ids);
        }
    }

    private void validateStep(WorkflowStep step, Set<String> ids) {
        String field = "steps[" + step.id() + "]";

        if (step.kind() == null || step.config() == null) {
            throw new WorkflowValidationException(field, "kind and config are required");
        }

        for (String next : step.nextSteps()) {
            if (!ids.contains(next)) {
                throw new WorkflowValidationException(field + ".nextSteps", "unknown step " + next);
            }
        }

        int maxNext = step.kind() == StepKind.CONDITION ? 2 : 1;
        if (step.nextSteps().size() > maxNext) {
            throw new WorkflowValidationException(field + ".nextSteps",
                step.kind() + " step allows at most " + maxNext + " next step(s)");
        }

        switch (step.kind()) {
            case ACTION -> {
                String action = ((ActionConfig) step.config()).action();
                if (action == null || action.isBlank()) {
                    throw new WorkflowValidationException(field + ".config.action", "cannot be empty");
                }
            }
            case CONDITION -> {
                if (step.nextSteps().isEmpty()) {
                    throw new WorkflowValidationException(field + ".nextSteps", "condition step needs a branch");
                }
                ConditionConfig config = (ConditionConfig) step.config();
                if (config.condition() == null
                        || config.condition().field() == null
                        || config.condition().field().isBlank()
                        || config.condition().operator() == null) {
                    throw new WorkflowValidationException(field + ".config.condition", "field and operator are required");
                }
            }
            case DELAY -> {
                if (((DelayConfig) step.config()).delaySeconds() < 0) {
                    throw new WorkflowValidationException(field + ".config.delaySeconds", "must be >= 0");
                }
            }
            case APPROVAL -> {
                String approver = ((ApprovalConfig) step.config()).approverId();
                if (approver == null || approver.isBlank()) {
                    throw new WorkflowValidationException(field + ".config.approverId", "cannot be empty");
                }
            }
            case NOTIFICATION -> {
                // handler defaults, parameters are free-form
            }
        }
    }

    private WorkflowDefinition changeStatus(String workflowId, DefinitionStatus status) {
        WorkflowDefinition current = get(workflowId);
        if (current.status() == status) {
            return current;
        }

        WorkflowDefinition changed = current.withStatus(status, clock.instant());
        definitionRepository.save(changed);
        log.info("Workflow {} is now {} (version {})", workflowId, status, changed.version());
        return changed;
    }
}
