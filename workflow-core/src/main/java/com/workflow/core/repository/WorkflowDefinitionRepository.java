package com.workflow.core.repository;

import com.workflow.core.model.DefinitionStatus;
import com.workflow.core.model.WorkflowDefinition;

import java.util.List;
import java.util.Optional;

/**
 * Repository for WorkflowDefinition persistence.
 * Every version is kept so executions can resolve the version they bound.
 */
public interface WorkflowDefinitionRepository {

    /**
     * Save a definition version. Saving the same (id, version) again replaces it.
     *
     * @param definition The definition version to save
     */
    void save(WorkflowDefinition definition);

    /**
     * Find a specific version of a definition.
     *
     * @param id      The workflow id
     * @param version The version number
     * @return The definition if found
     */
    Optional<WorkflowDefinition> find(String id, int version);

    /**
     * Find the latest version of a definition.
     *
     * @param id The workflow id
     * @return The latest version if found
     */
    Optional<WorkflowDefinition> findLatest(String id);

    /**
     * List the latest version of every definition, newest first.
     *
     * @param status Optional status filter, null for all
     * @return Matching definitions ordered by creation time descending
     */
    List<WorkflowDefinition> findAllLatest(DefinitionStatus status);

    /**
     * Delete every version of a definition.
     *
     * @param id The workflow id
     * @return Number of versions deleted
     */
    int delete(String id);
}
