package com.workflow.engine.persistence;

import com.workflow.core.model.DefinitionStatus;
import com.workflow.core.model.WorkflowDefinition;
import com.workflow.core.repository.WorkflowDefinitionRepository;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of WorkflowDefinitionRepository.
 * For demonstration and testing purposes.
 */
public class InMemoryWorkflowDefinitionRepository implements WorkflowDefinitionRepository {

    // Key: id:version
    private final Map<String, WorkflowDefinition> definitions = new ConcurrentHashMap<>();

    private String buildKey(String id, int version) {
        return id + ":" + version;
    }

    @Override
    public void save(WorkflowDefinition definition) {
        definitions.put(buildKey(definition.id(), definition.version()), definition);
    }

    @Override
    public Optional<WorkflowDefinition> find(String id, int version) {
        return Optional.ofNullable(definitions.get(buildKey(id, version)));
    }

    @Override
    public Optional<WorkflowDefinition> findLatest(String id) {
        return definitions.values().stream()
            .filter(d -> d.id().equals(id))
            .max(Comparator.comparing(WorkflowDefinition::version));
    }

    @Override
    public List<WorkflowDefinition> findAllLatest(DefinitionStatus status) {
        // Latest version of each workflow
        Map<String, WorkflowDefinition> latestById = new HashMap<>();
        definitions.values().forEach(d -> {
            WorkflowDefinition existing = latestById.get(d.id());
            if (existing == null || d.version() > existing.version()) {
                latestById.put(d.id(), d);
            }
        });
        return latestById.values().stream()
            .filter(d -> status == null || d.status() == status)
            .sorted(Comparator.comparing(
                (WorkflowDefinition d) -> d.createdAt() != null ? d.createdAt() : Instant.EPOCH).reversed())
            .collect(Collectors.toList());
    }

    @Override
    public int delete(String id) {
        List<String> keys = definitions.values().stream()
            .filter(d -> d.id().equals(id))
            .map(d -> buildKey(d.id(), d.version()))
            .collect(Collectors.toList());

        keys.forEach(definitions::remove);
        return keys.size();
    }
}
