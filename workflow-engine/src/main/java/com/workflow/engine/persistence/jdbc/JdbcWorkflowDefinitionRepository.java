package com.workflow.engine.persistence.jdbc;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.workflow.core.exception.WorkflowValidationException;
import com.workflow.core.model.DefinitionStatus;
import com.workflow.core.model.ErrorHandlingPolicy;
import com.workflow.core.model.OnError;
import com.workflow.core.model.StepConfigs;
import com.workflow.core.model.StepKind;
import com.workflow.core.model.TriggerKind;
import com.workflow.core.model.WorkflowDefinition;
import com.workflow.core.model.WorkflowStep;
import com.workflow.core.model.WorkflowTrigger;
import com.workflow.core.repository.WorkflowDefinitionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.workflow.engine.persistence.jdbc.JsonColumns.toInstant;
import static com.workflow.engine.persistence.jdbc.JsonColumns.toTimestamp;

/**
 * PostgreSQL-backed implementation of WorkflowDefinitionRepository.
 * One row per (id, version); a stored version is never modified by the engine.
 *
 * Uses JSONB columns for:
 * - Steps, each in its key-value form (typed configs are rebuilt through {@link StepConfigs})
 * - Trigger parameters
 */
public class JdbcWorkflowDefinitionRepository implements WorkflowDefinitionRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcWorkflowDefinitionRepository.class);

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumns json;
    private final WorkflowDefinitionRowMapper rowMapper;

    public JdbcWorkflowDefinitionRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.json = new JsonColumns(objectMapper);
        this.rowMapper = new WorkflowDefinitionRowMapper();
    }

    @Override
    @Transactional
    public void save(WorkflowDefinition definition) {
        String sql = """
            INSERT INTO workflow_definitions (
                id, version, name, description, status,
                trigger_kind, trigger_parameters, steps,
                created_at, updated_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?::jsonb, ?::jsonb, ?, ?)
            ON CONFLICT (id, version) DO UPDATE SET
                name = EXCLUDED.name,
                description = EXCLUDED.description,
                status = EXCLUDED.status,
                trigger_kind = EXCLUDED.trigger_kind,
                trigger_parameters = EXCLUDED.trigger_parameters,
                steps = EXCLUDED.steps,
                updated_at = EXCLUDED.updated_at
            """;

        jdbcTemplate.update(sql,
            definition.id(),
            definition.version(),
            definition.name(),
            definition.description(),
            definition.status().name(),
            definition.trigger().kind().name(),
            json.toJson(definition.trigger().parameters()),
            json.toJson(toDocuments(definition.steps())),
            toTimestamp(definition.createdAt()),
            toTimestamp(definition.updatedAt())
        );

        log.debug("Saved workflow definition {} v{}", definition.id(), definition.version());
    }

    @Override
    public Optional<WorkflowDefinition> find(String id, int version) {
        String sql = "SELECT * FROM workflow_definitions WHERE id = ? AND version = ?";
        List<WorkflowDefinition> results = jdbcTemplate.query(sql, rowMapper, id, version);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public Optional<WorkflowDefinition> findLatest(String id) {
        String sql = """
            SELECT * FROM workflow_definitions
            WHERE id = ?
            ORDER BY version DESC
            LIMIT 1
            """;
        List<WorkflowDefinition> results = jdbcTemplate.query(sql, rowMapper, id);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<WorkflowDefinition> findAllLatest(DefinitionStatus status) {
        // Latest version of each workflow, then filtered
        String sql = """
            SELECT * FROM (
                SELECT DISTINCT ON (id) *
                FROM workflow_definitions
                ORDER BY id, version DESC
            ) latest
            WHERE (?::text IS NULL OR status = ?)
            ORDER BY created_at DESC
            """;
        String statusName = status != null ? status.name() : null;
        return jdbcTemplate.query(sql, rowMapper, statusName, statusName);
    }

    @Override
    @Transactional
    public int delete(String id) {
        return jdbcTemplate.update("DELETE FROM workflow_definitions WHERE id = ?", id);
    }

    // ========== Step Documents ==========

    private static List<Map<String, Object>> toDocuments(List<WorkflowStep> steps) {
        List<Map<String, Object>> documents = new ArrayList<>();
        for (WorkflowStep step : steps) {
            ErrorHandlingPolicy policy = step.errorHandling();
            Map<String, Object> errorHandling = new LinkedHashMap<>();
            errorHandling.put("maxRetries", policy.maxRetries());
            errorHandling.put("retryDelaySeconds", policy.retryDelaySeconds());
            errorHandling.put("backoffMultiplier", policy.backoffMultiplier());
            errorHandling.put("maxRetryDelaySeconds", policy.maxRetryDelaySeconds());
            errorHandling.put("onError", policy.onError().name());

            Map<String, Object> document = new LinkedHashMap<>();
            document.put("id", step.id());
            document.put("name", step.name());
            document.put("kind", step.kind().name());
            document.put("config", step.config().toMap());
            document.put("nextSteps", step.nextSteps());
            document.put("errorHandling", errorHandling);
            documents.add(document);
        }
        return documents;
    }

    @SuppressWarnings("unchecked")
    private static WorkflowStep fromDocument(Map<String, Object> document) {
        StepKind kind = StepKind.valueOf((String) document.get("kind"));
        Map<String, Object> policy = (Map<String, Object>) document.getOrDefault("errorHandling", Map.of());

        return WorkflowStep.builder()
            .id((String) document.get("id"))
            .name((String) document.get("name"))
            .kind(kind)
            .config(StepConfigs.fromMap(kind, (Map<String, Object>) document.get("config")))
            .nextSteps((List<String>) document.getOrDefault("nextSteps", List.of()))
            .errorHandling(ErrorHandlingPolicy.builder()
                .maxRetries(number(policy, "maxRetries", ErrorHandlingPolicy.DEFAULT_MAX_RETRIES).intValue())
                .retryDelaySeconds(number(policy, "retryDelaySeconds", ErrorHandlingPolicy.DEFAULT_RETRY_DELAY_SECONDS).longValue())
                .backoffMultiplier(number(policy, "backoffMultiplier", 1.0).doubleValue())
                .maxRetryDelaySeconds(number(policy, "maxRetryDelaySeconds", ErrorHandlingPolicy.DEFAULT_MAX_RETRY_DELAY_SECONDS).longValue())
                .onError(OnError.valueOf(String.valueOf(policy.getOrDefault("onError", OnError.STOP.name()))))
                .build())
            .build();
    }

    private static Number number(Map<String, Object> map, String key, Number defaultValue) {
        Object value = map.get(key);
        return value instanceof Number ? (Number) value : defaultValue;
    }

    private class WorkflowDefinitionRowMapper implements RowMapper<WorkflowDefinition> {
        @Override
        public WorkflowDefinition mapRow(ResultSet rs, int rowNum) throws SQLException {
            List<WorkflowStep> steps = new ArrayList<>();
            try {
                for (Map<String, Object> document : json.readMapList(rs.getString("steps"))) {
                    steps.add(fromDocument(document));
                }
            } catch (WorkflowValidationException | IllegalArgumentException | ClassCastException e) {
                throw new SQLException("Failed to map steps of workflow definition " + rs.getString("id"), e);
            }

            return new WorkflowDefinition(
                rs.getString("id"),
                rs.getString("name"),
                rs.getString("description"),
                rs.getInt("version"),
                new WorkflowTrigger(
                    TriggerKind.valueOf(rs.getString("trigger_kind")),
                    json.readMap(rs.getString("trigger_parameters"))),
                steps,
                DefinitionStatus.valueOf(rs.getString("status")),
                toInstant(rs.getTimestamp("created_at")),
                toInstant(rs.getTimestamp("updated_at"))
            );
        }
    }
}
