package com.workflow.engine.persistence.jdbc;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.workflow.core.exception.OptimisticLockException;
import com.workflow.core.model.ExecutionStatistics;
import com.workflow.core.model.ExecutionStatus;
import com.workflow.core.model.PauseReason;
import com.workflow.core.model.WorkflowExecution;
import com.workflow.core.repository.ExecutionQuery;
import com.workflow.core.repository.WorkflowExecutionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.workflow.engine.persistence.jdbc.JsonColumns.toInstant;
import static com.workflow.engine.persistence.jdbc.JsonColumns.toTimestamp;

/**
 * PostgreSQL-backed implementation of WorkflowExecutionRepository.
 * Supports optimistic locking via sequence numbers for concurrent access.
 */
public class JdbcWorkflowExecutionRepository implements WorkflowExecutionRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcWorkflowExecutionRepository.class);

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumns json;
    private final WorkflowExecutionRowMapper rowMapper;

    public JdbcWorkflowExecutionRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.json = new JsonColumns(objectMapper);
        this.rowMapper = new WorkflowExecutionRowMapper();
    }

    @Override
    @Transactional
    public void save(WorkflowExecution execution) {
        String sql = """
            INSERT INTO workflow_executions (
                id, workflow_id, definition_version, status, pause_reason,
                current_step_id, context, error, retry_count,
                started_at, completed_at, updated_at, sequence_number
            ) VALUES (?, ?, ?, ?, ?, ?, ?::jsonb, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (id) DO NOTHING
            """;

        int rows = jdbcTemplate.update(sql,
            execution.id(),
            execution.workflowId(),
            execution.definitionVersion(),
            execution.status().name(),
            execution.pauseReason() != null ? execution.pauseReason().name() : null,
            execution.currentStepId(),
            json.toJson(execution.context()),
            execution.error(),
            execution.retryCount(),
            toTimestamp(execution.startedAt()),
            toTimestamp(execution.completedAt()),
            toTimestamp(execution.updatedAt()),
            execution.sequenceNumber()
        );

        if (rows == 0) {
            log.debug("Workflow execution already exists: {}", execution.id());
        }
    }

    @Override
    @Transactional
    public WorkflowExecution update(WorkflowExecution execution) {
        WorkflowExecution next = execution.toBuilder().incrementSequence().build();

        String sql = """
            UPDATE workflow_executions SET
                status = ?,
                pause_reason = ?,
                current_step_id = ?,
                context = ?::jsonb,
                error = ?,
                retry_count = ?,
                completed_at = ?,
                updated_at = ?,
                sequence_number = ?
            WHERE id = ? AND sequence_number = ?
            """;

        int rows = jdbcTemplate.update(sql,
            next.status().name(),
            next.pauseReason() != null ? next.pauseReason().name() : null,
            next.currentStepId(),
            json.toJson(next.context()),
            next.error(),
            next.retryCount(),
            toTimestamp(next.completedAt()),
            toTimestamp(next.updatedAt()),
            next.sequenceNumber(),
            execution.id(),
            execution.sequenceNumber()  // Expected previous sequence
        );

        if (rows == 0) {
            throw new OptimisticLockException("WorkflowExecution", execution.id());
        }
        return next;
    }

    @Override
    public Optional<WorkflowExecution> findById(String executionId) {
        String sql = "SELECT * FROM workflow_executions WHERE id = ?";
        List<WorkflowExecution> results = jdbcTemplate.query(sql, rowMapper, executionId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<WorkflowExecution> find(ExecutionQuery query) {
        StringBuilder sql = new StringBuilder("SELECT * FROM workflow_executions WHERE 1 = 1");
        List<Object> args = new ArrayList<>();
        if (query.workflowId() != null) {
            sql.append(" AND workflow_id = ?");
            args.add(query.workflowId());
        }
        if (query.status() != null) {
            sql.append(" AND status = ?");
            args.add(query.status().name());
        }
        sql.append(" ORDER BY started_at DESC LIMIT ?");
        args.add(query.limit());

        return jdbcTemplate.query(sql.toString(), rowMapper, args.toArray());
    }

    @Override
    public List<WorkflowExecution> findByStatus(ExecutionStatus status, int limit) {
        String sql = "SELECT * FROM workflow_executions WHERE status = ? ORDER BY updated_at LIMIT ?";
        return jdbcTemplate.query(sql, rowMapper, status.name(), limit);
    }

    @Override
    public long countActive(String workflowId) {
        String sql = """
            SELECT COUNT(*) FROM workflow_executions
            WHERE workflow_id = ? AND status IN ('RUNNING', 'PAUSED')
            """;
        Long count = jdbcTemplate.queryForObject(sql, Long.class, workflowId);
        return count != null ? count : 0;
    }

    @Override
    public ExecutionStatistics statistics(String workflowId) {
        String sql = """
            SELECT
                COUNT(*) AS total,
                COUNT(*) FILTER (WHERE status = 'COMPLETED') AS successful,
                COUNT(*) FILTER (WHERE status = 'FAILED') AS failed,
                AVG(EXTRACT(EPOCH FROM (completed_at - started_at)))
                    FILTER (WHERE completed_at IS NOT NULL) AS average_seconds
            FROM workflow_executions
            WHERE (?::text IS NULL OR workflow_id = ?)
            """;

        return jdbcTemplate.queryForObject(sql, (rs, rowNum) -> ExecutionStatistics.of(
            rs.getLong("total"),
            rs.getLong("successful"),
            rs.getLong("failed"),
            rs.getDouble("average_seconds")
        ), workflowId, workflowId);
    }

    private class WorkflowExecutionRowMapper implements RowMapper<WorkflowExecution> {
        @Override
        public WorkflowExecution mapRow(ResultSet rs, int rowNum) throws SQLException {
            String pauseReason = rs.getString("pause_reason");
            return new WorkflowExecution(
                rs.getString("id"),
                rs.getString("workflow_id"),
                rs.getInt("definition_version"),
                ExecutionStatus.valueOf(rs.getString("status")),
                pauseReason != null ? PauseReason.valueOf(pauseReason) : null,
                rs.getString("current_step_id"),
                json.readMap(rs.getString("context")),
                rs.getString("error"),
                rs.getInt("retry_count"),
                toInstant(rs.getTimestamp("started_at")),
                toInstant(rs.getTimestamp("completed_at")),
                toInstant(rs.getTimestamp("updated_at")),
                rs.getLong("sequence_number")
            );
        }
    }
}
