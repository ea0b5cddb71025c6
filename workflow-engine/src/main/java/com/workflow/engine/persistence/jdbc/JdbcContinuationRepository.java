package com.workflow.engine.persistence.jdbc;

import com.workflow.scheduler.ContinuationRepository;
import com.workflow.scheduler.ContinuationType;
import com.workflow.scheduler.ScheduledContinuation;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

import static com.workflow.engine.persistence.jdbc.JsonColumns.toInstant;
import static com.workflow.engine.persistence.jdbc.JsonColumns.toTimestamp;

/**
 * PostgreSQL-backed continuation table, so pending delays and retries survive a restart.
 * Firing is a conditional update, so a continuation fires at most once.
 */
public class JdbcContinuationRepository implements ContinuationRepository {

    private static final RowMapper<ScheduledContinuation> ROW_MAPPER = (rs, rowNum) -> new ScheduledContinuation(
        rs.getString("id"),
        rs.getString("execution_id"),
        rs.getLong("execution_sequence"),
        rs.getString("step_id"),
        ContinuationType.valueOf(rs.getString("type")),
        toInstant(rs.getTimestamp("wake_at")),
        rs.getBoolean("fired"),
        toInstant(rs.getTimestamp("fired_at")),
        rs.getBoolean("cancelled"),
        toInstant(rs.getTimestamp("created_at"))
    );

    private final JdbcTemplate jdbcTemplate;

    public JdbcContinuationRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    @Transactional
    public void save(ScheduledContinuation continuation) {
        String sql = """
            INSERT INTO scheduled_continuations (
                id, execution_id, execution_sequence, step_id, type, wake_at,
                fired, fired_at, cancelled, created_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;
        jdbcTemplate.update(sql,
            continuation.id(),
            continuation.executionId(),
            continuation.executionSequence(),
            continuation.stepId(),
            continuation.type().name(),
            toTimestamp(continuation.wakeAt()),
            continuation.fired(),
            toTimestamp(continuation.firedAt()),
            continuation.cancelled(),
            toTimestamp(continuation.createdAt())
        );
    }

    @Override
    public List<ScheduledContinuation> findDue(Instant now, int limit) {
        String sql = """
            SELECT * FROM scheduled_continuations
            WHERE fired = FALSE AND cancelled = FALSE AND wake_at <= ?
            ORDER BY wake_at
            LIMIT ?
            """;
        return jdbcTemplate.query(sql, ROW_MAPPER, Timestamp.from(now), limit);
    }

    @Override
    public List<ScheduledContinuation> findPendingByExecution(String executionId) {
        String sql = """
            SELECT * FROM scheduled_continuations
            WHERE execution_id = ? AND fired = FALSE AND cancelled = FALSE
            ORDER BY wake_at
            """;
        return jdbcTemplate.query(sql, ROW_MAPPER, executionId);
    }

    @Override
    @Transactional
    public boolean markFired(String continuationId, Instant firedAt) {
        String sql = """
            UPDATE scheduled_continuations SET fired = TRUE, fired_at = ?
            WHERE id = ? AND fired = FALSE AND cancelled = FALSE
            """;
        return jdbcTemplate.update(sql, Timestamp.from(firedAt), continuationId) > 0;
    }

    @Override
    @Transactional
    public int cancelByExecution(String executionId) {
        String sql = """
            UPDATE scheduled_continuations SET cancelled = TRUE
            WHERE execution_id = ? AND fired = FALSE AND cancelled = FALSE
            """;
        return jdbcTemplate.update(sql, executionId);
    }
}
