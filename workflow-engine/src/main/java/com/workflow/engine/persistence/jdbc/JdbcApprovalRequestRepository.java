package com.workflow.engine.persistence.jdbc;

import com.workflow.core.model.ApprovalRequest;
import com.workflow.core.model.ApprovalStatus;
import com.workflow.core.repository.ApprovalRequestRepository;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

import static com.workflow.engine.persistence.jdbc.JsonColumns.toInstant;
import static com.workflow.engine.persistence.jdbc.JsonColumns.toTimestamp;

/**
 * PostgreSQL-backed implementation of ApprovalRequestRepository.
 * Resolution is a conditional update on status = 'PENDING', so exactly one response wins.
 */
public class JdbcApprovalRequestRepository implements ApprovalRequestRepository {

    private static final RowMapper<ApprovalRequest> ROW_MAPPER = (rs, rowNum) -> new ApprovalRequest(
        rs.getString("id"),
        rs.getString("execution_id"),
        rs.getString("step_id"),
        rs.getString("approver_id"),
        ApprovalStatus.valueOf(rs.getString("status")),
        toInstant(rs.getTimestamp("requested_at")),
        toInstant(rs.getTimestamp("responded_at")),
        rs.getString("comments")
    );

    private final JdbcTemplate jdbcTemplate;

    public JdbcApprovalRequestRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    @Transactional
    public void save(ApprovalRequest request) {
        String sql = """
            INSERT INTO approval_requests (
                id, execution_id, step_id, approver_id, status,
                requested_at, responded_at, comments
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            """;
        jdbcTemplate.update(sql,
            request.id(),
            request.executionId(),
            request.stepId(),
            request.approverId(),
            request.status().name(),
            toTimestamp(request.requestedAt()),
            toTimestamp(request.respondedAt()),
            request.comments()
        );
    }

    @Override
    @Transactional
    public boolean resolve(ApprovalRequest resolved) {
        String sql = """
            UPDATE approval_requests SET
                status = ?,
                responded_at = ?,
                comments = ?
            WHERE id = ? AND status = 'PENDING'
            """;
        int rows = jdbcTemplate.update(sql,
            resolved.status().name(),
            toTimestamp(resolved.respondedAt()),
            resolved.comments(),
            resolved.id()
        );
        return rows > 0;
    }

    @Override
    public Optional<ApprovalRequest> findById(String requestId) {
        List<ApprovalRequest> results = jdbcTemplate.query(
            "SELECT * FROM approval_requests WHERE id = ?", ROW_MAPPER, requestId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public Optional<ApprovalRequest> findPending(String executionId, String stepId) {
        String sql = """
            SELECT * FROM approval_requests
            WHERE execution_id = ? AND step_id = ? AND status = 'PENDING'
            LIMIT 1
            """;
        List<ApprovalRequest> results = jdbcTemplate.query(sql, ROW_MAPPER, executionId, stepId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public Optional<ApprovalRequest> findLatest(String executionId, String stepId) {
        String sql = """
            SELECT * FROM approval_requests
            WHERE execution_id = ? AND step_id = ?
            ORDER BY requested_at DESC
            LIMIT 1
            """;
        List<ApprovalRequest> results = jdbcTemplate.query(sql, ROW_MAPPER, executionId, stepId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<ApprovalRequest> findByExecution(String executionId) {
        return jdbcTemplate.query(
            "SELECT * FROM approval_requests WHERE execution_id = ? ORDER BY requested_at",
            ROW_MAPPER, executionId);
    }

    @Override
    public List<ApprovalRequest> findPendingByApprover(String approverId) {
        return jdbcTemplate.query(
            "SELECT * FROM approval_requests WHERE approver_id = ? AND status = 'PENDING' ORDER BY requested_at",
            ROW_MAPPER, approverId);
    }
}
