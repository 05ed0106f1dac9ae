package com.canonicalsync.engine.persistence.jdbc;

import com.canonicalsync.core.model.CanonicalWorkflow;
import com.canonicalsync.core.repository.CanonicalWorkflowRepository;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL-backed implementation of CanonicalWorkflowRepository.
 */
@Repository("jdbcCanonicalWorkflowRepository")
public class JdbcCanonicalWorkflowRepository implements CanonicalWorkflowRepository {

    private final JdbcTemplate jdbcTemplate;
    private final CanonicalWorkflowRowMapper rowMapper = new CanonicalWorkflowRowMapper();

    public JdbcCanonicalWorkflowRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public boolean createIfAbsent(CanonicalWorkflow workflow) {
        String sql = """
            INSERT INTO canonical_workflows (tenant_id, canonical_id, display_name, created_at, deleted_at)
            VALUES (?, ?, ?, ?, ?)
            ON CONFLICT (tenant_id, canonical_id) DO NOTHING
            """;

        int rows = jdbcTemplate.update(sql,
            workflow.tenantId(),
            workflow.canonicalId(),
            workflow.displayName(),
            Timestamp.from(workflow.createdAt()),
            toTimestamp(workflow.deletedAt())
        );
        return rows > 0;
    }

    @Override
    public Optional<CanonicalWorkflow> findById(String tenantId, String canonicalId) {
        String sql = """
            SELECT * FROM canonical_workflows
            WHERE tenant_id = ? AND canonical_id = ?
            """;
        List<CanonicalWorkflow> results = jdbcTemplate.query(sql, rowMapper, tenantId, canonicalId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<CanonicalWorkflow> findActive(String tenantId) {
        String sql = """
            SELECT * FROM canonical_workflows
            WHERE tenant_id = ? AND deleted_at IS NULL
            ORDER BY canonical_id
            """;
        return jdbcTemplate.query(sql, rowMapper, tenantId);
    }

    @Override
    public boolean markDeleted(String tenantId, String canonicalId, Instant deletedAt) {
        String sql = """
            UPDATE canonical_workflows SET deleted_at = ?
            WHERE tenant_id = ? AND canonical_id = ? AND deleted_at IS NULL
            """;
        return jdbcTemplate.update(sql, Timestamp.from(deletedAt), tenantId, canonicalId) > 0;
    }

    private Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static class CanonicalWorkflowRowMapper implements RowMapper<CanonicalWorkflow> {
        @Override
        public CanonicalWorkflow mapRow(ResultSet rs, int rowNum) throws SQLException {
            Timestamp deletedAt = rs.getTimestamp("deleted_at");
            return new CanonicalWorkflow(
                rs.getString("tenant_id"),
                rs.getString("canonical_id"),
                rs.getString("display_name"),
                rs.getTimestamp("created_at").toInstant(),
                deletedAt != null ? deletedAt.toInstant() : null
            );
        }
    }
}
