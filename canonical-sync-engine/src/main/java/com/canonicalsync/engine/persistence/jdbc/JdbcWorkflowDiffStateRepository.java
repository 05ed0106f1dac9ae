package com.canonicalsync.engine.persistence.jdbc;

import com.canonicalsync.core.model.ConflictMetadata;
import com.canonicalsync.core.model.DiffStatus;
import com.canonicalsync.core.model.WorkflowDiffState;
import com.canonicalsync.core.repository.WorkflowDiffStateRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL-backed implementation of WorkflowDiffStateRepository.
 * Conflict metadata is stored as JSONB next to the four input hashes.
 */
@Repository("jdbcWorkflowDiffStateRepository")
public class JdbcWorkflowDiffStateRepository implements WorkflowDiffStateRepository {

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final DiffStateRowMapper rowMapper;

    public JdbcWorkflowDiffStateRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.rowMapper = new DiffStateRowMapper();
    }

    @Override
    public void upsert(WorkflowDiffState state) {
        String sql = """
            INSERT INTO workflow_diff_state (
                tenant_id, source_environment_id, target_environment_id, canonical_id,
                diff_status, source_git_hash, target_git_hash, source_env_hash, target_env_hash,
                conflict_metadata, computed_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?)
            ON CONFLICT (tenant_id, source_environment_id, target_environment_id, canonical_id) DO UPDATE SET
                diff_status = EXCLUDED.diff_status,
                source_git_hash = EXCLUDED.source_git_hash,
                target_git_hash = EXCLUDED.target_git_hash,
                source_env_hash = EXCLUDED.source_env_hash,
                target_env_hash = EXCLUDED.target_env_hash,
                conflict_metadata = EXCLUDED.conflict_metadata,
                computed_at = EXCLUDED.computed_at
            """;

        jdbcTemplate.update(sql,
            state.tenantId(),
            state.sourceEnvironmentId(),
            state.targetEnvironmentId(),
            state.canonicalId(),
            state.diffStatus().name(),
            state.sourceGitHash(),
            state.targetGitHash(),
            state.sourceEnvHash(),
            state.targetEnvHash(),
            toJson(state.conflictMetadata()),
            Timestamp.from(state.computedAt())
        );
    }

    @Override
    public Optional<WorkflowDiffState> find(
            String tenantId, String sourceEnvironmentId, String targetEnvironmentId, String canonicalId) {
        String sql = """
            SELECT * FROM workflow_diff_state
            WHERE tenant_id = ? AND source_environment_id = ? AND target_environment_id = ? AND canonical_id = ?
            """;
        List<WorkflowDiffState> results = jdbcTemplate.query(
            sql, rowMapper, tenantId, sourceEnvironmentId, targetEnvironmentId, canonicalId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<WorkflowDiffState> findByPair(String tenantId, String sourceEnvironmentId, String targetEnvironmentId) {
        String sql = """
            SELECT * FROM workflow_diff_state
            WHERE tenant_id = ? AND source_environment_id = ? AND target_environment_id = ?
            ORDER BY canonical_id
            """;
        return jdbcTemplate.query(sql, rowMapper, tenantId, sourceEnvironmentId, targetEnvironmentId);
    }

    @Override
    public void delete(String tenantId, String sourceEnvironmentId, String targetEnvironmentId, String canonicalId) {
        String sql = """
            DELETE FROM workflow_diff_state
            WHERE tenant_id = ? AND source_environment_id = ? AND target_environment_id = ? AND canonical_id = ?
            """;
        jdbcTemplate.update(sql, tenantId, sourceEnvironmentId, targetEnvironmentId, canonicalId);
    }

    private String toJson(ConflictMetadata metadata) {
        if (metadata == null) return null;
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize conflict metadata", e);
        }
    }

    private class DiffStateRowMapper implements RowMapper<WorkflowDiffState> {
        @Override
        public WorkflowDiffState mapRow(ResultSet rs, int rowNum) throws SQLException {
            try {
                String metadata = rs.getString("conflict_metadata");
                return new WorkflowDiffState(
                    rs.getString("tenant_id"),
                    rs.getString("source_environment_id"),
                    rs.getString("target_environment_id"),
                    rs.getString("canonical_id"),
                    DiffStatus.valueOf(rs.getString("diff_status")),
                    rs.getString("source_git_hash"),
                    rs.getString("target_git_hash"),
                    rs.getString("source_env_hash"),
                    rs.getString("target_env_hash"),
                    metadata != null ? objectMapper.readValue(metadata, ConflictMetadata.class) : null,
                    rs.getTimestamp("computed_at").toInstant()
                );
            } catch (JsonProcessingException e) {
                throw new SQLException("Failed to map workflow diff row", e);
            }
        }
    }
}
