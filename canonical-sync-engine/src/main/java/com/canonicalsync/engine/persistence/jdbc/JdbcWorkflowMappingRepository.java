package com.canonicalsync.engine.persistence.jdbc;

import com.canonicalsync.core.model.MappingStatus;
import com.canonicalsync.core.model.WorkflowEnvironmentMapping;
import com.canonicalsync.core.repository.WorkflowMappingRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
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
 * PostgreSQL-backed implementation of WorkflowMappingRepository.
 * Upserts are keyed on the primary key (tenant, environment, runtime instance id);
 * concurrent writers to one key serialize in the database, last writer wins.
 */
@Repository("jdbcWorkflowMappingRepository")
public class JdbcWorkflowMappingRepository implements WorkflowMappingRepository {

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final MappingRowMapper rowMapper = new MappingRowMapper();

    public JdbcWorkflowMappingRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public void upsert(WorkflowEnvironmentMapping mapping) {
        String sql = """
            INSERT INTO workflow_env_map (
                tenant_id, environment_id, runtime_instance_id, canonical_id, status,
                env_content_hash, runtime_updated_at, payload, last_synced_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?)
            ON CONFLICT (tenant_id, environment_id, runtime_instance_id) DO UPDATE SET
                canonical_id = EXCLUDED.canonical_id,
                status = EXCLUDED.status,
                env_content_hash = EXCLUDED.env_content_hash,
                runtime_updated_at = EXCLUDED.runtime_updated_at,
                payload = EXCLUDED.payload,
                last_synced_at = EXCLUDED.last_synced_at
            """;

        jdbcTemplate.update(sql,
            mapping.tenantId(),
            mapping.environmentId(),
            mapping.runtimeInstanceId(),
            mapping.canonicalId(),
            mapping.status().name(),
            mapping.environmentContentHash(),
            toTimestamp(mapping.runtimeUpdatedAt()),
            toJson(mapping.payload()),
            toTimestamp(mapping.lastSyncedAt())
        );
    }

    @Override
    public Optional<WorkflowEnvironmentMapping> findByRuntimeInstance(
            String tenantId, String environmentId, String runtimeInstanceId) {
        String sql = """
            SELECT * FROM workflow_env_map
            WHERE tenant_id = ? AND environment_id = ? AND runtime_instance_id = ?
            """;
        List<WorkflowEnvironmentMapping> results =
            jdbcTemplate.query(sql, rowMapper, tenantId, environmentId, runtimeInstanceId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<WorkflowEnvironmentMapping> findByEnvironment(String tenantId, String environmentId) {
        String sql = """
            SELECT * FROM workflow_env_map
            WHERE tenant_id = ? AND environment_id = ?
            ORDER BY runtime_instance_id
            """;
        return jdbcTemplate.query(sql, rowMapper, tenantId, environmentId);
    }

    @Override
    public List<WorkflowEnvironmentMapping> findByCanonicalId(String tenantId, String environmentId, String canonicalId) {
        String sql = """
            SELECT * FROM workflow_env_map
            WHERE tenant_id = ? AND environment_id = ? AND canonical_id = ?
            ORDER BY runtime_instance_id
            """;
        return jdbcTemplate.query(sql, rowMapper, tenantId, environmentId, canonicalId);
    }

    @Override
    public boolean updateStatus(
            String tenantId, String environmentId, String runtimeInstanceId,
            MappingStatus status, Instant lastSyncedAt) {
        String sql = """
            UPDATE workflow_env_map SET status = ?, last_synced_at = ?
            WHERE tenant_id = ? AND environment_id = ? AND runtime_instance_id = ?
            """;
        return jdbcTemplate.update(sql,
            status.name(), toTimestamp(lastSyncedAt), tenantId, environmentId, runtimeInstanceId) > 0;
    }

    // ========== Helper Methods ==========

    private String toJson(JsonNode node) {
        if (node == null) return null;
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize payload to JSON", e);
        }
    }

    private Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private class MappingRowMapper implements RowMapper<WorkflowEnvironmentMapping> {
        @Override
        public WorkflowEnvironmentMapping mapRow(ResultSet rs, int rowNum) throws SQLException {
            try {
                String payload = rs.getString("payload");
                return new WorkflowEnvironmentMapping(
                    rs.getString("tenant_id"),
                    rs.getString("environment_id"),
                    rs.getString("runtime_instance_id"),
                    rs.getString("canonical_id"),
                    MappingStatus.valueOf(rs.getString("status")),
                    rs.getString("env_content_hash"),
                    toInstant(rs.getTimestamp("runtime_updated_at")),
                    payload != null ? objectMapper.readTree(payload) : null,
                    toInstant(rs.getTimestamp("last_synced_at"))
                );
            } catch (JsonProcessingException e) {
                throw new SQLException("Failed to map workflow mapping row", e);
            }
        }

        private Instant toInstant(Timestamp ts) {
            return ts != null ? ts.toInstant() : null;
        }
    }
}
