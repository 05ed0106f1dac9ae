package com.canonicalsync.engine.persistence.jdbc;

import com.canonicalsync.core.exception.DuplicateActiveJobException;
import com.canonicalsync.core.model.SyncJob;
import com.canonicalsync.core.model.SyncJobKind;
import com.canonicalsync.core.model.SyncJobStatus;
import com.canonicalsync.core.model.SyncProgress;
import com.canonicalsync.core.repository.EnvironmentRepository;
import com.canonicalsync.core.repository.SyncJobRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * PostgreSQL-backed implementation of SyncJobRepository.
 *
 * At most one PENDING or RUNNING job per (tenant, environment, job kind) is
 * enforced by the partial unique index ux_sync_jobs_active; a violation surfaces
 * as DuplicateActiveJobException so callers can re-query and return the winner.
 * Updates are fenced on the job's previous status.
 */
@Repository("jdbcSyncJobRepository")
public class JdbcSyncJobRepository implements SyncJobRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcSyncJobRepository.class);

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final EnvironmentRepository environmentRepository;
    private final SyncJobRowMapper rowMapper;

    public JdbcSyncJobRepository(
            JdbcTemplate jdbcTemplate, ObjectMapper objectMapper, EnvironmentRepository environmentRepository) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.environmentRepository = environmentRepository;
        this.rowMapper = new SyncJobRowMapper();
    }

    @Override
    public void create(SyncJob job) {
        String sql = """
            INSERT INTO sync_jobs (
                job_id, tenant_id, environment_id, job_kind, status, trigger_source,
                progress, result, error, created_at, started_at, completed_at, updated_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?::jsonb, ?::jsonb, ?, ?, ?, ?, ?)
            """;

        try {
            jdbcTemplate.update(sql,
                job.jobId(),
                job.tenantId(),
                job.environmentId(),
                job.jobKind().name(),
                job.status().name(),
                job.trigger(),
                toJson(job.progress()),
                toJson(job.result()),
                job.error(),
                toTimestamp(job.createdAt()),
                toTimestamp(job.startedAt()),
                toTimestamp(job.completedAt()),
                toTimestamp(job.updatedAt())
            );
        } catch (DuplicateKeyException e) {
            log.debug("Active {} job already exists for {}/{}", job.jobKind(), job.tenantId(), job.environmentId());
            throw new DuplicateActiveJobException(job.tenantId(), job.environmentId(), job.jobKind(), e);
        }
    }

    @Override
    @Transactional
    public boolean update(SyncJob job, SyncJobStatus expectedStatus) {
        String sql = """
            UPDATE sync_jobs SET
                status = ?,
                progress = ?::jsonb,
                result = ?::jsonb,
                error = ?,
                started_at = ?,
                completed_at = ?,
                updated_at = ?
            WHERE job_id = ? AND status = ?
            """;

        int rows = jdbcTemplate.update(sql,
            job.status().name(),
            toJson(job.progress()),
            toJson(job.result()),
            job.error(),
            toTimestamp(job.startedAt()),
            toTimestamp(job.completedAt()),
            toTimestamp(job.updatedAt()),
            job.jobId(),
            expectedStatus.name()
        );

        if (rows == 0) {
            log.warn("Status fence mismatch for job {}: expected {}", job.jobId(), expectedStatus);
        }
        return rows > 0;
    }

    @Override
    @Transactional
    public boolean finish(SyncJob job, SyncJobStatus expectedStatus) {
        if (!update(job, expectedStatus)) {
            return false;
        }
        environmentRepository.markSynced(job.tenantId(), job.environmentId(), job.jobKind(), job.updatedAt());
        return true;
    }

    @Override
    public Optional<SyncJob> findById(UUID jobId) {
        String sql = "SELECT * FROM sync_jobs WHERE job_id = ?";
        List<SyncJob> results = jdbcTemplate.query(sql, rowMapper, jobId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public Optional<SyncJob> findActive(String tenantId, String environmentId, SyncJobKind jobKind) {
        String sql = """
            SELECT * FROM sync_jobs
            WHERE tenant_id = ? AND environment_id = ? AND job_kind = ?
              AND status IN ('PENDING', 'RUNNING')
            ORDER BY created_at DESC
            LIMIT 1
            """;
        List<SyncJob> results = jdbcTemplate.query(sql, rowMapper, tenantId, environmentId, jobKind.name());
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public Optional<SyncJob> findLatest(String tenantId, String environmentId, SyncJobKind jobKind) {
        String sql = """
            SELECT * FROM sync_jobs
            WHERE tenant_id = ? AND environment_id = ? AND job_kind = ?
            ORDER BY created_at DESC
            LIMIT 1
            """;
        List<SyncJob> results = jdbcTemplate.query(sql, rowMapper, tenantId, environmentId, jobKind.name());
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<SyncJob> findStale(Instant olderThan, int limit) {
        String sql = """
            SELECT * FROM sync_jobs
            WHERE status IN ('PENDING', 'RUNNING')
              AND updated_at < ?
            ORDER BY updated_at
            LIMIT ?
            """;
        return jdbcTemplate.query(sql, rowMapper, Timestamp.from(olderThan), limit);
    }

    // ========== Helper Methods ==========

    private String toJson(Object obj) {
        if (obj == null) return null;
        try {
            return objectMapper.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize to JSON", e);
        }
    }

    private Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private class SyncJobRowMapper implements RowMapper<SyncJob> {
        @Override
        public SyncJob mapRow(ResultSet rs, int rowNum) throws SQLException {
            try {
                String progress = rs.getString("progress");
                String result = rs.getString("result");
                return new SyncJob(
                    UUID.fromString(rs.getString("job_id")),
                    rs.getString("tenant_id"),
                    rs.getString("environment_id"),
                    SyncJobKind.valueOf(rs.getString("job_kind")),
                    SyncJobStatus.valueOf(rs.getString("status")),
                    rs.getString("trigger_source"),
                    progress != null ? objectMapper.readValue(progress, SyncProgress.class) : null,
                    result != null ? objectMapper.readTree(result) : null,
                    rs.getString("error"),
                    toInstant(rs.getTimestamp("created_at")),
                    toInstant(rs.getTimestamp("started_at")),
                    toInstant(rs.getTimestamp("completed_at")),
                    toInstant(rs.getTimestamp("updated_at"))
                );
            } catch (JsonProcessingException e) {
                throw new SQLException("Failed to map sync job row", e);
            }
        }

        private Instant toInstant(Timestamp ts) {
            return ts != null ? ts.toInstant() : null;
        }
    }
}
