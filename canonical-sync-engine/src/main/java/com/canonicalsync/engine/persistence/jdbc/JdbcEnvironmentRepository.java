package com.canonicalsync.engine.persistence.jdbc;

import com.canonicalsync.core.model.Environment;
import com.canonicalsync.core.model.GitRepositoryConfig;
import com.canonicalsync.core.model.SyncJobKind;
import com.canonicalsync.core.model.SyncTimestamps;
import com.canonicalsync.core.repository.EnvironmentRepository;
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
 * PostgreSQL-backed implementation of EnvironmentRepository.
 * Gating timestamps live in environment_sync_timestamps, one row per job kind.
 */
@Repository("jdbcEnvironmentRepository")
public class JdbcEnvironmentRepository implements EnvironmentRepository {

    private final JdbcTemplate jdbcTemplate;
    private final EnvironmentRowMapper environmentMapper = new EnvironmentRowMapper();

    public JdbcEnvironmentRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Insert or replace an environment definition.
     */
    public void save(Environment environment) {
        String sql = """
            INSERT INTO environments (
                tenant_id, environment_id, name, environment_class, runtime_base_url, runtime_api_key,
                git_repo_url, git_branch, git_folder, git_pinned_commit, git_access_token
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (tenant_id, environment_id) DO UPDATE SET
                name = EXCLUDED.name,
                environment_class = EXCLUDED.environment_class,
                runtime_base_url = EXCLUDED.runtime_base_url,
                runtime_api_key = EXCLUDED.runtime_api_key,
                git_repo_url = EXCLUDED.git_repo_url,
                git_branch = EXCLUDED.git_branch,
                git_folder = EXCLUDED.git_folder,
                git_pinned_commit = EXCLUDED.git_pinned_commit,
                git_access_token = EXCLUDED.git_access_token
            """;

        GitRepositoryConfig git = environment.git();
        jdbcTemplate.update(sql,
            environment.tenantId(),
            environment.environmentId(),
            environment.name(),
            environment.environmentClass(),
            environment.runtimeBaseUrl(),
            environment.runtimeApiKey(),
            git != null ? git.repoUrl() : null,
            git != null ? git.branch() : null,
            git != null ? git.folder() : null,
            git != null ? git.pinnedCommitSha() : null,
            git != null ? git.accessToken() : null
        );
    }

    @Override
    public Optional<Environment> findById(String tenantId, String environmentId) {
        String sql = "SELECT * FROM environments WHERE tenant_id = ? AND environment_id = ?";
        List<Environment> results = jdbcTemplate.query(sql, environmentMapper, tenantId, environmentId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<Environment> findByTenant(String tenantId) {
        String sql = "SELECT * FROM environments WHERE tenant_id = ? ORDER BY environment_id";
        return jdbcTemplate.query(sql, environmentMapper, tenantId);
    }

    @Override
    public List<Environment> findAll() {
        String sql = "SELECT * FROM environments ORDER BY tenant_id, environment_id";
        return jdbcTemplate.query(sql, environmentMapper);
    }

    @Override
    public Optional<SyncTimestamps> findSyncTimestamps(String tenantId, String environmentId, SyncJobKind jobKind) {
        String sql = """
            SELECT * FROM environment_sync_timestamps
            WHERE tenant_id = ? AND environment_id = ? AND job_kind = ?
            """;
        List<SyncTimestamps> results = jdbcTemplate.query(sql, (rs, rowNum) -> new SyncTimestamps(
            rs.getString("tenant_id"),
            rs.getString("environment_id"),
            SyncJobKind.valueOf(rs.getString("job_kind")),
            toInstant(rs.getTimestamp("last_sync_attempted_at")),
            toInstant(rs.getTimestamp("last_sync_at"))
        ), tenantId, environmentId, jobKind.name());
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public void markSyncAttempted(String tenantId, String environmentId, SyncJobKind jobKind, Instant at) {
        String sql = """
            INSERT INTO environment_sync_timestamps (tenant_id, environment_id, job_kind, last_sync_attempted_at)
            VALUES (?, ?, ?, ?)
            ON CONFLICT (tenant_id, environment_id, job_kind) DO UPDATE SET
                last_sync_attempted_at = EXCLUDED.last_sync_attempted_at
            """;
        jdbcTemplate.update(sql, tenantId, environmentId, jobKind.name(), Timestamp.from(at));
    }

    @Override
    public void markSynced(String tenantId, String environmentId, SyncJobKind jobKind, Instant at) {
        String sql = """
            INSERT INTO environment_sync_timestamps (tenant_id, environment_id, job_kind, last_sync_at)
            VALUES (?, ?, ?, ?)
            ON CONFLICT (tenant_id, environment_id, job_kind) DO UPDATE SET
                last_sync_at = EXCLUDED.last_sync_at
            """;
        jdbcTemplate.update(sql, tenantId, environmentId, jobKind.name(), Timestamp.from(at));
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    private static class EnvironmentRowMapper implements RowMapper<Environment> {
        @Override
        public Environment mapRow(ResultSet rs, int rowNum) throws SQLException {
            String repoUrl = rs.getString("git_repo_url");
            GitRepositoryConfig git = repoUrl == null ? null : new GitRepositoryConfig(
                repoUrl,
                rs.getString("git_branch"),
                rs.getString("git_folder"),
                rs.getString("git_pinned_commit"),
                rs.getString("git_access_token")
            );
            return new Environment(
                rs.getString("tenant_id"),
                rs.getString("environment_id"),
                rs.getString("name"),
                rs.getString("environment_class"),
                rs.getString("runtime_base_url"),
                rs.getString("runtime_api_key"),
                git
            );
        }
    }
}
