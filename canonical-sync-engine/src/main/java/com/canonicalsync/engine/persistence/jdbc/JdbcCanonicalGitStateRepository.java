package com.canonicalsync.engine.persistence.jdbc;

import com.canonicalsync.core.model.CanonicalGitState;
import com.canonicalsync.core.repository.CanonicalGitStateRepository;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL-backed implementation of CanonicalGitStateRepository.
 */
@Repository("jdbcCanonicalGitStateRepository")
public class JdbcCanonicalGitStateRepository implements CanonicalGitStateRepository {

    private final JdbcTemplate jdbcTemplate;
    private final GitStateRowMapper rowMapper = new GitStateRowMapper();

    public JdbcCanonicalGitStateRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void upsert(CanonicalGitState state) {
        String sql = """
            INSERT INTO canonical_git_state (
                tenant_id, environment_id, canonical_id,
                git_path, git_content_hash, git_commit_sha, last_synced_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (tenant_id, environment_id, canonical_id) DO UPDATE SET
                git_path = EXCLUDED.git_path,
                git_content_hash = EXCLUDED.git_content_hash,
                git_commit_sha = EXCLUDED.git_commit_sha,
                last_synced_at = EXCLUDED.last_synced_at
            """;

        jdbcTemplate.update(sql,
            state.tenantId(),
            state.environmentId(),
            state.canonicalId(),
            state.gitPath(),
            state.gitContentHash(),
            state.gitCommitSha(),
            state.lastSyncedAt() != null ? Timestamp.from(state.lastSyncedAt()) : null
        );
    }

    @Override
    public Optional<CanonicalGitState> find(String tenantId, String environmentId, String canonicalId) {
        String sql = """
            SELECT * FROM canonical_git_state
            WHERE tenant_id = ? AND environment_id = ? AND canonical_id = ?
            """;
        List<CanonicalGitState> results = jdbcTemplate.query(sql, rowMapper, tenantId, environmentId, canonicalId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<CanonicalGitState> findByContentHash(String tenantId, String environmentId, String contentHash) {
        String sql = """
            SELECT * FROM canonical_git_state
            WHERE tenant_id = ? AND environment_id = ? AND git_content_hash = ?
            ORDER BY canonical_id
            """;
        return jdbcTemplate.query(sql, rowMapper, tenantId, environmentId, contentHash);
    }

    @Override
    public List<CanonicalGitState> findByEnvironment(String tenantId, String environmentId) {
        String sql = """
            SELECT * FROM canonical_git_state
            WHERE tenant_id = ? AND environment_id = ?
            ORDER BY canonical_id
            """;
        return jdbcTemplate.query(sql, rowMapper, tenantId, environmentId);
    }

    private static class GitStateRowMapper implements RowMapper<CanonicalGitState> {
        @Override
        public CanonicalGitState mapRow(ResultSet rs, int rowNum) throws SQLException {
            Timestamp syncedAt = rs.getTimestamp("last_synced_at");
            return new CanonicalGitState(
                rs.getString("tenant_id"),
                rs.getString("environment_id"),
                rs.getString("canonical_id"),
                rs.getString("git_path"),
                rs.getString("git_content_hash"),
                rs.getString("git_commit_sha"),
                syncedAt != null ? syncedAt.toInstant() : null
            );
        }
    }
}
