package com.canonicalsync.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Materialized reconciliation result for one canonical workflow between two environments.
 *
 * Unique Key: (tenantId, sourceEnvironmentId, targetEnvironmentId, canonicalId)
 *
 * Fully derivable from git state and environment mappings; safe to overwrite or drop.
 * conflictMetadata is non-null only when diffStatus is CONFLICT.
 */
public record WorkflowDiffState(
    String tenantId,
    String sourceEnvironmentId,
    String targetEnvironmentId,
    String canonicalId,
    DiffStatus diffStatus,
    String sourceGitHash,
    String targetGitHash,
    String sourceEnvHash,
    String targetEnvHash,
    ConflictMetadata conflictMetadata,
    Instant computedAt
) {
    /**
     * True when the stored hashes match the given ones, so recomputation can be skipped.
     */
    public boolean hasSameInputs(String sourceGit, String targetGit, String sourceEnv, String targetEnv) {
        return Objects.equals(sourceGitHash, sourceGit)
            && Objects.equals(targetGitHash, targetGit)
            && Objects.equals(sourceEnvHash, sourceEnv)
            && Objects.equals(targetEnvHash, targetEnv);
    }
}
