package com.canonicalsync.core.model;

import java.time.Instant;

/**
 * Last-seen Git representation of a canonical workflow for one environment's pipeline.
 *
 * Unique Key: (tenantId, environmentId, canonicalId)
 * Owned exclusively by the Git sync engine.
 */
public record CanonicalGitState(
    String tenantId,
    String environmentId,
    String canonicalId,
    String gitPath,
    String gitContentHash,
    String gitCommitSha,
    Instant lastSyncedAt
) {
}
