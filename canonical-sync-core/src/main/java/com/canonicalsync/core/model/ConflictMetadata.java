package com.canonicalsync.core.model;

import java.time.Instant;

/**
 * Snapshot of the four contributing hashes at the moment a conflict was detected,
 * kept for manual resolution downstream.
 */
public record ConflictMetadata(
    String sourceGitHash,
    Instant sourceGitSyncedAt,
    String targetGitHash,
    Instant targetGitSyncedAt,
    String sourceEnvHash,
    Instant sourceEnvSyncedAt,
    String targetEnvHash,
    Instant targetEnvSyncedAt,
    Instant detectedAt
) {
}
