package com.canonicalsync.engine.sync;

import com.canonicalsync.engine.hashing.CollisionWarning;

import java.util.List;

/**
 * Outcome of a Git to database pass.
 *
 * @param commitSha commit the files were read at, null when it could not be resolved
 * @param created canonical workflows created on first sighting
 * @param updated existing canonical workflows whose git state changed
 * @param unchanged files whose fingerprint matched the recorded git state
 * @param sidecarsIngested environment-map files applied
 */
public record RepoSyncResult(
    String commitSha,
    int created,
    int updated,
    int unchanged,
    int sidecarsIngested,
    List<SyncError> errors,
    List<CollisionWarning> collisionWarnings
) implements SyncResult {
}
