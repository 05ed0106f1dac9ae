package com.canonicalsync.engine.sync;

import com.canonicalsync.engine.hashing.CollisionWarning;

import java.util.List;

/**
 * Outcome of a runtime to database pass.
 *
 * @param totalCount workflows in the runtime listing
 * @param created mappings created for instances never seen before
 * @param updated existing mappings rewritten with a fresh fingerprint
 * @param linked mappings that became linked during this pass
 * @param untracked mappings left or created without a canonical workflow
 * @param skipped instances short-circuited because nothing changed
 * @param missing mappings transitioned to missing
 * @param revived missing mappings whose instance reappeared
 */
public record RuntimeSyncResult(
    int totalCount,
    int created,
    int updated,
    int linked,
    int untracked,
    int skipped,
    int missing,
    int revived,
    List<SyncError> errors,
    List<CollisionWarning> collisionWarnings
) implements SyncResult {
}
