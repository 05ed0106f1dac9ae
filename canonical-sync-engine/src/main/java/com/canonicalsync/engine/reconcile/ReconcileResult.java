package com.canonicalsync.engine.reconcile;

import com.canonicalsync.engine.sync.SyncError;

import java.util.List;

/**
 * Outcome of reconciling one ordered environment pair.
 *
 * @param updated diff rows recomputed and written
 * @param unchanged canonical workflows whose inputs matched the stored row
 * @param removed stale diff rows dropped
 * @param skippedByDebounce the call fell inside the debounce window and did nothing
 */
public record ReconcileResult(
    String sourceEnvironmentId,
    String targetEnvironmentId,
    int updated,
    int unchanged,
    int removed,
    boolean skippedByDebounce,
    List<SyncError> errors
) {
    public static ReconcileResult debounced(String sourceEnvironmentId, String targetEnvironmentId) {
        return new ReconcileResult(sourceEnvironmentId, targetEnvironmentId, 0, 0, 0, true, List.of());
    }
}
