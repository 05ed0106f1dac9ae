package com.canonicalsync.core.model;

import java.time.Instant;

/**
 * Retry-gating timestamps per (tenant, environment, job kind).
 * lastSyncAttemptedAt advances before every job creation attempt,
 * lastSyncAt on every terminal transition, success or failure.
 */
public record SyncTimestamps(
    String tenantId,
    String environmentId,
    SyncJobKind jobKind,
    Instant lastSyncAttemptedAt,
    Instant lastSyncAt
) {
    /**
     * The later of the two timestamps, or null when the environment was never synced.
     */
    public Instant lastActivityAt() {
        if (lastSyncAttemptedAt == null) {
            return lastSyncAt;
        }
        if (lastSyncAt == null) {
            return lastSyncAttemptedAt;
        }
        return lastSyncAt.isAfter(lastSyncAttemptedAt) ? lastSyncAt : lastSyncAttemptedAt;
    }
}
