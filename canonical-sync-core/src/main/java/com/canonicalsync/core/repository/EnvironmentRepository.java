package com.canonicalsync.core.repository;

import com.canonicalsync.core.model.Environment;
import com.canonicalsync.core.model.SyncJobKind;
import com.canonicalsync.core.model.SyncTimestamps;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository for environments and their retry-gating timestamps.
 */
public interface EnvironmentRepository {

    /**
     * Find an environment by key.
     */
    Optional<Environment> findById(String tenantId, String environmentId);

    /**
     * Find all environments of a tenant.
     */
    List<Environment> findByTenant(String tenantId);

    /**
     * Find all environments across all tenants. Used by the scheduler.
     */
    List<Environment> findAll();

    /**
     * Read the gating timestamps of one job kind for an environment.
     */
    Optional<SyncTimestamps> findSyncTimestamps(String tenantId, String environmentId, SyncJobKind jobKind);

    /**
     * Advance lastSyncAttemptedAt. Called before every job creation attempt.
     */
    void markSyncAttempted(String tenantId, String environmentId, SyncJobKind jobKind, Instant at);

    /**
     * Advance lastSyncAt. Called when a job completes or fails.
     */
    void markSynced(String tenantId, String environmentId, SyncJobKind jobKind, Instant at);
}
