package com.canonicalsync.engine.service;

import com.canonicalsync.core.model.SyncJob;
import com.canonicalsync.core.model.SyncJobKind;
import com.canonicalsync.core.model.SyncProgress;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Service interface for the sync job lifecycle.
 */
public interface SyncService {

    // ========== Job Lifecycle ==========

    /**
     * Request a sync. Returns the already pending or running job when one exists;
     * never waits for it. Advances lastSyncAttemptedAt before creating a job.
     */
    SyncRequestResult requestSync(String tenantId, String environmentId, SyncJobKind jobKind, String trigger);

    /**
     * Move a pending job to running.
     */
    SyncJob startSync(UUID jobId);

    /**
     * Record progress and checkpoint of a running job.
     */
    SyncJob updateProgress(UUID jobId, SyncProgress progress);

    /**
     * Complete a job with its result. Advances lastSyncAt.
     */
    SyncJob completeSync(UUID jobId, JsonNode result);

    /**
     * Fail a job with an error. Advances lastSyncAt.
     */
    SyncJob failSync(UUID jobId, String error);

    /**
     * Execute a job with the engine registered for its kind and record the outcome.
     *
     * @return the job in its terminal state
     */
    SyncJob runJob(SyncJob job);

    // ========== Queries ==========

    SyncJob getJob(UUID jobId);

    SyncStatus getSyncStatus(String tenantId, String environmentId);

    // ========== Request/Response Records ==========

    record SyncRequestResult(SyncJob job, boolean isNew) {}

    record SyncStatus(
        String tenantId,
        String environmentId,
        Map<SyncJobKind, KindStatus> kinds
    ) {}

    record KindStatus(
        SyncJob latestJob,
        Instant lastSyncAttemptedAt,
        Instant lastSyncAt
    ) {}
}
