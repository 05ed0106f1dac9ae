package com.canonicalsync.core.repository;

import com.canonicalsync.core.model.SyncJob;
import com.canonicalsync.core.model.SyncJobKind;
import com.canonicalsync.core.model.SyncJobStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for sync jobs.
 *
 * The store itself guarantees that at most one PENDING or RUNNING job exists
 * per (tenant, environment, job kind); callers never rely on in-process locks.
 */
public interface SyncJobRepository {

    /**
     * Atomically insert a new job.
     *
     * @throws com.canonicalsync.core.exception.DuplicateActiveJobException
     *         if a non-terminal job already exists for the same key
     */
    void create(SyncJob job);

    /**
     * Persist a changed job (status, progress, result or error) only if the stored
     * job is still in {@code expectedStatus}.
     *
     * @return false if another writer moved the job out of the expected status first
     */
    boolean update(SyncJob job, SyncJobStatus expectedStatus);

    /**
     * Persist a terminal job and advance lastSyncAt of its environment and kind
     * in one unit of work. Guarded like {@link #update}; nothing is written when
     * the guard fails.
     *
     * @return false if another writer moved the job out of the expected status first
     */
    boolean finish(SyncJob job, SyncJobStatus expectedStatus);

    /**
     * Find a job by id.
     */
    Optional<SyncJob> findById(UUID jobId);

    /**
     * Find the pending or running job for a key, if any.
     */
    Optional<SyncJob> findActive(String tenantId, String environmentId, SyncJobKind jobKind);

    /**
     * Find the most recently created job for a key, in any status.
     */
    Optional<SyncJob> findLatest(String tenantId, String environmentId, SyncJobKind jobKind);

    /**
     * Find non-terminal jobs whose last update is older than the cutoff.
     *
     * @param olderThan jobs last updated before this instant
     * @param limit maximum number of jobs to return
     */
    List<SyncJob> findStale(Instant olderThan, int limit);
}
