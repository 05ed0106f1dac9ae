package com.canonicalsync.core.model;

import com.canonicalsync.core.exception.InvalidStateTransitionException;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.UUID;

/**
 * Lifecycle record for one sync of one environment.
 *
 * Primary Key: jobId
 * Partial Unique Constraint: (tenantId, environmentId, jobKind) while status is PENDING or RUNNING
 *
 * Invariants:
 * - status transitions follow SyncJobStatus.canTransitionTo
 * - result is set only on COMPLETED, error only on FAILED
 */
public record SyncJob(
    UUID jobId,
    String tenantId,
    String environmentId,
    SyncJobKind jobKind,
    SyncJobStatus status,
    String trigger,

    SyncProgress progress,
    JsonNode result,
    String error,

    Instant createdAt,
    Instant startedAt,
    Instant completedAt,
    Instant updatedAt
) {
    public static final String TRIGGER_MANUAL = "manual";
    public static final String TRIGGER_SCHEDULER = "scheduler";

    /**
     * Create a new job in PENDING state with queued progress.
     */
    public static SyncJob pending(
            String tenantId,
            String environmentId,
            SyncJobKind jobKind,
            String trigger,
            Instant now) {
        return new SyncJob(
            UUID.randomUUID(),
            tenantId,
            environmentId,
            jobKind,
            SyncJobStatus.PENDING,
            trigger,
            SyncProgress.queued(),
            null,
            null,
            now,
            null,
            null,
            now
        );
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    /**
     * Checkpoint recorded by the last completed batch, if any.
     */
    public SyncCheckpoint checkpoint() {
        return progress != null ? progress.checkpoint() : null;
    }

    public SyncJob withRunning(Instant now) {
        requireTransition(SyncJobStatus.RUNNING);
        return new SyncJob(
            jobId, tenantId, environmentId, jobKind, SyncJobStatus.RUNNING, trigger,
            progress, result, error, createdAt, now, completedAt, now
        );
    }

    public SyncJob withProgress(SyncProgress newProgress, Instant now) {
        return new SyncJob(
            jobId, tenantId, environmentId, jobKind, status, trigger,
            newProgress, result, error, createdAt, startedAt, completedAt, now
        );
    }

    public SyncJob withCompleted(JsonNode jobResult, Instant now) {
        requireTransition(SyncJobStatus.COMPLETED);
        return new SyncJob(
            jobId, tenantId, environmentId, jobKind, SyncJobStatus.COMPLETED, trigger,
            progress, jobResult, null, createdAt, startedAt, now, now
        );
    }

    public SyncJob withFailed(String jobError, Instant now) {
        requireTransition(SyncJobStatus.FAILED);
        return new SyncJob(
            jobId, tenantId, environmentId, jobKind, SyncJobStatus.FAILED, trigger,
            progress, null, jobError, createdAt, startedAt, now, now
        );
    }

    private void requireTransition(SyncJobStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new InvalidStateTransitionException(status, target);
        }
    }
}
