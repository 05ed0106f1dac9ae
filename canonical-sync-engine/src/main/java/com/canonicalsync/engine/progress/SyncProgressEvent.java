package com.canonicalsync.engine.progress;

import com.canonicalsync.core.model.SyncJob;
import com.canonicalsync.core.model.SyncJobKind;
import com.canonicalsync.core.model.SyncJobStatus;
import com.canonicalsync.core.model.SyncProgress;

import java.time.Instant;
import java.util.UUID;

/**
 * Live progress of a job, emitted per batch and per state transition.
 */
public record SyncProgressEvent(
    UUID jobId,
    String tenantId,
    String environmentId,
    SyncJobKind jobKind,
    SyncJobStatus status,
    int current,
    int total,
    int percentage,
    String message,
    Instant emittedAt
) {
    public static SyncProgressEvent of(SyncJob job, Instant now) {
        SyncProgress progress = job.progress() != null ? job.progress() : SyncProgress.queued();
        return new SyncProgressEvent(
            job.jobId(),
            job.tenantId(),
            job.environmentId(),
            job.jobKind(),
            job.status(),
            progress.current(),
            progress.total(),
            progress.percentage(),
            progress.message(),
            now
        );
    }
}
