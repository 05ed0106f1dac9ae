package com.canonicalsync.api.rest;

import com.canonicalsync.core.model.SyncJob;
import com.canonicalsync.core.model.SyncJobKind;
import com.canonicalsync.core.model.SyncJobStatus;
import com.canonicalsync.core.model.SyncProgress;
import com.canonicalsync.engine.coordinator.SyncJobDispatcher;
import com.canonicalsync.engine.service.SyncService;
import com.canonicalsync.engine.service.SyncService.KindStatus;
import com.canonicalsync.engine.service.SyncService.SyncRequestResult;
import com.canonicalsync.engine.service.SyncService.SyncStatus;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.UUID;

/**
 * REST API for requesting syncs and following their jobs.
 */
@RestController
@RequestMapping("/api/v1")
public class SyncController {

    static final String TENANT_HEADER = "X-Tenant-Id";

    private final SyncService syncService;
    private final SyncJobDispatcher dispatcher;

    public SyncController(SyncService syncService, SyncJobDispatcher dispatcher) {
        this.syncService = syncService;
        this.dispatcher = dispatcher;
    }

    /**
     * Request a sync. A new job runs in the background; an active job is returned as is.
     */
    @PostMapping("/environments/{environmentId}/sync")
    public ResponseEntity<SyncRequestResponse> requestSync(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @PathVariable String environmentId,
            @RequestParam(defaultValue = "ENV_SYNC") SyncJobKind kind) {

        SyncRequestResult result = dispatcher.requestAndDispatch(tenantId, environmentId, kind);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
            .body(new SyncRequestResponse(SyncJobResponse.from(result.job()), result.isNew()));
    }

    /**
     * Latest job and gating timestamps per job kind.
     */
    @GetMapping("/environments/{environmentId}/sync-status")
    public ResponseEntity<SyncStatusResponse> getSyncStatus(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @PathVariable String environmentId) {

        return ResponseEntity.ok(SyncStatusResponse.from(syncService.getSyncStatus(tenantId, environmentId)));
    }

    /**
     * Get a job by id.
     */
    @GetMapping("/sync-jobs/{jobId}")
    public ResponseEntity<SyncJobResponse> getJob(@PathVariable UUID jobId) {
        return ResponseEntity.ok(SyncJobResponse.from(syncService.getJob(jobId)));
    }

    // ========== DTOs ==========

    public record SyncRequestResponse(
        SyncJobResponse job,
        @JsonProperty("isNew") boolean isNew
    ) {}

    public record SyncJobResponse(
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
        public static SyncJobResponse from(SyncJob job) {
            return new SyncJobResponse(
                job.jobId(),
                job.tenantId(),
                job.environmentId(),
                job.jobKind(),
                job.status(),
                job.trigger(),
                job.progress(),
                job.result(),
                job.error(),
                job.createdAt(),
                job.startedAt(),
                job.completedAt(),
                job.updatedAt()
            );
        }
    }

    public record KindStatusResponse(
        SyncJobResponse latestJob,
        Instant lastSyncAttemptedAt,
        Instant lastSyncAt
    ) {
        public static KindStatusResponse from(KindStatus status) {
            return new KindStatusResponse(
                status.latestJob() != null ? SyncJobResponse.from(status.latestJob()) : null,
                status.lastSyncAttemptedAt(),
                status.lastSyncAt()
            );
        }
    }

    public record SyncStatusResponse(
        String tenantId,
        String environmentId,
        Map<SyncJobKind, KindStatusResponse> kinds
    ) {
        public static SyncStatusResponse from(SyncStatus status) {
            Map<SyncJobKind, KindStatusResponse> kinds = new EnumMap<>(SyncJobKind.class);
            status.kinds().forEach((kind, kindStatus) -> kinds.put(kind, KindStatusResponse.from(kindStatus)));
            return new SyncStatusResponse(status.tenantId(), status.environmentId(), kinds);
        }
    }
}
