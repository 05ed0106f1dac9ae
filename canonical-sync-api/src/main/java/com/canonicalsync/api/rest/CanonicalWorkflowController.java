package com.canonicalsync.api.rest;

import com.canonicalsync.core.exception.NotFoundException;
import com.canonicalsync.core.model.CanonicalWorkflow;
import com.canonicalsync.core.repository.CanonicalWorkflowRepository;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * REST API for a tenant's canonical workflow identities.
 * Identities are created by repository syncs; tenants can only list and retire them.
 */
@RestController
@RequestMapping("/api/v1/canonical-workflows")
public class CanonicalWorkflowController {

    private final CanonicalWorkflowRepository canonicalWorkflowRepository;
    private final Clock clock;

    public CanonicalWorkflowController(CanonicalWorkflowRepository canonicalWorkflowRepository, Clock clock) {
        this.canonicalWorkflowRepository = canonicalWorkflowRepository;
        this.clock = clock;
    }

    @GetMapping
    public ResponseEntity<List<CanonicalWorkflowResponse>> listActive(
            @RequestHeader(SyncController.TENANT_HEADER) String tenantId) {

        List<CanonicalWorkflowResponse> workflows = canonicalWorkflowRepository.findActive(tenantId).stream()
            .map(CanonicalWorkflowResponse::from)
            .toList();
        return ResponseEntity.ok(workflows);
    }

    /**
     * Soft delete. Diff rows for the workflow are dropped on the next reconciliation.
     */
    @DeleteMapping("/{canonicalId}")
    public ResponseEntity<Void> delete(
            @RequestHeader(SyncController.TENANT_HEADER) String tenantId,
            @PathVariable String canonicalId) {

        if (!canonicalWorkflowRepository.markDeleted(tenantId, canonicalId, clock.instant())) {
            throw new NotFoundException("CanonicalWorkflow", canonicalId);
        }
        return ResponseEntity.noContent().build();
    }

    public record CanonicalWorkflowResponse(
        String canonicalId,
        String displayName,
        Instant createdAt
    ) {
        public static CanonicalWorkflowResponse from(CanonicalWorkflow workflow) {
            return new CanonicalWorkflowResponse(
                workflow.canonicalId(),
                workflow.displayName(),
                workflow.createdAt()
            );
        }
    }
}
