package com.canonicalsync.api.rest;

import com.canonicalsync.core.model.ConflictMetadata;
import com.canonicalsync.core.model.DiffStatus;
import com.canonicalsync.core.model.WorkflowDiffState;
import com.canonicalsync.core.repository.WorkflowDiffStateRepository;
import com.canonicalsync.engine.reconcile.ReconcileResult;
import com.canonicalsync.engine.service.ReconciliationService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;

/**
 * REST API for pairwise diff status between environments.
 */
@RestController
@RequestMapping("/api/v1/diffs")
public class DiffController {

    private final WorkflowDiffStateRepository diffStateRepository;
    private final ReconciliationService reconciliationService;

    public DiffController(WorkflowDiffStateRepository diffStateRepository,
                          ReconciliationService reconciliationService) {
        this.diffStateRepository = diffStateRepository;
        this.reconciliationService = reconciliationService;
    }

    /**
     * Stored diff rows of an ordered environment pair.
     */
    @GetMapping
    public ResponseEntity<List<DiffResponse>> getDiffs(
            @RequestHeader(SyncController.TENANT_HEADER) String tenantId,
            @RequestParam String source,
            @RequestParam String target) {

        List<DiffResponse> diffs = diffStateRepository.findByPair(tenantId, source, target).stream()
            .map(DiffResponse::from)
            .toList();
        return ResponseEntity.ok(diffs);
    }

    /**
     * Recompute an ordered pair now. Without force, a call inside the debounce window is skipped.
     */
    @PostMapping("/reconcile")
    public ResponseEntity<ReconcileResult> reconcile(
            @RequestHeader(SyncController.TENANT_HEADER) String tenantId,
            @RequestParam String source,
            @RequestParam String target,
            @RequestParam(defaultValue = "false") boolean force) {

        return ResponseEntity.ok(reconciliationService.reconcilePair(tenantId, source, target, force));
    }

    public record DiffResponse(
        String canonicalId,
        String sourceEnvironmentId,
        String targetEnvironmentId,
        DiffStatus diffStatus,
        String sourceGitHash,
        String targetGitHash,
        String sourceEnvHash,
        String targetEnvHash,
        ConflictMetadata conflictMetadata,
        Instant computedAt
    ) {
        public static DiffResponse from(WorkflowDiffState state) {
            return new DiffResponse(
                state.canonicalId(),
                state.sourceEnvironmentId(),
                state.targetEnvironmentId(),
                state.diffStatus(),
                state.sourceGitHash(),
                state.targetGitHash(),
                state.sourceEnvHash(),
                state.targetEnvHash(),
                state.conflictMetadata(),
                state.computedAt()
            );
        }
    }
}
