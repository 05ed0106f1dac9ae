package com.canonicalsync.engine.sync;

import com.canonicalsync.core.client.RuntimeClient;
import com.canonicalsync.core.client.RuntimeClient.WorkflowSummary;
import com.canonicalsync.core.exception.UpstreamUnavailableException;
import com.canonicalsync.core.model.CanonicalGitState;
import com.canonicalsync.core.model.Environment;
import com.canonicalsync.core.model.MappingStatus;
import com.canonicalsync.core.model.SyncCheckpoint;
import com.canonicalsync.core.model.SyncJobKind;
import com.canonicalsync.core.model.SyncProgress;
import com.canonicalsync.core.model.WorkflowEnvironmentMapping;
import com.canonicalsync.core.repository.CanonicalGitStateRepository;
import com.canonicalsync.core.repository.WorkflowMappingRepository;
import com.canonicalsync.engine.hashing.CollisionWarning;
import com.canonicalsync.engine.hashing.FingerprintSession;
import com.canonicalsync.engine.hashing.HashingService;
import com.canonicalsync.engine.metrics.SyncMetrics;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Pulls workflow state from an environment's runtime into the mapping table.
 *
 * The listing is processed in fixed-size batches. After each batch a checkpoint
 * {lastProcessedIndex, totalCount} is reported, so a restarted job continues
 * where the previous attempt stopped. Every workflow runs inside its own failure
 * boundary; only an unreachable runtime or database aborts the pass.
 *
 * All writes are keyed upserts, so running the pass again is always safe.
 */
public class RuntimeSyncEngine implements SyncStrategy {

    private static final Logger log = LoggerFactory.getLogger(RuntimeSyncEngine.class);

    public static final int DEFAULT_BATCH_SIZE = 25;
    public static final String DEFAULT_FULL_PAYLOAD_CLASS = "dev";

    private final RuntimeClient runtimeClient;
    private final WorkflowMappingRepository mappingRepository;
    private final CanonicalGitStateRepository gitStateRepository;
    private final HashingService hashingService;
    private final SyncMetrics metrics;
    private final Clock clock;
    private final int batchSize;
    private final String fullPayloadEnvironmentClass;

    public RuntimeSyncEngine(
            RuntimeClient runtimeClient,
            WorkflowMappingRepository mappingRepository,
            CanonicalGitStateRepository gitStateRepository,
            HashingService hashingService,
            SyncMetrics metrics,
            Clock clock) {
        this(runtimeClient, mappingRepository, gitStateRepository, hashingService, metrics, clock,
            DEFAULT_BATCH_SIZE, DEFAULT_FULL_PAYLOAD_CLASS);
    }

    public RuntimeSyncEngine(
            RuntimeClient runtimeClient,
            WorkflowMappingRepository mappingRepository,
            CanonicalGitStateRepository gitStateRepository,
            HashingService hashingService,
            SyncMetrics metrics,
            Clock clock,
            int batchSize,
            String fullPayloadEnvironmentClass) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        }
        this.runtimeClient = runtimeClient;
        this.mappingRepository = mappingRepository;
        this.gitStateRepository = gitStateRepository;
        this.hashingService = hashingService;
        this.metrics = metrics;
        this.clock = clock;
        this.batchSize = batchSize;
        this.fullPayloadEnvironmentClass = fullPayloadEnvironmentClass;
    }

    @Override
    public SyncJobKind kind() {
        return SyncJobKind.ENV_SYNC;
    }

    @Override
    public SyncResult sync(Environment environment, JobProgressSink sink) {
        return syncEnvironment(environment, sink);
    }

    /**
     * Run one runtime to database pass over an environment.
     */
    public RuntimeSyncResult syncEnvironment(Environment environment, JobProgressSink sink) {
        List<WorkflowSummary> summaries = runtimeClient.listWorkflowSummaries(environment);
        int total = summaries.size();
        int startIndex = resumeIndex(sink.resumeCheckpoint(), total);
        int totalBatches = (total + batchSize - 1) / batchSize;

        FingerprintSession session = hashingService.newSession();
        boolean storePayload = environment.isClass(fullPayloadEnvironmentClass);
        PassCounters counters = new PassCounters();
        List<SyncError> errors = new ArrayList<>();

        log.info("Runtime sync of {}/{}: {} workflows, starting at index {}",
            environment.tenantId(), environment.environmentId(), total, startIndex);
        sink.report(SyncProgress.of(startIndex, total, "Syncing workflows from runtime..."));

        for (int batchStart = startIndex; batchStart < total; batchStart += batchSize) {
            int batchEnd = Math.min(batchStart + batchSize, total);
            for (WorkflowSummary summary : summaries.subList(batchStart, batchEnd)) {
                try {
                    processWorkflow(environment, summary, storePayload, session, counters);
                } catch (UpstreamUnavailableException | DataAccessResourceFailureException e) {
                    throw e;
                } catch (Exception e) {
                    log.warn("Failed to sync runtime workflow {} in {}: {}",
                        summary.id(), environment.environmentId(), e.getMessage());
                    errors.add(SyncError.of(summary.id(), e));
                    metrics.itemFailed(SyncJobKind.ENV_SYNC);
                }
            }

            int batchNumber = (batchEnd + batchSize - 1) / batchSize;
            sink.report(SyncProgress.of(batchEnd, total,
                    "Processed batch " + batchNumber + "/" + totalBatches)
                .withCheckpoint(new SyncCheckpoint(batchEnd, total)));
        }

        Set<String> seen = summaries.stream().map(WorkflowSummary::id).collect(Collectors.toSet());
        int missing = markMissing(environment, seen, errors);

        List<CollisionWarning> warnings = session.warnings();
        metrics.collisionsDetected(SyncJobKind.ENV_SYNC, warnings.size());

        RuntimeSyncResult result = new RuntimeSyncResult(
            total,
            counters.created,
            counters.updated,
            counters.linked,
            counters.untracked,
            counters.skipped,
            missing,
            counters.revived,
            List.copyOf(errors),
            warnings
        );
        log.info("Runtime sync of {}/{} finished: created={} updated={} linked={} untracked={} skipped={} missing={} revived={} errors={}",
            environment.tenantId(), environment.environmentId(), result.created(), result.updated(),
            result.linked(), result.untracked(), result.skipped(), result.missing(), result.revived(),
            result.errors().size());
        return result;
    }

    private void processWorkflow(
            Environment environment,
            WorkflowSummary summary,
            boolean storePayload,
            FingerprintSession session,
            PassCounters counters) {
        String tenantId = environment.tenantId();
        String environmentId = environment.environmentId();
        WorkflowEnvironmentMapping existing = mappingRepository
            .findByRuntimeInstance(tenantId, environmentId, summary.id())
            .orElse(null);

        if (isUnchanged(existing, summary)) {
            counters.skipped++;
            metrics.workflowProcessed(SyncJobKind.ENV_SYNC, "skipped");
            return;
        }

        JsonNode payload = runtimeClient.fetchWorkflow(environment, summary.id());
        String knownCanonicalId = existing != null ? existing.canonicalId() : null;
        String hash = session.fingerprint(payload, knownCanonicalId, summary.id());

        String canonicalId = knownCanonicalId;
        MappingStatus status;
        String outcome;

        if (existing == null) {
            canonicalId = findAutoLinkCandidate(environment, summary.id(), hash);
            status = canonicalId != null ? MappingStatus.LINKED : MappingStatus.UNTRACKED;
            counters.created++;
            outcome = "created";
        } else if (existing.status() == MappingStatus.MISSING) {
            status = knownCanonicalId != null ? MappingStatus.LINKED : MappingStatus.UNTRACKED;
            counters.revived++;
            outcome = "revived";
        } else if (existing.status() == MappingStatus.UNTRACKED && knownCanonicalId == null) {
            canonicalId = findAutoLinkCandidate(environment, summary.id(), hash);
            status = canonicalId != null ? MappingStatus.LINKED : MappingStatus.UNTRACKED;
            counters.updated++;
            outcome = "updated";
        } else {
            // linked, ignored and deleted keep their status; only the content is refreshed
            status = existing.status();
            counters.updated++;
            outcome = "updated";
        }

        boolean becameLinked = status == MappingStatus.LINKED
            && (existing == null || existing.status() != MappingStatus.LINKED);
        if (becameLinked) {
            counters.linked++;
        } else if (status == MappingStatus.UNTRACKED) {
            counters.untracked++;
        }

        WorkflowEnvironmentMapping.Builder builder = existing != null
            ? existing.toBuilder()
            : WorkflowEnvironmentMapping.builder(tenantId, environmentId, summary.id());
        mappingRepository.upsert(builder
            .canonicalId(canonicalId)
            .status(status)
            .environmentContentHash(hash)
            .runtimeUpdatedAt(summary.updatedAt())
            .payload(storePayload ? payload : null)
            .lastSyncedAt(clock.instant())
            .build());

        metrics.workflowProcessed(SyncJobKind.ENV_SYNC, outcome);
        log.debug("Runtime workflow {} -> status={} canonicalId={} hash={}", summary.id(), status, canonicalId, hash);
    }

    /**
     * Short-circuit: unchanged modification time on a mapping that is not missing.
     */
    private static boolean isUnchanged(WorkflowEnvironmentMapping existing, WorkflowSummary summary) {
        return existing != null
            && existing.status() != MappingStatus.MISSING
            && summary.updatedAt() != null
            && summary.updatedAt().equals(existing.runtimeUpdatedAt());
    }

    /**
     * Adopt a canonical workflow only when exactly one git state in this environment
     * carries the fingerprint and no other runtime instance is linked to it.
     */
    private String findAutoLinkCandidate(Environment environment, String runtimeInstanceId, String hash) {
        List<String> candidates = gitStateRepository
            .findByContentHash(environment.tenantId(), environment.environmentId(), hash)
            .stream()
            .map(CanonicalGitState::canonicalId)
            .distinct()
            .toList();

        if (candidates.size() != 1) {
            if (candidates.size() > 1) {
                log.debug("Fingerprint {} matches {} canonical workflows, leaving {} untracked",
                    hash, candidates.size(), runtimeInstanceId);
            }
            return null;
        }

        String canonicalId = candidates.get(0);
        boolean linkedElsewhere = mappingRepository
            .findByCanonicalId(environment.tenantId(), environment.environmentId(), canonicalId)
            .stream()
            .anyMatch(m -> m.isLinked() && !m.runtimeInstanceId().equals(runtimeInstanceId));
        if (linkedElsewhere) {
            log.debug("Canonical workflow {} already linked to another instance, leaving {} untracked",
                canonicalId, runtimeInstanceId);
            return null;
        }
        return canonicalId;
    }

    private int markMissing(Environment environment, Set<String> seen, List<SyncError> errors) {
        int missing = 0;
        for (WorkflowEnvironmentMapping mapping : mappingRepository
                .findByEnvironment(environment.tenantId(), environment.environmentId())) {
            if (!mapping.status().isTracked() || seen.contains(mapping.runtimeInstanceId())) {
                continue;
            }
            try {
                if (mappingRepository.updateStatus(
                        mapping.tenantId(), mapping.environmentId(), mapping.runtimeInstanceId(),
                        MappingStatus.MISSING, clock.instant())) {
                    missing++;
                    metrics.workflowProcessed(SyncJobKind.ENV_SYNC, "missing");
                }
            } catch (UpstreamUnavailableException | DataAccessResourceFailureException e) {
                throw e;
            } catch (Exception e) {
                log.warn("Failed to mark runtime workflow {} missing: {}", mapping.runtimeInstanceId(), e.getMessage());
                errors.add(SyncError.of(mapping.runtimeInstanceId(), e));
            }
        }
        return missing;
    }

    private int resumeIndex(SyncCheckpoint checkpoint, int total) {
        if (checkpoint == null) {
            return 0;
        }
        int index = checkpoint.lastProcessedIndex();
        if (index < 0 || index > total) {
            log.warn("Ignoring checkpoint {} outside listing of {} workflows", index, total);
            return 0;
        }
        if (index > 0) {
            log.info("Resuming runtime sync from checkpoint {}/{}", index, checkpoint.totalCount());
        }
        return index;
    }

    private static final class PassCounters {
        int created;
        int updated;
        int linked;
        int untracked;
        int skipped;
        int revived;
    }
}
