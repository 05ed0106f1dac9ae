package com.canonicalsync.engine.sync;

import com.canonicalsync.core.client.GitClient;
import com.canonicalsync.core.exception.SyncConfigurationException;
import com.canonicalsync.core.exception.UpstreamUnavailableException;
import com.canonicalsync.core.model.CanonicalGitState;
import com.canonicalsync.core.model.CanonicalWorkflow;
import com.canonicalsync.core.model.Environment;
import com.canonicalsync.core.model.GitRepositoryConfig;
import com.canonicalsync.core.model.MappingStatus;
import com.canonicalsync.core.model.SyncJobKind;
import com.canonicalsync.core.model.SyncProgress;
import com.canonicalsync.core.model.WorkflowEnvironmentMapping;
import com.canonicalsync.core.repository.CanonicalGitStateRepository;
import com.canonicalsync.core.repository.CanonicalWorkflowRepository;
import com.canonicalsync.core.repository.WorkflowMappingRepository;
import com.canonicalsync.engine.hashing.CollisionWarning;
import com.canonicalsync.engine.hashing.FingerprintSession;
import com.canonicalsync.engine.hashing.HashingService;
import com.canonicalsync.engine.metrics.SyncMetrics;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Pulls canonical identity and git-side fingerprints from an environment's repository.
 *
 * Each {@code workflows/<folder>/<canonicalId>.json} file yields one canonical workflow
 * and one git state row. An adjacent {@code <canonicalId>.env-map.json} sidecar, when
 * present, links runtime instances to the canonical workflow directly.
 */
public class GitSyncEngine implements SyncStrategy {

    private static final Logger log = LoggerFactory.getLogger(GitSyncEngine.class);

    private static final String WORKFLOW_SUFFIX = ".json";
    private static final int PROGRESS_EVERY = 25;

    private final GitClient gitClient;
    private final CanonicalWorkflowRepository canonicalWorkflowRepository;
    private final CanonicalGitStateRepository gitStateRepository;
    private final WorkflowMappingRepository mappingRepository;
    private final HashingService hashingService;
    private final ObjectMapper objectMapper;
    private final SyncMetrics metrics;
    private final Clock clock;

    public GitSyncEngine(
            GitClient gitClient,
            CanonicalWorkflowRepository canonicalWorkflowRepository,
            CanonicalGitStateRepository gitStateRepository,
            WorkflowMappingRepository mappingRepository,
            HashingService hashingService,
            ObjectMapper objectMapper,
            SyncMetrics metrics,
            Clock clock) {
        this.gitClient = gitClient;
        this.canonicalWorkflowRepository = canonicalWorkflowRepository;
        this.gitStateRepository = gitStateRepository;
        this.mappingRepository = mappingRepository;
        this.hashingService = hashingService;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public SyncJobKind kind() {
        return SyncJobKind.REPO_SYNC;
    }

    @Override
    public SyncResult sync(Environment environment, JobProgressSink sink) {
        return syncRepository(environment, sink);
    }

    public RepoSyncResult syncRepository(Environment environment) {
        return syncRepository(environment, JobProgressSink.NONE);
    }

    /**
     * Run one Git to database pass over an environment's repository folder.
     */
    public RepoSyncResult syncRepository(Environment environment, JobProgressSink sink) {
        if (!environment.hasGitConfig()) {
            throw new SyncConfigurationException(environment.environmentId(),
                List.of("git repository is not configured"));
        }
        GitRepositoryConfig git = environment.git();

        String commitSha = resolveCommit(git);
        String ref = commitSha != null ? commitSha : git.branch();

        List<String> paths = gitClient.listFiles(git, git.workflowsPath(), ref);
        Set<String> available = new HashSet<>(paths);
        List<String> workflowFiles = paths.stream()
            .filter(p -> p.endsWith(WORKFLOW_SUFFIX) && !EnvironmentMapSidecar.isSidecar(p))
            .sorted()
            .toList();
        int total = workflowFiles.size();

        FingerprintSession session = hashingService.newSession();
        FileCounters counters = new FileCounters();
        List<SyncError> errors = new ArrayList<>();

        log.info("Repo sync of {}/{}: {} workflow files at {}",
            environment.tenantId(), environment.environmentId(), total, ref);
        sink.report(SyncProgress.of(0, total, "Syncing workflows from Git..."));

        for (int i = 0; i < total; i++) {
            String path = workflowFiles.get(i);
            try {
                processFile(environment, path, ref, commitSha, available, session, counters, errors);
            } catch (UpstreamUnavailableException | DataAccessResourceFailureException e) {
                throw e;
            } catch (Exception e) {
                log.warn("Failed to sync git file {}: {}", path, e.getMessage());
                errors.add(SyncError.of(path, e));
                metrics.itemFailed(SyncJobKind.REPO_SYNC);
            }
            int processed = i + 1;
            if (processed % PROGRESS_EVERY == 0 || processed == total) {
                sink.report(SyncProgress.of(processed, total, "Processed " + processed + "/" + total + " files"));
            }
        }

        List<CollisionWarning> warnings = session.warnings();
        metrics.collisionsDetected(SyncJobKind.REPO_SYNC, warnings.size());

        RepoSyncResult result = new RepoSyncResult(
            commitSha,
            counters.created,
            counters.updated,
            counters.unchanged,
            counters.sidecarsIngested,
            List.copyOf(errors),
            warnings
        );
        log.info("Repo sync of {}/{} finished: created={} updated={} unchanged={} sidecars={} errors={}",
            environment.tenantId(), environment.environmentId(), result.created(), result.updated(),
            result.unchanged(), result.sidecarsIngested(), result.errors().size());
        return result;
    }

    private String resolveCommit(GitRepositoryConfig git) {
        if (git.isPinned()) {
            return git.pinnedCommitSha();
        }
        try {
            return gitClient.headCommit(git, git.branch());
        } catch (RuntimeException e) {
            // listing falls back to the branch ref; git state rows record no sha
            log.warn("Could not resolve head of {}@{}: {}", git.repoUrl(), git.branch(), e.getMessage());
            return null;
        }
    }

    private void processFile(
            Environment environment,
            String path,
            String ref,
            String commitSha,
            Set<String> available,
            FingerprintSession session,
            FileCounters counters,
            List<SyncError> errors) throws IOException {
        String tenantId = environment.tenantId();
        String environmentId = environment.environmentId();
        String canonicalId = canonicalIdFromPath(path);

        JsonNode payload = objectMapper.readTree(gitClient.readFile(environment.git(), path, ref));
        String hash = session.fingerprint(payload, canonicalId, path);

        CanonicalGitState existing = gitStateRepository.find(tenantId, environmentId, canonicalId).orElse(null);
        if (existing != null && hash.equals(existing.gitContentHash())) {
            counters.unchanged++;
            metrics.workflowProcessed(SyncJobKind.REPO_SYNC, "unchanged");
            return;
        }

        Instant now = clock.instant();
        String displayName = payload.path("name").asText(canonicalId);
        if (canonicalWorkflowRepository.createIfAbsent(CanonicalWorkflow.create(tenantId, canonicalId, displayName, now))) {
            counters.created++;
            metrics.workflowProcessed(SyncJobKind.REPO_SYNC, "created");
        } else {
            counters.updated++;
            metrics.workflowProcessed(SyncJobKind.REPO_SYNC, "updated");
        }

        gitStateRepository.upsert(new CanonicalGitState(
            tenantId, environmentId, canonicalId, path, hash, commitSha, now));

        String sidecarPath = EnvironmentMapSidecar.pathFor(path);
        if (!available.contains(sidecarPath)) {
            return;
        }
        try {
            ingestSidecar(environment, canonicalId, sidecarPath, ref, now);
            counters.sidecarsIngested++;
        } catch (UpstreamUnavailableException | DataAccessResourceFailureException e) {
            throw e;
        } catch (Exception e) {
            log.warn("Failed to ingest sidecar {}: {}", sidecarPath, e.getMessage());
            errors.add(SyncError.of(sidecarPath, e));
        }
    }

    /**
     * Every environment entry with a runtime instance id becomes a linked mapping.
     * Stored payload and runtime modification time of an existing mapping are preserved.
     */
    private void ingestSidecar(
            Environment environment,
            String canonicalId,
            String sidecarPath,
            String ref,
            Instant now) throws IOException {
        EnvironmentMapSidecar sidecar = objectMapper.readValue(
            gitClient.readFile(environment.git(), sidecarPath, ref), EnvironmentMapSidecar.class);
        if (sidecar.environments() == null) {
            return;
        }

        for (Map.Entry<String, EnvironmentMapSidecar.EnvironmentEntry> entry : sidecar.environments().entrySet()) {
            String targetEnvironmentId = entry.getKey();
            EnvironmentMapSidecar.EnvironmentEntry declared = entry.getValue();
            if (declared == null || declared.runtimeInstanceId() == null || declared.runtimeInstanceId().isBlank()) {
                continue;
            }

            WorkflowEnvironmentMapping.Builder builder = mappingRepository
                .findByRuntimeInstance(environment.tenantId(), targetEnvironmentId, declared.runtimeInstanceId())
                .map(WorkflowEnvironmentMapping::toBuilder)
                .orElseGet(() -> WorkflowEnvironmentMapping.builder(
                    environment.tenantId(), targetEnvironmentId, declared.runtimeInstanceId()));
            builder.canonicalId(canonicalId)
                .status(MappingStatus.LINKED)
                .lastSyncedAt(now);
            String declaredHash = declared.normalizedContentHash();
            if (declaredHash != null) {
                builder.environmentContentHash(declaredHash);
            }
            mappingRepository.upsert(builder.build());
            log.debug("Sidecar linked {}/{} to canonical workflow {}",
                targetEnvironmentId, declared.runtimeInstanceId(), canonicalId);
        }
    }

    static String canonicalIdFromPath(String path) {
        String fileName = path.substring(path.lastIndexOf('/') + 1);
        return fileName.substring(0, fileName.length() - WORKFLOW_SUFFIX.length());
    }

    private static final class FileCounters {
        int created;
        int updated;
        int unchanged;
        int sidecarsIngested;
    }
}
