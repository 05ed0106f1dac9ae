package com.canonicalsync.engine.reconcile;

import com.canonicalsync.core.exception.NotFoundException;
import com.canonicalsync.core.exception.SyncConfigurationException;
import com.canonicalsync.core.model.CanonicalGitState;
import com.canonicalsync.core.model.CanonicalWorkflow;
import com.canonicalsync.core.model.ConflictMetadata;
import com.canonicalsync.core.model.DiffStatus;
import com.canonicalsync.core.model.Environment;
import com.canonicalsync.core.model.WorkflowDiffState;
import com.canonicalsync.core.model.WorkflowEnvironmentMapping;
import com.canonicalsync.core.repository.CanonicalGitStateRepository;
import com.canonicalsync.core.repository.CanonicalWorkflowRepository;
import com.canonicalsync.core.repository.EnvironmentRepository;
import com.canonicalsync.core.repository.WorkflowDiffStateRepository;
import com.canonicalsync.core.repository.WorkflowMappingRepository;
import com.canonicalsync.engine.logging.LoggingContext;
import com.canonicalsync.engine.metrics.SyncMetrics;
import com.canonicalsync.engine.service.ReconciliationService;
import com.canonicalsync.engine.sync.SyncError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Materializes pairwise diff status from the git-state and mapping tables.
 *
 * Diff rows are a cache: every row can be recomputed from its inputs, so an
 * incremental pass only rewrites rows whose four input hashes moved, and
 * {@code force} rewrites everything. The debounce map is per instance; it only
 * bounds cost and never affects correctness.
 */
public class ReconciliationEngine implements ReconciliationService {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationEngine.class);

    public static final Duration DEFAULT_DEBOUNCE_WINDOW = Duration.ofSeconds(60);

    private static final Comparator<WorkflowEnvironmentMapping> LATEST_SYNCED = Comparator.comparing(
        WorkflowEnvironmentMapping::lastSyncedAt, Comparator.nullsFirst(Comparator.naturalOrder()));

    private final EnvironmentRepository environmentRepository;
    private final CanonicalWorkflowRepository canonicalWorkflowRepository;
    private final CanonicalGitStateRepository gitStateRepository;
    private final WorkflowMappingRepository mappingRepository;
    private final WorkflowDiffStateRepository diffStateRepository;
    private final DiffClassifier classifier;
    private final SyncMetrics metrics;
    private final Clock clock;
    private final Duration debounceWindow;
    private final String runtimeAuthoritativeClass;

    private final Map<String, Instant> lastRunByPair = new ConcurrentHashMap<>();

    public ReconciliationEngine(
            EnvironmentRepository environmentRepository,
            CanonicalWorkflowRepository canonicalWorkflowRepository,
            CanonicalGitStateRepository gitStateRepository,
            WorkflowMappingRepository mappingRepository,
            WorkflowDiffStateRepository diffStateRepository,
            SyncMetrics metrics,
            Clock clock,
            Duration debounceWindow,
            String runtimeAuthoritativeClass) {
        this.environmentRepository = environmentRepository;
        this.canonicalWorkflowRepository = canonicalWorkflowRepository;
        this.gitStateRepository = gitStateRepository;
        this.mappingRepository = mappingRepository;
        this.diffStateRepository = diffStateRepository;
        this.classifier = new DiffClassifier();
        this.metrics = metrics;
        this.clock = clock;
        this.debounceWindow = debounceWindow;
        this.runtimeAuthoritativeClass = runtimeAuthoritativeClass;
    }

    @Override
    public ReconcileResult reconcilePair(
            String tenantId, String sourceEnvironmentId, String targetEnvironmentId, boolean force) {
        if (sourceEnvironmentId.equals(targetEnvironmentId)) {
            throw new SyncConfigurationException(sourceEnvironmentId,
                List.of("source and target environments must differ"));
        }
        Environment source = requireEnvironment(tenantId, sourceEnvironmentId);
        requireEnvironment(tenantId, targetEnvironmentId);

        if (!enterWindow(tenantId + ":" + sourceEnvironmentId + ":" + targetEnvironmentId, force)) {
            log.debug("Reconcile {} -> {} debounced", sourceEnvironmentId, targetEnvironmentId);
            metrics.reconcileDebounced();
            return ReconcileResult.debounced(sourceEnvironmentId, targetEnvironmentId);
        }

        try (var ctx = LoggingContext.forPair(tenantId, sourceEnvironmentId, targetEnvironmentId)) {
            return recompute(tenantId, source, targetEnvironmentId, force);
        }
    }

    @Override
    public PairwiseReconcileResult reconcileAllPairsFor(String tenantId, String changedEnvironmentId) {
        List<ReconcileResult> results = new ArrayList<>();
        List<String> errors = new ArrayList<>();

        for (Environment other : environmentRepository.findByTenant(tenantId)) {
            if (other.environmentId().equals(changedEnvironmentId)) {
                continue;
            }
            reconcileCollecting(tenantId, changedEnvironmentId, other.environmentId(), results, errors);
            reconcileCollecting(tenantId, other.environmentId(), changedEnvironmentId, results, errors);
        }

        log.info("Reconciled {} against all environments: {} pairs, {} errors",
            changedEnvironmentId, results.size(), errors.size());
        return new PairwiseReconcileResult(changedEnvironmentId, List.copyOf(results), List.copyOf(errors));
    }

    private void reconcileCollecting(
            String tenantId, String source, String target,
            List<ReconcileResult> results, List<String> errors) {
        try {
            results.add(reconcilePair(tenantId, source, target, false));
        } catch (Exception e) {
            log.error("Failed to reconcile {} -> {}", source, target, e);
            errors.add(source + "->" + target + ": " + e.getMessage());
        }
    }

    private ReconcileResult recompute(String tenantId, Environment source, String targetEnvironmentId, boolean force) {
        String sourceEnvironmentId = source.environmentId();
        boolean sourceRuntimeAuthoritative = source.isClass(runtimeAuthoritativeClass);

        Map<String, CanonicalGitState> sourceGit = byCanonicalId(
            gitStateRepository.findByEnvironment(tenantId, sourceEnvironmentId), CanonicalGitState::canonicalId);
        Map<String, CanonicalGitState> targetGit = byCanonicalId(
            gitStateRepository.findByEnvironment(tenantId, targetEnvironmentId), CanonicalGitState::canonicalId);
        Map<String, WorkflowEnvironmentMapping> sourceLinks = linkedByCanonicalId(tenantId, sourceEnvironmentId);
        Map<String, WorkflowEnvironmentMapping> targetLinks = linkedByCanonicalId(tenantId, targetEnvironmentId);
        Map<String, WorkflowDiffState> stored = byCanonicalId(
            diffStateRepository.findByPair(tenantId, sourceEnvironmentId, targetEnvironmentId),
            WorkflowDiffState::canonicalId);

        Set<String> active = canonicalWorkflowRepository.findActive(tenantId).stream()
            .map(CanonicalWorkflow::canonicalId)
            .collect(Collectors.toCollection(TreeSet::new));

        int updated = 0;
        int unchanged = 0;
        int removed = 0;
        List<SyncError> errors = new ArrayList<>();
        Instant now = clock.instant();

        for (String canonicalId : active) {
            try {
                CanonicalGitState sg = sourceGit.get(canonicalId);
                CanonicalGitState tg = targetGit.get(canonicalId);
                WorkflowEnvironmentMapping se = sourceLinks.get(canonicalId);
                WorkflowEnvironmentMapping te = targetLinks.get(canonicalId);

                DiffInputs inputs = new DiffInputs(
                    sg != null ? sg.gitContentHash() : null,
                    tg != null ? tg.gitContentHash() : null,
                    se != null ? se.environmentContentHash() : null,
                    te != null ? te.environmentContentHash() : null,
                    sourceRuntimeAuthoritative
                );
                WorkflowDiffState prior = stored.get(canonicalId);

                if (inputs.isEmpty()) {
                    if (prior != null) {
                        diffStateRepository.delete(tenantId, sourceEnvironmentId, targetEnvironmentId, canonicalId);
                        removed++;
                    }
                    continue;
                }
                if (!force && prior != null && prior.hasSameInputs(
                        inputs.sourceGitHash(), inputs.targetGitHash(), inputs.sourceEnvHash(), inputs.targetEnvHash())) {
                    unchanged++;
                    continue;
                }

                DiffStatus status = classifier.classify(inputs);
                ConflictMetadata conflict = status == DiffStatus.CONFLICT
                    ? new ConflictMetadata(
                        inputs.sourceGitHash(), sg != null ? sg.lastSyncedAt() : null,
                        inputs.targetGitHash(), tg != null ? tg.lastSyncedAt() : null,
                        inputs.sourceEnvHash(), se != null ? se.lastSyncedAt() : null,
                        inputs.targetEnvHash(), te != null ? te.lastSyncedAt() : null,
                        now)
                    : null;

                diffStateRepository.upsert(new WorkflowDiffState(
                    tenantId, sourceEnvironmentId, targetEnvironmentId, canonicalId, status,
                    inputs.sourceGitHash(), inputs.targetGitHash(), inputs.sourceEnvHash(), inputs.targetEnvHash(),
                    conflict, now));
                metrics.diffComputed(status);
                updated++;
            } catch (Exception e) {
                log.warn("Failed to reconcile canonical workflow {}: {}", canonicalId, e.getMessage());
                errors.add(SyncError.of(canonicalId, e));
            }
        }

        for (String canonicalId : stored.keySet()) {
            if (active.contains(canonicalId)) {
                continue;
            }
            try {
                diffStateRepository.delete(tenantId, sourceEnvironmentId, targetEnvironmentId, canonicalId);
                removed++;
            } catch (Exception e) {
                log.warn("Failed to drop stale diff for {}: {}", canonicalId, e.getMessage());
                errors.add(SyncError.of(canonicalId, e));
            }
        }

        log.info("Reconciled {} -> {}: updated={} unchanged={} removed={} errors={} force={}",
            sourceEnvironmentId, targetEnvironmentId, updated, unchanged, removed, errors.size(), force);
        return new ReconcileResult(sourceEnvironmentId, targetEnvironmentId,
            updated, unchanged, removed, false, List.copyOf(errors));
    }

    /**
     * Claim the debounce slot for a pair. Forced calls always claim it.
     */
    private boolean enterWindow(String key, boolean force) {
        Instant now = clock.instant();
        AtomicBoolean admitted = new AtomicBoolean(false);
        lastRunByPair.compute(key, (k, last) -> {
            if (force || last == null || !now.isBefore(last.plus(debounceWindow))) {
                admitted.set(true);
                return now;
            }
            return last;
        });
        return admitted.get();
    }

    private Environment requireEnvironment(String tenantId, String environmentId) {
        return environmentRepository.findById(tenantId, environmentId)
            .orElseThrow(() -> new NotFoundException("Environment", environmentId));
    }

    /**
     * Linked mapping per canonical workflow; the most recently synced wins when several exist.
     */
    private Map<String, WorkflowEnvironmentMapping> linkedByCanonicalId(String tenantId, String environmentId) {
        return mappingRepository.findByEnvironment(tenantId, environmentId).stream()
            .filter(WorkflowEnvironmentMapping::isLinked)
            .collect(Collectors.toMap(
                WorkflowEnvironmentMapping::canonicalId,
                Function.identity(),
                (a, b) -> LATEST_SYNCED.compare(a, b) >= 0 ? a : b));
    }

    private static <T> Map<String, T> byCanonicalId(List<T> rows, Function<T, String> key) {
        return rows.stream().collect(Collectors.toMap(key, Function.identity(), (a, b) -> a));
    }
}
