package com.canonicalsync.engine.metrics;

import com.canonicalsync.core.model.DiffStatus;
import com.canonicalsync.core.model.SyncJobKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Prometheus metrics for sync and reconciliation.
 * 
 * Metrics exposed:
 * - Job starts, completions and failures by kind, with duration
 * - Per-workflow outcomes of each sync pass
 * - Fingerprint collisions
 * - Reconciliation results by diff status and debounce skips
 */
public class SyncMetrics implements MeterBinder {

    public static final String JOBS_ACTIVE = "canonical_sync.jobs.active";
    public static final String JOBS_STARTED = "canonical_sync.jobs.started";
    public static final String JOBS_COMPLETED = "canonical_sync.jobs.completed";
    public static final String JOBS_FAILED = "canonical_sync.jobs.failed";
    public static final String JOB_DURATION = "canonical_sync.job.duration";

    public static final String WORKFLOWS_PROCESSED = "canonical_sync.workflows.processed";
    public static final String ITEM_ERRORS = "canonical_sync.item.errors";
    public static final String HASH_COLLISIONS = "canonical_sync.hash.collisions";

    public static final String DIFFS_COMPUTED = "canonical_sync.reconcile.diffs";
    public static final String RECONCILE_DEBOUNCED = "canonical_sync.reconcile.debounced";

    // Replaced by the application registry in bindTo; keeps the engines usable standalone
    private MeterRegistry registry = new SimpleMeterRegistry();

    private final Map<SyncJobKind, AtomicInteger> activeJobs = new EnumMap<>(SyncJobKind.class);

    public SyncMetrics() {
        for (SyncJobKind kind : SyncJobKind.values()) {
            activeJobs.put(kind, new AtomicInteger(0));
        }
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        this.registry = registry;

        for (SyncJobKind kind : SyncJobKind.values()) {
            Gauge.builder(JOBS_ACTIVE, activeJobs.get(kind), AtomicInteger::get)
                .tag("kind", kind.name())
                .description("Sync jobs currently running in this instance")
                .register(registry);
        }
    }

    // ========== Job Metrics ==========

    public void jobStarted(SyncJobKind kind) {
        Counter.builder(JOBS_STARTED)
            .tag("kind", kind.name())
            .description("Total sync jobs started")
            .register(registry)
            .increment();
        activeJobs.get(kind).incrementAndGet();
    }

    public void jobCompleted(SyncJobKind kind, Duration duration) {
        Counter.builder(JOBS_COMPLETED)
            .tag("kind", kind.name())
            .description("Total sync jobs completed")
            .register(registry)
            .increment();
        recordDuration(kind, "success", duration);
        activeJobs.get(kind).updateAndGet(v -> Math.max(0, v - 1));
    }

    public void jobFailed(SyncJobKind kind, String errorCode, Duration duration) {
        Counter.builder(JOBS_FAILED)
            .tag("kind", kind.name())
            .tag("error", errorCode)
            .description("Total sync jobs failed")
            .register(registry)
            .increment();
        recordDuration(kind, "failure", duration);
        activeJobs.get(kind).updateAndGet(v -> Math.max(0, v - 1));
    }

    private void recordDuration(SyncJobKind kind, String outcome, Duration duration) {
        if (duration == null) {
            return;
        }
        Timer.builder(JOB_DURATION)
            .tag("kind", kind.name())
            .tag("outcome", outcome)
            .description("Sync job duration")
            .register(registry)
            .record(duration);
    }

    // ========== Sync Pass Metrics ==========

    public void workflowProcessed(SyncJobKind kind, String outcome) {
        Counter.builder(WORKFLOWS_PROCESSED)
            .tag("kind", kind.name())
            .tag("outcome", outcome)
            .description("Workflows processed by sync passes")
            .register(registry)
            .increment();
    }

    public void itemFailed(SyncJobKind kind) {
        Counter.builder(ITEM_ERRORS)
            .tag("kind", kind.name())
            .description("Workflows or files that failed inside a sync pass")
            .register(registry)
            .increment();
    }

    public void collisionsDetected(SyncJobKind kind, int count) {
        if (count <= 0) {
            return;
        }
        Counter.builder(HASH_COLLISIONS)
            .tag("kind", kind.name())
            .description("Fingerprint collision warnings raised")
            .register(registry)
            .increment(count);
    }

    // ========== Reconciliation Metrics ==========

    public void diffComputed(DiffStatus status) {
        Counter.builder(DIFFS_COMPUTED)
            .tag("status", status.name())
            .description("Diff states recomputed")
            .register(registry)
            .increment();
    }

    public void reconcileDebounced() {
        Counter.builder(RECONCILE_DEBOUNCED)
            .description("Pair reconciliations skipped inside the debounce window")
            .register(registry)
            .increment();
    }

    public MeterRegistry registry() {
        return registry;
    }
}
