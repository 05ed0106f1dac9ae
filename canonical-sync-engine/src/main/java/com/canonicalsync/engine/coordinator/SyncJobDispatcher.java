package com.canonicalsync.engine.coordinator;

import com.canonicalsync.core.model.SyncJob;
import com.canonicalsync.core.model.SyncJobKind;
import com.canonicalsync.core.model.SyncJobStatus;
import com.canonicalsync.engine.logging.LoggingContext;
import com.canonicalsync.engine.service.ReconciliationService;
import com.canonicalsync.engine.service.SyncService;
import com.canonicalsync.engine.service.SyncService.SyncRequestResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Runs manually requested jobs in the background and reconciles the environment afterwards.
 * Only the caller that created a job dispatches it, so each job runs at most once per request.
 */
public class SyncJobDispatcher {

    private static final Logger log = LoggerFactory.getLogger(SyncJobDispatcher.class);

    private final SyncService syncService;
    private final ReconciliationService reconciliationService;
    private final ExecutorService executor;

    public SyncJobDispatcher(SyncService syncService, ReconciliationService reconciliationService, int poolSize) {
        this(syncService, reconciliationService, Executors.newFixedThreadPool(Math.max(1, poolSize)));
    }

    public SyncJobDispatcher(
            SyncService syncService,
            ReconciliationService reconciliationService,
            ExecutorService executor) {
        this.syncService = syncService;
        this.reconciliationService = reconciliationService;
        this.executor = executor;
    }

    /**
     * Request a sync and, if a new job was created, run it in the background.
     */
    public SyncRequestResult requestAndDispatch(String tenantId, String environmentId, SyncJobKind kind) {
        SyncRequestResult result = syncService.requestSync(tenantId, environmentId, kind, SyncJob.TRIGGER_MANUAL);
        if (result.isNew()) {
            dispatch(result.job());
        }
        return result;
    }

    /**
     * Run a job in the background.
     */
    public Future<?> dispatch(SyncJob job) {
        return executor.submit(() -> execute(job));
    }

    void execute(SyncJob job) {
        try {
            SyncJob finished = syncService.runJob(job);
            if (finished.status() == SyncJobStatus.COMPLETED) {
                reconciliationService.reconcileAllPairsFor(finished.tenantId(), finished.environmentId());
            }
        } catch (Exception e) {
            log.error("Background execution of job {} failed", job.jobId(), e);
        } finally {
            LoggingContext.clearAll();
        }
    }

    /**
     * Stop accepting jobs and wait for running ones.
     */
    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Sync job dispatcher stopped");
    }
}
