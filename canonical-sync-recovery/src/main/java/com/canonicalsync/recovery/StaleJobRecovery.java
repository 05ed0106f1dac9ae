package com.canonicalsync.recovery;

import com.canonicalsync.core.exception.InvalidStateTransitionException;
import com.canonicalsync.core.model.SyncJob;
import com.canonicalsync.core.repository.SyncJobRepository;
import com.canonicalsync.engine.logging.LoggingContext;
import com.canonicalsync.engine.service.SyncService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Fails sync jobs abandoned by a crashed or hung worker.
 *
 * A pending or running job that has not been updated within the liveness timeout
 * blocks new jobs for its environment and kind. Failing it frees the key, and the
 * failure also advances lastSyncAt so the scheduler waits a full interval.
 */
public class StaleJobRecovery {

    private static final Logger log = LoggerFactory.getLogger(StaleJobRecovery.class);

    public static final String LIVENESS_ERROR = "liveness timeout exceeded";
    private static final Duration DEFAULT_CHECK_INTERVAL = Duration.ofMinutes(1);
    private static final int BATCH_SIZE = 100;

    private final SyncJobRepository jobRepository;
    private final SyncService syncService;
    private final Clock clock;
    private final Duration livenessTimeout;
    private final Duration checkInterval;

    private final ScheduledExecutorService scheduler;
    private volatile boolean running = false;

    public StaleJobRecovery(
            SyncJobRepository jobRepository,
            SyncService syncService,
            Clock clock,
            Duration livenessTimeout) {
        this(jobRepository, syncService, clock, livenessTimeout, DEFAULT_CHECK_INTERVAL);
    }

    public StaleJobRecovery(
            SyncJobRepository jobRepository,
            SyncService syncService,
            Clock clock,
            Duration livenessTimeout,
            Duration checkInterval) {
        this.jobRepository = jobRepository;
        this.syncService = syncService;
        this.clock = clock;
        this.livenessTimeout = livenessTimeout;
        this.checkInterval = checkInterval;
        this.scheduler = Executors.newSingleThreadScheduledExecutor();
    }

    /**
     * Start the periodic check.
     */
    public void start() {
        if (running) {
            log.warn("Stale job recovery already running");
            return;
        }

        running = true;
        log.info("Starting stale job recovery: timeout={} interval={}", livenessTimeout, checkInterval);

        scheduler.scheduleWithFixedDelay(
            this::runCheck,
            checkInterval.toMillis(),
            checkInterval.toMillis(),
            TimeUnit.MILLISECONDS
        );
    }

    /**
     * Stop the periodic check.
     */
    public void stop() {
        running = false;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(30, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Stale job recovery stopped");
    }

    public boolean isRunning() {
        return running;
    }

    private void runCheck() {
        if (!running) return;

        try {
            recoverStaleJobs();
        } catch (Exception e) {
            log.error("Error in stale job recovery", e);
        }
    }

    /**
     * Fail every non-terminal job last updated before now minus the liveness timeout.
     *
     * @return number of jobs failed
     */
    public int recoverStaleJobs() {
        Instant cutoff = clock.instant().minus(livenessTimeout);
        List<SyncJob> stale = jobRepository.findStale(cutoff, BATCH_SIZE);
        if (stale.isEmpty()) {
            return 0;
        }

        log.info("Found {} stale sync jobs", stale.size());

        int recovered = 0;
        for (SyncJob job : stale) {
            try (var ctx = LoggingContext.forJob(job)) {
                syncService.failSync(job.jobId(), LIVENESS_ERROR);
                recovered++;
            } catch (InvalidStateTransitionException e) {
                // Finished between the query and the update
                log.debug("Job {} reached a terminal state before recovery", job.jobId());
            } catch (Exception e) {
                log.error("Failed to recover stale job: {}", job.jobId(), e);
            }
        }
        return recovered;
    }
}
