package com.canonicalsync.scheduler;

import com.canonicalsync.core.model.Environment;
import com.canonicalsync.core.model.SyncJob;
import com.canonicalsync.core.model.SyncJobKind;
import com.canonicalsync.core.model.SyncJobStatus;
import com.canonicalsync.core.model.SyncTimestamps;
import com.canonicalsync.core.repository.EnvironmentRepository;
import com.canonicalsync.engine.logging.LoggingContext;
import com.canonicalsync.engine.service.ReconciliationService;
import com.canonicalsync.engine.service.SyncService;
import com.canonicalsync.engine.service.SyncService.SyncRequestResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodic trigger for repository and runtime syncs.
 *
 * Responsibilities:
 * - Run one loop per job kind over every environment of every tenant
 * - Skip environments inside the debounce window or not yet due
 * - Create the job through the sync service, run it, then reconcile the environment
 *
 * Disabled by default. Several instances may run the loops at once: the job store
 * admits a single active job per environment and kind, and the debounce map only
 * saves work inside this instance.
 */
public class SyncScheduler {

    private static final Logger log = LoggerFactory.getLogger(SyncScheduler.class);

    private final EnvironmentRepository environmentRepository;
    private final SyncService syncService;
    private final ReconciliationService reconciliationService;
    private final SchedulerSettings settings;
    private final Clock clock;

    private final Map<String, Instant> lastTriggered = new ConcurrentHashMap<>();
    private final ScheduledExecutorService scheduler;
    private volatile boolean running = false;

    public SyncScheduler(
            EnvironmentRepository environmentRepository,
            SyncService syncService,
            ReconciliationService reconciliationService,
            SchedulerSettings settings,
            Clock clock) {
        this.environmentRepository = environmentRepository;
        this.syncService = syncService;
        this.reconciliationService = reconciliationService;
        this.settings = settings;
        this.clock = clock;
        this.scheduler = Executors.newScheduledThreadPool(2);
    }

    /**
     * Start both loops, unless scheduling is disabled.
     */
    public void start() {
        if (!settings.enabled()) {
            log.info("Sync scheduler disabled; syncs run only on request");
            return;
        }
        if (running) {
            log.warn("Sync scheduler already running");
            return;
        }

        running = true;
        long pollMillis = settings.pollInterval().toMillis();
        log.info("Starting sync scheduler: poll={} repoInterval={} envInterval={} debounce={}",
            settings.pollInterval(), settings.repoSyncInterval(), settings.envSyncInterval(), settings.debounceWindow());

        scheduler.scheduleWithFixedDelay(() -> runLoop(SyncJobKind.REPO_SYNC),
            pollMillis, pollMillis, TimeUnit.MILLISECONDS);
        scheduler.scheduleWithFixedDelay(() -> runLoop(SyncJobKind.ENV_SYNC),
            pollMillis, pollMillis, TimeUnit.MILLISECONDS);

        log.info("Sync scheduler started");
    }

    /**
     * Stop the loops and wait for a running tick to finish.
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
        log.info("Sync scheduler stopped");
    }

    public boolean isRunning() {
        return running;
    }

    private void runLoop(SyncJobKind kind) {
        if (!running) return;

        try {
            TickResult result = tick(kind);
            if (result.triggered() > 0 || result.failed() > 0) {
                log.info("{} tick: triggered={} failed={} notDue={} debounced={} active={}",
                    kind, result.triggered(), result.failed(), result.notDue(), result.debounced(),
                    result.alreadyActive());
            }
        } catch (Exception e) {
            log.error("Error in {} scheduler loop", kind, e);
        } finally {
            LoggingContext.clearAll();
        }
    }

    /**
     * Run one pass of the loop for a job kind over all eligible environments.
     */
    public TickResult tick(SyncJobKind kind) {
        Duration interval = kind == SyncJobKind.REPO_SYNC ? settings.repoSyncInterval() : settings.envSyncInterval();
        int considered = 0;
        int triggered = 0;
        int debounced = 0;
        int notDue = 0;
        int alreadyActive = 0;
        int failed = 0;

        for (Environment environment : environmentRepository.findAll()) {
            if (kind == SyncJobKind.REPO_SYNC && !environment.hasGitConfig()) {
                continue;
            }
            considered++;

            try (var ctx = LoggingContext.forEnvironment(environment.tenantId(), environment.environmentId())) {
                Instant now = clock.instant();
                String key = kind + ":" + environment.tenantId() + ":" + environment.environmentId();
                Instant last = lastTriggered.get(key);
                if (last != null && now.isBefore(last.plus(settings.debounceWindow()))) {
                    debounced++;
                    continue;
                }
                if (!isDue(environment, kind, interval, now)) {
                    notDue++;
                    continue;
                }

                lastTriggered.put(key, now);
                SyncRequestResult request = syncService.requestSync(
                    environment.tenantId(), environment.environmentId(), kind, SyncJob.TRIGGER_SCHEDULER);
                if (!request.isNew()) {
                    alreadyActive++;
                    continue;
                }

                triggered++;
                SyncJob finished = syncService.runJob(request.job());
                if (finished.status() == SyncJobStatus.COMPLETED) {
                    reconciliationService.reconcileAllPairsFor(environment.tenantId(), environment.environmentId());
                }
            } catch (Exception e) {
                failed++;
                log.error("Scheduled {} of {}/{} failed", kind, environment.tenantId(), environment.environmentId(), e);
            }
        }

        return new TickResult(kind, considered, triggered, debounced, notDue, alreadyActive, failed);
    }

    private boolean isDue(Environment environment, SyncJobKind kind, Duration interval, Instant now) {
        Instant lastActivity = environmentRepository
            .findSyncTimestamps(environment.tenantId(), environment.environmentId(), kind)
            .map(SyncTimestamps::lastActivityAt)
            .orElse(null);
        return lastActivity == null || !now.isBefore(lastActivity.plus(interval));
    }
}
