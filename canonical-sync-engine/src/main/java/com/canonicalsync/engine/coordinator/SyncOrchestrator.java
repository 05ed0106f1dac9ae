package com.canonicalsync.engine.coordinator;

import com.canonicalsync.core.exception.DuplicateActiveJobException;
import com.canonicalsync.core.exception.InvalidStateTransitionException;
import com.canonicalsync.core.exception.NotFoundException;
import com.canonicalsync.core.exception.SyncConfigurationException;
import com.canonicalsync.core.exception.SyncException;
import com.canonicalsync.core.model.Environment;
import com.canonicalsync.core.model.SyncCheckpoint;
import com.canonicalsync.core.model.SyncJob;
import com.canonicalsync.core.model.SyncJobKind;
import com.canonicalsync.core.model.SyncJobStatus;
import com.canonicalsync.core.model.SyncProgress;
import com.canonicalsync.core.model.SyncTimestamps;
import com.canonicalsync.core.repository.EnvironmentRepository;
import com.canonicalsync.core.repository.SyncJobRepository;
import com.canonicalsync.engine.logging.LoggingContext;
import com.canonicalsync.engine.metrics.SyncMetrics;
import com.canonicalsync.engine.progress.SyncProgressEvent;
import com.canonicalsync.engine.progress.SyncProgressPublisher;
import com.canonicalsync.engine.service.SyncService;
import com.canonicalsync.engine.sync.JobProgressSink;
import com.canonicalsync.engine.sync.SyncResult;
import com.canonicalsync.engine.sync.SyncStrategy;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Idempotency and lifecycle layer for sync jobs.
 *
 * Turns "sync environment E" into at most one in-flight job per
 * (tenant, environment, job kind). Mutual exclusion comes from the job store's
 * uniqueness constraint, so any number of service instances may call this
 * concurrently. Engines are plugged in per job kind.
 *
 * Every job write is conditional on the status it was read in. A write that loses
 * (for example to stale-job recovery) raises {@link InvalidStateTransitionException}
 * instead of overwriting the newer state.
 */
public class SyncOrchestrator implements SyncService {

    private static final Logger log = LoggerFactory.getLogger(SyncOrchestrator.class);

    private static final int MAX_CREATE_ATTEMPTS = 3;

    private final EnvironmentRepository environmentRepository;
    private final SyncJobRepository jobRepository;
    private final Map<SyncJobKind, SyncStrategy> strategies;
    private final SyncProgressPublisher progressPublisher;
    private final SyncMetrics metrics;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public SyncOrchestrator(
            EnvironmentRepository environmentRepository,
            SyncJobRepository jobRepository,
            List<SyncStrategy> strategies,
            SyncProgressPublisher progressPublisher,
            SyncMetrics metrics,
            ObjectMapper objectMapper,
            Clock clock) {
        this.environmentRepository = environmentRepository;
        this.jobRepository = jobRepository;
        this.strategies = new EnumMap<>(SyncJobKind.class);
        for (SyncStrategy strategy : strategies) {
            this.strategies.put(strategy.kind(), strategy);
        }
        this.progressPublisher = progressPublisher;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public SyncRequestResult requestSync(
            String tenantId, String environmentId, SyncJobKind jobKind, String trigger) {
        Environment environment = requireEnvironment(tenantId, environmentId);
        if (jobKind == SyncJobKind.REPO_SYNC && !environment.hasGitConfig()) {
            throw new SyncConfigurationException(environmentId, List.of("git repository is not configured"));
        }

        try (var ctx = LoggingContext.forEnvironment(tenantId, environmentId)) {
            // Callers never wait on a running job; they poll or follow progress events
            Optional<SyncJob> active = jobRepository.findActive(tenantId, environmentId, jobKind);
            if (active.isPresent()) {
                log.info("{} already {} as job {}", jobKind, active.get().status(), active.get().jobId());
                return new SyncRequestResult(active.get(), false);
            }

            // Must happen before the insert so a failed creation still delays the next retry
            environmentRepository.markSyncAttempted(tenantId, environmentId, jobKind, clock.instant());

            for (int attempt = 1; ; attempt++) {
                SyncJob job = SyncJob.pending(tenantId, environmentId, jobKind, trigger, clock.instant());
                try {
                    jobRepository.create(job);
                    log.info("Created {} job {} (trigger={})", jobKind, job.jobId(), trigger);
                    publish(job);
                    return new SyncRequestResult(job, true);
                } catch (DuplicateActiveJobException e) {
                    Optional<SyncJob> winner = jobRepository.findActive(tenantId, environmentId, jobKind);
                    if (winner.isPresent()) {
                        log.info("Lost job creation race, returning existing job {}", winner.get().jobId());
                        return new SyncRequestResult(winner.get(), false);
                    }
                    if (attempt >= MAX_CREATE_ATTEMPTS) {
                        throw e;
                    }
                    log.debug("Competing job finished before re-query, retrying creation (attempt {})", attempt);
                }
            }
        }
    }

    @Override
    public SyncJob startSync(UUID jobId) {
        SyncJob current = getJob(jobId);
        SyncJob job = current.withRunning(clock.instant());
        if (!jobRepository.update(job, current.status())) {
            throw InvalidStateTransitionException.superseded(jobId, current.status());
        }
        metrics.jobStarted(job.jobKind());
        publish(job);
        return job;
    }

    @Override
    public SyncJob updateProgress(UUID jobId, SyncProgress progress) {
        SyncJob job = getJob(jobId);
        if (job.isTerminal()) {
            log.debug("Ignoring progress for terminal job {}", jobId);
            return job;
        }
        SyncJob updated = job.withProgress(progress, clock.instant());
        if (!jobRepository.update(updated, job.status())) {
            throw InvalidStateTransitionException.superseded(jobId, job.status());
        }
        publish(updated);
        return updated;
    }

    @Override
    public SyncJob completeSync(UUID jobId, JsonNode result) {
        SyncJob job = getJob(jobId);
        Instant now = clock.instant();
        SyncJob completed = job.withCompleted(result, now);

        if (!jobRepository.finish(completed, job.status())) {
            throw InvalidStateTransitionException.superseded(jobId, job.status());
        }

        metrics.jobCompleted(job.jobKind(), elapsed(job, now));
        log.info("Completed {} job {}", job.jobKind(), jobId);
        publish(completed);
        return completed;
    }

    @Override
    public SyncJob failSync(UUID jobId, String error) {
        SyncJob job = getJob(jobId);
        Instant now = clock.instant();
        SyncJob failed = job.withFailed(error, now);

        // Failure advances lastSyncAt too, so the scheduler does not hot-loop on a broken environment
        if (!jobRepository.finish(failed, job.status())) {
            throw InvalidStateTransitionException.superseded(jobId, job.status());
        }

        metrics.jobFailed(job.jobKind(), errorCodeOf(error), elapsed(job, now));
        log.warn("Failed {} job {}: {}", job.jobKind(), jobId, error);
        publish(failed);
        return failed;
    }

    @Override
    public SyncJob runJob(SyncJob job) {
        try (var ctx = LoggingContext.forJob(job)) {
            SyncStrategy strategy = strategies.get(job.jobKind());
            if (strategy == null) {
                return failSync(job.jobId(), "No sync engine registered for " + job.jobKind());
            }
            Optional<Environment> environment = environmentRepository.findById(job.tenantId(), job.environmentId());
            if (environment.isEmpty()) {
                return failSync(job.jobId(), "Environment not found: " + job.environmentId());
            }

            SyncJob running;
            try {
                running = job.status() == SyncJobStatus.PENDING ? startSync(job.jobId()) : getJob(job.jobId());
            } catch (InvalidStateTransitionException e) {
                return superseded(job.jobId(), e);
            }

            SyncResult result;
            try {
                result = strategy.sync(environment.get(), new JobSink(running));
            } catch (Exception e) {
                log.error("Sync job {} aborted", running.jobId(), e);
                try {
                    return failSync(running.jobId(), describe(e));
                } catch (InvalidStateTransitionException lost) {
                    return superseded(running.jobId(), lost);
                }
            }
            try {
                return completeSync(running.jobId(), objectMapper.valueToTree(result));
            } catch (InvalidStateTransitionException e) {
                return superseded(running.jobId(), e);
            }
        }
    }

    /**
     * The job was finished elsewhere while this runner held it; keep the stored outcome.
     */
    private SyncJob superseded(UUID jobId, InvalidStateTransitionException e) {
        log.warn("Job {} was finished by another writer, discarding this run: {}", jobId, e.getMessage());
        return getJob(jobId);
    }

    @Override
    public SyncJob getJob(UUID jobId) {
        return jobRepository.findById(jobId)
            .orElseThrow(() -> new NotFoundException("SyncJob", jobId.toString()));
    }

    @Override
    public SyncStatus getSyncStatus(String tenantId, String environmentId) {
        requireEnvironment(tenantId, environmentId);
        Map<SyncJobKind, KindStatus> kinds = new EnumMap<>(SyncJobKind.class);
        for (SyncJobKind kind : SyncJobKind.values()) {
            SyncJob latest = jobRepository.findLatest(tenantId, environmentId, kind).orElse(null);
            Optional<SyncTimestamps> timestamps = environmentRepository.findSyncTimestamps(tenantId, environmentId, kind);
            kinds.put(kind, new KindStatus(
                latest,
                timestamps.map(SyncTimestamps::lastSyncAttemptedAt).orElse(null),
                timestamps.map(SyncTimestamps::lastSyncAt).orElse(null)
            ));
        }
        return new SyncStatus(tenantId, environmentId, kinds);
    }

    private Environment requireEnvironment(String tenantId, String environmentId) {
        return environmentRepository.findById(tenantId, environmentId)
            .orElseThrow(() -> new NotFoundException("Environment", environmentId));
    }

    private void publish(SyncJob job) {
        try {
            progressPublisher.publish(SyncProgressEvent.of(job, clock.instant()));
        } catch (RuntimeException e) {
            log.warn("Dropped progress event for job {}: {}", job.jobId(), e.getMessage());
        }
    }

    private static Duration elapsed(SyncJob job, Instant now) {
        Instant start = job.startedAt() != null ? job.startedAt() : job.createdAt();
        return start != null ? Duration.between(start, now) : null;
    }

    private static String describe(Exception e) {
        if (e instanceof SyncException) {
            return ((SyncException) e).getErrorCode() + ": " + e.getMessage();
        }
        return e.getClass().getSimpleName() + ": " + e.getMessage();
    }

    private static String errorCodeOf(String error) {
        if (error == null) {
            return "UNKNOWN";
        }
        int separator = error.indexOf(':');
        return separator > 0 ? error.substring(0, separator) : "UNKNOWN";
    }

    /**
     * Persists batch progress and checkpoints of one running job.
     */
    private final class JobSink implements JobProgressSink {

        private final SyncJob job;

        private JobSink(SyncJob job) {
            this.job = job;
        }

        @Override
        public SyncCheckpoint resumeCheckpoint() {
            return job.checkpoint();
        }

        @Override
        public void report(SyncProgress progress) {
            try {
                updateProgress(job.jobId(), progress);
            } catch (RuntimeException e) {
                // A lost checkpoint only costs reprocessing one batch on restart
                log.warn("Could not record progress for job {}: {}", job.jobId(), e.getMessage());
            }
        }
    }
}
