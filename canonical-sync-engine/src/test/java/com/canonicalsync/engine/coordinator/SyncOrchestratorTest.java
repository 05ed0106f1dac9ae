package com.canonicalsync.engine.coordinator;

import com.canonicalsync.core.exception.InvalidStateTransitionException;
import com.canonicalsync.core.exception.NotFoundException;
import com.canonicalsync.core.exception.SyncConfigurationException;
import com.canonicalsync.core.exception.UpstreamUnavailableException;
import com.canonicalsync.core.model.Environment;
import com.canonicalsync.core.model.GitRepositoryConfig;
import com.canonicalsync.core.model.SyncCheckpoint;
import com.canonicalsync.core.model.SyncJob;
import com.canonicalsync.core.model.SyncJobKind;
import com.canonicalsync.core.model.SyncJobStatus;
import com.canonicalsync.core.model.SyncProgress;
import com.canonicalsync.core.model.SyncTimestamps;
import com.canonicalsync.core.test.TimeController;
import com.canonicalsync.engine.hashing.CollisionWarning;
import com.canonicalsync.engine.metrics.SyncMetrics;
import com.canonicalsync.engine.persistence.InMemoryEnvironmentRepository;
import com.canonicalsync.engine.persistence.InMemorySyncJobRepository;
import com.canonicalsync.engine.progress.SyncProgressEvent;
import com.canonicalsync.engine.service.SyncService.SyncRequestResult;
import com.canonicalsync.engine.service.SyncService.SyncStatus;
import com.canonicalsync.engine.sync.JobProgressSink;
import com.canonicalsync.engine.sync.SyncError;
import com.canonicalsync.engine.sync.SyncResult;
import com.canonicalsync.engine.sync.SyncStrategy;
import com.canonicalsync.engine.test.Workflows;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.BiFunction;

import static org.assertj.core.api.Assertions.*;

class SyncOrchestratorTest {

    private static final String TENANT = "acme";
    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    private TimeController time;
    private InMemoryEnvironmentRepository environments;
    private InMemorySyncJobRepository jobs;
    private StubStrategy envStrategy;
    private List<SyncProgressEvent> events;
    private SyncOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        time = TimeController.frozenAt(T0);
        environments = new InMemoryEnvironmentRepository();
        jobs = new InMemorySyncJobRepository(environments);
        envStrategy = new StubStrategy(SyncJobKind.ENV_SYNC);
        events = new CopyOnWriteArrayList<>();
        orchestrator = new SyncOrchestrator(environments, jobs, List.of(envStrategy), events::add,
            new SyncMetrics(), Workflows.MAPPER, time);

        environments.save(new Environment(TENANT, "dev", "Development", "dev", "https://dev.example.com", "key", null));
    }

    @Test
    @DisplayName("Second request returns the active job instead of creating another")
    void testRequestReturnsActiveJob() {
        SyncRequestResult first = orchestrator.requestSync(TENANT, "dev", SyncJobKind.ENV_SYNC, SyncJob.TRIGGER_MANUAL);
        SyncRequestResult second = orchestrator.requestSync(TENANT, "dev", SyncJobKind.ENV_SYNC, SyncJob.TRIGGER_MANUAL);

        assertThat(first.isNew()).isTrue();
        assertThat(first.job().status()).isEqualTo(SyncJobStatus.PENDING);
        assertThat(first.job().progress()).isEqualTo(SyncProgress.queued());
        assertThat(second.isNew()).isFalse();
        assertThat(second.job().jobId()).isEqualTo(first.job().jobId());
    }

    @Test
    @DisplayName("Concurrent requests create exactly one job")
    void testAtMostOneJobUnderConcurrency() throws Exception {
        int callers = 16;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<SyncRequestResult>> futures = new ArrayList<>();

        for (int i = 0; i < callers; i++) {
            futures.add(pool.submit(() -> {
                start.await();
                return orchestrator.requestSync(TENANT, "dev", SyncJobKind.ENV_SYNC, SyncJob.TRIGGER_MANUAL);
            }));
        }
        start.countDown();

        List<SyncRequestResult> results = new ArrayList<>();
        for (Future<SyncRequestResult> future : futures) {
            results.add(future.get(10, TimeUnit.SECONDS));
        }
        pool.shutdown();

        assertThat(results).filteredOn(SyncRequestResult::isNew).hasSize(1);
        assertThat(results).extracting(r -> r.job().jobId()).containsOnly(results.get(0).job().jobId());
    }

    @Test
    @DisplayName("Kinds are independent")
    void testKindsIndependent() {
        environments.save(new Environment(TENANT, "dev", "Development", "dev", "https://dev.example.com", "key",
            new GitRepositoryConfig("https://github.com/acme/wf", "main", "dev", null, null)));

        SyncRequestResult env = orchestrator.requestSync(TENANT, "dev", SyncJobKind.ENV_SYNC, SyncJob.TRIGGER_MANUAL);
        SyncRequestResult repo = orchestrator.requestSync(TENANT, "dev", SyncJobKind.REPO_SYNC, SyncJob.TRIGGER_MANUAL);

        assertThat(env.isNew()).isTrue();
        assertThat(repo.isNew()).isTrue();
        assertThat(repo.job().jobId()).isNotEqualTo(env.job().jobId());
    }

    @Test
    @DisplayName("Attempt timestamp is written before the job insert, even when the insert fails")
    void testAttemptRecordedBeforeCreate() {
        InMemorySyncJobRepository failing = new InMemorySyncJobRepository(environments) {
            @Override
            public void create(SyncJob job) {
                assertThat(environments.findSyncTimestamps(TENANT, "dev", SyncJobKind.ENV_SYNC)).isPresent();
                throw new IllegalStateException("database is read-only");
            }
        };
        SyncOrchestrator withFailingStore = new SyncOrchestrator(environments, failing, List.of(envStrategy),
            events::add, new SyncMetrics(), Workflows.MAPPER, time);

        assertThatThrownBy(() -> withFailingStore.requestSync(TENANT, "dev", SyncJobKind.ENV_SYNC, SyncJob.TRIGGER_SCHEDULER))
            .isInstanceOf(IllegalStateException.class);

        SyncTimestamps timestamps = environments.findSyncTimestamps(TENANT, "dev", SyncJobKind.ENV_SYNC).orElseThrow();
        assertThat(timestamps.lastSyncAttemptedAt()).isEqualTo(T0);
        assertThat(timestamps.lastSyncAt()).isNull();
    }

    @Test
    @DisplayName("Repository sync without git configuration is rejected before any job exists")
    void testRepoSyncRequiresGitConfig() {
        assertThatThrownBy(() -> orchestrator.requestSync(TENANT, "dev", SyncJobKind.REPO_SYNC, SyncJob.TRIGGER_MANUAL))
            .isInstanceOf(SyncConfigurationException.class);
        assertThat(jobs.findLatest(TENANT, "dev", SyncJobKind.REPO_SYNC)).isEmpty();
    }

    @Test
    @DisplayName("Unknown environment is not found")
    void testUnknownEnvironment() {
        assertThatThrownBy(() -> orchestrator.requestSync(TENANT, "qa", SyncJobKind.ENV_SYNC, SyncJob.TRIGGER_MANUAL))
            .isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("Successful run completes the job with its result and advances lastSyncAt")
    void testRunJobCompletes() {
        SyncJob job = orchestrator.requestSync(TENANT, "dev", SyncJobKind.ENV_SYNC, SyncJob.TRIGGER_MANUAL).job();
        time.advanceSeconds(5);

        SyncJob finished = orchestrator.runJob(job);

        assertThat(finished.status()).isEqualTo(SyncJobStatus.COMPLETED);
        assertThat(finished.startedAt()).isEqualTo(T0.plusSeconds(5));
        assertThat(finished.result().path("processed").asInt()).isEqualTo(3);
        assertThat(finished.error()).isNull();
        assertThat(environments.findSyncTimestamps(TENANT, "dev", SyncJobKind.ENV_SYNC).orElseThrow().lastSyncAt())
            .isEqualTo(T0.plusSeconds(5));
        assertThat(jobs.findActive(TENANT, "dev", SyncJobKind.ENV_SYNC)).isEmpty();
        assertThat(events).extracting(SyncProgressEvent::status)
            .containsSubsequence(SyncJobStatus.PENDING, SyncJobStatus.RUNNING, SyncJobStatus.COMPLETED);
    }

    @Test
    @DisplayName("Aborted run fails the job with the error code and frees the slot")
    void testRunJobFails() {
        envStrategy.behavior = (env, sink) -> {
            throw new UpstreamUnavailableException("runtime", "503 Service Unavailable", null);
        };
        SyncJob job = orchestrator.requestSync(TENANT, "dev", SyncJobKind.ENV_SYNC, SyncJob.TRIGGER_MANUAL).job();

        SyncJob failed = orchestrator.runJob(job);

        assertThat(failed.status()).isEqualTo(SyncJobStatus.FAILED);
        assertThat(failed.error()).startsWith("UPSTREAM_UNAVAILABLE");
        assertThat(failed.result()).isNull();
        assertThat(environments.findSyncTimestamps(TENANT, "dev", SyncJobKind.ENV_SYNC).orElseThrow().lastSyncAt())
            .isEqualTo(T0);
        assertThat(orchestrator.requestSync(TENANT, "dev", SyncJobKind.ENV_SYNC, SyncJob.TRIGGER_MANUAL).isNew())
            .isTrue();
    }

    @Test
    @DisplayName("Job without a registered engine fails")
    void testMissingStrategyFailsJob() {
        environments.save(new Environment(TENANT, "dev", "Development", "dev", "https://dev.example.com", "key",
            new GitRepositoryConfig("https://github.com/acme/wf", "main", "dev", null, null)));
        SyncJob job = orchestrator.requestSync(TENANT, "dev", SyncJobKind.REPO_SYNC, SyncJob.TRIGGER_MANUAL).job();

        SyncJob failed = orchestrator.runJob(job);

        assertThat(failed.status()).isEqualTo(SyncJobStatus.FAILED);
        assertThat(failed.error()).contains("REPO_SYNC");
    }

    @Test
    @DisplayName("Batch progress is persisted on the job while it runs")
    void testProgressPersisted() {
        envStrategy.behavior = (env, sink) -> {
            sink.report(SyncProgress.of(25, 60, "Processed batch 1/3").withCheckpoint(new SyncCheckpoint(25, 60)));
            return new StubResult(25);
        };
        SyncJob job = orchestrator.requestSync(TENANT, "dev", SyncJobKind.ENV_SYNC, SyncJob.TRIGGER_MANUAL).job();

        SyncJob finished = orchestrator.runJob(job);

        assertThat(finished.progress().percentage()).isEqualTo(41);
        assertThat(finished.checkpoint()).isEqualTo(new SyncCheckpoint(25, 60));
        assertThat(events).extracting(SyncProgressEvent::message).contains("Processed batch 1/3");
    }

    @Test
    @DisplayName("A restarted job resumes from its stored checkpoint")
    void testResumeFromStoredCheckpoint() {
        SyncJob job = orchestrator.requestSync(TENANT, "dev", SyncJobKind.ENV_SYNC, SyncJob.TRIGGER_MANUAL).job();
        orchestrator.startSync(job.jobId());
        orchestrator.updateProgress(job.jobId(),
            SyncProgress.of(50, 100, "Processed batch 2/4").withCheckpoint(new SyncCheckpoint(50, 100)));

        Set<SyncCheckpoint> seen = ConcurrentHashMap.newKeySet();
        envStrategy.behavior = (env, sink) -> {
            seen.add(sink.resumeCheckpoint());
            return new StubResult(50);
        };
        SyncJob finished = orchestrator.runJob(orchestrator.getJob(job.jobId()));

        assertThat(finished.status()).isEqualTo(SyncJobStatus.COMPLETED);
        assertThat(seen).containsExactly(new SyncCheckpoint(50, 100));
    }

    @Test
    @DisplayName("Progress for a terminal job is ignored")
    void testProgressAfterTerminalIgnored() {
        SyncJob job = orchestrator.requestSync(TENANT, "dev", SyncJobKind.ENV_SYNC, SyncJob.TRIGGER_MANUAL).job();
        orchestrator.startSync(job.jobId());
        orchestrator.failSync(job.jobId(), "liveness timeout exceeded");

        SyncJob after = orchestrator.updateProgress(job.jobId(), SyncProgress.of(1, 2, "late"));

        assertThat(after.status()).isEqualTo(SyncJobStatus.FAILED);
        assertThat(after.progress()).isEqualTo(SyncProgress.queued());
    }

    @Test
    @DisplayName("A run overtaken by stale-job recovery keeps the recovered outcome")
    void testRunOvertakenByRecovery() {
        SyncJob job = orchestrator.requestSync(TENANT, "dev", SyncJobKind.ENV_SYNC, SyncJob.TRIGGER_MANUAL).job();
        envStrategy.behavior = (env, sink) -> {
            time.advanceSeconds(5);
            orchestrator.failSync(job.jobId(), "liveness timeout exceeded");
            time.advanceSeconds(5);
            sink.report(SyncProgress.of(25, 60, "Processed batch 1/3"));
            return new StubResult(60);
        };

        SyncJob finished = orchestrator.runJob(job);

        assertThat(finished.status()).isEqualTo(SyncJobStatus.FAILED);
        assertThat(finished.error()).isEqualTo("liveness timeout exceeded");
        SyncJob stored = orchestrator.getJob(job.jobId());
        assertThat(stored.status()).isEqualTo(SyncJobStatus.FAILED);
        assertThat(stored.result()).isNull();
        assertThat(stored.progress()).isEqualTo(SyncProgress.queued());
        assertThat(environments.findSyncTimestamps(TENANT, "dev", SyncJobKind.ENV_SYNC).orElseThrow().lastSyncAt())
            .isEqualTo(T0.plusSeconds(5));
    }

    @Test
    @DisplayName("An aborted run overtaken by stale-job recovery keeps the recovery error")
    void testAbortedRunOvertakenByRecovery() {
        SyncJob job = orchestrator.requestSync(TENANT, "dev", SyncJobKind.ENV_SYNC, SyncJob.TRIGGER_MANUAL).job();
        envStrategy.behavior = (env, sink) -> {
            orchestrator.failSync(job.jobId(), "liveness timeout exceeded");
            throw new UpstreamUnavailableException("runtime", "503 Service Unavailable", null);
        };

        SyncJob finished = orchestrator.runJob(job);

        assertThat(finished.status()).isEqualTo(SyncJobStatus.FAILED);
        assertThat(finished.error()).isEqualTo("liveness timeout exceeded");
    }

    @Test
    @DisplayName("Starting a job that recovery already failed is refused")
    void testStartAfterRecoveryRefused() {
        SyncJob job = orchestrator.requestSync(TENANT, "dev", SyncJobKind.ENV_SYNC, SyncJob.TRIGGER_MANUAL).job();
        orchestrator.failSync(job.jobId(), "liveness timeout exceeded");

        SyncJob result = orchestrator.runJob(job);

        assertThat(result.status()).isEqualTo(SyncJobStatus.FAILED);
        assertThat(result.error()).isEqualTo("liveness timeout exceeded");
    }

    @Test
    @DisplayName("Completion that loses the status fence to a concurrent failure is not written")
    void testCompletionLosesStatusFence() {
        InMemorySyncJobRepository racing = new InMemorySyncJobRepository(environments) {
            @Override
            public boolean finish(SyncJob job, SyncJobStatus expectedStatus) {
                if (job.status() == SyncJobStatus.COMPLETED) {
                    SyncJob stored = findById(job.jobId()).orElseThrow();
                    super.finish(stored.withFailed("liveness timeout exceeded", T0.plusSeconds(1)), stored.status());
                }
                return super.finish(job, expectedStatus);
            }
        };
        SyncOrchestrator withRacingStore = new SyncOrchestrator(environments, racing, List.of(envStrategy),
            events::add, new SyncMetrics(), Workflows.MAPPER, time);
        SyncJob job = withRacingStore.requestSync(TENANT, "dev", SyncJobKind.ENV_SYNC, SyncJob.TRIGGER_MANUAL).job();

        assertThatThrownBy(() -> {
            withRacingStore.startSync(job.jobId());
            withRacingStore.completeSync(job.jobId(), Workflows.MAPPER.createObjectNode());
        }).isInstanceOf(InvalidStateTransitionException.class);

        SyncJob stored = racing.findById(job.jobId()).orElseThrow();
        assertThat(stored.status()).isEqualTo(SyncJobStatus.FAILED);
        assertThat(stored.result()).isNull();
        assertThat(environments.findSyncTimestamps(TENANT, "dev", SyncJobKind.ENV_SYNC).orElseThrow().lastSyncAt())
            .isEqualTo(T0.plusSeconds(1));
    }

    @Test
    @DisplayName("Runner that loses the status fence returns the stored outcome")
    void testRunJobLosesStatusFence() {
        InMemorySyncJobRepository racing = new InMemorySyncJobRepository(environments) {
            @Override
            public boolean finish(SyncJob job, SyncJobStatus expectedStatus) {
                if (job.status() == SyncJobStatus.COMPLETED) {
                    SyncJob stored = findById(job.jobId()).orElseThrow();
                    super.finish(stored.withFailed("liveness timeout exceeded", T0), stored.status());
                }
                return super.finish(job, expectedStatus);
            }
        };
        SyncOrchestrator withRacingStore = new SyncOrchestrator(environments, racing, List.of(envStrategy),
            events::add, new SyncMetrics(), Workflows.MAPPER, time);
        SyncJob job = withRacingStore.requestSync(TENANT, "dev", SyncJobKind.ENV_SYNC, SyncJob.TRIGGER_MANUAL).job();

        SyncJob finished = withRacingStore.runJob(job);

        assertThat(finished.status()).isEqualTo(SyncJobStatus.FAILED);
        assertThat(finished.error()).isEqualTo("liveness timeout exceeded");
    }

    @Test
    @DisplayName("Sync status reports the latest job and timestamps per kind")
    void testSyncStatus() {
        SyncJob job = orchestrator.requestSync(TENANT, "dev", SyncJobKind.ENV_SYNC, SyncJob.TRIGGER_MANUAL).job();

        SyncStatus status = orchestrator.getSyncStatus(TENANT, "dev");

        assertThat(status.kinds()).containsOnlyKeys(SyncJobKind.ENV_SYNC, SyncJobKind.REPO_SYNC);
        assertThat(status.kinds().get(SyncJobKind.ENV_SYNC).latestJob().jobId()).isEqualTo(job.jobId());
        assertThat(status.kinds().get(SyncJobKind.ENV_SYNC).lastSyncAttemptedAt()).isEqualTo(T0);
        assertThat(status.kinds().get(SyncJobKind.REPO_SYNC).latestJob()).isNull();
    }

    @Test
    @DisplayName("Unknown job id is not found")
    void testUnknownJob() {
        assertThatThrownBy(() -> orchestrator.getJob(UUID.randomUUID()))
            .isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("A failing progress publisher does not fail the job")
    void testPublisherFailureTolerated() {
        SyncOrchestrator noisy = new SyncOrchestrator(environments, jobs, List.of(envStrategy),
            event -> { throw new IllegalStateException("channel closed"); },
            new SyncMetrics(), Workflows.MAPPER, time);

        SyncJob job = noisy.requestSync(TENANT, "dev", SyncJobKind.ENV_SYNC, SyncJob.TRIGGER_MANUAL).job();

        assertThat(noisy.runJob(job).status()).isEqualTo(SyncJobStatus.COMPLETED);
    }

    record StubResult(int processed) implements SyncResult {
        @Override
        public List<SyncError> errors() {
            return List.of();
        }

        @Override
        public List<CollisionWarning> collisionWarnings() {
            return List.of();
        }
    }

    static final class StubStrategy implements SyncStrategy {

        private final SyncJobKind kind;
        volatile BiFunction<Environment, JobProgressSink, SyncResult> behavior = (env, sink) -> new StubResult(3);

        StubStrategy(SyncJobKind kind) {
            this.kind = kind;
        }

        @Override
        public SyncJobKind kind() {
            return kind;
        }

        @Override
        public SyncResult sync(Environment environment, JobProgressSink sink) {
            return behavior.apply(environment, sink);
        }
    }
}
