package com.canonicalsync.recovery;

import com.canonicalsync.core.model.Environment;
import com.canonicalsync.core.model.SyncJob;
import com.canonicalsync.core.model.SyncJobKind;
import com.canonicalsync.core.model.SyncJobStatus;
import com.canonicalsync.core.test.TimeController;
import com.canonicalsync.engine.coordinator.SyncOrchestrator;
import com.canonicalsync.engine.metrics.SyncMetrics;
import com.canonicalsync.engine.persistence.InMemoryEnvironmentRepository;
import com.canonicalsync.engine.persistence.InMemorySyncJobRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class StaleJobRecoveryTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    private TimeController time;
    private InMemoryEnvironmentRepository environments;
    private InMemorySyncJobRepository jobs;
    private SyncOrchestrator orchestrator;
    private StaleJobRecovery recovery;

    @BeforeEach
    void setUp() {
        time = TimeController.frozenAt(T0);
        environments = new InMemoryEnvironmentRepository();
        jobs = new InMemorySyncJobRepository(environments);
        orchestrator = new SyncOrchestrator(environments, jobs, List.of(), event -> { },
            new SyncMetrics(), new ObjectMapper(), time);
        recovery = new StaleJobRecovery(jobs, orchestrator, time, Duration.ofMinutes(30));

        environments.save(new Environment("acme", "dev", "Development", "dev", "https://dev.acme.io", "key", null));
        environments.save(new Environment("acme", "prod", "Production", "prod", "https://prod.acme.io", "key", null));
    }

    @Test
    @DisplayName("Running job without updates past the timeout is failed")
    void testStaleRunningJobFailed() {
        SyncJob job = orchestrator.requestSync("acme", "dev", SyncJobKind.ENV_SYNC, SyncJob.TRIGGER_MANUAL).job();
        orchestrator.startSync(job.jobId());

        time.advanceMinutes(31);
        int recovered = recovery.recoverStaleJobs();

        assertThat(recovered).isEqualTo(1);
        SyncJob failed = orchestrator.getJob(job.jobId());
        assertThat(failed.status()).isEqualTo(SyncJobStatus.FAILED);
        assertThat(failed.error()).isEqualTo(StaleJobRecovery.LIVENESS_ERROR);
        assertThat(environments.findSyncTimestamps("acme", "dev", SyncJobKind.ENV_SYNC))
            .hasValueSatisfying(ts -> assertThat(ts.lastSyncAt()).isEqualTo(time.now()));
    }

    @Test
    @DisplayName("Pending job that never started is failed too")
    void testStalePendingJobFailed() {
        SyncJob job = orchestrator.requestSync("acme", "dev", SyncJobKind.REPO_SYNC, SyncJob.TRIGGER_SCHEDULER).job();

        time.advanceMinutes(45);

        assertThat(recovery.recoverStaleJobs()).isEqualTo(1);
        assertThat(orchestrator.getJob(job.jobId()).status()).isEqualTo(SyncJobStatus.FAILED);
    }

    @Test
    @DisplayName("Job that keeps reporting progress is left running")
    void testRecentlyUpdatedJobKept() {
        SyncJob job = orchestrator.requestSync("acme", "dev", SyncJobKind.ENV_SYNC, SyncJob.TRIGGER_MANUAL).job();
        SyncJob running = orchestrator.startSync(job.jobId());

        time.advanceMinutes(20);
        orchestrator.updateProgress(job.jobId(), running.progress());
        time.advanceMinutes(20);

        assertThat(recovery.recoverStaleJobs()).isZero();
        assertThat(orchestrator.getJob(job.jobId()).status()).isEqualTo(SyncJobStatus.RUNNING);
    }

    @Test
    @DisplayName("Terminal jobs are never touched")
    void testTerminalJobsIgnored() {
        SyncJob job = orchestrator.requestSync("acme", "dev", SyncJobKind.ENV_SYNC, SyncJob.TRIGGER_MANUAL).job();
        orchestrator.startSync(job.jobId());
        orchestrator.completeSync(job.jobId(), null);

        time.advanceMinutes(90);

        assertThat(recovery.recoverStaleJobs()).isZero();
        assertThat(orchestrator.getJob(job.jobId()).status()).isEqualTo(SyncJobStatus.COMPLETED);
    }

    @Test
    @DisplayName("Recovering a stale job frees the key for a new request")
    void testKeyFreedAfterRecovery() {
        SyncJob stale = orchestrator.requestSync("acme", "prod", SyncJobKind.ENV_SYNC, SyncJob.TRIGGER_MANUAL).job();
        time.advanceMinutes(31);

        assertThat(orchestrator.requestSync("acme", "prod", SyncJobKind.ENV_SYNC, SyncJob.TRIGGER_MANUAL).isNew())
            .isFalse();

        recovery.recoverStaleJobs();

        var next = orchestrator.requestSync("acme", "prod", SyncJobKind.ENV_SYNC, SyncJob.TRIGGER_MANUAL);
        assertThat(next.isNew()).isTrue();
        assertThat(next.job().jobId()).isNotEqualTo(stale.jobId());
    }

    @Test
    @DisplayName("Start and stop toggle the running flag")
    void testStartStop() {
        recovery.start();
        assertThat(recovery.isRunning()).isTrue();

        recovery.stop();
        assertThat(recovery.isRunning()).isFalse();
    }
}
