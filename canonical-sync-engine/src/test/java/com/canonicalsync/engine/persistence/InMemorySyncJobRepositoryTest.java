package com.canonicalsync.engine.persistence;

import com.canonicalsync.core.exception.DuplicateActiveJobException;
import com.canonicalsync.core.model.SyncJob;
import com.canonicalsync.core.model.SyncJobKind;
import com.canonicalsync.core.model.SyncJobStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

class InMemorySyncJobRepositoryTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    private final InMemoryEnvironmentRepository environments = new InMemoryEnvironmentRepository();
    private final InMemorySyncJobRepository repository = new InMemorySyncJobRepository(environments);

    @Test
    @DisplayName("Second active job for the same key is rejected")
    void testDuplicateActiveRejected() {
        repository.create(SyncJob.pending("acme", "dev", SyncJobKind.ENV_SYNC, SyncJob.TRIGGER_MANUAL, T0));

        assertThatThrownBy(() -> repository.create(
                SyncJob.pending("acme", "dev", SyncJobKind.ENV_SYNC, SyncJob.TRIGGER_SCHEDULER, T0)))
            .isInstanceOf(DuplicateActiveJobException.class);
    }

    @Test
    @DisplayName("A terminal job frees the key")
    void testTerminalJobFreesKey() {
        SyncJob first = SyncJob.pending("acme", "dev", SyncJobKind.ENV_SYNC, SyncJob.TRIGGER_MANUAL, T0);
        repository.create(first);
        assertThat(repository.update(first.withFailed("boom", T0.plusSeconds(1)), SyncJobStatus.PENDING)).isTrue();

        SyncJob second = SyncJob.pending("acme", "dev", SyncJobKind.ENV_SYNC, SyncJob.TRIGGER_MANUAL, T0.plusSeconds(2));
        repository.create(second);

        assertThat(repository.findActive("acme", "dev", SyncJobKind.ENV_SYNC)).contains(second);
        assertThat(repository.findLatest("acme", "dev", SyncJobKind.ENV_SYNC)).contains(second);
    }

    @Test
    @DisplayName("Stale lookup returns only non-terminal jobs not updated since the cutoff")
    void testFindStale() {
        SyncJob old = SyncJob.pending("acme", "dev", SyncJobKind.ENV_SYNC, SyncJob.TRIGGER_MANUAL, T0);
        SyncJob fresh = SyncJob.pending("acme", "prod", SyncJobKind.ENV_SYNC, SyncJob.TRIGGER_MANUAL, T0.plusSeconds(3600));
        SyncJob done = SyncJob.pending("acme", "qa", SyncJobKind.ENV_SYNC, SyncJob.TRIGGER_MANUAL, T0)
            .withFailed("boom", T0);
        repository.create(old);
        repository.create(fresh);
        repository.create(done);

        assertThat(repository.findStale(T0.plusSeconds(1800), 10)).containsExactly(old);
    }

    @Test
    @DisplayName("Update is rejected once the stored job left the expected status")
    void testUpdateFencedOnStatus() {
        SyncJob job = SyncJob.pending("acme", "dev", SyncJobKind.ENV_SYNC, SyncJob.TRIGGER_MANUAL, T0);
        repository.create(job);
        SyncJob running = job.withRunning(T0.plusSeconds(1));
        assertThat(repository.update(running, SyncJobStatus.PENDING)).isTrue();
        assertThat(repository.finish(running.withFailed("liveness timeout exceeded", T0.plusSeconds(2)),
            SyncJobStatus.RUNNING)).isTrue();

        boolean written = repository.update(running.withProgress(running.progress(), T0.plusSeconds(3)),
            SyncJobStatus.RUNNING);

        assertThat(written).isFalse();
        assertThat(repository.findById(job.jobId()).orElseThrow().status()).isEqualTo(SyncJobStatus.FAILED);
    }

    @Test
    @DisplayName("Finishing a job advances lastSyncAt; a lost finish writes nothing")
    void testFinishAdvancesTimestampOnlyWhenWritten() {
        SyncJob job = SyncJob.pending("acme", "dev", SyncJobKind.ENV_SYNC, SyncJob.TRIGGER_MANUAL, T0);
        repository.create(job);

        assertThat(repository.finish(job.withFailed("boom", T0.plusSeconds(5)), SyncJobStatus.RUNNING)).isFalse();
        assertThat(environments.findSyncTimestamps("acme", "dev", SyncJobKind.ENV_SYNC)).isEmpty();

        assertThat(repository.finish(job.withFailed("boom", T0.plusSeconds(6)), SyncJobStatus.PENDING)).isTrue();
        assertThat(environments.findSyncTimestamps("acme", "dev", SyncJobKind.ENV_SYNC).orElseThrow().lastSyncAt())
            .isEqualTo(T0.plusSeconds(6));
    }
}
