package com.canonicalsync.core.model;

import com.canonicalsync.core.exception.InvalidStateTransitionException;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SyncJobTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    @Test
    void pending_shouldStartWithQueuedProgress() {
        SyncJob job = SyncJob.pending("t1", "dev", SyncJobKind.ENV_SYNC, SyncJob.TRIGGER_MANUAL, T0);

        assertThat(job.status()).isEqualTo(SyncJobStatus.PENDING);
        assertThat(job.progress().current()).isZero();
        assertThat(job.progress().total()).isZero();
        assertThat(job.progress().percentage()).isZero();
        assertThat(job.progress().message()).isEqualTo("Sync queued...");
        assertThat(job.checkpoint()).isNull();
    }

    @Test
    void lifecycle_shouldRecordTimestampsAndResult() {
        SyncJob job = SyncJob.pending("t1", "dev", SyncJobKind.REPO_SYNC, SyncJob.TRIGGER_SCHEDULER, T0)
            .withRunning(T0.plusSeconds(1))
            .withCompleted(JsonNodeFactory.instance.objectNode().put("created", 3), T0.plusSeconds(5));

        assertThat(job.status()).isEqualTo(SyncJobStatus.COMPLETED);
        assertThat(job.startedAt()).isEqualTo(T0.plusSeconds(1));
        assertThat(job.completedAt()).isEqualTo(T0.plusSeconds(5));
        assertThat(job.result().get("created").asInt()).isEqualTo(3);
        assertThat(job.error()).isNull();
    }

    @Test
    void withCompleted_fromTerminalState_shouldBeRejected() {
        SyncJob failed = SyncJob.pending("t1", "dev", SyncJobKind.ENV_SYNC, SyncJob.TRIGGER_MANUAL, T0)
            .withFailed("runtime unreachable", T0);

        assertThatThrownBy(() -> failed.withCompleted(null, T0))
            .isInstanceOf(InvalidStateTransitionException.class);
    }

    @Test
    void progress_shouldComputePercentageAndKeepCheckpoint() {
        SyncProgress progress = SyncProgress.of(25, 60, "Processed batch 1/3")
            .withCheckpoint(new SyncCheckpoint(25, 60));

        assertThat(progress.percentage()).isEqualTo(41);
        assertThat(progress.checkpoint().lastProcessedIndex()).isEqualTo(25);
        assertThat(SyncProgress.of(0, 0, "empty").percentage()).isZero();
    }
}
