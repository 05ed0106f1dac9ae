package com.canonicalsync.core.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkflowEnvironmentMappingTest {

    @Test
    void linkedWithoutCanonicalId_shouldBeRejected() {
        assertThatThrownBy(() -> WorkflowEnvironmentMapping.builder("t1", "dev", "rt-1")
                .status(MappingStatus.LINKED)
                .build())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("rt-1");
    }

    @Test
    void withStatus_shouldKeepHashAndCanonicalId() {
        Instant now = Instant.parse("2024-03-01T10:00:00Z");
        WorkflowEnvironmentMapping mapping = WorkflowEnvironmentMapping.linked("t1", "dev", "rt-1", "C1", "abc", now);

        WorkflowEnvironmentMapping missing = mapping.withStatus(MappingStatus.MISSING, now.plusSeconds(60));

        assertThat(missing.status()).isEqualTo(MappingStatus.MISSING);
        assertThat(missing.canonicalId()).isEqualTo("C1");
        assertThat(missing.environmentContentHash()).isEqualTo("abc");
        assertThat(missing.lastSyncedAt()).isEqualTo(now.plusSeconds(60));
    }

    @Test
    void isTracked_shouldCoverLinkedAndUntrackedOnly() {
        assertThat(MappingStatus.LINKED.isTracked()).isTrue();
        assertThat(MappingStatus.UNTRACKED.isTracked()).isTrue();
        assertThat(MappingStatus.MISSING.isTracked()).isFalse();
        assertThat(MappingStatus.IGNORED.isTracked()).isFalse();
        assertThat(MappingStatus.DELETED.isTracked()).isFalse();
    }
}
