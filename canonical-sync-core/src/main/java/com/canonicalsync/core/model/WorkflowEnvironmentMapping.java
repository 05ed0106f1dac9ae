package com.canonicalsync.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;

/**
 * Binds a concrete runtime instance in one environment to a canonical workflow.
 *
 * Unique Key: (tenantId, environmentId, runtimeInstanceId)
 *
 * Invariants:
 * - status LINKED requires a canonical id
 * - payload is only kept for the store-full-payload environment class
 * - rows are never deleted, only status-transitioned
 */
public record WorkflowEnvironmentMapping(
    String tenantId,
    String environmentId,
    String runtimeInstanceId,
    String canonicalId,
    MappingStatus status,
    String environmentContentHash,
    Instant runtimeUpdatedAt,
    JsonNode payload,
    Instant lastSyncedAt
) {
    public WorkflowEnvironmentMapping {
        if (status == MappingStatus.LINKED && canonicalId == null) {
            throw new IllegalArgumentException(
                "Linked mapping requires a canonical id: " + environmentId + "/" + runtimeInstanceId);
        }
    }

    public static WorkflowEnvironmentMapping linked(
            String tenantId,
            String environmentId,
            String runtimeInstanceId,
            String canonicalId,
            String contentHash,
            Instant now) {
        return new WorkflowEnvironmentMapping(
            tenantId, environmentId, runtimeInstanceId, canonicalId,
            MappingStatus.LINKED, contentHash, null, null, now
        );
    }

    public boolean isLinked() {
        return status == MappingStatus.LINKED;
    }

    public WorkflowEnvironmentMapping withStatus(MappingStatus newStatus, Instant now) {
        return new WorkflowEnvironmentMapping(
            tenantId, environmentId, runtimeInstanceId, canonicalId,
            newStatus, environmentContentHash, runtimeUpdatedAt, payload, now
        );
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public static Builder builder(String tenantId, String environmentId, String runtimeInstanceId) {
        return new Builder(tenantId, environmentId, runtimeInstanceId);
    }

    public static class Builder {
        private final String tenantId;
        private final String environmentId;
        private final String runtimeInstanceId;
        private String canonicalId;
        private MappingStatus status = MappingStatus.UNTRACKED;
        private String environmentContentHash;
        private Instant runtimeUpdatedAt;
        private JsonNode payload;
        private Instant lastSyncedAt;

        private Builder(String tenantId, String environmentId, String runtimeInstanceId) {
            this.tenantId = tenantId;
            this.environmentId = environmentId;
            this.runtimeInstanceId = runtimeInstanceId;
        }

        private Builder(WorkflowEnvironmentMapping mapping) {
            this(mapping.tenantId, mapping.environmentId, mapping.runtimeInstanceId);
            this.canonicalId = mapping.canonicalId;
            this.status = mapping.status;
            this.environmentContentHash = mapping.environmentContentHash;
            this.runtimeUpdatedAt = mapping.runtimeUpdatedAt;
            this.payload = mapping.payload;
            this.lastSyncedAt = mapping.lastSyncedAt;
        }

        public Builder canonicalId(String canonicalId) { this.canonicalId = canonicalId; return this; }
        public Builder status(MappingStatus status) { this.status = status; return this; }
        public Builder environmentContentHash(String hash) { this.environmentContentHash = hash; return this; }
        public Builder runtimeUpdatedAt(Instant at) { this.runtimeUpdatedAt = at; return this; }
        public Builder payload(JsonNode payload) { this.payload = payload; return this; }
        public Builder lastSyncedAt(Instant at) { this.lastSyncedAt = at; return this; }

        public WorkflowEnvironmentMapping build() {
            return new WorkflowEnvironmentMapping(
                tenantId, environmentId, runtimeInstanceId, canonicalId, status,
                environmentContentHash, runtimeUpdatedAt, payload, lastSyncedAt
            );
        }
    }
}
