package com.canonicalsync.core.model;

import java.time.Instant;

/**
 * Tenant-scoped logical identity of a workflow, independent of any environment.
 *
 * Primary Key: (tenantId, canonicalId)
 *
 * Created on first sighting in Git. Identity is immutable; rows are only
 * soft-deleted by an explicit tenant action.
 */
public record CanonicalWorkflow(
    String tenantId,
    String canonicalId,
    String displayName,
    Instant createdAt,
    Instant deletedAt
) {
    public static CanonicalWorkflow create(String tenantId, String canonicalId, String displayName, Instant now) {
        return new CanonicalWorkflow(tenantId, canonicalId, displayName, now, null);
    }

    public boolean isDeleted() {
        return deletedAt != null;
    }

    public CanonicalWorkflow withDeletedAt(Instant at) {
        return new CanonicalWorkflow(tenantId, canonicalId, displayName, createdAt, at);
    }
}
