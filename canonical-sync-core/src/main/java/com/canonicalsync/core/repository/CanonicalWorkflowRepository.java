package com.canonicalsync.core.repository;

import com.canonicalsync.core.model.CanonicalWorkflow;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository for canonical workflow identities.
 */
public interface CanonicalWorkflowRepository {

    /**
     * Insert the workflow unless a row with the same (tenant, canonical id) exists.
     *
     * @return true if a new row was created, false if it already existed
     */
    boolean createIfAbsent(CanonicalWorkflow workflow);

    /**
     * Find a canonical workflow by its key, deleted or not.
     */
    Optional<CanonicalWorkflow> findById(String tenantId, String canonicalId);

    /**
     * Find all canonical workflows of a tenant that have not been soft-deleted.
     */
    List<CanonicalWorkflow> findActive(String tenantId);

    /**
     * Soft-delete a canonical workflow.
     *
     * @return true if an active row was marked deleted
     */
    boolean markDeleted(String tenantId, String canonicalId, Instant deletedAt);
}
