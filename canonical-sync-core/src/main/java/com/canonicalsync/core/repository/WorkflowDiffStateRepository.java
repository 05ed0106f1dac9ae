package com.canonicalsync.core.repository;

import com.canonicalsync.core.model.WorkflowDiffState;

import java.util.List;
import java.util.Optional;

/**
 * Repository for materialized pairwise diff results.
 * Contents are a cache of the mapping and git-state tables and may be recomputed at any time.
 */
public interface WorkflowDiffStateRepository {

    /**
     * Insert or fully replace the diff row for its key.
     */
    void upsert(WorkflowDiffState state);

    /**
     * Find the stored diff of one canonical workflow for an ordered environment pair.
     */
    Optional<WorkflowDiffState> find(
        String tenantId, String sourceEnvironmentId, String targetEnvironmentId, String canonicalId);

    /**
     * Find all stored diffs for an ordered environment pair.
     */
    List<WorkflowDiffState> findByPair(String tenantId, String sourceEnvironmentId, String targetEnvironmentId);

    /**
     * Drop the diff row of one canonical workflow for an ordered environment pair.
     */
    void delete(String tenantId, String sourceEnvironmentId, String targetEnvironmentId, String canonicalId);
}
