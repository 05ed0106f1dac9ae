package com.canonicalsync.core.repository;

import com.canonicalsync.core.model.MappingStatus;
import com.canonicalsync.core.model.WorkflowEnvironmentMapping;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository for runtime instance to canonical workflow mappings.
 *
 * All writes are keyed upserts on (tenant, environment, runtime instance id),
 * so re-running a sync pass is safe.
 */
public interface WorkflowMappingRepository {

    /**
     * Insert or fully replace the mapping for its key.
     */
    void upsert(WorkflowEnvironmentMapping mapping);

    /**
     * Find the mapping for a runtime instance.
     */
    Optional<WorkflowEnvironmentMapping> findByRuntimeInstance(
        String tenantId, String environmentId, String runtimeInstanceId);

    /**
     * Find every mapping of an environment regardless of status.
     */
    List<WorkflowEnvironmentMapping> findByEnvironment(String tenantId, String environmentId);

    /**
     * Find the mappings in an environment bound to a canonical workflow.
     * More than one row may exist when an old instance went missing and a new one was linked.
     */
    List<WorkflowEnvironmentMapping> findByCanonicalId(String tenantId, String environmentId, String canonicalId);

    /**
     * Transition a mapping to a new status without touching its hash or payload.
     *
     * @return true if a row was updated
     */
    boolean updateStatus(
        String tenantId, String environmentId, String runtimeInstanceId,
        MappingStatus status, Instant lastSyncedAt);
}
