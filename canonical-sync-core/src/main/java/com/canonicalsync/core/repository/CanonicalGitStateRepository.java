package com.canonicalsync.core.repository;

import com.canonicalsync.core.model.CanonicalGitState;

import java.util.List;
import java.util.Optional;

/**
 * Repository for the Git-side fingerprints of canonical workflows, per environment.
 */
public interface CanonicalGitStateRepository {

    /**
     * Insert or replace the git state for (tenant, environment, canonical id).
     */
    void upsert(CanonicalGitState state);

    /**
     * Find the git state of one canonical workflow in one environment.
     */
    Optional<CanonicalGitState> find(String tenantId, String environmentId, String canonicalId);

    /**
     * Find every git state in an environment whose content hash equals the given fingerprint.
     * Used for auto-linking runtime instances.
     */
    List<CanonicalGitState> findByContentHash(String tenantId, String environmentId, String contentHash);

    /**
     * Find every git state recorded for an environment.
     */
    List<CanonicalGitState> findByEnvironment(String tenantId, String environmentId);
}
