package com.canonicalsync.engine.service;

import com.canonicalsync.engine.reconcile.PairwiseReconcileResult;
import com.canonicalsync.engine.reconcile.ReconcileResult;

/**
 * Computes pairwise diff status between environments from recorded hashes.
 */
public interface ReconciliationService {

    /**
     * Reconcile one ordered pair. A non-forced call inside the debounce window of the
     * previous call for the same (tenant, source, target) returns a skipped result.
     */
    ReconcileResult reconcilePair(String tenantId, String sourceEnvironmentId, String targetEnvironmentId, boolean force);

    /**
     * Reconcile a changed environment against every other environment of the tenant, both directions.
     * Failures of individual pairs are collected, not thrown.
     */
    PairwiseReconcileResult reconcileAllPairsFor(String tenantId, String changedEnvironmentId);
}
