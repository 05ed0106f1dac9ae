package com.canonicalsync.engine.reconcile;

import java.util.List;

/**
 * Outcome of reconciling a changed environment against every other environment, both directions.
 *
 * @param errors one entry per pair that failed as a whole
 */
public record PairwiseReconcileResult(
    String changedEnvironmentId,
    List<ReconcileResult> results,
    List<String> errors
) {
    public int pairsReconciled() {
        return (int) results.stream().filter(r -> !r.skippedByDebounce()).count();
    }
}
