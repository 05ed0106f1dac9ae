package com.canonicalsync.core.model;

/**
 * Soft lifecycle of a runtime instance as seen in one environment.
 * Mappings are never deleted, only moved between these states.
 */
public enum MappingStatus {
    /** Bound to a canonical workflow. Requires a canonical id. */
    LINKED,
    /** Seen in the runtime, no canonical workflow adopted yet. */
    UNTRACKED,
    /** Previously seen, absent from the latest listing. */
    MISSING,
    /** Excluded from sync by a human. */
    IGNORED,
    /** Removed by explicit tenant action. */
    DELETED;

    /**
     * Statuses that take part in missing-detection after a full listing.
     */
    public boolean isTracked() {
        return this == LINKED || this == UNTRACKED;
    }
}
