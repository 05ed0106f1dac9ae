package com.canonicalsync.core.model;

/**
 * What a sync job ingests.
 */
public enum SyncJobKind {
    /** Git repository to database. */
    REPO_SYNC,
    /** Runtime instance to database. */
    ENV_SYNC
}
