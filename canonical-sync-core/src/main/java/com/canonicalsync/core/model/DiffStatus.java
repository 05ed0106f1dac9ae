package com.canonicalsync.core.model;

/**
 * Pairwise reconciliation outcome for one canonical workflow.
 */
public enum DiffStatus {
    /** Both Git states carry the same fingerprint. */
    UNCHANGED,
    /** Source is strictly ahead of target. */
    MODIFIED,
    /** Present in source Git only. */
    ADDED,
    /** Present in target Git only. */
    TARGET_ONLY,
    /** Target runtime already matches source Git, but target Git moved. */
    TARGET_HOTFIX,
    /** Source runtime and target Git changed independently. */
    CONFLICT
}
