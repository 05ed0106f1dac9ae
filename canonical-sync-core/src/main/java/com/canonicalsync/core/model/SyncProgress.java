package com.canonicalsync.core.model;

/**
 * Progress snapshot stored on a job and emitted on the progress channel.
 */
public record SyncProgress(
    int current,
    int total,
    int percentage,
    String message,
    SyncCheckpoint checkpoint
) {
    public static SyncProgress queued() {
        return new SyncProgress(0, 0, 0, "Sync queued...", null);
    }

    public static SyncProgress of(int current, int total, String message) {
        int percentage = total > 0 ? (int) Math.min(100, (current * 100L) / total) : 0;
        return new SyncProgress(current, total, percentage, message, null);
    }

    public SyncProgress withCheckpoint(SyncCheckpoint newCheckpoint) {
        return new SyncProgress(current, total, percentage, message, newCheckpoint);
    }
}
