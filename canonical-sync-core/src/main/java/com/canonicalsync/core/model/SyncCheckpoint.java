package com.canonicalsync.core.model;

/**
 * Resume cursor written after every batch.
 */
public record SyncCheckpoint(int lastProcessedIndex, int totalCount) {
}
