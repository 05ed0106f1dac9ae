package com.canonicalsync.engine.sync;

/**
 * One workflow or file that failed inside a sync pass.
 *
 * @param identifier runtime instance id or file path
 * @param message failure description
 */
public record SyncError(String identifier, String message) {

    public static SyncError of(String identifier, Exception e) {
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        return new SyncError(identifier, message);
    }
}
