package com.canonicalsync.engine.sync;

import com.canonicalsync.engine.hashing.CollisionWarning;

import java.util.List;

/**
 * Outcome of one sync pass, recorded on the job when it completes.
 */
public interface SyncResult {

    List<SyncError> errors();

    List<CollisionWarning> collisionWarnings();
}
