package com.canonicalsync.engine.sync;

import com.canonicalsync.core.model.SyncCheckpoint;
import com.canonicalsync.core.model.SyncProgress;

/**
 * Where a running sync pass reports progress and reads the checkpoint it resumes from.
 */
public interface JobProgressSink {

    /**
     * Checkpoint left by an earlier attempt of the same job, or null to start from the beginning.
     */
    SyncCheckpoint resumeCheckpoint();

    /**
     * Record progress. A progress carrying a checkpoint is the unit of crash recovery.
     */
    void report(SyncProgress progress);

    /**
     * Sink for passes run outside a job.
     */
    JobProgressSink NONE = new JobProgressSink() {
        @Override
        public SyncCheckpoint resumeCheckpoint() {
            return null;
        }

        @Override
        public void report(SyncProgress progress) {
            // not tracked
        }
    };
}
