package com.canonicalsync.engine.sync;

import com.canonicalsync.core.model.Environment;
import com.canonicalsync.core.model.SyncJobKind;

/**
 * A sync engine the orchestrator can run for a job kind.
 */
public interface SyncStrategy {

    SyncJobKind kind();

    /**
     * Run one full pass over an environment.
     * Per-item failures are reported in the result; an exception means the whole pass failed.
     */
    SyncResult sync(Environment environment, JobProgressSink sink);
}
