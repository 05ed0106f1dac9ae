package com.canonicalsync.engine.sync;

import com.canonicalsync.core.model.SyncCheckpoint;
import com.canonicalsync.core.model.SyncProgress;

import java.util.ArrayList;
import java.util.List;

/**
 * Progress sink that records every report and resumes from a fixed checkpoint.
 */
class RecordingProgressSink implements JobProgressSink {

    private final SyncCheckpoint resumeFrom;
    private final List<SyncProgress> reports = new ArrayList<>();

    RecordingProgressSink() {
        this(null);
    }

    RecordingProgressSink(SyncCheckpoint resumeFrom) {
        this.resumeFrom = resumeFrom;
    }

    @Override
    public SyncCheckpoint resumeCheckpoint() {
        return resumeFrom;
    }

    @Override
    public void report(SyncProgress progress) {
        reports.add(progress);
    }

    List<SyncProgress> reports() {
        return reports;
    }

    SyncProgress last() {
        return reports.get(reports.size() - 1);
    }
}
