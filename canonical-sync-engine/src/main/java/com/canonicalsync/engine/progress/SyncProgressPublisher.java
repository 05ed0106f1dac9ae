package com.canonicalsync.engine.progress;

/**
 * Best-effort delivery of progress events to observers.
 * A lost event only affects freshness of what observers see.
 */
public interface SyncProgressPublisher {

    void publish(SyncProgressEvent event);
}
