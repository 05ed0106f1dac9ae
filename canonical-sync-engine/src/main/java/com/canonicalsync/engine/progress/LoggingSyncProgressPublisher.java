package com.canonicalsync.engine.progress;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes progress events to the application log.
 */
public class LoggingSyncProgressPublisher implements SyncProgressPublisher {

    private static final Logger log = LoggerFactory.getLogger(LoggingSyncProgressPublisher.class);

    @Override
    public void publish(SyncProgressEvent event) {
        log.info("Sync progress job={} kind={} env={}/{} status={} {}/{} ({}%) {}",
            event.jobId(), event.jobKind(), event.tenantId(), event.environmentId(),
            event.status(), event.current(), event.total(), event.percentage(),
            event.message() != null ? event.message() : "");
    }
}
