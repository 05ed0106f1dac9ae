package com.canonicalsync.scheduler;

import com.canonicalsync.core.model.SyncJobKind;

/**
 * What one scheduler tick did.
 *
 * @param considered environments eligible for the loop's job kind
 * @param triggered jobs this tick created and ran
 * @param debounced environments skipped inside the debounce window
 * @param notDue environments whose last sync activity is younger than the interval
 * @param alreadyActive environments where another caller's job was pending or running
 * @param failed environments where requesting or running the job threw
 */
public record TickResult(
    SyncJobKind kind,
    int considered,
    int triggered,
    int debounced,
    int notDue,
    int alreadyActive,
    int failed
) {
}
