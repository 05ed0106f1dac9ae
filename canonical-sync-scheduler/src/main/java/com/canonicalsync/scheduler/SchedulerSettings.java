package com.canonicalsync.scheduler;

import java.time.Duration;

/**
 * Timing of the periodic sync loops.
 *
 * @param enabled loops only run when true; otherwise every sync is requested explicitly
 * @param pollInterval delay between two ticks of a loop
 * @param repoSyncInterval minimum age of the last repository sync activity before another is started
 * @param envSyncInterval minimum age of the last runtime sync activity before another is started
 * @param debounceWindow minimum time between two triggers for the same environment and kind
 */
public record SchedulerSettings(
    boolean enabled,
    Duration pollInterval,
    Duration repoSyncInterval,
    Duration envSyncInterval,
    Duration debounceWindow
) {
    public static SchedulerSettings defaults() {
        return new SchedulerSettings(
            false,
            Duration.ofMinutes(1),
            Duration.ofMinutes(30),
            Duration.ofMinutes(30),
            Duration.ofSeconds(60)
        );
    }
}
