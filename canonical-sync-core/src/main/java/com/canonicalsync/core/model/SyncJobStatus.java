package com.canonicalsync.core.model;

/**
 * Lifecycle states for a sync job.
 * At most one non-terminal job may exist per (tenant, environment, job kind).
 */
public enum SyncJobStatus {
    /**
     * Job row created, not yet picked up.
     * Transitions: -> RUNNING, FAILED
     */
    PENDING,

    /**
     * Engine is processing the environment.
     * Transitions: -> COMPLETED, FAILED
     */
    RUNNING,

    /**
     * Engine finished; result recorded. Terminal state.
     */
    COMPLETED,

    /**
     * Engine aborted or the job was declared dead. Terminal state.
     */
    FAILED;

    /**
     * Check if this state is terminal (no further transitions possible).
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Check if a job in this state occupies the per-environment job slot.
     */
    public boolean isActive() {
        return !isTerminal();
    }

    /**
     * Check if this state can transition to the target state.
     */
    public boolean canTransitionTo(SyncJobStatus target) {
        return switch (this) {
            case PENDING -> target == RUNNING || target == FAILED;
            case RUNNING -> target == COMPLETED || target == FAILED;
            case COMPLETED, FAILED -> false;
        };
    }
}
