package com.canonicalsync.core.exception;

import com.canonicalsync.core.model.SyncJobStatus;

import java.util.UUID;

/**
 * Thrown when an invalid job state transition is attempted.
 */
public class InvalidStateTransitionException extends SyncException {
    
    public static final String ERROR_CODE = "INVALID_STATE_TRANSITION";
    
    public InvalidStateTransitionException(SyncJobStatus currentState, SyncJobStatus targetState) {
        super(ERROR_CODE, String.format(
            "Cannot transition from %s to %s",
            currentState, targetState
        ));
    }

    private InvalidStateTransitionException(String message) {
        super(ERROR_CODE, message);
    }

    /**
     * The stored job left {@code expectedState} before a conditional write landed.
     */
    public static InvalidStateTransitionException superseded(UUID jobId, SyncJobStatus expectedState) {
        return new InvalidStateTransitionException(String.format(
            "Job %s is no longer %s; it was changed by another writer", jobId, expectedState));
    }
}
