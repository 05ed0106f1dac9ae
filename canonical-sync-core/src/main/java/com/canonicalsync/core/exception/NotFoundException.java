package com.canonicalsync.core.exception;

/**
 * Thrown when an environment, job or canonical workflow is not found.
 */
public class NotFoundException extends SyncException {
    
    public static final String ERROR_CODE = "NOT_FOUND";
    
    public NotFoundException(String entityType, String entityId) {
        super(ERROR_CODE, String.format(
            "%s not found: %s",
            entityType, entityId
        ));
    }
}
