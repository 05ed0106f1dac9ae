package com.canonicalsync.core.exception;

import com.canonicalsync.core.model.SyncJobKind;

/**
 * Thrown by the job store when a second non-terminal job is inserted
 * for the same (tenant, environment, job kind).
 */
public class DuplicateActiveJobException extends SyncException {
    
    public static final String ERROR_CODE = "DUPLICATE_ACTIVE_JOB";
    
    public DuplicateActiveJobException(String tenantId, String environmentId, SyncJobKind jobKind) {
        super(ERROR_CODE, String.format(
            "A %s job is already pending or running for %s/%s",
            jobKind, tenantId, environmentId
        ));
    }

    public DuplicateActiveJobException(String tenantId, String environmentId, SyncJobKind jobKind, Throwable cause) {
        super(ERROR_CODE, String.format(
            "A %s job is already pending or running for %s/%s",
            jobKind, tenantId, environmentId
        ), cause);
    }
}
