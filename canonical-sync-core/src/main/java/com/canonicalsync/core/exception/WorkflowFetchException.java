package com.canonicalsync.core.exception;

/**
 * Thrown when a single workflow or file could not be fetched although the
 * remote answered. Recorded against that item; the rest of the pass continues.
 */
public class WorkflowFetchException extends SyncException {

    public static final String ERROR_CODE = "WORKFLOW_FETCH_FAILED";

    private final String itemId;

    public WorkflowFetchException(String upstream, String itemId, String message, Throwable cause) {
        super(ERROR_CODE, upstream + ": " + itemId + ": " + message, cause);
        this.itemId = itemId;
    }

    public String getItemId() {
        return itemId;
    }
}
