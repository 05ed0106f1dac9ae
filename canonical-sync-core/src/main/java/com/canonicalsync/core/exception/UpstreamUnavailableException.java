package com.canonicalsync.core.exception;

/**
 * Thrown by the runtime and Git clients when the remote cannot be reached
 * or answers with an error. Aborts the current fetch; the job is failed.
 */
public class UpstreamUnavailableException extends SyncException {
    
    public static final String ERROR_CODE = "UPSTREAM_UNAVAILABLE";
    
    private final String upstream;
    
    public UpstreamUnavailableException(String upstream, String message, Throwable cause) {
        super(ERROR_CODE, upstream + ": " + message, cause);
        this.upstream = upstream;
    }
    
    public String getUpstream() {
        return upstream;
    }
}
