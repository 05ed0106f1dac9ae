package com.canonicalsync.core.exception;

import java.util.List;

/**
 * Thrown when an environment lacks the configuration a sync needs.
 */
public class SyncConfigurationException extends SyncException {
    
    public static final String ERROR_CODE = "CONFIGURATION_ERROR";
    
    private final List<String> problems;
    
    public SyncConfigurationException(String environmentId, List<String> problems) {
        super(ERROR_CODE, String.format(
            "Environment %s is not configured for sync: %s",
            environmentId, String.join(", ", problems)
        ));
        this.problems = List.copyOf(problems);
    }
    
    public List<String> getProblems() {
        return problems;
    }
}
