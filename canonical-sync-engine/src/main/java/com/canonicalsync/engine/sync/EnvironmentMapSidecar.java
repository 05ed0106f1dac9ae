package com.canonicalsync.engine.sync;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Map;

/**
 * Companion file {@code <canonicalId>.env-map.json} declaring which runtime instance
 * holds a canonical workflow in each environment.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EnvironmentMapSidecar(
    String canonicalWorkflowId,
    Map<String, EnvironmentEntry> environments
) {
    public static final String SUFFIX = ".env-map.json";

    /**
     * Sidecar path for a workflow file path.
     */
    public static String pathFor(String workflowPath) {
        return workflowPath.substring(0, workflowPath.length() - ".json".length()) + SUFFIX;
    }

    public static boolean isSidecar(String path) {
        return path.endsWith(SUFFIX);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record EnvironmentEntry(
        String environmentType,
        String runtimeInstanceId,
        String contentHash,
        String lastSeenAt
    ) {
        private static final String HASH_PREFIX = "sha256:";

        /**
         * Content hash without the optional algorithm prefix.
         */
        public String normalizedContentHash() {
            if (contentHash == null || contentHash.isBlank()) {
                return null;
            }
            return contentHash.startsWith(HASH_PREFIX) ? contentHash.substring(HASH_PREFIX.length()) : contentHash;
        }
    }
}
