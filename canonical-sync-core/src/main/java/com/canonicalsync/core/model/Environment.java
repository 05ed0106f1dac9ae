package com.canonicalsync.core.model;

/**
 * A tenant's deployment target: one runtime instance plus an optional Git pipeline.
 *
 * Primary Key: (tenantId, environmentId)
 */
public record Environment(
    String tenantId,
    String environmentId,
    String name,
    String environmentClass,
    String runtimeBaseUrl,
    String runtimeApiKey,
    GitRepositoryConfig git
) {
    public boolean hasGitConfig() {
        return git != null && git.repoUrl() != null && !git.repoUrl().isBlank();
    }

    public boolean isClass(String candidate) {
        return environmentClass != null && environmentClass.equalsIgnoreCase(candidate);
    }
}
