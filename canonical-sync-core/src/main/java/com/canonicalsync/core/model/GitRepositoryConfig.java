package com.canonicalsync.core.model;

/**
 * Where an environment's promotion pipeline keeps its workflow files.
 * Files live under {@code workflows/<folder>/<canonicalId>.json}.
 */
public record GitRepositoryConfig(
    String repoUrl,
    String branch,
    String folder,
    String pinnedCommitSha,
    String accessToken
) {
    public static final String WORKFLOWS_ROOT = "workflows";

    public String workflowsPath() {
        return WORKFLOWS_ROOT + "/" + folder;
    }

    public boolean isPinned() {
        return pinnedCommitSha != null && !pinnedCommitSha.isBlank();
    }
}
