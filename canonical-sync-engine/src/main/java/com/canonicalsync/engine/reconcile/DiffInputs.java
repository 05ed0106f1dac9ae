package com.canonicalsync.engine.reconcile;

/**
 * The four hashes a diff is computed from, null where the state is absent.
 *
 * @param sourceRuntimeAuthoritative the source environment's runtime is the source of truth
 *        for new work, so its runtime hash is what it promotes when present
 */
public record DiffInputs(
    String sourceGitHash,
    String targetGitHash,
    String sourceEnvHash,
    String targetEnvHash,
    boolean sourceRuntimeAuthoritative
) {
    public static DiffInputs of(String sourceGitHash, String targetGitHash, String sourceEnvHash, String targetEnvHash) {
        return new DiffInputs(sourceGitHash, targetGitHash, sourceEnvHash, targetEnvHash, false);
    }

    /**
     * Hash of what the source would promote.
     */
    public String promotableSourceHash() {
        if (sourceRuntimeAuthoritative && sourceEnvHash != null) {
            return sourceEnvHash;
        }
        return sourceGitHash;
    }

    public boolean isEmpty() {
        return sourceGitHash == null && targetGitHash == null && sourceEnvHash == null && targetEnvHash == null;
    }
}
