package com.canonicalsync.engine.reconcile;

import com.canonicalsync.core.model.DiffStatus;

import java.util.Objects;

/**
 * Deterministic diff classification. Rules apply in priority order:
 * <ol>
 *   <li>promotable source hash equals target git: UNCHANGED</li>
 *   <li>target git only: TARGET_ONLY</li>
 *   <li>source git only: ADDED</li>
 *   <li>source runtime drifted from source git while target git diverged: CONFLICT</li>
 *   <li>target runtime already equals the promotable source hash: TARGET_HOTFIX</li>
 *   <li>otherwise: MODIFIED</li>
 * </ol>
 * Presence and conflict checks use the raw git hashes. The promotable hash only differs from the
 * source git hash when the source runtime is authoritative.
 */
public class DiffClassifier {

    public DiffStatus classify(DiffInputs inputs) {
        String sourceGit = inputs.sourceGitHash();
        String targetGit = inputs.targetGitHash();
        String sourceEnv = inputs.sourceEnvHash();
        String targetEnv = inputs.targetEnvHash();
        String promotable = inputs.promotableSourceHash();

        if (sourceGit == null && targetGit == null) {
            return DiffStatus.UNCHANGED;
        }
        if (Objects.equals(promotable, targetGit)) {
            return DiffStatus.UNCHANGED;
        }
        if (sourceGit == null) {
            return DiffStatus.TARGET_ONLY;
        }
        if (targetGit == null) {
            return DiffStatus.ADDED;
        }

        boolean sourceHasLocalChanges = sourceEnv != null && !sourceEnv.equals(sourceGit);
        boolean targetGitDiverged = !targetGit.equals(sourceGit);
        if (sourceHasLocalChanges && targetGitDiverged) {
            return DiffStatus.CONFLICT;
        }
        if (promotable.equals(targetEnv)) {
            return DiffStatus.TARGET_HOTFIX;
        }
        return DiffStatus.MODIFIED;
    }
}
