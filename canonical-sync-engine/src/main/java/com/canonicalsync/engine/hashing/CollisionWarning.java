package com.canonicalsync.engine.hashing;

import java.util.List;

/**
 * Two different normalized payloads produced the same raw hash within one sync pass.
 *
 * @param hash the colliding raw hash
 * @param canonicalId the canonical workflow this warning is about, null if unknown
 * @param sampleIdentifiers runtime instance ids or file paths that produced the hash
 * @param resolvedHash the fingerprint actually returned for this canonical workflow
 */
public record CollisionWarning(
    String hash,
    String canonicalId,
    List<String> sampleIdentifiers,
    String resolvedHash
) {
    public boolean isResolved() {
        return !hash.equals(resolvedHash);
    }
}
