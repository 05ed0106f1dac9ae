package com.canonicalsync.engine.hashing;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Collision registry for a single sync pass.
 *
 * A session is created at the start of a pass and dropped at its end; nothing is
 * shared between passes or between concurrently running jobs. Within one session,
 * hash equality implies payload equality for every workflow fingerprinted with a
 * canonical id.
 */
public class FingerprintSession {

    private static final Logger log = LoggerFactory.getLogger(FingerprintSession.class);

    static final int MAX_SAMPLE_IDENTIFIERS = 5;

    private final WorkflowNormalizer normalizer;
    private final HashFunction hashFunction;

    private final Map<String, String> payloadByHash = new HashMap<>();
    private final Map<String, String> holderByHash = new HashMap<>();
    private final Map<String, Set<String>> identifiersByHash = new HashMap<>();
    private final Set<String> warnedKeys = new HashSet<>();
    private final List<CollisionWarning> warnings = new ArrayList<>();

    FingerprintSession(WorkflowNormalizer normalizer, HashFunction hashFunction) {
        this.normalizer = normalizer;
        this.hashFunction = hashFunction;
    }

    /**
     * Fingerprint a payload, identified by its canonical id.
     */
    public String fingerprint(JsonNode payload, String canonicalId) {
        return fingerprint(payload, canonicalId, canonicalId);
    }

    /**
     * Fingerprint a payload.
     *
     * @param payload raw workflow JSON
     * @param canonicalId canonical workflow id, or null when not known yet
     * @param identifier runtime instance id or file path, reported in collision warnings
     * @return the raw hash, or a canonical-id-salted hash when the raw hash collides
     */
    public synchronized String fingerprint(JsonNode payload, String canonicalId, String identifier) {
        String normalized = normalizer.toCanonicalJson(payload);
        String rawHash = hashFunction.hash(normalized);

        Set<String> identifiers = identifiersByHash.computeIfAbsent(rawHash, h -> new LinkedHashSet<>());
        if (identifier != null && identifiers.size() < MAX_SAMPLE_IDENTIFIERS) {
            identifiers.add(identifier);
        }

        String seen = payloadByHash.putIfAbsent(rawHash, normalized);
        if (seen == null) {
            if (canonicalId != null) {
                holderByHash.put(rawHash, canonicalId);
            }
            return rawHash;
        }
        if (seen.equals(normalized)) {
            return rawHash;
        }

        String resolved = canonicalId != null
            ? hashFunction.hash(canonicalId + ":" + normalized)
            : rawHash;
        List<String> sample = List.copyOf(identifiers);
        recordWarning(rawHash, canonicalId, sample, resolved);

        String holder = holderByHash.get(rawHash);
        if (holder != null && !holder.equals(canonicalId)) {
            recordWarning(rawHash, holder, sample, rawHash);
        }
        return resolved;
    }

    /**
     * Collision warnings raised so far, in detection order.
     */
    public synchronized List<CollisionWarning> warnings() {
        return List.copyOf(warnings);
    }

    private void recordWarning(String rawHash, String canonicalId, List<String> sample, String resolved) {
        if (!warnedKeys.add(rawHash + "|" + canonicalId)) {
            return;
        }
        warnings.add(new CollisionWarning(rawHash, canonicalId, sample, resolved));
        if (canonicalId != null) {
            log.warn("Fingerprint collision on {} for canonical workflow {}, samples={}, resolvedTo={}",
                rawHash, canonicalId, sample, resolved);
        } else {
            log.warn("Unresolved fingerprint collision on {} without canonical id, samples={}", rawHash, sample);
        }
    }
}
