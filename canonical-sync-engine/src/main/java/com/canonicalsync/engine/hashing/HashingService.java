package com.canonicalsync.engine.hashing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Deterministic content fingerprints for workflow payloads.
 *
 * Stateless; collision tracking lives in the {@link FingerprintSession} each sync
 * pass opens with {@link #newSession()} and passes along explicitly.
 */
public class HashingService {

    private final WorkflowNormalizer normalizer;
    private final HashFunction hashFunction;

    public HashingService(ObjectMapper objectMapper) {
        this(new WorkflowNormalizer(objectMapper), HashFunction.sha256());
    }

    public HashingService(WorkflowNormalizer normalizer, HashFunction hashFunction) {
        this.normalizer = normalizer;
        this.hashFunction = hashFunction;
    }

    /**
     * Open a collision registry for one sync pass.
     */
    public FingerprintSession newSession() {
        return new FingerprintSession(normalizer, hashFunction);
    }

    /**
     * Raw fingerprint without collision tracking.
     */
    public String rawFingerprint(JsonNode payload) {
        return hashFunction.hash(normalizer.toCanonicalJson(payload));
    }

    public WorkflowNormalizer normalizer() {
        return normalizer;
    }
}
