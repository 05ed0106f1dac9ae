package com.canonicalsync.engine.hashing;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Maps normalized workflow JSON to a content hash.
 */
@FunctionalInterface
public interface HashFunction {

    String hash(String normalizedJson);

    /**
     * Lowercase hex SHA-256 of the UTF-8 bytes.
     */
    static HashFunction sha256() {
        return input -> {
            try {
                MessageDigest digest = MessageDigest.getInstance("SHA-256");
                return HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
            } catch (NoSuchAlgorithmException e) {
                throw new IllegalStateException("SHA-256 not available", e);
            }
        };
    }
}
