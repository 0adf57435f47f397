package org.mcpkubernetes.identity;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Stable, non-reversible user reference for log lines.
 */
public final class UserHash {

    private UserHash() {
    }

    public static String of(String email) {
        if (email == null || email.isEmpty()) {
            return "user:anonymous";
        }
        return "user:" + HexFormat.of().formatHex(sha256(email), 0, 8);
    }

    static String digest(String value) {
        return HexFormat.of().formatHex(sha256(value));
    }

    private static byte[] sha256(String value) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(value.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static String of(Identity identity) {
        return identity == null ? of((String) null) : of(identity.email());
    }
}
