package io.github.jsonsubschema.semantic;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/// SHA-256 helpers for deterministic cache file naming.
final class Sha256 {
    private Sha256() {}

    static String hex(String text) {
        final byte[] digest = messageDigest().digest(text.getBytes(StandardCharsets.UTF_8));
        final var out = new StringBuilder(digest.length * 2);
        for (byte b : digest) {
            out.append(HEX[(b >>> 4) & 0x0F]).append(HEX[b & 0x0F]);
        }
        return out.toString();
    }

    private static MessageDigest messageDigest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            // SHA-256 is required by the Java platform.
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static final char[] HEX = "0123456789abcdef".toCharArray();
}
