package de.mirkosertic.mcp.ragsync.identity;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * SHA-256 hex digests used for content addressing and change detection.
 */
public final class ContentHasher {

    private ContentHasher() {
    }

    public static String sha256(final String content) {
        return sha256(content.getBytes(StandardCharsets.UTF_8));
    }

    public static String sha256(final byte[] data) {
        final MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (final NoSuchAlgorithmException e) {
            // Every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
        final byte[] hash = digest.digest(data);
        final StringBuilder hexString = new StringBuilder(hash.length * 2);
        for (final byte b : hash) {
            final String hex = Integer.toHexString(0xff & b);
            if (hex.length() == 1) {
                hexString.append('0');
            }
            hexString.append(hex);
        }
        return hexString.toString();
    }
}
