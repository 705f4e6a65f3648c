package org.netpreserve.forumminer.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * Content fingerprints in the {@code sha256:<hex>} form used by metadata and state files.
 */
public final class Fingerprints {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final String PREFIX = "sha256:";

    private Fingerprints() {
    }

    public static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new RuntimeException(e);
        }
    }

    public static String format(MessageDigest digest) {
        return PREFIX + HexFormat.of().formatHex(digest.digest());
    }

    public static String of(byte[] data) {
        var digest = newDigest();
        digest.update(data);
        return format(digest);
    }

    /**
     * Collapses whitespace runs to a single space and trims, so reflowed markup doesn't look like an edit.
     */
    public static String normalizeText(String text) {
        if (text == null) return "";
        return WHITESPACE.matcher(text).replaceAll(" ").strip();
    }

    /**
     * Fingerprint of the normalized text, or null when the normalized text is empty.
     */
    public static String ofText(String text) {
        String normalized = normalizeText(text);
        if (normalized.isEmpty()) return null;
        return of(normalized.getBytes(StandardCharsets.UTF_8));
    }
}
