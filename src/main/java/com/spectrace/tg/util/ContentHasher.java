package com.spectrace.tg.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;

/**
 * Short content fingerprints for change detection.
 *
 * The hash is the first 8 hex digits of SHA-256 over the text with leading
 * and trailing blank lines removed. It is not meant to resist tampering.
 */
public final class ContentHasher {
    public static final int LENGTH = 8;

    private ContentHasher() {
        // Utility class
    }

    public static String hash(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] bytes = digest.digest(text.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(bytes).substring(0, LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /** Joins lines after dropping blank lines at either end. */
    public static String trimBlankLines(List<String> lines) {
        int start = 0;
        int end = lines.size();
        while (start < end && lines.get(start).isBlank())
            start++;
        while (end > start && lines.get(end - 1).isBlank())
            end--;
        return String.join("\n", lines.subList(start, end));
    }

    public static boolean matches(String declared, String text) {
        return declared != null && declared.equalsIgnoreCase(hash(text));
    }
}
