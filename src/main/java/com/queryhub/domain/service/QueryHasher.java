package com.queryhub.domain.service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Cache key and log helpers for query text.
 */
public final class QueryHasher {

    static final int PREVIEW_LENGTH = 60;

    private QueryHasher() {
    }

    /**
     * SHA-256 hex of the trimmed query text. Case and inner whitespace are kept:
     * both can be significant inside string literals.
     */
    public static String hash(String queryText) {
        return sha256Hex(queryText == null ? "" : queryText.trim());
    }

    public static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Single-line prefix of the query for log lines.
     */
    public static String preview(String queryText) {
        if (queryText == null) {
            return "";
        }
        String flat = queryText.trim().replaceAll("\\s+", " ");
        return flat.length() <= PREVIEW_LENGTH ? flat : flat.substring(0, PREVIEW_LENGTH) + "...";
    }
}
