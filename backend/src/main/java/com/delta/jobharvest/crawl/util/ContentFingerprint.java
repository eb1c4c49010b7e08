package com.delta.jobharvest.crawl.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Stable SHA-256 fingerprint over a set of named fields. Keys are sorted and null values count as
 * empty, so two records with the same visible content hash the same regardless of insertion order.
 */
public final class ContentFingerprint {
    private static final char FIELD_SEPARATOR = '\u001f';

    private ContentFingerprint() {
    }

    public static String of(Map<String, String> fields) {
        SortedMap<String, String> sorted = new TreeMap<>(fields);
        StringBuilder payload = new StringBuilder();
        sorted.forEach((name, value) -> payload
            .append(name)
            .append('=')
            .append(value == null ? "" : value.trim())
            .append(FIELD_SEPARATOR));
        return sha256(payload.toString());
    }

    static String sha256(String value) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(value.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
