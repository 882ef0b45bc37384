package com.ai.studyengine.service.cache;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Content-addressable cache keys. Whitespace differences in the source
 * text do not change the key; any change to the generation parameters does.
 */
public final class ContentFingerprint {

    private static final String PREFIX = "ai_session:";

    private ContentFingerprint() {
    }

    /** e.g. {@code ai_session:9b74c9897bac770ffc029102a200c5de...:14:30} */
    public static String cacheKey(String sourceText, int topicCount, int questionsPerTopic) {
        return PREFIX + sha256(normalize(sourceText)) + ":" + topicCount + ":" + questionsPerTopic;
    }

    static String normalize(String text) {
        return text == null ? "" : text.strip().replaceAll("\\s+", " ");
    }

    /**
     * Lowercase hex SHA-256 of the UTF-8 bytes.
     */
    static String sha256(String text) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] digest = md.digest(text.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(64);
            for (byte b : digest) {
                sb.append(String.format("%02x", b));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            // SHA-256 is mandatory in every Java SE runtime
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}
