package com.contentvalidator.validation.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Text and URL normalization plus the stable hashes derived from them.
 */
public final class Fingerprints {

    /**
     * Number of normalized evidence characters that participate in an issue fingerprint
     */
    public static final int EVIDENCE_PREFIX_LENGTH = 200;

    private Fingerprints() {
    }

    /**
     * Lower-case, trim and collapse internal whitespace runs to a single space.
     */
    public static String normalizeText(String text) {
        if (text == null) {
            return "";
        }
        return text.toLowerCase(Locale.ROOT).trim().replaceAll("\\s+", " ");
    }

    /**
     * Drop the fragment and trailing slash, then lower-case.
     */
    public static String normalizeUrl(String url) {
        if (url == null) {
            return "";
        }
        String normalized = url.trim();
        int hash = normalized.indexOf('#');
        if (hash >= 0) {
            normalized = normalized.substring(0, hash);
        }
        while (normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized.toLowerCase(Locale.ROOT);
    }

    public static String contentHash(String text) {
        return sha256(normalizeText(text));
    }

    /**
     * Identity of an issue across scans. Two findings with the same page,
     * category, type, evidence prefix and guideline rule share a fingerprint.
     */
    public static String issueFingerprint(String pageUrl, String category, String type,
                                          String evidence, String ruleId) {
        String normalizedEvidence = normalizeText(evidence);
        if (normalizedEvidence.length() > EVIDENCE_PREFIX_LENGTH) {
            normalizedEvidence = normalizedEvidence.substring(0, EVIDENCE_PREFIX_LENGTH);
        }
        StringBuilder key = new StringBuilder()
                .append(normalizeUrl(pageUrl)).append('|')
                .append(category == null ? "" : category.toLowerCase(Locale.ROOT)).append('|')
                .append(type == null ? "" : type.toLowerCase(Locale.ROOT)).append('|')
                .append(normalizedEvidence);
        if (ruleId != null && !ruleId.isBlank()) {
            key.append('|').append(ruleId);
        }
        return sha256(key.toString());
    }

    private static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
