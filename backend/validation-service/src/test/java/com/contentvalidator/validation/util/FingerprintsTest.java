package com.contentvalidator.validation.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FingerprintsTest {

    @Test
    @DisplayName("normalizeText lower-cases, trims and collapses whitespace")
    void normalizeText() {
        assertThat(Fingerprints.normalizeText("  Click   HERE\n\tnow ")).isEqualTo("click here now");
        assertThat(Fingerprints.normalizeText(null)).isEmpty();
    }

    @Test
    @DisplayName("normalizeUrl drops fragment and trailing slash")
    void normalizeUrl() {
        assertThat(Fingerprints.normalizeUrl("https://Example.com/About/#team")).isEqualTo("https://example.com/about");
        assertThat(Fingerprints.normalizeUrl("https://example.com/")).isEqualTo("https://example.com");
        assertThat(Fingerprints.normalizeUrl(null)).isEmpty();
    }

    @Test
    @DisplayName("Fingerprint is stable across whitespace, casing and URL variants")
    void fingerprintStableAcrossFormatting() {
        String a = Fingerprints.issueFingerprint("https://example.com/x", "Formatting", "all_caps_abuse",
                "BUY  NOW TODAY", null);
        String b = Fingerprints.issueFingerprint("https://EXAMPLE.com/x/#top", "formatting", "ALL_CAPS_ABUSE",
                " buy now\ntoday ", null);

        assertThat(a).isEqualTo(b).hasSize(64);
    }

    @Test
    @DisplayName("Fingerprint changes with page, type or guideline rule")
    void fingerprintDistinguishesDefects() {
        String base = Fingerprints.issueFingerprint("https://example.com/x", "content", "tone", "evidence", null);

        assertThat(Fingerprints.issueFingerprint("https://example.com/y", "content", "tone", "evidence", null))
                .isNotEqualTo(base);
        assertThat(Fingerprints.issueFingerprint("https://example.com/x", "content", "clarity", "evidence", null))
                .isNotEqualTo(base);
        assertThat(Fingerprints.issueFingerprint("https://example.com/x", "content", "tone", "evidence", "R-1"))
                .isNotEqualTo(base);
    }

    @Test
    @DisplayName("Only the first 200 normalized evidence characters participate")
    void evidencePrefixBound() {
        String prefix = "a".repeat(Fingerprints.EVIDENCE_PREFIX_LENGTH);

        String a = Fingerprints.issueFingerprint("https://example.com", "c", "t", prefix + " tail one", null);
        String b = Fingerprints.issueFingerprint("https://example.com", "c", "t", prefix + " tail two", null);

        assertThat(a).isEqualTo(b);
    }
}
