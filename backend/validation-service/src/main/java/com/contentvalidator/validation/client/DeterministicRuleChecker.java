package com.contentvalidator.validation.client;

import com.contentvalidator.validation.dto.ContentChunk;
import com.contentvalidator.validation.dto.PageContent;
import com.contentvalidator.validation.dto.RawFinding;
import com.contentvalidator.validation.dto.ValidationContext;
import com.contentvalidator.validation.entity.IssueSource;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fast in-process text rules, applied chunk by chunk.
 */
@Component
public class DeterministicRuleChecker implements ContentValidator {

    static final List<String> BANNED_PHRASES = List.of(
            "click here",
            "read more",
            "learn more here",
            "click this link"
    );

    private static final List<PunctuationRule> PUNCTUATION_RULES = List.of(
            new PunctuationRule(Pattern.compile("!{2,}"), "Multiple exclamation marks"),
            new PunctuationRule(Pattern.compile("\\?{2,}"), "Multiple question marks"),
            new PunctuationRule(Pattern.compile("\\.{4,}"), "Excessive periods (not an ellipsis)"),
            new PunctuationRule(Pattern.compile(",{2,}"), "Multiple consecutive commas")
    );

    private static final Pattern MULTIPLE_SPACES = Pattern.compile("[^ \\n] {2,}[^ \\n]");
    private static final Pattern NON_LETTERS = Pattern.compile("[^A-Za-z]");

    private static final int ALL_CAPS_MIN_WORDS = 3;
    private static final int WHITESPACE_MIN_MATCHES = 3;

    private record PunctuationRule(Pattern pattern, String description) {
    }

    @Override
    public IssueSource source() {
        return IssueSource.DETERMINISTIC;
    }

    @Override
    public List<RawFinding> validate(PageContent content, ValidationContext context) {
        List<RawFinding> findings = new ArrayList<>();
        for (ContentChunk chunk : content.chunks()) {
            findings.addAll(check(chunk.text()));
        }
        return findings;
    }

    public List<RawFinding> check(String text) {
        List<RawFinding> findings = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return findings;
        }
        checkBannedPhrases(text, findings);
        checkRepeatedPunctuation(text, findings);
        checkAllCaps(text, findings);
        checkWhitespace(text, findings);
        return findings;
    }

    private void checkBannedPhrases(String text, List<RawFinding> findings) {
        String lower = text.toLowerCase(Locale.ROOT);
        for (String phrase : BANNED_PHRASES) {
            int idx = lower.indexOf(phrase);
            if (idx < 0) {
                continue;
            }
            findings.add(RawFinding.builder()
                    .category("link_text")
                    .type("banned_phrase")
                    .severity("medium")
                    .evidence("..." + context(text, idx, idx + phrase.length(), 30) + "...")
                    .explanation("The phrase \"" + phrase + "\" is non-descriptive and should be replaced with meaningful text.")
                    .proposedFix("Replace \"" + phrase + "\" with a descriptive action or destination.")
                    .confidence(0.90)
                    .build());
        }
    }

    private void checkRepeatedPunctuation(String text, List<RawFinding> findings) {
        for (PunctuationRule rule : PUNCTUATION_RULES) {
            Matcher matcher = rule.pattern().matcher(text);
            while (matcher.find()) {
                findings.add(RawFinding.builder()
                        .category("formatting")
                        .type("repeated_punctuation")
                        .severity("low")
                        .evidence("..." + context(text, matcher.start(), matcher.end(), 20) + "...")
                        .explanation(rule.description() + " detected.")
                        .proposedFix("Use standard punctuation.")
                        .confidence(0.95)
                        .build());
            }
        }
    }

    private void checkAllCaps(String text, List<RawFinding> findings) {
        List<String> streak = new ArrayList<>();
        for (String word : text.trim().split("\\s+")) {
            String letters = NON_LETTERS.matcher(word).replaceAll("");
            if (letters.length() > 3 && letters.equals(letters.toUpperCase(Locale.ROOT))) {
                streak.add(word);
            } else {
                flushCaps(streak, findings);
            }
        }
        flushCaps(streak, findings);
    }

    private void flushCaps(List<String> streak, List<RawFinding> findings) {
        if (streak.size() >= ALL_CAPS_MIN_WORDS) {
            findings.add(RawFinding.builder()
                    .category("formatting")
                    .type("all_caps_abuse")
                    .severity("medium")
                    .evidence(String.join(" ", streak))
                    .explanation("Excessive use of ALL CAPS can feel like shouting and reduces readability.")
                    .proposedFix("Use title case or sentence case instead.")
                    .confidence(0.85)
                    .build());
        }
        streak.clear();
    }

    private void checkWhitespace(String text, List<RawFinding> findings) {
        Matcher matcher = MULTIPLE_SPACES.matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        if (count >= WHITESPACE_MIN_MATCHES) {
            findings.add(RawFinding.builder()
                    .category("formatting")
                    .type("whitespace_anomaly")
                    .severity("low")
                    .evidence("Found " + count + " instances of multiple consecutive spaces")
                    .explanation("Multiple consecutive spaces may indicate copy-paste issues or formatting problems.")
                    .proposedFix("Replace multiple spaces with single spaces.")
                    .confidence(0.80)
                    .build());
        }
    }

    private static String context(String text, int start, int end, int radius) {
        return text.substring(Math.max(0, start - radius), Math.min(text.length(), end + radius));
    }
}
