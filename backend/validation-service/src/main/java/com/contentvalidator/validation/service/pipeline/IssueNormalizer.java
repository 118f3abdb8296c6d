package com.contentvalidator.validation.service.pipeline;

import com.contentvalidator.validation.dto.RawFinding;
import com.contentvalidator.validation.entity.Issue;
import com.contentvalidator.validation.entity.IssueSeverity;
import com.contentvalidator.validation.entity.IssueSource;
import com.contentvalidator.validation.entity.ScanPage;
import com.contentvalidator.validation.exception.MalformedFindingException;
import com.contentvalidator.validation.util.Fingerprints;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Turns validator output into persisted issues with a stable fingerprint.
 * Stateless.
 */
@Component
public class IssueNormalizer {

    static final String DEFAULT_CATEGORY = "content";
    static final String DEFAULT_TYPE = "unspecified";

    public Issue normalize(RawFinding raw, IssueSource source, ScanPage page) {
        if (raw == null) {
            throw new MalformedFindingException("Finding is null");
        }
        String evidence = blankToNull(raw.getEvidence());
        String explanation = blankToNull(raw.getExplanation());
        if (evidence == null && explanation == null) {
            throw new MalformedFindingException("Finding has neither evidence nor explanation");
        }

        String category = defaultIfBlank(raw.getCategory(), DEFAULT_CATEGORY).toLowerCase(Locale.ROOT);
        String type = defaultIfBlank(raw.getType(), DEFAULT_TYPE);
        String ruleId = cleanRuleId(raw.getGuidelineRuleId());

        return Issue.builder()
                .scanJobId(page.getScanJobId())
                .scanPageId(page.getId())
                .pageUrl(page.getUrl())
                .category(category)
                .type(type)
                .severity(IssueSeverity.parse(raw.getSeverity()))
                .evidence(evidence)
                .explanation(explanation != null ? explanation : evidence)
                .proposedFix(blankToNull(raw.getProposedFix()))
                .source(source)
                .confidence(clampConfidence(raw.getConfidence()))
                .guidelineSetName(blankToNull(raw.getGuidelineSetName()))
                .guidelineSourceFile(blankToNull(raw.getGuidelineSourceFile()))
                .guidelineSection(blankToNull(raw.getGuidelineSection()))
                .guidelineRuleId(ruleId)
                .fingerprint(Fingerprints.issueFingerprint(
                        page.getUrl(), category, type, evidence != null ? evidence : explanation, ruleId))
                .build();
    }

    static double clampConfidence(Double confidence) {
        if (confidence == null || confidence.isNaN()) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, confidence));
    }

    // LLM output sometimes wraps ids as "[R-12]"
    static String cleanRuleId(String ruleId) {
        if (ruleId == null) {
            return null;
        }
        String cleaned = ruleId.trim();
        while (cleaned.startsWith("[") || cleaned.startsWith("(")) {
            cleaned = cleaned.substring(1).trim();
        }
        while (cleaned.endsWith("]") || cleaned.endsWith(")")) {
            cleaned = cleaned.substring(0, cleaned.length() - 1).trim();
        }
        return cleaned.isEmpty() ? null : cleaned;
    }

    private static String defaultIfBlank(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value.trim();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
