package com.contentvalidator.validation.dto;

import com.contentvalidator.validation.entity.Issue;
import com.contentvalidator.validation.entity.IssueSeverity;
import com.contentvalidator.validation.entity.IssueSource;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IssueDto {

    private Long id;
    private Long scanPageId;
    private String pageUrl;
    private String category;
    private String type;
    private IssueSeverity severity;
    private String evidence;
    private String explanation;
    private String proposedFix;
    private IssueSource source;
    private Double confidence;
    private String guidelineSetName;
    private String guidelineSourceFile;
    private String guidelineSection;
    private String guidelineRuleId;
    private String fingerprint;

    public static IssueDto from(Issue issue) {
        return IssueDto.builder()
                .id(issue.getId())
                .scanPageId(issue.getScanPageId())
                .pageUrl(issue.getPageUrl())
                .category(issue.getCategory())
                .type(issue.getType())
                .severity(issue.getSeverity())
                .evidence(issue.getEvidence())
                .explanation(issue.getExplanation())
                .proposedFix(issue.getProposedFix())
                .source(issue.getSource())
                .confidence(issue.getConfidence())
                .guidelineSetName(issue.getGuidelineSetName())
                .guidelineSourceFile(issue.getGuidelineSourceFile())
                .guidelineSection(issue.getGuidelineSection())
                .guidelineRuleId(issue.getGuidelineRuleId())
                .fingerprint(issue.getFingerprint())
                .build();
    }
}
