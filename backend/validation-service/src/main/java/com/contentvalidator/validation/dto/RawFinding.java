package com.contentvalidator.validation.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A finding as reported by a validator, before normalization.
 * Every field may be missing or out of range.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RawFinding {

    private String category;
    private String type;
    private String severity;
    private String evidence;
    private String explanation;

    @JsonAlias({"proposed_fix", "fix"})
    private String proposedFix;

    private Double confidence;

    @JsonAlias("guideline_set_name")
    private String guidelineSetName;

    @JsonAlias({"guideline_source_file", "source_file"})
    private String guidelineSourceFile;

    @JsonAlias({"guideline_section", "section"})
    private String guidelineSection;

    @JsonAlias({"guideline_rule_id", "rule_id"})
    private String guidelineRuleId;
}
