package com.contentvalidator.validation.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Full results of a completed scan.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScanResultsDto {

    private ScanJobDto job;
    private IssueSummary summary;
    private List<PageResultDto> pages;
    private List<IssueDto> issues;

    /**
     * Every page error, flattened, each entry tagged with its page URL
     */
    private List<Map<String, Object>> pageErrors;

    /**
     * Issues grouped by remediation effort: quick_wins, medium_effort, structural_fixes
     */
    private Map<String, List<IssueDto>> fixPacks;
}
