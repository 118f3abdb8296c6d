package com.contentvalidator.validation.dto;

import com.contentvalidator.validation.entity.ExclusionRule;
import com.contentvalidator.validation.entity.JobStage;
import com.contentvalidator.validation.entity.ScanJob;
import com.contentvalidator.validation.entity.ScanJobStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ScanJobDto {

    private Long id;
    private String baseUrl;
    private String siteKey;
    private ScanJobStatus status;
    private JobStage stage;
    private Long guidelineSetId;
    private Integer guidelineVersion;
    private Map<String, Boolean> sources;
    private Boolean applyDefaultExclusions;
    private List<ExclusionRule> exclusionRules;
    private ProgressSnapshot progress;
    private Map<String, Object> summary;
    private Map<String, Object> error;
    private LocalDateTime createdAt;
    private LocalDateTime startedAt;
    private LocalDateTime finishedAt;

    public static ScanJobDto from(ScanJob job) {
        return ScanJobDto.builder()
                .id(job.getId())
                .baseUrl(job.getBaseUrl())
                .siteKey(job.getSiteKey())
                .status(job.getStatus())
                .stage(job.getStage())
                .guidelineSetId(job.getGuidelineSetId())
                .guidelineVersion(job.getGuidelineVersion())
                .sources(Map.of(
                        "deterministic", Boolean.TRUE.equals(job.getRunDeterministic()),
                        "llm", Boolean.TRUE.equals(job.getRunLlm()),
                        "axe", Boolean.TRUE.equals(job.getRunAxe())))
                .applyDefaultExclusions(job.getApplyDefaultExclusions())
                .exclusionRules(job.getExclusionRules())
                .progress(ProgressSnapshot.fromJob(job))
                .summary(job.getSummary())
                .error(job.errorPayload())
                .createdAt(job.getCreatedAt())
                .startedAt(job.getStartedAt())
                .finishedAt(job.getFinishedAt())
                .build();
    }
}
