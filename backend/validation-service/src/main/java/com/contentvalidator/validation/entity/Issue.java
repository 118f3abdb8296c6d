package com.contentvalidator.validation.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

/**
 * A normalized validation finding.
 * Written only while its job is running; never updated afterwards.
 */
@Entity
@Table(name = "issues", indexes = {
        @Index(name = "idx_issues_scan_job_id", columnList = "scan_job_id"),
        @Index(name = "idx_issues_scan_page_id", columnList = "scan_page_id"),
        @Index(name = "idx_issues_fingerprint", columnList = "fingerprint")
})
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Issue {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "scan_job_id", nullable = false)
    private Long scanJobId;

    @Column(name = "scan_page_id")
    private Long scanPageId;

    @Column(name = "page_url", nullable = false, length = 2048)
    private String pageUrl;

    @Column(nullable = false, length = 100)
    private String category;

    @Column(nullable = false, length = 100)
    private String type;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private IssueSeverity severity;

    @Column(columnDefinition = "TEXT")
    private String evidence;

    @Column(columnDefinition = "TEXT")
    private String explanation;

    @Column(name = "proposed_fix", columnDefinition = "TEXT")
    private String proposedFix;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private IssueSource source;

    @Builder.Default
    private Double confidence = 0.0;

    // Guideline provenance (LLM findings only)

    @Column(name = "guideline_set_name", length = 255)
    private String guidelineSetName;

    @Column(name = "guideline_source_file", length = 512)
    private String guidelineSourceFile;

    @Column(name = "guideline_section", length = 255)
    private String guidelineSection;

    @Column(name = "guideline_rule_id", length = 100)
    private String guidelineRuleId;

    /**
     * SHA-256 hex identity used to match the same defect across scans
     */
    @Column(nullable = false, length = 64)
    private String fingerprint;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;
}
