package com.contentvalidator.validation.entity;

import com.contentvalidator.validation.util.Fingerprints;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * One end-to-end validation run over a set of pages of a site.
 * Only the pipeline worker mutates a job; readers see persisted state
 * or the snapshots it publishes.
 */
@Entity
@Table(name = "scan_jobs", indexes = {
        @Index(name = "idx_scan_jobs_baseline", columnList = "site_key, status, finished_at"),
        @Index(name = "idx_scan_jobs_status", columnList = "status"),
        @Index(name = "idx_scan_jobs_created_at", columnList = "created_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScanJob {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * Base URL as submitted (trimmed); used for fetching and display
     */
    @Column(name = "base_url", nullable = false, length = 2048)
    private String baseUrl;

    /**
     * Normalized form of {@link #baseUrl}; the key used to pair scans of the same site
     */
    @Column(name = "site_key", nullable = false, length = 2048)
    private String siteKey;

    @Column(name = "guideline_set_id")
    private Long guidelineSetId;

    @Column(name = "guideline_version")
    private Integer guidelineVersion;

    @Column(name = "run_deterministic", nullable = false)
    @Builder.Default
    private Boolean runDeterministic = true;

    @Column(name = "run_llm", nullable = false)
    @Builder.Default
    private Boolean runLlm = true;

    @Column(name = "run_axe", nullable = false)
    @Builder.Default
    private Boolean runAxe = true;

    @Column(name = "apply_default_exclusions", nullable = false)
    @Builder.Default
    private Boolean applyDefaultExclusions = true;

    /**
     * Caller supplied rules for skipping discovered pages
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "exclusion_rules")
    @Builder.Default
    private List<ExclusionRule> exclusionRules = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    @Builder.Default
    private ScanJobStatus status = ScanJobStatus.PENDING;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    @Builder.Default
    private JobStage stage = JobStage.PENDING;

    // Progress counters of the last published snapshot

    @Column(name = "total_pages")
    @Builder.Default
    private Integer totalPages = 0;

    @Column(name = "scraped_count")
    @Builder.Default
    private Integer scrapedCount = 0;

    @Column(name = "validated_count")
    @Builder.Default
    private Integer validatedCount = 0;

    @Column(name = "current_page", length = 2048)
    private String currentPage;

    @Column(name = "progress_message", length = 1024)
    private String progressMessage;

    @Column(name = "progress_sequence", nullable = false)
    @Builder.Default
    private Long progressSequence = 0L;

    /**
     * Issue summary computed while finalizing
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "summary")
    private Map<String, Object> summary;

    @Enumerated(EnumType.STRING)
    @Column(name = "failure_reason", length = 64)
    private ScanFailureReason failureReason;

    @Column(name = "error_message", length = 1024)
    private String errorMessage;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @Column(name = "started_at")
    private LocalDateTime startedAt;

    @Column(name = "finished_at")
    private LocalDateTime finishedAt;

    @PrePersist
    @PreUpdate
    void fillSiteKey() {
        if (siteKey == null && baseUrl != null) {
            siteKey = Fingerprints.normalizeUrl(baseUrl);
        }
    }

    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }

    public boolean isCompleted() {
        return status == ScanJobStatus.COMPLETED;
    }

    /**
     * Error payload as exposed to API clients, or null when the job has not failed
     */
    public Map<String, Object> errorPayload() {
        if (failureReason == null) {
            return null;
        }
        return Map.of(
                "reason", failureReason.getCode(),
                "message", errorMessage != null ? errorMessage : failureReason.getDescription()
        );
    }
}
