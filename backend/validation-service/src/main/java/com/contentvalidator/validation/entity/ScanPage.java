package com.contentvalidator.validation.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A target page of a scan job together with its scrape state and
 * the errors collaborators raised for it.
 */
@Entity
@Table(name = "scan_pages", indexes = {
        @Index(name = "idx_scan_pages_job_id", columnList = "scan_job_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScanPage {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "scan_job_id", nullable = false)
    private Long scanJobId;

    @Column(nullable = false, length = 2048)
    private String url;

    @Column(length = 512)
    private String title;

    @Enumerated(EnumType.STRING)
    @Column(length = 16)
    @Builder.Default
    private PageSource source = PageSource.MANUAL;

    @Enumerated(EnumType.STRING)
    @Column(name = "scrape_status", nullable = false, length = 16)
    @Builder.Default
    private ScrapeStatus scrapeStatus = ScrapeStatus.PENDING;

    /**
     * Per-page failures: each entry has stage, source, reason and message
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "errors")
    @Builder.Default
    private List<Map<String, Object>> errors = new ArrayList<>();

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    public void recordError(JobStage stage, IssueSource source, ScanFailureReason reason, String message) {
        Map<String, Object> error = new HashMap<>();
        error.put("stage", stage.wireValue());
        if (source != null) {
            error.put("source", source.wireValue());
        }
        error.put("reason", reason.getCode());
        error.put("message", message != null ? message : reason.getDescription());
        if (errors == null) {
            errors = new ArrayList<>();
        }
        errors.add(error);
    }

    public boolean hasErrors() {
        return errors != null && !errors.isEmpty();
    }

    public void markScraped(String title) {
        this.scrapeStatus = ScrapeStatus.DONE;
        if (title != null && !title.isBlank()) {
            this.title = title.length() > 512 ? title.substring(0, 512) : title;
        }
    }

    public void markScrapeFailed(ScanFailureReason reason, String message) {
        this.scrapeStatus = ScrapeStatus.FAILED;
        recordError(JobStage.SCRAPING, null, reason, message);
    }
}
