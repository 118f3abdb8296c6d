package com.contentvalidator.validation.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Comparison of a baseline scan (A) against a later scan (B) of the same site.
 * Partitions use set semantics by fingerprint; instance counts are informational.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DiffResult {

    private Long baselineJobId;
    private Long candidateJobId;
    private String baseUrl;

    private List<DiffEntry> newIssues;
    private List<DiffEntry> resolvedIssues;
    private List<DiffEntry> unchangedIssues;

    private Summary summary;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Summary {
        private int newCount;
        private int resolvedCount;
        private int unchangedCount;

        /**
         * Issue instances behind the unchanged fingerprints in the baseline scan
         */
        private int unchangedInstancesBaseline;

        /**
         * Issue instances behind the unchanged fingerprints in the candidate scan
         */
        private int unchangedInstancesCandidate;

        private Map<String, Integer> newBySeverity;
        private Map<String, Integer> resolvedBySeverity;
        private Map<String, Integer> newByCategory;
        private Map<String, Integer> resolvedByCategory;
    }
}
