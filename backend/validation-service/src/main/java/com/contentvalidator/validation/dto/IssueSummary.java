package com.contentvalidator.validation.dto;

import com.contentvalidator.validation.entity.Issue;
import com.contentvalidator.validation.entity.IssueSeverity;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Issue counts of a job, computed while finalizing and stored with it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IssueSummary {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private int total;
    private int high;
    private int medium;
    private int low;

    @Builder.Default
    private Map<String, Integer> byCategory = new TreeMap<>();

    @Builder.Default
    private Map<String, Integer> bySource = new TreeMap<>();

    private int totalPages;
    private int scrapedPages;
    private int validatedPages;
    private int skippedPages;
    private int pageErrors;
    private int malformedFindings;

    public static IssueSummary of(Collection<Issue> issues) {
        IssueSummary summary = new IssueSummary();
        for (Issue issue : issues) {
            summary.total++;
            IssueSeverity severity = issue.getSeverity() != null ? issue.getSeverity() : IssueSeverity.MEDIUM;
            switch (severity) {
                case HIGH -> summary.high++;
                case LOW -> summary.low++;
                default -> summary.medium++;
            }
            summary.byCategory.merge(issue.getCategory(), 1, Integer::sum);
            if (issue.getSource() != null) {
                summary.bySource.merge(issue.getSource().wireValue(), 1, Integer::sum);
            }
        }
        return summary;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> toMap() {
        return new LinkedHashMap<>(MAPPER.convertValue(this, Map.class));
    }

    public static IssueSummary fromMap(Map<String, Object> map) {
        if (map == null) {
            return new IssueSummary();
        }
        return MAPPER.convertValue(map, IssueSummary.class);
    }
}
