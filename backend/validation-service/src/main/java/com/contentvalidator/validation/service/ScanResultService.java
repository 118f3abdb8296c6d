package com.contentvalidator.validation.service;

import com.contentvalidator.validation.dto.IssueDto;
import com.contentvalidator.validation.dto.IssueSummary;
import com.contentvalidator.validation.dto.PageResultDto;
import com.contentvalidator.validation.dto.ScanJobDto;
import com.contentvalidator.validation.dto.ScanResultsDto;
import com.contentvalidator.validation.entity.Issue;
import com.contentvalidator.validation.entity.IssueSeverity;
import com.contentvalidator.validation.entity.ScanJob;
import com.contentvalidator.validation.entity.ScanPage;
import com.contentvalidator.validation.exception.ResultsNotReadyException;
import com.contentvalidator.validation.exception.ScanNotFoundException;
import com.contentvalidator.validation.repository.IssueRepository;
import com.contentvalidator.validation.repository.ScanJobRepository;
import com.contentvalidator.validation.repository.ScanPageRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Assembles the results of completed scans.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ScanResultService {

    public static final String QUICK_WINS = "quick_wins";
    public static final String MEDIUM_EFFORT = "medium_effort";
    public static final String STRUCTURAL_FIXES = "structural_fixes";

    static final double QUICK_WIN_MIN_CONFIDENCE = 0.8;

    private final ScanJobRepository scanJobRepository;
    private final ScanPageRepository scanPageRepository;
    private final IssueRepository issueRepository;

    public ScanResultsDto getResults(Long jobId) {
        ScanJob job = scanJobRepository.findById(jobId)
                .orElseThrow(() -> new ScanNotFoundException(jobId));
        if (!job.isCompleted()) {
            throw new ResultsNotReadyException(jobId, job.getStatus());
        }

        List<ScanPage> pages = scanPageRepository.findByScanJobIdOrderByIdAsc(jobId);
        List<Issue> issues = issueRepository.findByScanJobIdOrderByIdAsc(jobId);
        Map<Long, List<IssueDto>> issuesByPage = issues.stream()
                .filter(i -> i.getScanPageId() != null)
                .collect(Collectors.groupingBy(Issue::getScanPageId, LinkedHashMap::new,
                        Collectors.mapping(IssueDto::from, Collectors.toList())));

        List<PageResultDto> pageResults = new ArrayList<>();
        List<Map<String, Object>> pageErrors = new ArrayList<>();
        for (ScanPage page : pages) {
            List<Map<String, Object>> errors = page.getErrors() != null ? page.getErrors() : List.of();
            pageResults.add(PageResultDto.builder()
                    .id(page.getId())
                    .url(page.getUrl())
                    .title(page.getTitle())
                    .scrapeStatus(page.getScrapeStatus())
                    .issues(issuesByPage.getOrDefault(page.getId(), List.of()))
                    .errors(errors)
                    .build());
            for (Map<String, Object> error : errors) {
                Map<String, Object> entry = new HashMap<>(error);
                entry.put("pageUrl", page.getUrl());
                pageErrors.add(entry);
            }
        }

        IssueSummary summary = job.getSummary() != null
                ? IssueSummary.fromMap(job.getSummary())
                : IssueSummary.of(issues);

        return ScanResultsDto.builder()
                .job(ScanJobDto.from(job))
                .summary(summary)
                .pages(pageResults)
                .issues(issues.stream().map(IssueDto::from).toList())
                .pageErrors(pageErrors)
                .fixPacks(buildFixPacks(issues))
                .build();
    }

    /**
     * Group issues by remediation effort: confident low-severity findings are quick wins,
     * medium severity is medium effort, high severity needs structural fixes.
     */
    static Map<String, List<IssueDto>> buildFixPacks(List<Issue> issues) {
        Map<String, List<IssueDto>> packs = new LinkedHashMap<>();
        packs.put(QUICK_WINS, new ArrayList<>());
        packs.put(MEDIUM_EFFORT, new ArrayList<>());
        packs.put(STRUCTURAL_FIXES, new ArrayList<>());

        for (Issue issue : issues) {
            IssueSeverity severity = issue.getSeverity();
            if (severity == IssueSeverity.LOW) {
                double confidence = issue.getConfidence() != null ? issue.getConfidence() : 0.0;
                if (confidence >= QUICK_WIN_MIN_CONFIDENCE) {
                    packs.get(QUICK_WINS).add(IssueDto.from(issue));
                }
            } else if (severity == IssueSeverity.MEDIUM) {
                packs.get(MEDIUM_EFFORT).add(IssueDto.from(issue));
            } else if (severity == IssueSeverity.HIGH) {
                packs.get(STRUCTURAL_FIXES).add(IssueDto.from(issue));
            }
        }
        return packs;
    }
}
