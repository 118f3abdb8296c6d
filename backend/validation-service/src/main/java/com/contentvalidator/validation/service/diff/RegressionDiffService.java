package com.contentvalidator.validation.service.diff;

import com.contentvalidator.validation.dto.DiffEntry;
import com.contentvalidator.validation.dto.DiffResult;
import com.contentvalidator.validation.dto.IssueDto;
import com.contentvalidator.validation.entity.Issue;
import com.contentvalidator.validation.entity.ScanJob;
import com.contentvalidator.validation.entity.ScanJobStatus;
import com.contentvalidator.validation.exception.IncomparableJobsException;
import com.contentvalidator.validation.exception.NoBaselineAvailableException;
import com.contentvalidator.validation.exception.ScanNotFoundException;
import com.contentvalidator.validation.repository.IssueRepository;
import com.contentvalidator.validation.repository.ScanJobRepository;
import com.contentvalidator.validation.util.Fingerprints;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Compares the issues of two completed scans of the same site by fingerprint.
 *
 * <p>Classification uses set semantics: a fingerprint is new, resolved or unchanged
 * depending only on whether it occurs in each scan. How many issues share a
 * fingerprint is reported per entry and, for unchanged fingerprints, per scan.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RegressionDiffService {

    private final ScanJobRepository scanJobRepository;
    private final IssueRepository issueRepository;

    /**
     * @param baselineJobId the earlier scan (A)
     * @param candidateJobId the later scan (B)
     */
    public DiffResult diff(Long baselineJobId, Long candidateJobId) {
        ScanJob baseline = load(baselineJobId);
        ScanJob candidate = load(candidateJobId);
        return diff(baseline, candidate);
    }

    /**
     * Compare a scan with the most recent earlier completed scan of the same site.
     *
     * @throws NoBaselineAvailableException when there is none
     */
    public DiffResult compareToLast(Long jobId) {
        ScanJob candidate = load(jobId);
        requireCompleted(candidate);

        List<ScanJob> previous = scanJobRepository.findPreviousByStatus(
                siteKeyOf(candidate), ScanJobStatus.COMPLETED, candidate.getId(),
                candidate.getFinishedAt(), PageRequest.of(0, 1));
        if (previous.isEmpty()) {
            log.info("No baseline for scan job {} ({})", jobId, candidate.getBaseUrl());
            throw new NoBaselineAvailableException(jobId);
        }
        return diff(previous.get(0), candidate);
    }

    private DiffResult diff(ScanJob baseline, ScanJob candidate) {
        requireCompleted(baseline);
        requireCompleted(candidate);
        if (!siteKeyOf(baseline).equals(siteKeyOf(candidate))) {
            throw new IncomparableJobsException(candidate.getId(),
                    "Scans " + baseline.getId() + " and " + candidate.getId() + " are for different sites");
        }

        Map<String, List<Issue>> a = groupByFingerprint(issueRepository.findByScanJobIdOrderByIdAsc(baseline.getId()));
        Map<String, List<Issue>> b = groupByFingerprint(issueRepository.findByScanJobIdOrderByIdAsc(candidate.getId()));

        List<DiffEntry> newIssues = new ArrayList<>();
        List<DiffEntry> unchanged = new ArrayList<>();
        int unchangedInstancesA = 0;
        int unchangedInstancesB = 0;
        for (Map.Entry<String, List<Issue>> entry : b.entrySet()) {
            List<Issue> inBaseline = a.get(entry.getKey());
            if (inBaseline == null) {
                newIssues.add(toEntry(entry));
            } else {
                unchanged.add(toEntry(entry));
                unchangedInstancesA += inBaseline.size();
                unchangedInstancesB += entry.getValue().size();
            }
        }

        List<DiffEntry> resolved = new ArrayList<>();
        for (Map.Entry<String, List<Issue>> entry : a.entrySet()) {
            if (!b.containsKey(entry.getKey())) {
                resolved.add(toEntry(entry));
            }
        }

        DiffResult.Summary summary = DiffResult.Summary.builder()
                .newCount(newIssues.size())
                .resolvedCount(resolved.size())
                .unchangedCount(unchanged.size())
                .unchangedInstancesBaseline(unchangedInstancesA)
                .unchangedInstancesCandidate(unchangedInstancesB)
                .newBySeverity(countBy(newIssues, true))
                .resolvedBySeverity(countBy(resolved, true))
                .newByCategory(countBy(newIssues, false))
                .resolvedByCategory(countBy(resolved, false))
                .build();

        log.info("Diff {} -> {} ({}): new={}, resolved={}, unchanged={}",
                baseline.getId(), candidate.getId(), candidate.getBaseUrl(),
                summary.getNewCount(), summary.getResolvedCount(), summary.getUnchangedCount());

        return DiffResult.builder()
                .baselineJobId(baseline.getId())
                .candidateJobId(candidate.getId())
                .baseUrl(candidate.getBaseUrl())
                .newIssues(newIssues)
                .resolvedIssues(resolved)
                .unchangedIssues(unchanged)
                .summary(summary)
                .build();
    }

    private ScanJob load(Long jobId) {
        return scanJobRepository.findById(jobId)
                .orElseThrow(() -> new ScanNotFoundException(jobId));
    }

    private static void requireCompleted(ScanJob job) {
        if (!job.isCompleted()) {
            throw new IncomparableJobsException(job.getId(),
                    "Scan " + job.getId() + " is " + job.getStatus().wireValue() + ", only completed scans can be compared");
        }
    }

    private static String siteKeyOf(ScanJob job) {
        return job.getSiteKey() != null ? job.getSiteKey() : Fingerprints.normalizeUrl(job.getBaseUrl());
    }

    private static Map<String, List<Issue>> groupByFingerprint(List<Issue> issues) {
        Map<String, List<Issue>> grouped = new LinkedHashMap<>();
        for (Issue issue : issues) {
            grouped.computeIfAbsent(issue.getFingerprint(), fp -> new ArrayList<>()).add(issue);
        }
        return grouped;
    }

    private static DiffEntry toEntry(Map.Entry<String, List<Issue>> entry) {
        return new DiffEntry(entry.getKey(), IssueDto.from(entry.getValue().get(0)), entry.getValue().size());
    }

    private static Map<String, Integer> countBy(List<DiffEntry> entries, boolean bySeverity) {
        Map<String, Integer> counts = new TreeMap<>();
        for (DiffEntry entry : entries) {
            String key = bySeverity
                    ? entry.issue().getSeverity().wireValue()
                    : entry.issue().getCategory();
            counts.merge(key, 1, Integer::sum);
        }
        return counts;
    }
}
