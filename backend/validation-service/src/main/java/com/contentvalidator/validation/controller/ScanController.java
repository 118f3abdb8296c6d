package com.contentvalidator.validation.controller;

import com.contentvalidator.validation.dto.DiffResult;
import com.contentvalidator.validation.dto.ScanJobDto;
import com.contentvalidator.validation.service.ScanJobService;
import com.contentvalidator.validation.service.diff.RegressionDiffService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Scan history and regression comparison.
 */
@RestController
@RequestMapping("/api/scans")
@RequiredArgsConstructor
public class ScanController {

    private final ScanJobService scanJobService;
    private final RegressionDiffService regressionDiffService;

    @GetMapping
    public ResponseEntity<List<ScanJobDto>> listByBaseUrl(@RequestParam String baseUrl) {
        return ResponseEntity.ok(scanJobService.listByBaseUrl(baseUrl).stream().map(ScanJobDto::from).toList());
    }

    @GetMapping("/recent")
    public ResponseEntity<List<ScanJobDto>> listRecent(@RequestParam(defaultValue = "20") int limit) {
        return ResponseEntity.ok(scanJobService.listRecent(limit).stream().map(ScanJobDto::from).toList());
    }

    /**
     * Compare scan {@code id} (baseline) with scan {@code to}.
     */
    @GetMapping("/{id}/compare")
    public ResponseEntity<DiffResult> compare(@PathVariable Long id, @RequestParam("to") Long to) {
        return ResponseEntity.ok(regressionDiffService.diff(id, to));
    }

    @GetMapping("/{id}/compare-to-last")
    public ResponseEntity<DiffResult> compareToLast(@PathVariable Long id) {
        return ResponseEntity.ok(regressionDiffService.compareToLast(id));
    }
}
