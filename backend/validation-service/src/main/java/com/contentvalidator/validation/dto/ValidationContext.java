package com.contentvalidator.validation.dto;

/**
 * Job-level inputs a validator needs alongside the page content.
 */
public record ValidationContext(Long jobId, String baseUrl, Long guidelineSetId, Integer guidelineVersion) {
}
