package com.contentvalidator.validation.entity;

/**
 * Scrape state of a single target page
 */
public enum ScrapeStatus {
    PENDING,
    DONE,
    FAILED,
    SKIPPED
}
