package com.contentvalidator.validation.exception;

import com.contentvalidator.validation.entity.ScanFailureReason;

/**
 * Scraping or validating a single page failed.
 * Recorded against the page; the job continues.
 */
public class PageFailureException extends ValidationServiceException {

    private final String pageUrl;
    private final ScanFailureReason reason;

    public PageFailureException(String pageUrl, ScanFailureReason reason, String message) {
        super("PAGE_FAILURE", message);
        this.pageUrl = pageUrl;
        this.reason = reason;
    }

    public PageFailureException(String pageUrl, ScanFailureReason reason, String message, Throwable cause) {
        super("PAGE_FAILURE", message, null, cause);
        this.pageUrl = pageUrl;
        this.reason = reason;
    }

    public String getPageUrl() {
        return pageUrl;
    }

    public ScanFailureReason getReason() {
        return reason;
    }
}
