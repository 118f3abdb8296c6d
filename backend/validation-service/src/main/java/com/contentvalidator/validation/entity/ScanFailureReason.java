package com.contentvalidator.validation.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;

/**
 * Categorized reasons for job-level and page-level failures.
 * The code is what gets persisted in error payloads and sent to clients.
 */
public enum ScanFailureReason {
    // Job-fatal
    NO_PAGES("no_pages", "No target pages to validate"),
    BASE_URL_UNREACHABLE("base_url_unreachable", "No target page could be fetched"),
    JOB_CANCELLED("job_cancelled", "Job was cancelled"),
    INTERRUPTED_BY_RESTART("interrupted_by_restart", "Job was running when the service restarted"),
    QUEUE_REJECTED("queue_rejected", "Job queue is full"),

    // Per call
    TIMEOUT("timeout", "Call exceeded its time limit"),
    CONNECTION_REFUSED("connection_refused", "Connection refused by remote host"),
    DNS_RESOLUTION_FAILED("dns_resolution_failed", "DNS resolution failed"),
    SSL_HANDSHAKE_FAILED("ssl_handshake_failed", "SSL handshake failed"),
    HTTP_ERROR("http_error", "Remote host returned an error status"),
    EMPTY_CONTENT("empty_content", "No text content extracted from page"),
    URL_BLOCKED("url_blocked", "URL points to a private or reserved network address"),
    VALIDATOR_ERROR("validator_error", "Validator failed"),

    UNKNOWN("unknown", "Unknown error occurred");

    private final String code;
    private final String description;

    ScanFailureReason(String code, String description) {
        this.code = code;
        this.description = description;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Classify an exception raised by a collaborator call.
     */
    public static ScanFailureReason fromException(Throwable e) {
        if (e == null) return UNKNOWN;
        if (e instanceof TimeoutException) return TIMEOUT;
        if (e instanceof CancellationException) return JOB_CANCELLED;

        String message = e.getMessage() != null ? e.getMessage().toLowerCase() : "";
        String className = e.getClass().getSimpleName().toLowerCase();

        if (className.contains("timeout") || message.contains("timed out") || message.contains("timeout")) {
            return TIMEOUT;
        }
        if (className.contains("unknownhost") || message.contains("unknown host") || message.contains("dns")) {
            return DNS_RESOLUTION_FAILED;
        }
        if (message.contains("connection refused") || className.contains("connectexception")) {
            return CONNECTION_REFUSED;
        }
        if (className.contains("ssl") || message.contains("certificate")) {
            return SSL_HANDSHAKE_FAILED;
        }
        if (className.contains("httpstatus") || message.contains("status=")) {
            return HTTP_ERROR;
        }
        return UNKNOWN;
    }

    /**
     * Look up a reason by its persisted code.
     */
    @JsonCreator
    public static ScanFailureReason fromCode(String code) {
        if (code == null || code.isBlank()) return UNKNOWN;
        for (ScanFailureReason reason : values()) {
            if (reason.code.equalsIgnoreCase(code.trim())) {
                return reason;
            }
        }
        return UNKNOWN;
    }

    @Override
    public String toString() {
        return code;
    }
}
