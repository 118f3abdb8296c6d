package com.contentvalidator.validation.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle status of a scan job.
 * Serialized lower-case; parsing accepts either casing so that
 * {@code COMPLETED} and {@code completed} name the same state.
 */
public enum ScanJobStatus {
    /**
     * Job has been created and is waiting for a worker
     */
    PENDING,

    /**
     * A worker is driving the job through its stages
     */
    RUNNING,

    /**
     * All stages finished; issues are immutable and diffable
     */
    COMPLETED,

    /**
     * Job ended early (fatal error, cancellation or restart)
     */
    FAILED;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    @JsonCreator
    public static ScanJobStatus fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Job status is required");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
