package com.contentvalidator.validation.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Ordered stages of the scan pipeline.
 *
 * <pre>
 * PENDING → SCRAPING → VALIDATING → RUNNING_TOOLS → FINALIZING → COMPLETED
 * </pre>
 *
 * Any non-terminal stage may move to {@link #FAILED}. Stages never repeat
 * and none is skipped on the success path.
 */
public enum JobStage {
    PENDING(ScanJobStatus.PENDING),
    SCRAPING(ScanJobStatus.RUNNING),
    VALIDATING(ScanJobStatus.RUNNING),
    RUNNING_TOOLS(ScanJobStatus.RUNNING),
    FINALIZING(ScanJobStatus.RUNNING),
    COMPLETED(ScanJobStatus.COMPLETED),
    FAILED(ScanJobStatus.FAILED);

    private final ScanJobStatus status;

    JobStage(ScanJobStatus status) {
        this.status = status;
    }

    /**
     * Lifecycle status implied by this stage
     */
    public ScanJobStatus status() {
        return status;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * The stage following this one on the success path, or null for terminal stages.
     */
    public JobStage next() {
        return switch (this) {
            case PENDING -> SCRAPING;
            case SCRAPING -> VALIDATING;
            case VALIDATING -> RUNNING_TOOLS;
            case RUNNING_TOOLS -> FINALIZING;
            case FINALIZING -> COMPLETED;
            case COMPLETED, FAILED -> null;
        };
    }

    public boolean canTransitionTo(JobStage target) {
        if (target == null || isTerminal()) {
            return false;
        }
        return target == FAILED || target == next();
    }

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static JobStage fromWire(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Stage is required");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
