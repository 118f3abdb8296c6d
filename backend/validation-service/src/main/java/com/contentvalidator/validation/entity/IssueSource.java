package com.contentvalidator.validation.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Validator family that produced an issue.
 */
public enum IssueSource {
    /**
     * Rule-based text checks
     */
    DETERMINISTIC,

    /**
     * LLM guideline matching backed by retrieval
     */
    LLM,

    /**
     * axe-core accessibility audit
     */
    AXE;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static IssueSource fromWire(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Issue source is required");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
