package com.contentvalidator.validation.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Severity of a validation issue.
 */
public enum IssueSeverity {
    HIGH,
    MEDIUM,
    LOW;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Lenient parse used for collaborator output. Accepts any casing and the
     * axe impact levels; unknown or missing values fall back to {@link #MEDIUM}.
     */
    @JsonCreator
    public static IssueSeverity parse(String value) {
        if (value == null || value.isBlank()) {
            return MEDIUM;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "high", "critical", "serious" -> HIGH;
            case "low", "minor" -> LOW;
            default -> MEDIUM;
        };
    }
}
