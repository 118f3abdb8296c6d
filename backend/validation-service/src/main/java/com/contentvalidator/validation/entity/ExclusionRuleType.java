package com.contentvalidator.validation.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How an exclusion rule value is matched against a discovered page URL.
 * All matching is case-insensitive.
 */
public enum ExclusionRuleType {
    /** Substring of the full URL */
    URL_CONTAINS,
    /** Regular expression found anywhere in the URL */
    URL_REGEX,
    /** Substring of the URL path */
    PATH_BLOCKLIST,
    /** Substring of the host */
    DOMAIN_BLOCKLIST;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ExclusionRuleType parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Exclusion rule type is required");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
