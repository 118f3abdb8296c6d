package com.contentvalidator.validation.entity;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * A single page exclusion rule, e.g. {@code {"type": "path_blocklist", "value": "/legal"}}.
 */
public record ExclusionRule(
        @NotNull ExclusionRuleType type,
        @NotBlank @Size(max = 512) String value
) {

    public static ExclusionRule urlContains(String value) {
        return new ExclusionRule(ExclusionRuleType.URL_CONTAINS, value);
    }
}
