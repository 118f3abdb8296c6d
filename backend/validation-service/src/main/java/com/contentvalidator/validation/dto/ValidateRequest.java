package com.contentvalidator.validation.dto;

import com.contentvalidator.validation.entity.ExclusionRule;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Request to start a scan. When {@code pageUrls} is empty the pages are discovered
 * from the base URL.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValidateRequest {

    @NotBlank(message = "baseUrl is required")
    @Pattern(regexp = "^https?://.+", message = "baseUrl must be an http(s) URL")
    private String baseUrl;

    @Size(max = 500, message = "At most 500 page URLs per scan")
    @Builder.Default
    private List<String> pageUrls = new ArrayList<>();

    @Builder.Default
    private boolean runDeterministic = true;

    @Builder.Default
    private boolean runLlm = true;

    @Builder.Default
    private boolean runAxe = true;

    /**
     * Extra rules for skipping discovered pages; explicit {@code pageUrls} are never skipped
     */
    @Size(max = 50, message = "At most 50 exclusion rules per scan")
    @Builder.Default
    private List<@Valid ExclusionRule> exclusionRules = new ArrayList<>();

    /**
     * Skip privacy, terms, cookie, login, account and portal pages during discovery
     */
    @Builder.Default
    private boolean applyDefaultExclusions = true;

    private Long guidelineSetId;

    private Integer guidelineVersion;
}
