package com.contentvalidator.validation.client;

import com.contentvalidator.validation.dto.PageContent;
import com.contentvalidator.validation.dto.RawFinding;
import com.contentvalidator.validation.dto.ValidationContext;
import com.contentvalidator.validation.entity.IssueSource;

import java.util.List;

/**
 * One validator family. Implementations are called concurrently for different pages.
 */
public interface ContentValidator {

    IssueSource source();

    /**
     * False when the validator is not configured, e.g. no service URL.
     */
    default boolean isAvailable() {
        return true;
    }

    List<RawFinding> validate(PageContent content, ValidationContext context);
}
