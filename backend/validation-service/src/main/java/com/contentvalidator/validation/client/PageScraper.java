package com.contentvalidator.validation.client;

import com.contentvalidator.validation.dto.PageContent;
import com.contentvalidator.validation.exception.PageFailureException;

public interface PageScraper {

    /**
     * Fetch a page and split its text into chunks.
     *
     * @throws PageFailureException when the page cannot be fetched or has no text
     */
    PageContent scrape(String url);
}
