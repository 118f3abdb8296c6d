package com.contentvalidator.validation.client;

import com.contentvalidator.validation.dto.PageCandidate;

import java.util.List;

/**
 * Finds the pages of a site worth validating.
 */
public interface PageDiscoveryClient {

    List<PageCandidate> discoverPages(String baseUrl, int maxPages);
}
