package com.contentvalidator.validation.entity;

/**
 * How a target page entered a scan.
 */
public enum PageSource {
    SITEMAP,
    NAV,
    CRAWL,
    MANUAL
}
