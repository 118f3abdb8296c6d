package com.contentvalidator.validation.dto;

import java.util.List;

/**
 * A heading-delimited block of page text.
 */
public record ContentChunk(List<String> headingPath, String text, String contentHash) {

    public ContentChunk {
        headingPath = headingPath == null ? List.of() : List.copyOf(headingPath);
    }
}
