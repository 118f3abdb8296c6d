package com.contentvalidator.validation.dto;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Scraped text of one page, split into chunks.
 */
public record PageContent(String url, String title, String html, List<ContentChunk> chunks) {

    public PageContent {
        chunks = chunks == null ? List.of() : List.copyOf(chunks);
    }

    public String fullText() {
        return chunks.stream().map(ContentChunk::text).collect(Collectors.joining("\n\n"));
    }

    public boolean isEmpty() {
        return chunks.stream().allMatch(c -> c.text() == null || c.text().isBlank());
    }
}
