package com.example.KbRag.model;

import java.util.Map;

/**
 * Typed metadata attached to a retrieved chunk.
 *
 * @param pageStart  first PDF page covered by the chunk, null for non-PDF sources
 * @param pageEnd    last PDF page covered by the chunk, null when unknown
 * @param url        original URL for crawled web content
 * @param extensions anything else the storage layer attached
 */
public record PassageMetadata(
        Integer pageStart,
        Integer pageEnd,
        String url,
        Map<String, Object> extensions
) {
    public static final PassageMetadata EMPTY = new PassageMetadata(null, null, null, Map.of());

    public PassageMetadata {
        if (pageStart != null && pageEnd != null && pageEnd < pageStart) {
            throw new IllegalArgumentException(
                    "pageEnd (" + pageEnd + ") must not be before pageStart (" + pageStart + ")");
        }
        extensions = extensions == null ? Map.of() : Map.copyOf(extensions);
    }

    public boolean hasPages() {
        return pageStart != null;
    }

    /**
     * "p. 3" or "p. 3-5"; null when the chunk has no page information.
     */
    public String pageRangeLabel() {
        if (pageStart == null) {
            return null;
        }
        if (pageEnd != null && !pageEnd.equals(pageStart)) {
            return "p. " + pageStart + "-" + pageEnd;
        }
        return "p. " + pageStart;
    }
}
