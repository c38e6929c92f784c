package com.example.KbRag.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Client-facing view of a retrieved passage.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SourceDescriptor(
        int index,
        String title,
        String path,
        double similarity,
        Integer pageNumber,
        String pageRange,
        String url,
        String content
) {
    public static SourceDescriptor from(int index, RetrievedPassage passage, boolean inlineContent) {
        PassageMetadata metadata = passage.metadata();
        return new SourceDescriptor(
                index,
                passage.documentTitle(),
                passage.documentSource(),
                passage.similarity(),
                metadata.pageStart(),
                metadata.pageRangeLabel(),
                metadata.url(),
                inlineContent ? passage.content() : null
        );
    }
}
