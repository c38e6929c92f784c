package com.example.KbRag.model;

import lombok.Builder;

/**
 * One candidate chunk returned by the search layer.
 * Similarity is always kept inside [0, 1].
 */
@Builder(toBuilder = true)
public record RetrievedPassage(
        String chunkId,
        String documentId,
        String documentTitle,
        String documentSource,
        String content,
        double similarity,
        Double fusionScore,
        PassageMetadata metadata,
        boolean boilerplate
) {
    public RetrievedPassage {
        if (Double.isNaN(similarity)) {
            throw new IllegalArgumentException("similarity must be a number");
        }
        similarity = clamp(similarity);
        metadata = metadata == null ? PassageMetadata.EMPTY : metadata;
        content = content == null ? "" : content;
    }

    public RetrievedPassage withSimilarity(double value) {
        return toBuilder().similarity(value).build();
    }

    public static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
