package com.example.KbRag.model;

/**
 * A single retrieval request as it flows through the pipeline.
 *
 * @param rawText             question exactly as the user typed it
 * @param normalizedText      question without interrogative scaffolding (null before normalization)
 * @param expandedText        normalized text plus LLM synonyms (null before expansion)
 * @param limit               maximum number of passages to return
 * @param similarityThreshold optional override of the configured threshold
 */
public record Query(
        String rawText,
        String normalizedText,
        String expandedText,
        int limit,
        Double similarityThreshold
) {
    public Query {
        if (rawText == null || rawText.isBlank()) {
            throw new IllegalArgumentException("Question must not be empty");
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
    }

    public static Query of(String rawText, int limit, Double similarityThreshold) {
        return new Query(rawText, null, null, limit, similarityThreshold);
    }

    public Query withNormalized(String normalized) {
        return new Query(rawText, normalized, expandedText, limit, similarityThreshold);
    }

    public Query withExpanded(String expanded) {
        return new Query(rawText, normalizedText, expanded, limit, similarityThreshold);
    }

    /** Text used for lexical matching: expanded when available, else normalized, else raw. */
    public String lexicalText() {
        if (expandedText != null && !expandedText.isBlank()) {
            return expandedText;
        }
        return semanticText();
    }

    /** Text used for the query embedding. */
    public String semanticText() {
        return normalizedText != null && !normalizedText.isBlank() ? normalizedText : rawText;
    }

    public double resolveThreshold(double defaultValue) {
        return similarityThreshold == null ? defaultValue : similarityThreshold;
    }
}
