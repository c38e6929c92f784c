package com.example.KbRag.model;

/**
 * Parameters of one fused (semantic + lexical) search call.
 */
public record HybridSearchRequest(
        String queryText,
        float[] queryEmbedding,
        int limit,
        double similarityThreshold,
        boolean excludeBoilerplate,
        int rrfK,
        int maxPerDocument
) {
}
