package com.example.KbRag.repository;

import com.example.KbRag.model.HybridSearchRequest;
import com.example.KbRag.model.KbDocument;
import com.example.KbRag.model.RetrievedPassage;

import java.util.List;
import java.util.Optional;

/**
 * Read access to indexed chunks. Implementations may throw any runtime exception;
 * the search gateway decides how to degrade.
 */
public interface PassageSearchRepository {

    /**
     * Reciprocal Rank Fusion of the semantic and lexical rankings, ordered by fused score.
     */
    List<RetrievedPassage> fusedSearch(HybridSearchRequest request);

    /**
     * Semantic-only nearest neighbours, ordered by similarity.
     */
    List<RetrievedPassage> vectorSearch(float[] queryEmbedding, int limit, double similarityThreshold);

    Optional<KbDocument> findDocumentById(String documentId);
}
