package com.example.KbRag.service;

import com.example.KbRag.model.HybridSearchRequest;
import com.example.KbRag.model.RankedResultSet;
import com.example.KbRag.model.RetrievedPassage;
import com.example.KbRag.model.SearchOutcome;
import com.example.KbRag.repository.PassageSearchRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Single entry point to storage search.
 *
 * Tries fused search first and, if it fails, semantic-only search exactly once.
 * Results of either path are re-checked here: similarity inside [0, 1], nothing below
 * the threshold, per-document cap and limit respected.
 */
@Service
@RequiredArgsConstructor
public class SearchGateway {

    private static final Logger log = LoggerFactory.getLogger(SearchGateway.class);

    private final PassageSearchRepository repository;

    public SearchOutcome search(HybridSearchRequest request) {
        List<RetrievedPassage> fused;
        try {
            fused = repository.fusedSearch(request);
        } catch (RuntimeException fusedError) {
            log.warn("Fused search failed, falling back to vector search: {}", fusedError.getMessage());
            return fallback(request, fusedError);
        }

        List<RetrievedPassage> checked = check(fused, request);
        log.info("Fused search returned {} passages ({} after checks)", fused.size(), checked.size());
        return SearchOutcome.fused(checked);
    }

    private SearchOutcome fallback(HybridSearchRequest request, RuntimeException fusedError) {
        try {
            List<RetrievedPassage> vector = repository.vectorSearch(
                    request.queryEmbedding(), request.limit(), request.similarityThreshold());
            List<RetrievedPassage> checked = check(vector, request);
            log.info("Vector fallback returned {} passages ({} after checks)", vector.size(), checked.size());
            return SearchOutcome.vectorFallback(checked);
        } catch (RuntimeException vectorError) {
            vectorError.addSuppressed(fusedError);
            log.error("Vector fallback failed as well, search unavailable", vectorError);
            return SearchOutcome.unavailable(vectorError);
        }
    }

    private static List<RetrievedPassage> check(List<RetrievedPassage> passages, HybridSearchRequest request) {
        if (passages == null || passages.isEmpty()) {
            return List.of();
        }
        // RetrievedPassage clamps similarity on construction
        List<RetrievedPassage> aboveThreshold = passages.stream()
                .filter(p -> p.similarity() >= request.similarityThreshold())
                .toList();
        return RankedResultSet.capPerDocument(aboveThreshold, request.maxPerDocument(), request.limit());
    }
}
