package com.example.KbRag.model;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Final ordered passages for one request: descending similarity,
 * at most {@code maxPerDocument} passages per parent document, at most {@code limit} overall.
 */
public record RankedResultSet(List<RetrievedPassage> passages) {

    public static final RankedResultSet EMPTY = new RankedResultSet(List.of());

    public RankedResultSet {
        passages = passages == null ? List.of() : List.copyOf(passages);
    }

    public static RankedResultSet of(List<RetrievedPassage> candidates, int maxPerDocument, int limit) {
        List<RetrievedPassage> sorted = new ArrayList<>(candidates);
        // List.sort is stable, ties keep their incoming order
        sorted.sort(Comparator.comparingDouble(RetrievedPassage::similarity).reversed());
        return new RankedResultSet(capPerDocument(sorted, maxPerDocument, limit));
    }

    /**
     * Keeps the incoming order, dropping passages once their document reached the cap
     * and stopping at the global limit.
     */
    public static List<RetrievedPassage> capPerDocument(List<RetrievedPassage> ordered, int maxPerDocument, int limit) {
        Map<String, Integer> perDocument = new HashMap<>();
        List<RetrievedPassage> kept = new ArrayList<>();
        for (RetrievedPassage passage : ordered) {
            if (kept.size() >= limit) {
                break;
            }
            String key = passage.documentId() == null ? passage.chunkId() : passage.documentId();
            int count = perDocument.getOrDefault(key, 0);
            if (count >= maxPerDocument) {
                continue;
            }
            perDocument.put(key, count + 1);
            kept.add(passage);
        }
        return kept;
    }

    public boolean isEmpty() {
        return passages.isEmpty();
    }

    public int size() {
        return passages.size();
    }

    public double maxSimilarity() {
        return passages.stream().mapToDouble(RetrievedPassage::similarity).max().orElse(0.0);
    }

    /**
     * Passage behind a 1-based citation index, as presented to the model.
     */
    public RetrievedPassage atCitationIndex(int index) {
        if (index < 1 || index > passages.size()) {
            throw new IndexOutOfBoundsException("Citation index " + index + " outside [1, " + passages.size() + "]");
        }
        return passages.get(index - 1);
    }
}
